package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.audit.DeviceType;

/**
 * Maps a raw client-agent string to a device category. Implementations are pure and stateless.
 */
public interface DeviceContextClassifier {

    DeviceType classify(String userAgent);
}
