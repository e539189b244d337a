package com.purchasingpower.tutor.service.impl;

import com.purchasingpower.tutor.model.audit.DeviceType;
import com.purchasingpower.tutor.service.DeviceContextClassifier;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * User-agent sniffing. Tablet signatures are tested first: Android tablets and iPads
 * share substrings with phones.
 */
@Component
public class UserAgentDeviceClassifier implements DeviceContextClassifier {

    @Override
    public DeviceType classify(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceType.DESKTOP;
        }
        String ua = userAgent.toLowerCase(Locale.ROOT);

        if (ua.contains("ipad") || ua.contains("tablet")
                || (ua.contains("android") && !ua.contains("mobile"))) {
            return DeviceType.TABLET;
        }
        if (ua.contains("mobile") || ua.contains("iphone") || ua.contains("android")) {
            return DeviceType.MOBILE;
        }
        return DeviceType.DESKTOP;
    }
}
