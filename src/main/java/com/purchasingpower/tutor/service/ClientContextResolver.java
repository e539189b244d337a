package com.purchasingpower.tutor.service;

import com.purchasingpower.tutor.model.audit.DeviceType;
import com.purchasingpower.tutor.model.dto.ClientContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the client context for audit rows. An explicit device hint beats user-agent sniffing;
 * an unrecognized hint is ignored.
 */
@Component
@RequiredArgsConstructor
public class ClientContextResolver {

    private final DeviceContextClassifier deviceClassifier;
    private final BrowserDetector browserDetector;

    public ClientContext resolve(String userAgent, String deviceHint) {
        DeviceType deviceType = DeviceType.fromValue(deviceHint)
                .orElseGet(() -> deviceClassifier.classify(userAgent));

        return ClientContext.builder()
                .userAgent(userAgent)
                .deviceType(deviceType)
                .browserName(browserDetector.detect(userAgent))
                .build();
    }
}
