package com.purchasingpower.tutor.service;

import org.springframework.stereotype.Component;

/**
 * Browser family from a user-agent string. Edge and Opera advertise Chrome and Safari
 * tokens too, so they are tested first.
 */
@Component
public class BrowserDetector {

    public static final String UNKNOWN = "Unknown";

    public String detect(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return UNKNOWN;
        }
        if (userAgent.contains("Edg")) {
            return "Edge";
        }
        if (userAgent.contains("OPR") || userAgent.contains("Opera")) {
            return "Opera";
        }
        if (userAgent.contains("Firefox")) {
            return "Firefox";
        }
        if (userAgent.contains("Chrome") && !userAgent.contains("Chromium")) {
            return "Chrome";
        }
        if (userAgent.contains("Safari")) {
            return "Safari";
        }
        return UNKNOWN;
    }
}
