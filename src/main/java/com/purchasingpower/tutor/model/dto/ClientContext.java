package com.purchasingpower.tutor.model.dto;

import com.purchasingpower.tutor.model.audit.DeviceType;
import lombok.Builder;
import lombok.Value;

/**
 * What is known about the requesting client, stamped onto audit rows.
 */
@Value
@Builder
public class ClientContext {

    String userAgent;
    DeviceType deviceType;
    String browserName;

    public static ClientContext unknown() {
        return ClientContext.builder()
            .deviceType(DeviceType.DESKTOP)
            .browserName("Unknown")
            .build();
    }
}
