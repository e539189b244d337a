package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.model.provider.ProviderType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderReply {

    String reply;

    /** Model the request was sent with. */
    String model;

    ProviderType provider;

    long responseTimeMs;
}
