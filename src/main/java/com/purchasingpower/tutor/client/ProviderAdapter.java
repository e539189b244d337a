package com.purchasingpower.tutor.client;

import com.purchasingpower.tutor.model.provider.ProviderSelection;
import com.purchasingpower.tutor.model.provider.ProviderType;

/**
 * One LLM backend. Implementations translate a {@link ProviderRequest} into the
 * backend's wire format and block until it answers.
 *
 * <p>Every failure surfaces as {@link com.purchasingpower.tutor.exception.ProviderException};
 * implementations never retry.
 */
public interface ProviderAdapter {

    ProviderType getType();

    ProviderReply send(ProviderSelection selection, ProviderRequest request);
}
