package com.purchasingpower.tutor.model.dto;

/**
 * Authenticated caller as asserted by the upstream gateway.
 */
public record CallerIdentity(Long userId, boolean admin) {
}
