package com.credentialguard.domain.model;

/**
 * Device states in which a stored item may be extracted.
 */
public enum Accessibility {
    WHEN_UNLOCKED_THIS_DEVICE_ONLY
}
