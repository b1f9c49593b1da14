package com.credentialguard.domain.model;

/**
 * Authentication factors an access policy can require.
 */
public enum AuthFactor {
    BIOMETRIC,
    DEVICE_PASSCODE
}
