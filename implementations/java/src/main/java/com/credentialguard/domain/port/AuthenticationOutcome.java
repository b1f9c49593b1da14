package com.credentialguard.domain.port;

/**
 * Result of one authentication ceremony.
 */
public enum AuthenticationOutcome {
    SUCCESS,
    FAILED,        // wrong biometric, too many attempts
    CANCELLED,     // user dismissed the prompt
    UNAVAILABLE    // no factor of the policy can be evaluated
}
