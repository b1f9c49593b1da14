package com.credentialguard.domain.model;

/**
 * Which enrolled biometrics a stored item is bound to.
 */
public enum BiometricScope {
    /** Any change to the enrolled set invalidates the item. */
    CURRENT_ENROLLMENT_SET,
    /** Item survives enrollment changes. */
    ANY_ENROLLMENT
}
