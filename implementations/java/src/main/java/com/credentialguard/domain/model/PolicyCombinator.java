package com.credentialguard.domain.model;

/**
 * How the factors of an {@link AccessPolicy} combine.
 */
public enum PolicyCombinator {
    /** Every factor must be presented. */
    AND,
    /** Any one factor is enough. */
    OR
}
