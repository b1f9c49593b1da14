package com.credentialguard.application;

/**
 * Events emitted by {@link CredentialGuard}.
 */
public enum GuardEventType {
    SECRET_STORED,
    STORE_FAILED,
    SECRET_RETRIEVED,
    RETRIEVAL_CANCELLED,
    RETRIEVAL_FAILED,
    SECRET_DELETED,
    DELETE_FAILED,
    STATE_RESET,
    AVAILABILITY_PROBE_FAILED,
    EXISTENCE_PROBE_FAILED
}
