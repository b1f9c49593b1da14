package com.credentialguard.domain.port;

/**
 * Status reported by a {@link SecureStore}.
 *
 * <p>Each status has a default raw code; adapters backed by a platform store
 * report the platform's own code instead.
 */
public enum StoreStatus {
    SUCCESS(0),
    USER_CANCELLED(-128),
    AUTH_FAILED(-25293),
    NOT_FOUND(-25300),
    DUPLICATE_ITEM(-25299),
    POLICY_REJECTED(-67585),
    INTEGRITY_FAILURE(-26275),
    OTHER(-1);

    private final int defaultCode;

    StoreStatus(int defaultCode) {
        this.defaultCode = defaultCode;
    }

    public int getDefaultCode() {
        return defaultCode;
    }
}
