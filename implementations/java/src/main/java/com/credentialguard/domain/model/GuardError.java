package com.credentialguard.domain.model;

import lombok.Value;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed failure returned by guard operations.
 *
 * <p>Kinds are never collapsed into one another. Store and storage errors
 * keep the raw platform code for diagnostics.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
public class GuardError {

    Kind kind;

    Integer code;

    public static GuardError policyConstructionFailed() {
        return new GuardError(Kind.POLICY_CONSTRUCTION_FAILED, null);
    }

    public static GuardError storeWriteFailed(int code) {
        return new GuardError(Kind.STORE_WRITE_FAILED, code);
    }

    public static GuardError userCancelled() {
        return new GuardError(Kind.USER_CANCELLED, null);
    }

    public static GuardError authenticationFailed() {
        return new GuardError(Kind.AUTHENTICATION_FAILED, null);
    }

    public static GuardError notFound() {
        return new GuardError(Kind.NOT_FOUND, null);
    }

    public static GuardError payloadCorrupt() {
        return new GuardError(Kind.PAYLOAD_CORRUPT, null);
    }

    public static GuardError storageError(int code) {
        return new GuardError(Kind.STORAGE_ERROR, code);
    }

    private GuardError(Kind kind, Integer code) {
        this.kind = Objects.requireNonNull(kind, "Kind must not be null");
        this.code = code;
    }

    public Optional<Integer> getCode() {
        return Optional.ofNullable(code);
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return code == null ? kind.name() : kind.name() + "(" + code + ")";
    }

    /**
     * Failure taxonomy.
     */
    public enum Kind {
        /** The store could not build the requested access-control combinator. */
        POLICY_CONSTRUCTION_FAILED,

        /** Persisting the item failed; code preserved. */
        STORE_WRITE_FAILED,

        /** The user dismissed the ceremony. Not an error to report. */
        USER_CANCELLED,

        /** Ceremony presented but not passed (wrong biometric, lockout). */
        AUTHENTICATION_FAILED,

        /** No item at the address. */
        NOT_FOUND,

        /** Payload returned but not decodable. Data integrity, not security. */
        PAYLOAD_CORRUPT,

        /** Any other store status; code preserved. */
        STORAGE_ERROR;

        /**
         * True when the user chose this outcome, so callers can skip error banners.
         */
        public boolean isUserInitiated() {
            return this == USER_CANCELLED;
        }

        /**
         * True when the item should be deleted and provisioned again rather than retried.
         */
        public boolean requiresReprovisioning() {
            return this == PAYLOAD_CORRUPT;
        }
    }
}
