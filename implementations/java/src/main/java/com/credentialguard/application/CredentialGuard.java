package com.credentialguard.application;

import com.credentialguard.domain.model.AccessPolicy;
import com.credentialguard.domain.model.AuthCacheState;
import com.credentialguard.domain.model.GuardError;
import com.credentialguard.domain.model.GuardResult;
import com.credentialguard.domain.model.ProtectedSecret;
import com.credentialguard.domain.model.StorageAddress;
import com.credentialguard.domain.port.AuthenticationPrompt;
import com.credentialguard.domain.port.Authenticator;
import com.credentialguard.domain.port.SecureStore;
import com.credentialguard.domain.port.StoreResponse;
import com.credentialguard.domain.port.StoreStatus;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.CharacterCodingException;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;

/**
 * Policy layer guarding the single stored API credential.
 *
 * <p>Decides when the caller must authenticate, how the credential is protected
 * at rest, and surfaces every failure as a distinct {@link GuardError}:
 * <ul>
 *   <li>Storage attaches {@link AccessPolicy#standard()} (biometric OR device passcode)</li>
 *   <li>Retrieval delegates exactly one ceremony to the {@link SecureStore}</li>
 *   <li>Existence and availability probes never prompt the user</li>
 *   <li>Nothing is retried automatically</li>
 * </ul>
 *
 * <p><strong>Threading:</strong> every store call blocks, and {@link #retrieve()} may
 * wait indefinitely while the ceremony is on screen. Callers owning a UI thread
 * must call it from a worker. This class adds no locking: concurrent callers must
 * serialize themselves, e.g. through {@link CredentialRetrievalCoordinator}, to
 * avoid duplicate prompts.
 *
 * <p>Decisions are reported to the injected {@link GuardEventListener}; this class
 * does no I/O of its own.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class CredentialGuard {

    private final SecureStore secureStore;
    private final Authenticator authenticator;
    private final AuthCache authCache;
    private final GuardEventListener eventListener;
    private final StorageAddress address;
    private final AuthenticationPrompt prompt;
    private final Clock clock;

    public CredentialGuard(
            SecureStore secureStore,
            Authenticator authenticator,
            AuthCache authCache,
            GuardEventListener eventListener,
            StorageAddress address,
            AuthenticationPrompt prompt,
            Clock clock) {

        this.secureStore = Objects.requireNonNull(secureStore, "SecureStore must not be null");
        this.authenticator = Objects.requireNonNull(authenticator, "Authenticator must not be null");
        this.authCache = Objects.requireNonNull(authCache, "AuthCache must not be null");
        this.eventListener = Objects.requireNonNull(eventListener, "Event listener must not be null");
        this.address = Objects.requireNonNull(address, "Storage address must not be null");
        this.prompt = Objects.requireNonNull(prompt, "Authentication prompt must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Whether biometric evaluation is possible right now. Never prompts and never
     * touches the cache; device errors fold into {@code false}.
     */
    public boolean isAvailable() {
        try {
            return authenticator.canEvaluate(AccessPolicy.biometricOnly());
        } catch (RuntimeException e) {
            emit(GuardEventType.AVAILABILITY_PROBE_FAILED, null, e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Whether an item is stored. Metadata-only query; never runs a ceremony.
     */
    public boolean hasStoredSecret() {
        try {
            return secureStore.exists(address);
        } catch (RuntimeException e) {
            emit(GuardEventType.EXISTENCE_PROBE_FAILED, null, e.getClass().getSimpleName());
            return false;
        }
    }

    /**
     * Replace the stored credential: delete any existing item, then add a new one
     * protected by the standard policy. Does not touch the cache.
     *
     * @param secret Credential bytes, well-formed UTF-8; not retained after the call
     * @return success, POLICY_CONSTRUCTION_FAILED or STORE_WRITE_FAILED(code)
     * @throws IllegalArgumentException if the secret is null or not valid UTF-8
     */
    public GuardResult<Void> store(byte[] secret) {
        if (secret == null) {
            throw new IllegalArgumentException("Secret must not be null");
        }
        if (!ProtectedSecret.isWellFormed(secret)) {
            throw new IllegalArgumentException("Secret must be valid UTF-8");
        }

        StoreResponse deleted = secureStore.delete(address);
        if (!deleted.isSuccess() && deleted.getStatus() != StoreStatus.NOT_FOUND) {
            GuardError error = GuardError.storeWriteFailed(deleted.getCode());
            emit(GuardEventType.STORE_FAILED, error, "delete of previous item failed");
            return GuardResult.failure(error);
        }

        StoreResponse response = secureStore.write(address, secret, AccessPolicy.standard());
        if (response.isSuccess()) {
            emit(GuardEventType.SECRET_STORED, null, null);
            return GuardResult.ok();
        }

        GuardError error = response.getStatus() == StoreStatus.POLICY_REJECTED
            ? GuardError.policyConstructionFailed()
            : GuardError.storeWriteFailed(response.getCode());
        emit(GuardEventType.STORE_FAILED, error, null);
        return GuardResult.failure(error);
    }

    /**
     * Retrieve the credential through a single authentication ceremony run by the store.
     *
     * <p>On success the cache records the ceremony time. Cancellation, failure and
     * absence leave the cache unchanged.
     *
     * @return the secret, or USER_CANCELLED, AUTHENTICATION_FAILED, NOT_FOUND,
     *     PAYLOAD_CORRUPT or STORAGE_ERROR(code)
     */
    public GuardResult<ProtectedSecret> retrieve() {
        StoreResponse response = secureStore.read(address, AccessPolicy.standard(), prompt);

        switch (response.getStatus()) {
            case SUCCESS:
                return decode(response.getPayload());
            case USER_CANCELLED:
                return fail(GuardEventType.RETRIEVAL_CANCELLED, GuardError.userCancelled());
            case AUTH_FAILED:
                return fail(GuardEventType.RETRIEVAL_FAILED, GuardError.authenticationFailed());
            case NOT_FOUND:
                return fail(GuardEventType.RETRIEVAL_FAILED, GuardError.notFound());
            default:
                return fail(GuardEventType.RETRIEVAL_FAILED, GuardError.storageError(response.getCode()));
        }
    }

    /**
     * Remove the stored credential. Idempotent: an absent item is success.
     */
    public GuardResult<Void> delete() {
        StoreResponse response = secureStore.delete(address);
        if (response.isSuccess() || response.getStatus() == StoreStatus.NOT_FOUND) {
            emit(GuardEventType.SECRET_DELETED, null, null);
            return GuardResult.ok();
        }

        GuardError error = GuardError.storageError(response.getCode());
        emit(GuardEventType.DELETE_FAILED, error, null);
        return GuardResult.failure(error);
    }

    /**
     * Sign-out: clear the cache and delete the stored credential.
     */
    public GuardResult<Void> resetAll() {
        authCache.clear();
        GuardResult<Void> deleted = delete();
        emit(GuardEventType.STATE_RESET, deleted.getError().orElse(null), null);
        return deleted;
    }

    /**
     * Whether a ceremony succeeded less than {@link AuthCache#CACHE_INTERVAL} ago.
     * Informational only; it never lets {@link #retrieve()} skip authentication.
     */
    public boolean isCacheValid() {
        return authCache.isValid();
    }

    public AuthCacheState cacheState() {
        return authCache.state();
    }

    public StorageAddress getAddress() {
        return address;
    }

    private GuardResult<ProtectedSecret> decode(byte[] payload) {
        if (payload == null) {
            return fail(GuardEventType.RETRIEVAL_FAILED, GuardError.payloadCorrupt());
        }

        ProtectedSecret secret;
        try {
            secret = ProtectedSecret.decode(payload);
        } catch (CharacterCodingException e) {
            return fail(GuardEventType.RETRIEVAL_FAILED, GuardError.payloadCorrupt());
        } finally {
            Arrays.fill(payload, (byte) 0);
        }

        authCache.recordSuccess();
        emit(GuardEventType.SECRET_RETRIEVED, null, null);
        return GuardResult.success(secret);
    }

    private GuardResult<ProtectedSecret> fail(GuardEventType type, GuardError error) {
        emit(type, error, null);
        return GuardResult.failure(error);
    }

    private void emit(GuardEventType type, GuardError error, String detail) {
        GuardEvent event = GuardEvent.builder()
            .type(type)
            .address(address)
            .error(error)
            .detail(detail)
            .occurredAt(clock.instant())
            .build();
        try {
            eventListener.onEvent(event);
        } catch (RuntimeException e) {
            // listener failures do not change the operation's result
            log.warn("Guard event listener failed for {}: {}", type, e.getMessage());
        }
    }
}
