package com.credentialguard.infrastructure.store;

import com.credentialguard.domain.model.AccessPolicy;
import com.credentialguard.domain.model.AuthFactor;
import com.credentialguard.domain.model.BiometricScope;
import com.credentialguard.domain.model.StorageAddress;
import com.credentialguard.domain.port.AuthenticationOutcome;
import com.credentialguard.domain.port.AuthenticationPrompt;
import com.credentialguard.domain.port.Authenticator;
import com.credentialguard.domain.port.SecureStore;
import com.credentialguard.domain.port.StoreResponse;
import com.credentialguard.domain.port.StoreStatus;
import com.credentialguard.infrastructure.crypto.AesGcmPayloadCipher;
import com.credentialguard.infrastructure.crypto.PayloadCipher;
import com.credentialguard.infrastructure.crypto.SealedPayload;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Software {@link SecureStore} holding sealed items in process memory.
 *
 * <p>Used when the host application does not provide a platform-backed store.
 * Enforces the same contract a hardware keystore does:
 * <ul>
 *   <li>Payloads sealed at rest with AES-256-GCM, bound to their address</li>
 *   <li>Add never overwrites: an existing item yields DUPLICATE_ITEM</li>
 *   <li>Policies needing an unsupported factor are rejected at write time</li>
 *   <li>Each read runs exactly one ceremony through the {@link Authenticator}</li>
 *   <li>Items bound to the current enrollment set vanish when that set changes</li>
 * </ul>
 *
 * <p>Nothing survives a restart. Device-unlock state is not observable here, so
 * {@code WHEN_UNLOCKED_THIS_DEVICE_ONLY} is delegated to the authenticator's ceremony.
 */
@Slf4j
public class InMemorySecureStore implements SecureStore {

    private final Authenticator authenticator;
    private final PayloadCipher cipher;
    private final Set<AuthFactor> supportedFactors;
    private final Map<StorageAddress, StoredItem> items = new ConcurrentHashMap<>();

    public InMemorySecureStore(Authenticator authenticator) {
        this(authenticator, new AesGcmPayloadCipher(), EnumSet.allOf(AuthFactor.class));
    }

    public InMemorySecureStore(Authenticator authenticator, PayloadCipher cipher, Set<AuthFactor> supportedFactors) {
        this.authenticator = Objects.requireNonNull(authenticator, "Authenticator must not be null");
        this.cipher = Objects.requireNonNull(cipher, "Cipher must not be null");
        this.supportedFactors = EnumSet.copyOf(Objects.requireNonNull(supportedFactors, "Supported factors must not be null"));
    }

    @Override
    public boolean exists(StorageAddress address) {
        return items.containsKey(address);
    }

    @Override
    public StoreResponse write(StorageAddress address, byte[] payload, AccessPolicy policy) {
        if (!supportedFactors.containsAll(policy.getFactors())) {
            log.warn("Rejecting policy for {}: supported factors {} do not cover {}",
                address, supportedFactors, policy.getFactors());
            return StoreResponse.of(StoreStatus.POLICY_REJECTED);
        }

        SealedPayload sealed;
        try {
            sealed = cipher.seal(payload, associatedData(address));
        } catch (AesGcmPayloadCipher.CryptoException e) {
            return StoreResponse.of(StoreStatus.OTHER);
        }

        StoredItem item = new StoredItem(sealed, policy, enrollmentBinding(policy));
        if (items.putIfAbsent(address, item) != null) {
            return StoreResponse.of(StoreStatus.DUPLICATE_ITEM);
        }

        log.debug("Stored item at {} with {}", address, policy);
        return StoreResponse.success();
    }

    @Override
    public StoreResponse delete(StorageAddress address) {
        return items.remove(address) != null
            ? StoreResponse.success()
            : StoreResponse.of(StoreStatus.NOT_FOUND);
    }

    @Override
    public StoreResponse read(StorageAddress address, AccessPolicy policy, AuthenticationPrompt prompt) {
        StoredItem item = items.get(address);
        if (item == null) {
            return StoreResponse.of(StoreStatus.NOT_FOUND);
        }

        if (!item.getPolicy().equals(policy)) {
            log.warn("Read of {} presented {} but item carries {}", address, policy, item.getPolicy());
            return StoreResponse.of(StoreStatus.POLICY_REJECTED);
        }

        if (item.getEnrollmentSet() != null
                && !item.getEnrollmentSet().equals(authenticator.currentEnrollmentSet())) {
            log.info("Biometric enrollment changed since {} was stored; invalidating item", address);
            items.remove(address, item);
            return StoreResponse.of(StoreStatus.NOT_FOUND);
        }

        AuthenticationOutcome outcome = authenticator.evaluate(item.getPolicy(), prompt);
        switch (outcome) {
            case SUCCESS:
                return open(address, item);
            case CANCELLED:
                return StoreResponse.of(StoreStatus.USER_CANCELLED);
            case FAILED:
            case UNAVAILABLE:
                return StoreResponse.of(StoreStatus.AUTH_FAILED);
            default:
                throw new IllegalStateException("Unknown authentication outcome: " + outcome);
        }
    }

    private StoreResponse open(StorageAddress address, StoredItem item) {
        try {
            return StoreResponse.success(cipher.open(item.getSealed(), associatedData(address)));
        } catch (AesGcmPayloadCipher.CryptoException e) {
            log.error("Integrity check failed for item at {}", address);
            return StoreResponse.of(StoreStatus.INTEGRITY_FAILURE);
        }
    }

    private String enrollmentBinding(AccessPolicy policy) {
        if (policy.getScope() != BiometricScope.CURRENT_ENROLLMENT_SET || !policy.requires(AuthFactor.BIOMETRIC)) {
            return null;
        }
        return authenticator.currentEnrollmentSet();
    }

    private static byte[] associatedData(StorageAddress address) {
        return (address.getService() + '\0' + address.getAccount()).getBytes(StandardCharsets.UTF_8);
    }

    @Value
    private static class StoredItem {
        SealedPayload sealed;
        AccessPolicy policy;
        String enrollmentSet;
    }
}
