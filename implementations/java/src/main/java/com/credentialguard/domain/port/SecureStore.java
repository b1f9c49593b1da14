package com.credentialguard.domain.port;

import com.credentialguard.domain.model.AccessPolicy;
import com.credentialguard.domain.model.StorageAddress;

/**
 * Capability-backed persistent key/value store holding the protected item.
 *
 * <p>Implementations must enforce:
 * <ul>
 *   <li>The access policy attached at write time, re-evaluated on every read</li>
 *   <li>Exactly one authentication ceremony per {@link #read} call</li>
 *   <li>No ceremony for {@link #exists}, {@link #write} or {@link #delete}</li>
 *   <li>Invalidation of items bound to a biometric enrollment set that changed</li>
 * </ul>
 *
 * <p>Failures are reported through {@link StoreResponse}, never thrown.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface SecureStore {

    /**
     * Metadata-only existence check.
     *
     * @param address Item address
     * @return true if an item is stored at the address
     */
    boolean exists(StorageAddress address);

    /**
     * Add a new item. Never updates in place.
     *
     * @param address Item address
     * @param payload Secret bytes
     * @param policy Access policy attached to the item
     * @return SUCCESS, POLICY_REJECTED, DUPLICATE_ITEM or another failure status
     */
    StoreResponse write(StorageAddress address, byte[] payload, AccessPolicy policy);

    /**
     * Remove the item.
     *
     * @param address Item address
     * @return SUCCESS, NOT_FOUND or another failure status
     */
    StoreResponse delete(StorageAddress address);

    /**
     * Read the item, running one authentication ceremony.
     *
     * @param address Item address
     * @param policy Policy the caller expects the item to carry
     * @param prompt Text shown during the ceremony
     * @return SUCCESS with payload, or the failure status
     */
    StoreResponse read(StorageAddress address, AccessPolicy policy, AuthenticationPrompt prompt);
}
