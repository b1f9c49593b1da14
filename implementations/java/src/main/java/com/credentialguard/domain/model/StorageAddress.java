package com.credentialguard.domain.model;

import lombok.Value;

/**
 * Immutable address of the single item managed by the guard.
 *
 * <p>Built once at startup and constant for the lifetime of the process.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Value
public class StorageAddress {
    String service;
    String account;

    public StorageAddress(String service, String account) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("Service must not be null or blank");
        }
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("Account must not be null or blank");
        }
        this.service = service;
        this.account = account;
    }

    @Override
    public String toString() {
        return service + "/" + account;
    }
}
