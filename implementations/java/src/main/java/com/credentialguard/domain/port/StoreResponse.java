package com.credentialguard.domain.port;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Objects;

/**
 * Outcome of a {@link SecureStore} call: status, raw code and, for reads, the payload.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreResponse {

    private final StoreStatus status;

    private final int code;

    private final byte[] payload;

    public static StoreResponse success() {
        return new StoreResponse(StoreStatus.SUCCESS, StoreStatus.SUCCESS.getDefaultCode(), null);
    }

    /**
     * Successful read. The payload is handed over, not copied.
     */
    public static StoreResponse success(byte[] payload) {
        return new StoreResponse(StoreStatus.SUCCESS, StoreStatus.SUCCESS.getDefaultCode(), payload);
    }

    public static StoreResponse of(StoreStatus status) {
        return of(status, status.getDefaultCode());
    }

    public static StoreResponse of(StoreStatus status, int code) {
        Objects.requireNonNull(status, "Status must not be null");
        if (status == StoreStatus.SUCCESS) {
            throw new IllegalArgumentException("Use success() for successful responses");
        }
        return new StoreResponse(status, code, null);
    }

    public boolean isSuccess() {
        return status == StoreStatus.SUCCESS;
    }

    @Override
    public String toString() {
        return "StoreResponse[status=" + status + ", code=" + code
            + (payload != null ? ", payload=" + payload.length + " bytes" : "") + "]";
    }
}
