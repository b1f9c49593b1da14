package com.credentialguard.application;

import com.credentialguard.domain.model.GuardError;
import com.credentialguard.domain.model.StorageAddress;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Structured record of a guard decision. Never carries secret material.
 */
@Value
@Builder
public class GuardEvent {
    GuardEventType type;
    StorageAddress address;
    GuardError error;
    String detail;
    Instant occurredAt;
}
