package com.credentialguard.domain.port;

import lombok.Value;

/**
 * Caller-visible text for the authentication ceremony.
 */
@Value
public class AuthenticationPrompt {
    String reason;
    String cancelLabel;

    public AuthenticationPrompt(String reason, String cancelLabel) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Prompt reason must not be null or blank");
        }
        if (cancelLabel == null || cancelLabel.isBlank()) {
            throw new IllegalArgumentException("Cancel label must not be null or blank");
        }
        this.reason = reason;
        this.cancelLabel = cancelLabel;
    }
}
