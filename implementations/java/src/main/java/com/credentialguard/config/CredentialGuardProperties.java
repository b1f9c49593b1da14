package com.credentialguard.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code credential-guard.*}. Read once at startup.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "credential-guard")
public class CredentialGuardProperties {

    /** Service part of the storage address. */
    @NotBlank
    private String service = "credential-guard-biometric-token";

    /** Account part of the storage address. */
    @NotBlank
    private String account = "api-token";

    /** Reason shown in the authentication prompt. */
    @NotBlank
    private String promptReason = "Access your API credentials";

    /** Label of the prompt's cancel button. */
    @NotBlank
    private String cancelLabel = "Cancel";

    @Valid
    private RetrievalExecutor retrievalExecutor = new RetrievalExecutor();

    @Data
    public static class RetrievalExecutor {

        /** Retrievals waiting behind the running ceremony before further ones are rejected. */
        @Min(1)
        private int queueCapacity = 16;
    }
}
