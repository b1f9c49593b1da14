package com.credentialguard.config;

import com.credentialguard.application.AuthCache;
import com.credentialguard.application.CredentialGuard;
import com.credentialguard.application.CredentialRetrievalCoordinator;
import com.credentialguard.application.GuardEventListener;
import com.credentialguard.domain.model.StorageAddress;
import com.credentialguard.domain.port.AuthenticationPrompt;
import com.credentialguard.domain.port.Authenticator;
import com.credentialguard.domain.port.SecureStore;
import com.credentialguard.infrastructure.audit.LoggingGuardEventListener;
import com.credentialguard.infrastructure.store.InMemorySecureStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires one {@link CredentialGuard} per application context.
 *
 * <p>The host application supplies the {@link Authenticator}; without one no guard
 * is created. Every other collaborator has a default that the host may replace:
 * <ul>
 *   <li>{@link SecureStore} - {@link InMemorySecureStore} (sealed, process memory)</li>
 *   <li>{@link GuardEventListener} - {@link LoggingGuardEventListener}</li>
 * </ul>
 *
 * <p>No {@link Clock} or {@link MeterRegistry} bean is published. A single host
 * bean of either type is used when present; otherwise the system UTC clock and
 * {@link Metrics#globalRegistry} are.
 */
@AutoConfiguration(
    after = RetrievalExecutorConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(CredentialGuardProperties.class)
@ConditionalOnBean(Authenticator.class)
@Slf4j
public class CredentialGuardConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GuardEventListener guardEventListener(ObjectProvider<MeterRegistry> meterRegistry) {
        return new LoggingGuardEventListener(meterRegistry.getIfUnique(() -> Metrics.globalRegistry));
    }

    @Bean
    @ConditionalOnMissingBean
    public SecureStore secureStore(Authenticator authenticator) {
        log.warn("No SecureStore provided; using in-memory store. Stored credentials will not survive a restart");
        return new InMemorySecureStore(authenticator);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthCache authCache(ObjectProvider<Clock> clock) {
        return new AuthCache(clockOf(clock));
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialGuard credentialGuard(
            SecureStore secureStore,
            Authenticator authenticator,
            AuthCache authCache,
            GuardEventListener guardEventListener,
            CredentialGuardProperties properties,
            ObjectProvider<Clock> clock) {

        StorageAddress address = new StorageAddress(properties.getService(), properties.getAccount());
        AuthenticationPrompt prompt = new AuthenticationPrompt(properties.getPromptReason(), properties.getCancelLabel());

        log.info("Credential guard configured for {}", address);
        return new CredentialGuard(
            secureStore, authenticator, authCache, guardEventListener, address, prompt, clockOf(clock));
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialRetrievalCoordinator credentialRetrievalCoordinator(
            CredentialGuard credentialGuard,
            @Qualifier(RetrievalExecutorConfiguration.EXECUTOR_BEAN_NAME) Executor executor) {
        return new CredentialRetrievalCoordinator(credentialGuard, executor);
    }

    private static Clock clockOf(ObjectProvider<Clock> clock) {
        return clock.getIfUnique(Clock::systemUTC);
    }
}
