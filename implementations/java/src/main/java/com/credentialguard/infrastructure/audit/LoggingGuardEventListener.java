package com.credentialguard.infrastructure.audit;

import com.credentialguard.application.GuardEvent;
import com.credentialguard.application.GuardEventListener;
import com.credentialguard.domain.model.GuardError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Default guard event sink: one log line per event plus a Micrometer counter.
 *
 * <p>Cancellation is expected user behaviour and logged at INFO; corrupt payloads
 * are data-integrity problems and logged at ERROR.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingGuardEventListener implements GuardEventListener {

    public static final String METER_NAME = "credential.guard.events";

    private final MeterRegistry meterRegistry;

    @Override
    public void onEvent(GuardEvent event) {
        Counter.builder(METER_NAME)
            .tag("type", event.getType().name())
            .description("Credential guard decisions")
            .register(meterRegistry)
            .increment();

        GuardError error = event.getError();
        switch (event.getType()) {
            case SECRET_STORED:
            case SECRET_DELETED:
            case STATE_RESET:
                if (error == null) {
                    log.info("GUARD event={} address={}", event.getType(), event.getAddress());
                } else {
                    log.warn("GUARD event={} address={} error={}", event.getType(), event.getAddress(), error);
                }
                break;
            case SECRET_RETRIEVED:
                log.debug("GUARD event={} address={}", event.getType(), event.getAddress());
                break;
            case RETRIEVAL_CANCELLED:
                log.info("GUARD event={} address={}", event.getType(), event.getAddress());
                break;
            case RETRIEVAL_FAILED:
                if (error != null && error.getKind().requiresReprovisioning()) {
                    log.error("GUARD event={} address={} error={} - delete and provision again",
                        event.getType(), event.getAddress(), error);
                } else {
                    log.warn("GUARD event={} address={} error={}", event.getType(), event.getAddress(), error);
                }
                break;
            default:
                log.warn("GUARD event={} address={} error={} detail={}",
                    event.getType(), event.getAddress(), error, event.getDetail());
        }
    }
}
