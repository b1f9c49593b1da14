package com.credentialguard.application;

import com.credentialguard.domain.model.GuardResult;
import com.credentialguard.domain.model.ProtectedSecret;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single in-flight guard around {@link CredentialGuard#retrieve()}.
 *
 * <p>Runs the blocking retrieval on a worker executor so UI-owning threads never
 * wait on the ceremony. Callers arriving while a ceremony is on screen join it
 * instead of triggering a second prompt. Every caller gets its own copy of the
 * secret; the shared original is zeroed once the last joiner has copied it.
 * A finished ceremony is never joined. If the executor rejects the ceremony the
 * returned future fails with {@link RejectedExecutionException}.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class CredentialRetrievalCoordinator {

    private final CredentialGuard credentialGuard;
    private final Executor executor;
    private final Object lock = new Object();

    // guarded by lock
    private Ceremony current;

    public CredentialRetrievalCoordinator(CredentialGuard credentialGuard, Executor executor) {
        this.credentialGuard = Objects.requireNonNull(credentialGuard, "CredentialGuard must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    /**
     * Retrieve the credential off the calling thread.
     *
     * @return future completing with this caller's own result
     */
    public CompletableFuture<GuardResult<ProtectedSecret>> retrieveAsync() {
        synchronized (lock) {
            if (current == null || current.future.isDone()) {
                current = new Ceremony(start());
            } else {
                log.debug("Joining in-flight ceremony for {}", credentialGuard.getAddress());
            }

            Ceremony ceremony = current;
            ceremony.joiners++;
            return ceremony.future.thenApply(result -> handOut(ceremony, result));
        }
    }

    /**
     * Whether a ceremony is currently running.
     */
    public boolean isInFlight() {
        synchronized (lock) {
            return current != null && !current.future.isDone();
        }
    }

    private CompletableFuture<GuardResult<ProtectedSecret>> start() {
        try {
            return CompletableFuture.supplyAsync(credentialGuard::retrieve, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Retrieval executor rejected ceremony for {}: {}", credentialGuard.getAddress(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    private GuardResult<ProtectedSecret> handOut(Ceremony ceremony, GuardResult<ProtectedSecret> shared) {
        synchronized (lock) {
            GuardResult<ProtectedSecret> own = shared.map(ProtectedSecret::copy);
            ceremony.joiners--;
            if (ceremony.joiners == 0 && shared.isSuccess()) {
                shared.getValue().purge();
            }
            return own;
        }
    }

    private static final class Ceremony {
        private final CompletableFuture<GuardResult<ProtectedSecret>> future;
        private int joiners;

        private Ceremony(CompletableFuture<GuardResult<ProtectedSecret>> future) {
            this.future = future;
        }
    }
}
