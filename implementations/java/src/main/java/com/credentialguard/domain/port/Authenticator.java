package com.credentialguard.domain.port;

import com.credentialguard.domain.model.AccessPolicy;

/**
 * Capability that evaluates an access policy against the live user.
 *
 * <p>Provided by the host application (sensor driver, OS prompt).
 */
public interface Authenticator {

    /**
     * Whether the policy can currently be evaluated: sensor present, enrolled,
     * not locked out. Must not prompt and must have no side effect.
     *
     * @param policy Policy to probe
     * @return true if a ceremony for this policy could run now
     */
    boolean canEvaluate(AccessPolicy policy);

    /**
     * Run one ceremony. Blocks until the user finishes; called by
     * {@link SecureStore} implementations only.
     *
     * @param policy Policy the user must satisfy
     * @param prompt Reason and cancel label to display
     * @return Ceremony outcome
     */
    AuthenticationOutcome evaluate(AccessPolicy policy, AuthenticationPrompt prompt);

    /**
     * Opaque identifier of the currently enrolled biometric set, or {@code null}
     * when the authenticator cannot tell.
     */
    default String currentEnrollmentSet() {
        return null;
    }
}
