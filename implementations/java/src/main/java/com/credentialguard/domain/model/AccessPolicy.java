package com.credentialguard.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Access-control policy attached to the stored secret at write time.
 *
 * <p>The policy is plain data: a set of {@link AuthFactor}s joined by a
 * {@link PolicyCombinator}, plus the device state and biometric scope the
 * secure store must enforce on every read. Evaluating it against presented
 * factors requires no hardware.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>At least one factor is required</li>
 *   <li>Immutable - factor set is defensively copied</li>
 *   <li>Enrollment binding is enforced by the store, not by this class</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class AccessPolicy {

    private final Set<AuthFactor> factors;

    private final PolicyCombinator combinator;

    private final Accessibility accessibility;

    private final BiometricScope scope;

    /**
     * Creates a policy with validation.
     *
     * @param factors Required factors (non-empty, defensively copied)
     * @param combinator How factors combine
     * @param accessibility Device state required for extraction
     * @param scope Biometric enrollment binding
     * @return New policy
     * @throws IllegalArgumentException if no factor is given
     */
    public static AccessPolicy of(
            Set<AuthFactor> factors,
            PolicyCombinator combinator,
            Accessibility accessibility,
            BiometricScope scope) {

        Objects.requireNonNull(factors, "Factors must not be null");
        if (factors.isEmpty()) {
            throw new IllegalArgumentException("Access policy requires at least one factor");
        }

        return new AccessPolicy(
            Collections.unmodifiableSet(EnumSet.copyOf(factors)),
            Objects.requireNonNull(combinator, "Combinator must not be null"),
            Objects.requireNonNull(accessibility, "Accessibility must not be null"),
            Objects.requireNonNull(scope, "Biometric scope must not be null")
        );
    }

    /**
     * Policy protecting the stored credential: biometric OR device passcode,
     * device unlocked, bound to the current enrollment set.
     *
     * @return Standard storage policy
     */
    public static AccessPolicy standard() {
        return of(
            EnumSet.of(AuthFactor.BIOMETRIC, AuthFactor.DEVICE_PASSCODE),
            PolicyCombinator.OR,
            Accessibility.WHEN_UNLOCKED_THIS_DEVICE_ONLY,
            BiometricScope.CURRENT_ENROLLMENT_SET
        );
    }

    /**
     * Biometric-only policy used to probe sensor availability.
     *
     * @return Biometric-only policy
     */
    public static AccessPolicy biometricOnly() {
        return of(
            EnumSet.of(AuthFactor.BIOMETRIC),
            PolicyCombinator.OR,
            Accessibility.WHEN_UNLOCKED_THIS_DEVICE_ONLY,
            BiometricScope.CURRENT_ENROLLMENT_SET
        );
    }

    /**
     * Check whether the presented factors satisfy this policy.
     *
     * @param presented Factors the user proved
     * @return true if OR and any factor matches, or AND and all factors match
     */
    public boolean isSatisfiedBy(Set<AuthFactor> presented) {
        Objects.requireNonNull(presented, "Presented factors must not be null");

        if (combinator == PolicyCombinator.AND) {
            return presented.containsAll(factors);
        }
        return factors.stream().anyMatch(presented::contains);
    }

    public boolean requires(AuthFactor factor) {
        return factors.contains(factor);
    }

    @Override
    public String toString() {
        return String.format(
            "AccessPolicy[factors=%s, combinator=%s, accessibility=%s, scope=%s]",
            factors, combinator, accessibility, scope
        );
    }
}
