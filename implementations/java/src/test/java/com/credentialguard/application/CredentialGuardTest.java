package com.credentialguard.application;

import com.credentialguard.domain.model.AccessPolicy;
import com.credentialguard.domain.model.AuthFactor;
import com.credentialguard.domain.model.GuardError;
import com.credentialguard.domain.model.GuardResult;
import com.credentialguard.domain.model.ProtectedSecret;
import com.credentialguard.domain.model.StorageAddress;
import com.credentialguard.domain.port.AuthenticationOutcome;
import com.credentialguard.domain.port.AuthenticationPrompt;
import com.credentialguard.domain.port.Authenticator;
import com.credentialguard.domain.port.SecureStore;
import com.credentialguard.domain.port.StoreResponse;
import com.credentialguard.domain.port.StoreStatus;
import com.credentialguard.infrastructure.crypto.AesGcmPayloadCipher;
import com.credentialguard.infrastructure.store.InMemorySecureStore;
import com.credentialguard.support.FakeAuthenticator;
import com.credentialguard.support.ForbiddenAuthenticator;
import com.credentialguard.support.MutableClock;
import com.credentialguard.support.RecordingEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class CredentialGuardTest {

    private static final StorageAddress ADDRESS = new StorageAddress("test-service", "test-account");
    private static final AuthenticationPrompt PROMPT = new AuthenticationPrompt("Access your API credentials", "Cancel");

    private MutableClock clock;
    private FakeAuthenticator authenticator;
    private RecordingEventListener events;
    private InMemorySecureStore store;
    private CredentialGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-18T09:00:00Z"));
        authenticator = new FakeAuthenticator();
        events = new RecordingEventListener();
        store = new InMemorySecureStore(authenticator);
        guard = guardWith(store, authenticator);
    }

    private CredentialGuard guardWith(SecureStore secureStore, Authenticator auth) {
        return new CredentialGuard(secureStore, auth, new AuthCache(clock), events, ADDRESS, PROMPT, clock);
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void storeTwiceKeepsOnlyTheLatestSecret() {
        assertTrue(guard.store(utf8("sk-first")).isSuccess());
        assertTrue(guard.store(utf8("sk-second")).isSuccess());

        try (ProtectedSecret secret = guard.retrieve().getValue()) {
            assertArrayEquals(utf8("sk-second"), secret.getBytes());
        }
        assertTrue(guard.delete().isSuccess());
        assertFalse(guard.hasStoredSecret(), "a single delete must remove everything that was stored");
    }

    @Test
    void roundTripReturnsIdenticalBytes() {
        byte[] original = utf8("sk-ant-é中☃-token");
        guard.store(original);

        GuardResult<ProtectedSecret> result = guard.retrieve();

        assertTrue(result.isSuccess());
        assertArrayEquals(original, result.getValue().getBytes());
        assertTrue(result.getValue().contentEquals(original));
    }

    @Test
    void deleteOnAbsentItemSucceeds() {
        GuardResult<Void> first = guard.delete();
        GuardResult<Void> second = guard.delete();

        assertTrue(first.isSuccess());
        assertTrue(second.isSuccess());
        assertFalse(first.failedWith(GuardError.Kind.NOT_FOUND));
    }

    @Test
    void hasStoredSecretNeverConsultsTheAuthenticator() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.exists(ADDRESS)).thenReturn(true);
        CredentialGuard probeOnly = guardWith(secureStore, new ForbiddenAuthenticator());

        assertTrue(probeOnly.hasStoredSecret());

        verify(secureStore).exists(ADDRESS);
        verifyNoMoreInteractions(secureStore);
    }

    @Test
    void hasStoredSecretOnRealStoreRunsNoCeremony() {
        guard.store(utf8("sk-token"));

        assertTrue(guard.hasStoredSecret());
        assertEquals(0, authenticator.ceremonies());
        assertEquals(0, authenticator.probes());
    }

    @Test
    void cacheIsInvalidBeforeAnySuccess() {
        assertFalse(guard.isCacheValid());
        assertFalse(guard.cacheState().getCreatedAt().isPresent());
    }

    @Test
    void cacheExpiresExactlyAtTheInterval() {
        guard.store(utf8("sk-token"));
        guard.retrieve();
        assertTrue(guard.isCacheValid());

        clock.advance(AuthCache.CACHE_INTERVAL.minusSeconds(1));
        assertTrue(guard.isCacheValid());

        clock.advance(Duration.ofSeconds(1));
        assertFalse(guard.isCacheValid());
        assertFalse(guard.cacheState().getCreatedAt().isPresent());

        clock.advance(Duration.ofHours(5));
        assertFalse(guard.isCacheValid());
    }

    @Test
    void storingDoesNotCountAsAuthenticating() {
        guard.store(utf8("sk-token"));

        assertFalse(guard.isCacheValid());
    }

    @Test
    void resetAllClearsStorageAndCache() {
        guard.store(utf8("sk-token"));
        guard.retrieve();
        assertTrue(guard.isCacheValid());

        GuardResult<Void> reset = guard.resetAll();

        assertTrue(reset.isSuccess());
        assertFalse(guard.hasStoredSecret());
        assertFalse(guard.isCacheValid());
        assertTrue(events.types().contains(GuardEventType.STATE_RESET));
    }

    @Test
    void unavailableAuthenticatorDoesNotBlockStorage() {
        authenticator.withEnrolled(EnumSet.noneOf(AuthFactor.class));

        assertFalse(guard.isAvailable());
        assertTrue(guard.store(utf8("sk-token")).isSuccess());
        assertTrue(guard.hasStoredSecret());
    }

    @Test
    void storeRejectedPolicySurfacesPolicyConstructionFailed() {
        InMemorySecureStore passcodeOnly = new InMemorySecureStore(
            authenticator, new AesGcmPayloadCipher(), EnumSet.of(AuthFactor.DEVICE_PASSCODE));
        CredentialGuard noBiometricHardware = guardWith(passcodeOnly, authenticator);

        GuardResult<Void> result = noBiometricHardware.store(utf8("sk-token"));

        assertTrue(result.failedWith(GuardError.Kind.POLICY_CONSTRUCTION_FAILED));
        assertFalse(noBiometricHardware.hasStoredSecret());
    }

    @Test
    void storeWriteFailurePreservesCode() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.delete(ADDRESS)).thenReturn(StoreResponse.of(StoreStatus.NOT_FOUND));
        when(secureStore.write(any(), any(), any())).thenReturn(StoreResponse.of(StoreStatus.OTHER, -61));

        GuardResult<Void> result = guardWith(secureStore, authenticator).store(utf8("sk-token"));

        assertTrue(result.failedWith(GuardError.Kind.STORE_WRITE_FAILED));
        assertEquals(Optional.of(-61), result.getError().get().getCode());
    }

    @Test
    void storeAttachesStandardPolicy() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.delete(ADDRESS)).thenReturn(StoreResponse.success());
        when(secureStore.write(any(), any(), any())).thenReturn(StoreResponse.success());
        byte[] secret = utf8("sk-token");

        guardWith(secureStore, authenticator).store(secret);

        verify(secureStore).delete(ADDRESS);
        verify(secureStore).write(ADDRESS, secret, AccessPolicy.standard());
    }

    @Test
    void storeNullIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> guard.store(null));
    }

    @Test
    void storeRejectsSecretThatIsNotUtf8() {
        byte[] notUtf8 = {(byte) 0xFF, 0x01, 0x02};

        assertThrows(IllegalArgumentException.class, () -> guard.store(notUtf8));
        assertFalse(guard.hasStoredSecret());
        assertTrue(events.events().isEmpty());
    }

    @Test
    void storeReportsDeleteFailureWithoutWriting() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.delete(ADDRESS)).thenReturn(StoreResponse.of(StoreStatus.OTHER, -25308));

        GuardResult<Void> result = guardWith(secureStore, authenticator).store(utf8("sk-token"));

        assertTrue(result.failedWith(GuardError.Kind.STORE_WRITE_FAILED));
        assertEquals(Optional.of(-25308), result.getError().get().getCode());
        verify(secureStore, never()).write(any(), any(), any());
        assertEquals(GuardEventType.STORE_FAILED, events.types().get(events.types().size() - 1));
    }

    @Test
    void retrieveOnEmptyStoreIsNotFoundWithoutPrompting() {
        GuardResult<ProtectedSecret> result = guard.retrieve();

        assertTrue(result.failedWith(GuardError.Kind.NOT_FOUND));
        assertEquals(0, authenticator.ceremonies());
    }

    @Test
    void retrieveRunsExactlyOneCeremonyWithThePrompt() {
        guard.store(utf8("sk-token"));

        guard.retrieve();

        assertEquals(1, authenticator.ceremonies());
        assertEquals(PROMPT, authenticator.lastPrompt());
    }

    @Test
    void cancelledCeremonyLeavesCacheUntouched() {
        guard.store(utf8("sk-token"));
        guard.retrieve();
        Instant firstSuccess = guard.cacheState().getCreatedAt().orElseThrow();

        clock.advance(Duration.ofMinutes(10));
        authenticator.thenAnswer(AuthenticationOutcome.CANCELLED);
        GuardResult<ProtectedSecret> result = guard.retrieve();

        assertTrue(result.failedWith(GuardError.Kind.USER_CANCELLED));
        assertTrue(result.getError().get().getKind().isUserInitiated());
        assertEquals(firstSuccess, guard.cacheState().getCreatedAt().orElseThrow());
        assertTrue(events.types().contains(GuardEventType.RETRIEVAL_CANCELLED));
    }

    @Test
    void cancellationBeforeAnySuccessKeepsCacheEmpty() {
        guard.store(utf8("sk-token"));
        authenticator.thenAnswer(AuthenticationOutcome.CANCELLED);

        guard.retrieve();

        assertFalse(guard.isCacheValid());
    }

    @Test
    void failedCeremonyIsDistinctFromCancellation() {
        guard.store(utf8("sk-token"));
        authenticator.thenAnswer(AuthenticationOutcome.FAILED);

        GuardResult<ProtectedSecret> result = guard.retrieve();

        assertTrue(result.failedWith(GuardError.Kind.AUTHENTICATION_FAILED));
        assertFalse(result.getError().get().getKind().isUserInitiated());
        assertFalse(guard.isCacheValid());
    }

    @Test
    void failedCeremonyIsNotRetried() {
        guard.store(utf8("sk-token"));
        authenticator.thenAnswer(AuthenticationOutcome.FAILED);

        guard.retrieve();

        assertEquals(1, authenticator.ceremonies());
    }

    @Test
    void undecodablePayloadIsCorrupt() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.read(any(), any(), any()))
            .thenReturn(StoreResponse.success(new byte[] {(byte) 0xC3, (byte) 0x28}));
        guard = guardWith(secureStore, authenticator);

        GuardResult<ProtectedSecret> result = guard.retrieve();

        assertTrue(result.failedWith(GuardError.Kind.PAYLOAD_CORRUPT));
        assertTrue(result.getError().get().getKind().requiresReprovisioning());
        assertFalse(guard.isCacheValid());
    }

    @Test
    void missingPayloadIsCorrupt() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.read(any(), any(), any())).thenReturn(StoreResponse.success(null));

        GuardResult<ProtectedSecret> result = guardWith(secureStore, authenticator).retrieve();

        assertTrue(result.failedWith(GuardError.Kind.PAYLOAD_CORRUPT));
    }

    @Test
    void unknownStoreStatusKeepsRawCode() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.read(any(), any(), any())).thenReturn(StoreResponse.of(StoreStatus.OTHER, -34018));

        GuardResult<ProtectedSecret> result = guardWith(secureStore, authenticator).retrieve();

        assertTrue(result.failedWith(GuardError.Kind.STORAGE_ERROR));
        assertEquals(Optional.of(-34018), result.getError().get().getCode());
    }

    @Test
    void deleteFailureIsReported() {
        SecureStore secureStore = mock(SecureStore.class);
        when(secureStore.delete(ADDRESS)).thenReturn(StoreResponse.of(StoreStatus.OTHER, -25308));

        GuardResult<Void> result = guardWith(secureStore, authenticator).delete();

        assertTrue(result.failedWith(GuardError.Kind.STORAGE_ERROR));
        assertEquals(Optional.of(-25308), result.getError().get().getCode());
        assertTrue(events.types().contains(GuardEventType.DELETE_FAILED));
    }

    @Test
    void availabilityProbeFoldsDeviceErrorsIntoFalse() {
        Authenticator broken = mock(Authenticator.class);
        when(broken.canEvaluate(any())).thenThrow(new IllegalStateException("sensor offline"));

        assertFalse(guardWith(store, broken).isAvailable());
        assertEquals(GuardEventType.AVAILABILITY_PROBE_FAILED, events.types().get(events.types().size() - 1));
    }

    @Test
    void availabilityProbesBiometricOnly() {
        authenticator.withEnrolled(EnumSet.of(AuthFactor.DEVICE_PASSCODE));

        assertFalse(guard.isAvailable(), "passcode alone does not make biometrics available");

        authenticator.withEnrolled(EnumSet.of(AuthFactor.BIOMETRIC));
        assertTrue(guard.isAvailable());
        assertEquals(0, authenticator.ceremonies());
    }

    @Test
    void failingListenerDoesNotChangeTheResult() {
        GuardEventListener failing = event -> {
            throw new IllegalStateException("audit sink down");
        };
        CredentialGuard withFailingListener = new CredentialGuard(
            store, authenticator, new AuthCache(clock), failing, ADDRESS, PROMPT, clock);

        assertTrue(withFailingListener.store(utf8("sk-token")).isSuccess());
        assertTrue(withFailingListener.retrieve().isSuccess());
    }

    @Test
    void eventsNeverCarrySecretMaterial() {
        guard.store(utf8("sk-very-secret"));
        guard.retrieve();

        events.events().forEach(event -> assertFalse(event.toString().contains("sk-very-secret")));
    }
}
