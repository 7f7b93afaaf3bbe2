package com.fellowship.auth.twofactor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 {@link ConcurrentHashMap} 的非持久化二次验证存储，仅用于本地开发与集成测试。
 */
public class InMemoryTwoFactorStore implements TwoFactorStore {

    private final ConcurrentHashMap<Long, TwoFactorEnrollment> enrollments = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Set<String>> backupCodes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTwoFactorStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<TwoFactorEnrollment> findEnrollment(long userId) {
        return Optional.ofNullable(enrollments.get(userId));
    }

    @Override
    public void saveEnrollment(TwoFactorEnrollment enrollment, Set<String> backupCodeHashes) {
        enrollments.put(enrollment.userId(), enrollment);
        replaceBackupCodes(enrollment.userId(), backupCodeHashes);
    }

    @Override
    public boolean deleteEnrollment(long userId) {
        backupCodes.remove(userId);
        return enrollments.remove(userId) != null;
    }

    @Override
    public boolean consumeBackupCode(long userId, String codeHash) {
        Set<String> codes = backupCodes.get(userId);
        return codes != null && codes.remove(codeHash);
    }

    @Override
    public void replaceBackupCodes(long userId, Set<String> backupCodeHashes) {
        Set<String> codes = ConcurrentHashMap.newKeySet();
        codes.addAll(backupCodeHashes);
        backupCodes.put(userId, codes);
    }

    @Override
    public int countBackupCodes(long userId) {
        Set<String> codes = backupCodes.get(userId);
        return codes == null ? 0 : codes.size();
    }

    @Override
    public boolean advanceLastUsedStep(long userId, long step) {
        boolean[] advanced = {false};
        enrollments.computeIfPresent(userId, (id, current) -> {
            if (step <= current.lastUsedStep()) {
                return current;
            }
            advanced[0] = true;
            return new TwoFactorEnrollment(current.userId(), current.secret(), current.enabledAt(), step);
        });
        return advanced[0];
    }

    @Override
    public void savePendingChallenge(PendingTwoFactorChallenge challenge, Duration ttl) {
        pending.put(challenge.sessionId(), new PendingEntry(challenge, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<PendingTwoFactorChallenge> findPendingChallenge(String sessionId) {
        PendingEntry entry = pending.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            pending.remove(sessionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.challenge());
    }

    @Override
    public boolean promotePendingChallenge(String sessionId) {
        Instant now = clock.instant();
        AtomicBoolean promoted = new AtomicBoolean();
        pending.computeIfPresent(sessionId, (id, entry) -> {
            if (!entry.expiresAt().isAfter(now) || entry.challenge().status() != ChallengeStatus.UNVERIFIED) {
                return entry;
            }
            promoted.set(true);
            return new PendingEntry(entry.challenge().withStatus(ChallengeStatus.VERIFIED), entry.expiresAt());
        });
        return promoted.get();
    }

    private record PendingEntry(PendingTwoFactorChallenge challenge, Instant expiresAt) {
    }
}
