package com.williamcallahan.inference.service;

import com.williamcallahan.inference.domain.ProviderConfig;
import com.williamcallahan.inference.domain.failure.ErrorKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks which credential each provider authenticates with and moves to the next one when a key fails.
 *
 * <p>A key rejected for authentication or payment stays out of rotation until the provider is reset. A rate
 * limited key rests until its reset window ends. Providers without configured keys have a single implicit
 * credential at index 0.</p>
 */
@Component
public class CredentialRotation {
    private static final Logger log = LoggerFactory.getLogger(CredentialRotation.class);

    private final ModelRegistry modelRegistry;
    private final Clock clock;
    private final Map<String, ProviderKeys> keysByProvider = new ConcurrentHashMap<>();

    public CredentialRotation(ModelRegistry modelRegistry, Clock clock) {
        this.modelRegistry = Objects.requireNonNull(modelRegistry, "modelRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the credential the next call to the provider should use.
     *
     * <p>Prefers the current key, then the next usable one in rotation order. When every remaining key is rate
     * limited, the key whose window ends first is returned.</p>
     *
     * @param provider provider name
     * @return credential index, empty once every key has been rejected
     * @throws UnknownProviderException when the provider is not in the catalogue
     */
    public OptionalInt activeCredential(String provider) {
        ProviderKeys keys = keysFor(provider);
        synchronized (keys) {
            Instant now = clock.instant();
            int next = keys.nextUsable(keys.current, now, -1);
            if (next < 0) {
                next = keys.earliestRested();
            }
            if (next < 0) {
                return OptionalInt.empty();
            }
            keys.current = next;
            return OptionalInt.of(next);
        }
    }

    /**
     * Takes a failed credential out of rotation and switches to the next usable one.
     *
     * @param provider provider name
     * @param failedIndex credential the failed call used
     * @param kind classified failure; credential-fatal kinds reject the key, others rest it
     * @param restWindow how long a rate limited key rests, null for the provider cooldown
     * @return true when another usable credential is now active
     */
    public boolean rotate(String provider, int failedIndex, ErrorKind kind, Duration restWindow) {
        ProviderConfig config = modelRegistry.provider(provider).orElseThrow(() -> new UnknownProviderException(provider));
        ProviderKeys keys = keysFor(provider);
        synchronized (keys) {
            if (failedIndex < 0 || failedIndex >= keys.count) {
                throw new IllegalArgumentException("Provider " + provider + " has no credential " + failedIndex);
            }
            Instant now = clock.instant();
            if (kind.isCredentialFatal()) {
                keys.rejected[failedIndex] = true;
            } else {
                Duration window = restWindow == null || restWindow.isZero() || restWindow.isNegative()
                        ? config.cooldown()
                        : restWindow;
                Instant until = now.plus(window);
                if (keys.restingUntil[failedIndex] == null || until.isAfter(keys.restingUntil[failedIndex])) {
                    keys.restingUntil[failedIndex] = until;
                }
            }
            int next = keys.nextUsable(failedIndex + 1, now, failedIndex);
            if (next < 0) {
                log.warn("[{}] Credential {} failed with {}; no other credential available", provider, failedIndex, kind);
                return false;
            }
            keys.current = next;
            log.info("[{}] Credential {} failed with {}; switching to credential {}", provider, failedIndex, kind, next);
            return true;
        }
    }

    /**
     * Describes the provider's credentials without changing the active one.
     */
    public CredentialStatus status(String provider) {
        ProviderKeys keys = keysFor(provider);
        synchronized (keys) {
            Instant now = clock.instant();
            List<Integer> rejected = new ArrayList<>();
            List<Integer> resting = new ArrayList<>();
            for (int index = 0; index < keys.count; index++) {
                if (keys.rejected[index]) {
                    rejected.add(index);
                } else if (keys.isResting(index, now)) {
                    resting.add(index);
                }
            }
            return new CredentialStatus(keys.count, keys.current, rejected, resting);
        }
    }

    /**
     * Returns every credential of the provider to rotation, starting again at index 0.
     */
    public void reset(String provider) {
        ProviderKeys keys = keysByProvider.get(provider);
        if (keys != null) {
            synchronized (keys) {
                keys.clear();
            }
        }
    }

    public void resetAll() {
        keysByProvider.keySet().forEach(this::reset);
    }

    private ProviderKeys keysFor(String provider) {
        ProviderConfig config = modelRegistry.provider(provider).orElseThrow(() -> new UnknownProviderException(provider));
        return keysByProvider.computeIfAbsent(provider, name -> new ProviderKeys(config.credentialCount()));
    }

    /**
     * Credential rotation state of one provider.
     *
     * @param count configured credentials, at least one
     * @param active index the next call uses
     * @param rejected indexes out of rotation until reset
     * @param resting indexes waiting out a rate limit
     */
    public record CredentialStatus(int count, int active, List<Integer> rejected, List<Integer> resting) {}

    private static final class ProviderKeys {
        private final int count;
        private final boolean[] rejected;
        private final Instant[] restingUntil;
        private int current;

        ProviderKeys(int count) {
            this.count = count;
            this.rejected = new boolean[count];
            this.restingUntil = new Instant[count];
        }

        int nextUsable(int start, Instant now, int excluded) {
            for (int offset = 0; offset < count; offset++) {
                int index = Math.floorMod(start + offset, count);
                if (index != excluded && !rejected[index] && !isResting(index, now)) {
                    return index;
                }
            }
            return -1;
        }

        int earliestRested() {
            int earliest = -1;
            for (int index = 0; index < count; index++) {
                if (!rejected[index] && (earliest < 0 || restingUntil[index].isBefore(restingUntil[earliest]))) {
                    earliest = index;
                }
            }
            return earliest;
        }

        boolean isResting(int index, Instant now) {
            return restingUntil[index] != null && now.isBefore(restingUntil[index]);
        }

        void clear() {
            current = 0;
            for (int index = 0; index < count; index++) {
                rejected[index] = false;
                restingUntil[index] = null;
            }
        }
    }
}
