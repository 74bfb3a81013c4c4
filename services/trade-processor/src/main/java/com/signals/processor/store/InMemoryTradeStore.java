package com.signals.processor.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link TradeStore} with the same TTL, counter and trim semantics as the Redis one.
 * Only meaningful when one processor instance runs, or for tests.
 */
public class InMemoryTradeStore implements TradeStore {

    private final Clock clock;
    private final ConcurrentHashMap<String, StoredValue> values = new ConcurrentHashMap<>();
    private final Map<String, LinkedList<String>> lists = new HashMap<>();

    public InMemoryTradeStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        StoredValue entry = values.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            values.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        values.put(key, new StoredValue(value, clock.instant().plus(ttl)));
    }

    @Override
    public long increment(String key) {
        Instant now = clock.instant();
        StoredValue updated = values.compute(key, (k, current) -> {
            if (current == null || current.isExpired(now)) {
                return new StoredValue("1", null);
            }
            long next;
            try {
                next = Long.parseLong(current.value()) + 1;
            } catch (NumberFormatException e) {
                throw new TradeStoreException("Value under " + key + " is not an integer");
            }
            return new StoredValue(Long.toString(next), current.expiresAt());
        });
        return Long.parseLong(updated.value());
    }

    @Override
    public synchronized void prependAndTrim(String key, String value, int maxSize) {
        LinkedList<String> list = lists.computeIfAbsent(key, k -> new LinkedList<>());
        list.addFirst(value);
        while (list.size() > maxSize) {
            list.removeLast();
        }
    }

    @Override
    public synchronized List<String> range(String key, int limit) {
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return List.of();
        }
        return new ArrayList<>(list.subList(0, Math.min(limit, list.size())));
    }

    private record StoredValue(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
