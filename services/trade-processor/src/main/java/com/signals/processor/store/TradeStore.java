package com.signals.processor.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Key-value store shared by all processor instances.
 *
 * <p>Each method is atomic on its own. Sequences of calls are not: callers that read,
 * decide and then write (the price cache) can interleave with other instances.
 */
public interface TradeStore {

    /**
     * @return the live value under {@code key}, empty if absent or expired
     */
    Optional<String> get(String key);

    void setWithTtl(String key, String value, Duration ttl);

    /**
     * Increments the integer counter under {@code key}, creating it at 1.
     *
     * @return the value after the increment
     */
    long increment(String key);

    /**
     * Pushes {@code value} onto the head of the list and keeps only the {@code maxSize} newest entries.
     */
    void prependAndTrim(String key, String value, int maxSize);

    /**
     * @return up to {@code limit} entries from the head of the list, newest first
     */
    List<String> range(String key, int limit);
}
