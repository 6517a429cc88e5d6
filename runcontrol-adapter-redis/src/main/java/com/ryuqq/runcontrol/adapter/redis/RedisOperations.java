package com.ryuqq.runcontrol.adapter.redis;

/**
 * Redis commands used by {@link RedisControlStore}.
 *
 * <p>Separates the protocol logic from the Lettuce client so the store can be tested
 * without a server. Both compare-and-set operations must be atomic on the server.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
interface RedisOperations extends AutoCloseable {

    String hget(String key, String field);

    void hset(String key, String field, String value);

    String get(String key);

    /**
     * Sets a hash field if its current value equals {@code expected}.
     *
     * @param expected expected value, or null if the field must be absent
     * @return true if the field was written
     */
    boolean hsetIfEquals(String key, String field, String expected, String value);

    /**
     * Sets a string key if its current value equals {@code expected}.
     *
     * @param expected expected value, or null if the key must be absent
     * @return true if the key was written
     */
    boolean setIfEquals(String key, String expected, String value);

    void del(String... keys);

    @Override
    void close();
}
