package com.ryuqq.runcontrol.adapter.redis;

import com.ryuqq.runcontrol.core.spi.ControlStore;
import com.ryuqq.runcontrol.testkit.contract.AbstractControlStoreContractTest;

/**
 * Contract Tests for {@link RedisControlStore} against an in-process Redis stand-in.
 *
 * <p>Verifies the store's protocol logic (key layout, encoding, compare-and-set usage).
 * Lettuce wiring is covered by {@link LettuceRedisOperationsTest}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RedisControlStoreContractTest extends AbstractControlStoreContractTest {

    @Override
    protected ControlStore createStore() {
        return new RedisControlStore(new FakeRedisOperations(), new RedisStoreConfig().withPollIntervalMs(20));
    }
}
