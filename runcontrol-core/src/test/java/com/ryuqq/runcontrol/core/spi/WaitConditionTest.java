package com.ryuqq.runcontrol.core.spi;

import com.ryuqq.runcontrol.core.model.FlagName;
import com.ryuqq.runcontrol.core.model.RunId;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaitConditionTest {

    private final RunId runId = RunId.of("run-1");
    private final Set<FlagName> raised = new HashSet<>();
    private final FlagReader reader = (id, flag) -> runId.equals(id) && raised.contains(flag);

    @Test
    void flagCleared_SatisfiedOnlyWhenFlagIsFalse() {
        WaitCondition condition = WaitCondition.flagCleared();

        assertThat(condition.isSatisfied(reader, runId, FlagName.PAUSED)).isTrue();

        raised.add(FlagName.PAUSED);
        assertThat(condition.isSatisfied(reader, runId, FlagName.PAUSED)).isFalse();
    }

    @Test
    void clearedOrCancelled_PausedAndCancelled_IsSatisfied() {
        // Given
        raised.add(FlagName.PAUSED);
        WaitCondition condition = WaitCondition.clearedOrCancelled();
        assertThat(condition.isSatisfied(reader, runId, FlagName.PAUSED)).isFalse();

        // When
        raised.add(FlagName.CANCELLED);

        // Then
        assertThat(condition.isSatisfied(reader, runId, FlagName.PAUSED)).isTrue();
    }

    @Test
    void or_NullOther_ThrowsException() {
        assertThatThrownBy(() -> WaitCondition.flagCleared().or(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
