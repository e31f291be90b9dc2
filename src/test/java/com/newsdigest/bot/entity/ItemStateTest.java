package com.newsdigest.bot.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ItemStateTest {

    @Test
    @DisplayName("정방향 이동만 허용")
    void forwardTransitionsOnly() {
        assertThat(ItemState.NEW.canTransitionTo(ItemState.SUMMARIZED)).isTrue();
        assertThat(ItemState.SUMMARIZED.canTransitionTo(ItemState.POSTED)).isTrue();
        assertThat(ItemState.NEW.canTransitionTo(ItemState.FAILED)).isTrue();
        assertThat(ItemState.SUMMARIZED.canTransitionTo(ItemState.SUMMARIZED)).isTrue();

        assertThat(ItemState.NEW.canTransitionTo(ItemState.POSTED)).isFalse();
        assertThat(ItemState.SUMMARIZED.canTransitionTo(ItemState.NEW)).isFalse();
        assertThat(ItemState.POSTED.canTransitionTo(ItemState.SUMMARIZED)).isFalse();
        assertThat(ItemState.FAILED.canTransitionTo(ItemState.NEW)).isFalse();
    }

    @Test
    @DisplayName("POSTED, FAILED는 종료 상태")
    void terminalStates() {
        for (ItemState target : ItemState.values()) {
            assertThat(ItemState.POSTED.canTransitionTo(target)).isFalse();
            assertThat(ItemState.FAILED.canTransitionTo(target)).isFalse();
        }
        assertThat(ItemState.POSTED.isTerminal()).isTrue();
        assertThat(ItemState.NEW.isTerminal()).isFalse();
    }
}
