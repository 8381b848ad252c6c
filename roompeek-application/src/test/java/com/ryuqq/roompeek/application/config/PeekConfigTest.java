package com.ryuqq.roompeek.application.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PeekConfig 검증 테스트.
 */
class PeekConfigTest {

    @Test
    void 기본_기한은_5000ms() {
        PeekConfig config = new PeekConfig("serverA");

        assertThat(config.defaultTimeoutMs()).isEqualTo(5000);
        assertThat(config.withDefaultTimeoutMs(0).defaultTimeoutMs()).isZero();
    }

    @Test
    void 서버_이름_비교는_정확히_일치() {
        PeekConfig config = new PeekConfig("serverA");

        assertThat(config.isLocal("serverA")).isTrue();
        assertThat(config.isLocal("servera")).isFalse();
        assertThat(config.isLocal("serverA:8448")).isFalse();
    }

    @Test
    void 잘못된_값은_거부() {
        assertThatThrownBy(() -> new PeekConfig(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("serverName");
        assertThatThrownBy(() -> new PeekConfig(":serverA"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PeekConfig("serverA", -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("defaultTimeoutMs");
    }
}
