package com.ryuqq.guildkeeper.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PresenceConfig / RedeliveryConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RunnerConfigTest {

    // ============================================================
    // PresenceConfig
    // ============================================================

    @Test
    void presenceConfig_기본값() {
        // when
        PresenceConfig config = new PresenceConfig();

        // then
        assertThat(config.intervalMs()).isEqualTo(3000);
        assertThat(config.render(2)).isEqualTo("Monitoring a total of 2 guilds | -help");
    }

    @Test
    void presenceConfig_템플릿에_count가_없으면_예외() {
        assertThatThrownBy(() -> new PresenceConfig(3000, "Watching guilds"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("{count}");
        assertThatThrownBy(() -> new PresenceConfig().withIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("intervalMs");
    }

    @Test
    void presenceConfig_withStatusTemplate() {
        // when
        PresenceConfig config = new PresenceConfig().withStatusTemplate("{count} servers");

        // then
        assertThat(config.render(0)).isEqualTo("0 servers");
        assertThat(config.intervalMs()).isEqualTo(3000);
    }

    // ============================================================
    // RedeliveryConfig
    // ============================================================

    @Test
    void redeliveryConfig_기본값() {
        // when
        RedeliveryConfig config = new RedeliveryConfig();

        // then
        assertThat(config.scanIntervalMs()).isEqualTo(5000);
        assertThat(config.batchSize()).isEqualTo(50);
        assertThat(config.maxAttempts()).isEqualTo(5);
        assertThat(config.baseDelayMs()).isEqualTo(1000);
        assertThat(config.maxDelayMs()).isEqualTo(60000);
    }

    @Test
    void redeliveryConfig_with_메서드는_해당_값만_바꾼다() {
        // when
        RedeliveryConfig config = new RedeliveryConfig()
            .withScanIntervalMs(100)
            .withBatchSize(3)
            .withMaxAttempts(2);

        // then
        assertThat(config).isEqualTo(new RedeliveryConfig(100, 3, 2, 1000, 60000));
    }

    @Test
    void redeliveryConfig_검증_실패() {
        assertThatThrownBy(() -> new RedeliveryConfig().withBatchSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize");
        assertThatThrownBy(() -> new RedeliveryConfig().withMaxAttempts(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new RedeliveryConfig().withDelays(5000, 1000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
    }
}
