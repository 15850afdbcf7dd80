package com.ryuqq.guildkeeper.adapter.inmemory.gateway;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.ryuqq.guildkeeper.testkit.contract.GuildFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryGateway / InMemoryPermissionOracle 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryGatewayTest {

    private InMemoryGateway gateway;
    private InMemoryPermissionOracle permissionOracle;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryGateway();
        permissionOracle = new InMemoryPermissionOracle();
    }

    @Test
    void setPresence_기록된_순서대로_조회된다() {
        // when
        gateway.setPresence("Monitoring a total of 0 guilds | -help");
        gateway.setPresence("Monitoring a total of 1 guilds | -help");

        // then
        assertThat(gateway.getPresences()).hasSize(2);
        assertThat(gateway.lastPresence()).contains("Monitoring a total of 1 guilds | -help");
    }

    @Test
    void sendReply_채널과_내용이_기록된다() {
        // when
        gateway.sendReply(CHANNEL_10, "Prefix set to ```!```");

        // then
        assertThat(gateway.lastReply())
            .contains(new InMemoryGateway.Reply(CHANNEL_10, "Prefix set to ```!```"));
    }

    @Test
    void failPresence_설정시_예외가_발생하고_기록되지_않는다() {
        // given
        gateway.failPresence(true);

        // when & then
        assertThatThrownBy(() -> gateway.setPresence("x"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(gateway.getPresences()).isEmpty();
    }

    @Test
    void failReplies_설정시_예외가_발생한다() {
        // given
        gateway.failReplies(true);

        // when & then
        assertThatThrownBy(() -> gateway.sendReply(CHANNEL_10, "x"))
            .isInstanceOf(IllegalStateException.class);
        assertThat(gateway.getReplies()).isEmpty();
    }

    @Test
    void permissionOracle_부여된_길드에서만_관리자이다() {
        // given
        permissionOracle.grantAdministrator(GUILD_123, ADMIN_1);

        // when & then
        assertThat(permissionOracle.isAdministrator(GUILD_123, ADMIN_1)).isTrue();
        assertThat(permissionOracle.isAdministrator(GUILD_456, ADMIN_1)).isFalse();
        assertThat(permissionOracle.isAdministrator(GUILD_123, MEMBER_99)).isFalse();

        permissionOracle.revokeAdministrator(GUILD_123, ADMIN_1);
        assertThat(permissionOracle.isAdministrator(GUILD_123, ADMIN_1)).isFalse();
    }
}
