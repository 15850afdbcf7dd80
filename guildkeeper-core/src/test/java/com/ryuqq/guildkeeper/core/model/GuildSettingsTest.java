package com.ryuqq.guildkeeper.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GuildSettings 및 식별자 Value Object 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GuildSettingsTest {

    @Test
    void defaults_UsesDashPrefixTimeoutAndNoMuteRole() {
        // Given
        GuildId guildId = GuildId.of(123L);
        UserId ownerId = UserId.of(42L);

        // When
        GuildSettings settings = GuildSettings.defaults(guildId, ownerId);

        // Then
        assertEquals(guildId, settings.guildId());
        assertEquals("-", settings.prefix().getValue());
        assertEquals(ownerId, settings.ownerId());
        assertEquals(MuteType.TIMEOUT, settings.muteType());
        assertEquals(0L, settings.muteRoleId());
    }

    @Test
    void withPrefix_ChangesOnlyPrefix() {
        // Given
        GuildSettings original = GuildSettings.defaults(GuildId.of(1L), UserId.of(2L));

        // When
        GuildSettings changed = original.withPrefix(Prefix.of("!"));

        // Then
        assertEquals("!", changed.prefix().getValue());
        assertEquals(original.guildId(), changed.guildId());
        assertEquals(original.ownerId(), changed.ownerId());
        assertEquals("-", original.prefix().getValue());
    }

    @Test
    void withMute_ChangesMuteFields() {
        // Given
        GuildSettings original = GuildSettings.defaults(GuildId.of(1L), UserId.of(2L));

        // When
        GuildSettings changed = original.withMute(MuteType.ROLE, 777L);

        // Then
        assertEquals(MuteType.ROLE, changed.muteType());
        assertEquals(777L, changed.muteRoleId());
    }

    @Test
    void constructor_NegativeMuteRole_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () ->
            new GuildSettings(GuildId.of(1L), Prefix.DEFAULT, UserId.of(2L), MuteType.TIMEOUT, -1L));
    }

    @Test
    void constructor_NullPrefix_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () ->
            new GuildSettings(GuildId.of(1L), null, UserId.of(2L), MuteType.TIMEOUT, 0L));
        assertTrue(exception.getMessage().contains("prefix"));
    }

    @Test
    void guildId_NonPositive_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> GuildId.of(0L));
        assertThrows(IllegalArgumentException.class, () -> UserId.of(-5L));
    }

    @Test
    void guildId_EqualsByValue() {
        // When & Then
        assertEquals(GuildId.of(99L), GuildId.of(99L));
        assertNotEquals(GuildId.of(99L), GuildId.of(100L));
        assertEquals("GuildId{99}", GuildId.of(99L).toString());
    }

    @Test
    void muteType_FromStorage_IsCaseInsensitive() {
        // When & Then
        assertEquals(MuteType.TIMEOUT, MuteType.fromStorage("timeout"));
        assertEquals(MuteType.ROLE, MuteType.fromStorage("ROLE"));
        assertEquals("timeout", MuteType.TIMEOUT.storageValue());
        assertThrows(IllegalArgumentException.class, () -> MuteType.fromStorage("ban"));
    }
}
