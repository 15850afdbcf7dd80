package com.ryuqq.guildkeeper.core.model;

/**
 * 길드 한 곳의 설정 (불변 record).
 *
 * <p>캐시와 영속 저장소가 각각 한 벌씩 보관하며, 값 변경은 항상
 * 새 인스턴스를 만드는 방식({@code withX})으로만 이루어집니다.</p>
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>prefix: {@code "-"}</li>
 *   <li>muteType: {@link MuteType#TIMEOUT}</li>
 *   <li>muteRoleId: 0 (미설정)</li>
 * </ul>
 *
 * @param guildId 길드 ID (키)
 * @param prefix 명령어 접두사
 * @param ownerId 생성 시점의 길드 소유자
 * @param muteType 뮤트 방식
 * @param muteRoleId 뮤트 역할 ID (0이면 미설정)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GuildSettings(
    GuildId guildId,
    Prefix prefix,
    UserId ownerId,
    MuteType muteType,
    long muteRoleId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 값이 null이거나 muteRoleId가 음수인 경우
     */
    public GuildSettings {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (muteType == null) {
            throw new IllegalArgumentException("muteType cannot be null");
        }
        if (muteRoleId < 0) {
            throw new IllegalArgumentException("muteRoleId must be non-negative (current: " + muteRoleId + ")");
        }
    }

    /**
     * 기본값으로 채운 설정 생성.
     *
     * @param guildId 길드 ID
     * @param ownerId 길드 소유자
     * @return 기본 설정
     */
    public static GuildSettings defaults(GuildId guildId, UserId ownerId) {
        return new GuildSettings(guildId, Prefix.DEFAULT, ownerId, MuteType.TIMEOUT, 0);
    }

    /**
     * prefix만 변경한 새 인스턴스 생성.
     */
    public GuildSettings withPrefix(Prefix prefix) {
        return new GuildSettings(guildId, prefix, ownerId, muteType, muteRoleId);
    }

    /**
     * 뮤트 설정만 변경한 새 인스턴스 생성.
     */
    public GuildSettings withMute(MuteType muteType, long muteRoleId) {
        return new GuildSettings(guildId, prefix, ownerId, muteType, muteRoleId);
    }
}
