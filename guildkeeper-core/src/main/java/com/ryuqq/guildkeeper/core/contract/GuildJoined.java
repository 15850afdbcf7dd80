package com.ryuqq.guildkeeper.core.contract;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.UserId;

/**
 * 길드 참여 이벤트.
 *
 * <p>봇이 새 길드에 참여했거나, 재연결 후 게이트웨이가 기존 길드를 다시 알릴 때 발생합니다.
 * 같은 길드에 대해 중복 수신될 수 있습니다.</p>
 *
 * @param guildId 길드 ID
 * @param ownerId 현재 길드 소유자
 * @param memberCount 멤버 수 (로깅 용도, 0 이상)
 * @param guildName 길드 이름 (로깅 용도, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GuildJoined(
    GuildId guildId,
    UserId ownerId,
    int memberCount,
    String guildName
) implements LifecycleEvent {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException guildId 또는 ownerId가 null이거나 memberCount가 음수인 경우
     */
    public GuildJoined {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId cannot be null");
        }
        if (memberCount < 0) {
            throw new IllegalArgumentException("memberCount must be non-negative (current: " + memberCount + ")");
        }
        // guildName은 null 허용
    }

    /**
     * 이름 없이 이벤트 생성.
     *
     * @param guildId 길드 ID
     * @param ownerId 길드 소유자
     * @param memberCount 멤버 수
     * @return GuildJoined 인스턴스
     */
    public static GuildJoined of(GuildId guildId, UserId ownerId, int memberCount) {
        return new GuildJoined(guildId, ownerId, memberCount, null);
    }
}
