package com.ryuqq.guildkeeper.core.contract;

import com.ryuqq.guildkeeper.core.model.GuildId;

/**
 * 길드 생명주기 이벤트.
 *
 * <p>게이트웨이가 전달하는 두 가지 이벤트를 나타냅니다:</p>
 * <ul>
 *   <li>{@link GuildJoined}: 봇이 길드에 참여함</li>
 *   <li>{@link GuildLeft}: 봇이 길드에서 나감</li>
 * </ul>
 *
 * <p>처리에 실패한 이벤트는 그대로 재전달 대기열에 들어가므로
 * 모든 구현체는 불변이어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface LifecycleEvent permits GuildJoined, GuildLeft {

    /**
     * 이벤트 대상 길드.
     *
     * @return 길드 ID
     */
    GuildId guildId();
}
