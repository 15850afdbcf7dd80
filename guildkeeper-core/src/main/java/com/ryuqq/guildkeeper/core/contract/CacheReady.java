package com.ryuqq.guildkeeper.core.contract;

import com.ryuqq.guildkeeper.core.model.GuildId;

import java.util.List;

/**
 * 게이트웨이 캐시 준비 완료 신호.
 *
 * <p>샤드가 준비될 때마다, 그리고 재연결할 때마다 반복해서 발생할 수 있습니다.
 * 수신 측은 몇 번을 받더라도 안전하게 처리해야 합니다.</p>
 *
 * @param knownGuilds 게이트웨이가 알고 있는 길드 목록 (불변 복사본)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheReady(List<GuildId> knownGuilds) {

    public CacheReady {
        if (knownGuilds == null) {
            throw new IllegalArgumentException("knownGuilds cannot be null");
        }
        knownGuilds = List.copyOf(knownGuilds);
    }
}
