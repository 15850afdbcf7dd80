package com.ryuqq.guildkeeper.application.cache;

import com.ryuqq.guildkeeper.core.model.GuildId;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 길드 단위 변경 락 (스트라이프).
 *
 * <p>같은 길드에 대한 "저장소 쓰기 → 캐시 갱신" 쌍을 직렬화합니다.
 * 캐시 맵을 보호하는 읽기/쓰기 락과는 별개이며, 저장소 호출 동안 보유됩니다.
 * 서로 다른 길드가 같은 스트라이프를 공유할 수 있으므로 한 번에 하나의 길드 락만 잡아야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GuildLocks {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public GuildLocks() {
        this(DEFAULT_STRIPES);
    }

    /**
     * @param stripeCount 스트라이프 수 (1 이상)
     * @throws IllegalArgumentException stripeCount가 1 미만인 경우
     */
    public GuildLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * @param guildId 길드 ID
     * @return 해당 길드의 변경 락
     */
    public Lock lockFor(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        return stripes[Math.floorMod(guildId.hashCode(), stripes.length)];
    }
}
