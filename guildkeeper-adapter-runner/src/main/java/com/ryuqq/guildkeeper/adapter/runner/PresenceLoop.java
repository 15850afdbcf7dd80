package com.ryuqq.guildkeeper.adapter.runner;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.core.spi.Gateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Presence 갱신 한 틱.
 *
 * <p>캐시에 있는 길드 수로 상태 문구를 만들어 게이트웨이에 게시합니다.
 * 게시 실패는 WARN으로 기록하고 삼킵니다. 예외가 밖으로 나가면
 * {@code scheduleAtFixedRate}가 이후 실행을 모두 취소하기 때문입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PresenceLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PresenceLoop.class);

    private final GuildSettingsCache cache;
    private final Gateway gateway;
    private final PresenceConfig config;

    public PresenceLoop(GuildSettingsCache cache, Gateway gateway, PresenceConfig config) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = cache;
        this.gateway = gateway;
        this.config = config;
    }

    @Override
    public void run() {
        // 캐시 읽기는 게이트웨이 호출 전에 끝남 (락 미보유 상태로 I/O)
        String status = config.render(cache.size());
        try {
            gateway.setPresence(status);
            log.debug("Presence published: {}", status);
        } catch (RuntimeException e) {
            log.warn("Failed to publish presence '{}'", status, e);
        }
    }
}
