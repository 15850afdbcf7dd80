package com.ryuqq.guildkeeper.application.lifecycle;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import com.ryuqq.guildkeeper.core.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * 시작 시 저장소 전체를 캐시로 적재.
 *
 * <p>실패는 치명적이지 않습니다. false를 반환하면 호출자가 나중에 다시 시도합니다.
 * 적재 전까지 조회는 PrefixCommand의 just-in-time 로드로 처리됩니다.</p>
 *
 * <p>저장소를 읽는 동안 도착한 가입/탈퇴/prefix 변경이 스냅샷으로 되돌려지지 않도록
 * {@link GuildSettingsCache#load}가 해당 길드를 건너뜁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CacheWarmer {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmer.class);

    private final SettingsStore store;
    private final GuildSettingsCache cache;
    private final GuildLifecycleHandler lifecycleHandler;

    public CacheWarmer(SettingsStore store, GuildSettingsCache cache, GuildLifecycleHandler lifecycleHandler) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (lifecycleHandler == null) {
            throw new IllegalArgumentException("lifecycleHandler cannot be null");
        }
        this.store = store;
        this.cache = cache;
        this.lifecycleHandler = lifecycleHandler;
    }

    /**
     * 저장소의 모든 행을 캐시에 적재하고 캐시에 남은 길드를 TRACKED로 표시.
     *
     * @return 성공하면 true, 저장소 읽기 실패 시 false
     */
    public boolean warm() {
        Set<GuildId> loaded;
        try {
            loaded = cache.load(store::loadAll);
        } catch (StoreException e) {
            log.warn("Cache warm-up failed, will retry: {}", e.getMessage());
            return false;
        }

        lifecycleHandler.track(loaded);

        log.info("Cache warmed: {} guild(s) loaded", loaded.size());
        return true;
    }
}
