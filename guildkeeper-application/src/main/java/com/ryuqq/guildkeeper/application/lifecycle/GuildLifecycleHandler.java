package com.ryuqq.guildkeeper.application.lifecycle;

import com.ryuqq.guildkeeper.application.cache.GuildSettingsCache;
import com.ryuqq.guildkeeper.core.contract.GuildJoined;
import com.ryuqq.guildkeeper.core.contract.GuildLeft;
import com.ryuqq.guildkeeper.core.contract.LifecycleEvent;
import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;
import com.ryuqq.guildkeeper.core.outcome.ErrorKind;
import com.ryuqq.guildkeeper.core.outcome.Ok;
import com.ryuqq.guildkeeper.core.outcome.Outcome;
import com.ryuqq.guildkeeper.core.outcome.Retry;
import com.ryuqq.guildkeeper.core.spi.SettingsStore;
import com.ryuqq.guildkeeper.core.spi.StoreException;
import com.ryuqq.guildkeeper.core.spi.StoreReadException;
import com.ryuqq.guildkeeper.core.statemachine.GuildState;
import com.ryuqq.guildkeeper.core.statemachine.GuildStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * 길드 가입/탈퇴 이벤트 처리기.
 *
 * <p>저장소(시스템 오브 레코드)를 먼저 쓰고, 성공한 경우에만 캐시를 갱신합니다.
 * 저장소 장애는 {@link Retry}로 반환되며 절대 프로세스를 중단시키지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * onGuildJoined:
 *   1. store.insertIfAbsent(defaults)
 *   2. 이미 행이 있었으면 store.find로 저장된 행을 다시 읽음 (커스텀 prefix 보존)
 *   3. 캐시에 저장소와 동일한 행을 기록
 *   4. 상태 UNKNOWN → TRACKED
 *
 * onGuildLeft:
 *   1. store.delete
 *   2. cache.remove
 *   3. 상태 → REMOVED (검증 후 상태 맵에서 제거, 이후 조회는 UNKNOWN)
 * </pre>
 *
 * <p>저장소 호출과 캐시 갱신은 {@link GuildSettingsCache#mutationLock(GuildId)}를 잡은 채 수행하므로
 * 같은 길드의 가입/탈퇴/prefix 변경은 저장소와 캐시에 같은 순서로 반영됩니다.</p>
 *
 * <p><strong>상태 관리:</strong></p>
 * <ul>
 *   <li>TRACKED 길드의 중복 join은 상태 변화 없음 (멱등)</li>
 *   <li>탈퇴한 길드는 상태를 남기지 않으므로 재가입은 새 occurrence로 UNKNOWN → TRACKED</li>
 *   <li>이 프로세스가 본 적 없는 길드의 leave는 UNKNOWN → REMOVED (이전 실행의 잔여 행 정리)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GuildLifecycleHandler {

    private static final Logger log = LoggerFactory.getLogger(GuildLifecycleHandler.class);

    private final SettingsStore store;
    private final GuildSettingsCache cache;
    private final ConcurrentHashMap<GuildId, GuildState> states = new ConcurrentHashMap<>();

    /**
     * 생성자.
     *
     * @param store 설정 저장소
     * @param cache 프로세스 캐시
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public GuildLifecycleHandler(SettingsStore store, GuildSettingsCache cache) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.store = store;
        this.cache = cache;
    }

    /**
     * 이벤트 타입에 따라 join/leave 처리로 분기.
     *
     * <p>재전달 경로에서 사용됩니다.</p>
     */
    public Outcome handle(LifecycleEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (event instanceof GuildJoined joined) {
            return onGuildJoined(joined);
        }
        return onGuildLeft((GuildLeft) event);
    }

    /**
     * 길드 가입 처리.
     *
     * @param event 가입 이벤트
     * @return Ok 또는 저장소 장애 시 Retry
     */
    public Outcome onGuildJoined(GuildJoined event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        GuildId guildId = event.guildId();
        GuildSettings defaults = GuildSettings.defaults(guildId, event.ownerId());

        GuildSettings effective;
        Lock guildLock = cache.mutationLock(guildId);
        guildLock.lock();
        try {
            try {
                boolean inserted = store.insertIfAbsent(defaults);
                effective = inserted ? defaults : store.find(guildId).orElse(defaults);
            } catch (StoreException e) {
                log.warn("Guild join not persisted, will retry: guildId={}, error={}", guildId, e.getMessage());
                return retryOf(e, "Failed to persist settings for joined guild " + guildId.getValue());
            }

            cache.upsert(guildId, () -> effective, ignored -> effective);
            markTracked(guildId);
        } finally {
            guildLock.unlock();
        }

        log.info("Guild joined: guildId={}, name={}, members={}, prefix={}",
            guildId, event.guildName(), event.memberCount(), effective.prefix());
        return Ok.of(guildId, "Guild " + guildId.getValue() + " is tracked with prefix " + effective.prefix());
    }

    /**
     * 길드 탈퇴 처리.
     *
     * @param event 탈퇴 이벤트
     * @return Ok 또는 저장소 장애 시 Retry
     */
    public Outcome onGuildLeft(GuildLeft event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        GuildId guildId = event.guildId();

        boolean existed;
        Lock guildLock = cache.mutationLock(guildId);
        guildLock.lock();
        try {
            try {
                existed = store.delete(guildId);
            } catch (StoreException e) {
                log.warn("Guild leave not persisted, will retry: guildId={}, error={}", guildId, e.getMessage());
                return retryOf(e, "Failed to delete settings for departed guild " + guildId.getValue());
            }

            cache.remove(guildId);
            markRemoved(guildId);
        } finally {
            guildLock.unlock();
        }

        log.info("Guild left: guildId={}, rowExisted={}", guildId, existed);
        return Ok.of(guildId, "Guild " + guildId.getValue() + " removed");
    }

    /**
     * 저장소에서 읽었거나 cache_ready가 알려준 길드 중 캐시에 엔트리가 있는 길드만 TRACKED로 표시.
     *
     * <p>캐시 확인은 길드 락 안에서 하므로 동시에 처리된 탈퇴가 다시 TRACKED로 되살아나지 않습니다.</p>
     *
     * @return TRACKED로 표시된 길드 수
     */
    public int track(Collection<GuildId> guildIds) {
        if (guildIds == null) {
            throw new IllegalArgumentException("guildIds cannot be null");
        }
        int tracked = 0;
        for (GuildId guildId : guildIds) {
            Lock guildLock = cache.mutationLock(guildId);
            guildLock.lock();
            try {
                if (cache.get(guildId).isPresent()) {
                    markTracked(guildId);
                    tracked++;
                }
            } finally {
                guildLock.unlock();
            }
        }
        return tracked;
    }

    /**
     * @return 길드의 현재 상태 (본 적 없으면 UNKNOWN)
     */
    public GuildState stateOf(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        return states.getOrDefault(guildId, GuildState.UNKNOWN);
    }

    /**
     * @return 상태 맵에 남아 있는 길드 수 (탈퇴한 길드는 포함되지 않음)
     */
    int stateCount() {
        return states.size();
    }

    private void markTracked(GuildId guildId) {
        states.compute(guildId, (id, current) -> {
            if (current == GuildState.TRACKED) {
                return current;
            }
            GuildState from = current == null ? GuildState.UNKNOWN : current;
            return GuildStateTransition.transition(from, GuildState.TRACKED);
        });
    }

    private void markRemoved(GuildId guildId) {
        states.compute(guildId, (id, current) -> {
            GuildState from = current == null ? GuildState.UNKNOWN : current;
            GuildStateTransition.validate(from, GuildState.REMOVED);
            // 종착 상태는 보관하지 않음
            return null;
        });
    }

    private static Retry retryOf(StoreException e, String message) {
        ErrorKind kind = e instanceof StoreReadException
            ? ErrorKind.STORE_READ_FAILURE
            : ErrorKind.STORE_WRITE_FAILURE;
        return Retry.of(kind, message, e.getMessage());
    }
}
