package com.ryuqq.guildkeeper.application.cache;

import com.ryuqq.guildkeeper.core.model.GuildId;
import com.ryuqq.guildkeeper.core.model.GuildSettings;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * 프로세스 전역 길드 설정 캐시.
 *
 * <p>모든 핸들러에 주입되는 단일 인스턴스로, 길드별 설정을 메모리에 보관합니다.
 * 시스템 오브 레코드는 {@link com.ryuqq.guildkeeper.core.spi.SettingsStore}이며,
 * 이 캐시는 저장소 쓰기가 확정된 뒤에만 갱신됩니다.</p>
 *
 * <p><strong>동시성 모델:</strong></p>
 * <ul>
 *   <li>하나의 {@link ReentrantReadWriteLock}이 전체 맵을 보호 (엔트리 단위 락 아님)</li>
 *   <li>읽기는 서로 동시에 진행, 쓰기는 메모리 변경 동안만 배타적</li>
 *   <li>이 클래스의 어떤 메서드도 I/O를 수행하지 않으므로 락이 저장소/게이트웨이 호출에 걸쳐 보유되지 않음</li>
 *   <li>같은 길드의 저장소 쓰기와 캐시 갱신 순서는 {@link #mutationLock(GuildId)}로 맞춤</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * GuildSettingsCache cache = new GuildSettingsCache();
 * cache.putIfAbsent(GuildSettings.defaults(guildId, ownerId));
 *
 * cache.upsert(guildId,
 *     () -&gt; GuildSettings.defaults(guildId, invoker),
 *     settings -&gt; settings.withPrefix(Prefix.of("!")));
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class GuildSettingsCache {

    private final Map<GuildId, GuildSettings> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();
    private final GuildLocks guildLocks = new GuildLocks();

    // load 진행 중에 변경된 길드 ID. writeLock으로 보호, load 중이 아니면 null
    private Set<GuildId> touchedDuringLoad;

    /**
     * 길드 단위 변경 락.
     *
     * <p>저장소 호출과 이어지는 캐시 갱신을 감싸는 데 사용합니다.
     * 캐시 조회는 이 락을 잡지 않습니다.</p>
     *
     * @param guildId 길드 ID
     * @return 해당 길드의 변경 락
     */
    public Lock mutationLock(GuildId guildId) {
        return guildLocks.lockFor(guildId);
    }

    /**
     * 길드 설정 조회.
     *
     * @param guildId 길드 ID
     * @return 캐시된 설정 (없으면 empty)
     * @throws IllegalArgumentException guildId가 null인 경우
     */
    public Optional<GuildSettings> get(GuildId guildId) {
        requireGuildId(guildId);
        readLock.lock();
        try {
            return Optional.ofNullable(entries.get(guildId));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 기존 엔트리 (없으면 defaults) 에 mutator를 적용하여 원자적으로 교체.
     *
     * <p>mutator와 defaults는 쓰기 락 안에서 실행되므로 순수 함수여야 합니다.
     * I/O를 수행하면 안 됩니다.</p>
     *
     * @param guildId 길드 ID
     * @param defaults 엔트리가 없을 때 사용할 기본값 공급자
     * @param mutator 적용할 변경
     * @return 저장된 새 설정
     * @throws IllegalArgumentException 인자가 null이거나 mutator 결과의 guildId가 다른 경우
     */
    public GuildSettings upsert(
        GuildId guildId,
        Supplier<GuildSettings> defaults,
        UnaryOperator<GuildSettings> mutator
    ) {
        requireGuildId(guildId);
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }

        writeLock.lock();
        try {
            GuildSettings current = entries.get(guildId);
            GuildSettings base = current != null ? current : defaults.get();
            GuildSettings updated = mutator.apply(base);
            if (updated == null || !guildId.equals(updated.guildId())) {
                throw new IllegalArgumentException(
                    "mutator must return settings for " + guildId + " (returned: " + updated + ")");
            }
            entries.put(guildId, updated);
            markTouched(guildId);
            return updated;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 엔트리가 있을 때만 mutator 적용.
     *
     * @return 갱신된 설정 (엔트리가 없었으면 empty)
     */
    public Optional<GuildSettings> updateIfPresent(GuildId guildId, UnaryOperator<GuildSettings> mutator) {
        requireGuildId(guildId);
        if (mutator == null) {
            throw new IllegalArgumentException("mutator cannot be null");
        }
        writeLock.lock();
        try {
            // 캐시에 없어도 저장소는 이미 바뀌었으므로 기록
            markTouched(guildId);
            GuildSettings current = entries.get(guildId);
            if (current == null) {
                return Optional.empty();
            }
            GuildSettings updated = mutator.apply(current);
            if (updated == null || !guildId.equals(updated.guildId())) {
                throw new IllegalArgumentException(
                    "mutator must return settings for " + guildId + " (returned: " + updated + ")");
            }
            entries.put(guildId, updated);
            return Optional.of(updated);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 엔트리가 없을 때만 저장.
     *
     * @param settings 저장할 설정
     * @return 캐시에 남아 있는 설정 (기존 값이 있으면 기존 값)
     */
    public GuildSettings putIfAbsent(GuildSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        writeLock.lock();
        try {
            GuildSettings existing = entries.putIfAbsent(settings.guildId(), settings);
            return existing != null ? existing : settings;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 엔트리 제거.
     *
     * @param guildId 길드 ID
     * @return 제거된 설정 (없었으면 empty)
     */
    public Optional<GuildSettings> remove(GuildId guildId) {
        requireGuildId(guildId);
        writeLock.lock();
        try {
            markTouched(guildId);
            return Optional.ofNullable(entries.remove(guildId));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @return 캐시된 길드 수
     */
    public int size() {
        readLock.lock();
        try {
            return entries.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 시작 시 저장소 스냅샷으로 캐시를 채웁니다.
     *
     * <p>스냅샷은 락 밖에서 읽습니다. 읽는 동안 변경되거나 제거된 길드는 건너뛰고,
     * 나머지는 엔트리가 없을 때만 저장합니다. 이미 있는 엔트리는 저장소 쓰기 이후에
     * 기록된 것이므로 유지됩니다.</p>
     *
     * @param snapshot 저장소 전체 행 공급자 (예외는 그대로 전파)
     * @return 적재 후 캐시에 남아 있는 스냅샷 길드 ID
     * @throws IllegalStateException 다른 load가 진행 중인 경우
     */
    public Set<GuildId> load(Supplier<? extends Collection<GuildSettings>> snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        writeLock.lock();
        try {
            if (touchedDuringLoad != null) {
                throw new IllegalStateException("Cache load already in progress");
            }
            touchedDuringLoad = new HashSet<>();
        } finally {
            writeLock.unlock();
        }

        Collection<GuildSettings> rows;
        try {
            rows = snapshot.get();
        } catch (RuntimeException | Error e) {
            endLoad();
            throw e;
        }

        writeLock.lock();
        try {
            if (rows == null) {
                throw new IllegalStateException("snapshot returned null");
            }
            Set<GuildId> loaded = new HashSet<>();
            for (GuildSettings each : rows) {
                GuildId guildId = each.guildId();
                if (touchedDuringLoad.contains(guildId)) {
                    // 더 최신 쓰기가 반영된 엔트리만 유지
                    if (entries.containsKey(guildId)) {
                        loaded.add(guildId);
                    }
                    continue;
                }
                entries.putIfAbsent(guildId, each);
                loaded.add(guildId);
            }
            return Set.copyOf(loaded);
        } finally {
            touchedDuringLoad = null;
            writeLock.unlock();
        }
    }

    /**
     * @return 현재 캐시된 길드 ID의 스냅샷
     */
    public Set<GuildId> guildIds() {
        readLock.lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            readLock.unlock();
        }
    }

    private void endLoad() {
        writeLock.lock();
        try {
            touchedDuringLoad = null;
        } finally {
            writeLock.unlock();
        }
    }

    // writeLock 보유 상태에서 호출
    private void markTouched(GuildId guildId) {
        if (touchedDuringLoad != null) {
            touchedDuringLoad.add(guildId);
        }
    }

    private static void requireGuildId(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
    }
}
