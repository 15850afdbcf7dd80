package com.ryuqq.guildkeeper.application.lifecycle;

import com.ryuqq.guildkeeper.core.contract.LifecycleEvent;
import com.ryuqq.guildkeeper.core.model.GuildId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 재전달 대기 중인 라이프사이클 이벤트 보관소.
 *
 * <p>저장소 장애로 {@code Retry}가 된 join/leave 이벤트를 길드별로 하나씩 보관합니다.
 * 같은 길드에 대해 새 이벤트가 들어오면 이전 이벤트를 대체합니다 (latest wins).</p>
 *
 * <p><strong>두 가지 적재 경로:</strong></p>
 * <ul>
 *   <li>{@link #offer}: 실시간 이벤트 실패. 항상 기존 대기 이벤트를 대체</li>
 *   <li>{@link #requeue}: 재전달 실패. 그 사이 더 새로운 이벤트가 들어왔다면 버려짐</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PendingLifecycleEvents {

    private final ConcurrentHashMap<GuildId, PendingEvent> pending = new ConcurrentHashMap<>();

    /**
     * 재전달 대기 이벤트.
     *
     * @param event 원본 이벤트
     * @param attempts 지금까지 실패한 처리 횟수 (1 이상)
     * @param dueAtMillis 다음 처리 가능 시각 (epoch millis)
     */
    public record PendingEvent(LifecycleEvent event, int attempts, long dueAtMillis) {

        public PendingEvent {
            if (event == null) {
                throw new IllegalArgumentException("event cannot be null");
            }
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be at least 1 (current: " + attempts + ")");
            }
        }

        public GuildId guildId() {
            return event.guildId();
        }
    }

    /**
     * 실시간 처리에 실패한 이벤트 적재. 같은 길드의 기존 대기 이벤트를 대체합니다.
     */
    public void offer(LifecycleEvent event, long dueAtMillis) {
        PendingEvent entry = new PendingEvent(event, 1, dueAtMillis);
        pending.put(entry.guildId(), entry);
    }

    /**
     * 재전달에 실패한 이벤트 재적재.
     *
     * @return 재적재되었으면 true, 더 새로운 이벤트가 이미 대기 중이면 false
     */
    public boolean requeue(PendingEvent entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        return pending.putIfAbsent(entry.guildId(), entry) == null;
    }

    /**
     * 처리 시각이 된 이벤트를 dueAt 순으로 최대 limit개 꺼냅니다 (제거됨).
     */
    public List<PendingEvent> drainDue(long nowMillis, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<PendingEvent> due = new ArrayList<>();
        for (PendingEvent entry : pending.values()) {
            if (entry.dueAtMillis() <= nowMillis) {
                due.add(entry);
            }
        }
        due.sort(Comparator.comparingLong(PendingEvent::dueAtMillis));

        List<PendingEvent> drained = new ArrayList<>(Math.min(limit, due.size()));
        for (PendingEvent entry : due) {
            if (drained.size() >= limit) {
                break;
            }
            // 동시에 offer로 대체된 엔트리는 건드리지 않음
            if (pending.remove(entry.guildId(), entry)) {
                drained.add(entry);
            }
        }
        return drained;
    }

    /**
     * 실시간 이벤트가 성공했을 때 같은 길드의 오래된 대기 이벤트 제거.
     */
    public void discard(GuildId guildId) {
        if (guildId == null) {
            throw new IllegalArgumentException("guildId cannot be null");
        }
        pending.remove(guildId);
    }

    public Optional<PendingEvent> peek(GuildId guildId) {
        return Optional.ofNullable(pending.get(guildId));
    }

    public int size() {
        return pending.size();
    }
}
