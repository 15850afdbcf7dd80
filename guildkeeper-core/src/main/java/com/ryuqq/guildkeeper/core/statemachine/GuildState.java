package com.ryuqq.guildkeeper.core.statemachine;

/**
 * 길드의 생명주기 상태 (프로세스 기준).
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>UNKNOWN → TRACKED (참여)</li>
 *   <li>TRACKED → REMOVED (이탈)</li>
 *   <li>UNKNOWN → REMOVED (이전 실행에서 남은 행 정리)</li>
 *   <li>REMOVED는 해당 참여 회차의 종료 상태</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * UNKNOWN
 *    │
 *    ├─► TRACKED (참여)
 *    │      │
 *    │      ▼ (이탈)
 *    └─► REMOVED
 *
 * 재참여 시 새 회차로 취급하여 UNKNOWN부터 다시 시작합니다.
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum GuildState {

    /**
     * 이 프로세스가 아직 참여 이벤트를 처리하지 않음.
     */
    UNKNOWN,

    /**
     * 캐시와 저장소에 설정이 존재하며 추적 중.
     */
    TRACKED,

    /**
     * 이탈 처리 완료 (캐시와 저장소에서 삭제됨).
     */
    REMOVED;

    /**
     * 종료 상태인지 확인.
     *
     * @return REMOVED인 경우 true
     */
    public boolean isTerminal() {
        return this == REMOVED;
    }
}
