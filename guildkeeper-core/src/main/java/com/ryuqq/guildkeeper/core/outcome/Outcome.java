package com.ryuqq.guildkeeper.core.outcome;

/**
 * 이벤트 및 명령어 처리 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Retry}: 저장소 일시 장애, 이벤트는 미처리 상태이며 재시도 가능</li>
 *   <li>{@link Fail}: 종료된 실패, 재시도해도 결과가 같음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 구현체가 위 세 가지로 제한됩니다.
 * 예외를 던지는 대신 이 타입을 반환하므로, 호출 측은 실패를 지역적으로 처리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = lifecycleHandler.onGuildJoined(event);
 * if (outcome instanceof Retry retry) {
 *     pending.enqueue(event, retry);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 사용자 또는 로그에 노출할 메시지.
     *
     * @return 메시지
     */
    String message();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 종료된 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
