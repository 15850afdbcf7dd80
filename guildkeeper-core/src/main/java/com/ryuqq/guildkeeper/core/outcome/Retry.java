package com.ryuqq.guildkeeper.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>생명주기 이벤트 처리 중 저장소 쓰기/읽기가 실패한 경우를 나타냅니다.
 * 이벤트는 미처리 상태로 간주되며, 재전달 대기열을 통해 다시 처리됩니다.
 * 프로세스를 중단시키는 치명적 오류로 취급하지 않습니다.</p>
 *
 * @param errorKind 실패 유형 (저장소 계열이어야 함)
 * @param message 재시도 사유
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Retry(
    ErrorKind errorKind,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind가 저장소 계열이 아니거나 message가 비어있는 경우
     */
    public Retry {
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        if (!errorKind.isStoreFailure()) {
            throw new IllegalArgumentException("Only store failures are retryable (current: " + errorKind + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Retry of(ErrorKind errorKind, String message, String cause) {
        return new Retry(errorKind, message, cause);
    }
}
