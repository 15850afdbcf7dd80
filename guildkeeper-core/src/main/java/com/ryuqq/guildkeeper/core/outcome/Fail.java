package com.ryuqq.guildkeeper.core.outcome;

/**
 * 종료된 실패 (재시도하지 않음).
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>DM에서 길드 전용 명령어 호출 ({@link ErrorKind#MISSING_CONTEXT})</li>
 *   <li>관리자 권한 없음 ({@link ErrorKind#PERMISSION_DENIED})</li>
 *   <li>공백이 포함된 접두사 ({@link ErrorKind#VALIDATION_ERROR})</li>
 *   <li>명령어 처리 중 저장소 쓰기 실패 ({@link ErrorKind#STORE_WRITE_FAILURE})</li>
 * </ul>
 *
 * @param errorKind 실패 유형
 * @param message 사용자에게 보여줄 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Fail(
    ErrorKind errorKind,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorKind가 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (errorKind == null) {
            throw new IllegalArgumentException("errorKind cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * Fail 생성 (cause 포함).
     */
    public static Fail of(ErrorKind errorKind, String message, String cause) {
        return new Fail(errorKind, message, cause);
    }

    /**
     * cause 없이 Fail 생성.
     */
    public static Fail of(ErrorKind errorKind, String message) {
        return new Fail(errorKind, message, null);
    }
}
