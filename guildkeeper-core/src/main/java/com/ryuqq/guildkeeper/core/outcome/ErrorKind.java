package com.ryuqq.guildkeeper.core.outcome;

/**
 * 실패 유형.
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>검증 계열 ({@link #MISSING_CONTEXT}, {@link #PERMISSION_DENIED}, {@link #VALIDATION_ERROR}):
 *       명령어를 즉시 종료하며 캐시/저장소를 절대 변경하지 않음</li>
 *   <li>{@link #NOT_FOUND}: 기대한 설정이 캐시와 저장소 어디에도 없음</li>
 *   <li>저장소 계열 ({@link #STORE_WRITE_FAILURE}, {@link #STORE_READ_FAILURE}):
 *       생명주기 처리에서는 재시도 대상, 명령어에서는 일반 실패로 보고</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 길드 밖(DM)에서 길드 전용 명령어 호출.
     */
    MISSING_CONTEXT,

    /**
     * 호출자에게 관리자 권한 없음.
     */
    PERMISSION_DENIED,

    /**
     * 입력값 검증 실패 (예: 공백이 포함된 접두사).
     */
    VALIDATION_ERROR,

    /**
     * 기대한 설정 항목 없음.
     */
    NOT_FOUND,

    /**
     * 영속 저장소 쓰기/삭제 실패.
     */
    STORE_WRITE_FAILURE,

    /**
     * 영속 저장소 읽기 실패.
     */
    STORE_READ_FAILURE;

    /**
     * 검증 계열 실패인지 확인.
     *
     * @return MISSING_CONTEXT, PERMISSION_DENIED, VALIDATION_ERROR인 경우 true
     */
    public boolean isValidation() {
        return this == MISSING_CONTEXT || this == PERMISSION_DENIED || this == VALIDATION_ERROR;
    }

    /**
     * 저장소 계열 실패인지 확인.
     *
     * @return STORE_WRITE_FAILURE 또는 STORE_READ_FAILURE인 경우 true
     */
    public boolean isStoreFailure() {
        return this == STORE_WRITE_FAILURE || this == STORE_READ_FAILURE;
    }
}
