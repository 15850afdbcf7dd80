package com.ryuqq.guildkeeper.core.model;

/**
 * 길드의 뮤트 처리 방식.
 *
 * <ul>
 *   <li>{@link #TIMEOUT}: 플랫폼 타임아웃 기능 사용 (기본값)</li>
 *   <li>{@link #ROLE}: 지정된 뮤트 역할 부여</li>
 * </ul>
 *
 * <p>저장소에는 소문자 문자열({@code "timeout"}, {@code "role"})로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum MuteType {

    TIMEOUT("timeout"),

    ROLE("role");

    private final String storageValue;

    MuteType(String storageValue) {
        this.storageValue = storageValue;
    }

    /**
     * 저장소 컬럼 값 조회.
     *
     * @return 저장용 문자열
     */
    public String storageValue() {
        return storageValue;
    }

    /**
     * 저장소 컬럼 값으로부터 MuteType 복원.
     *
     * @param storageValue 저장된 문자열 (대소문자 무시)
     * @return 대응하는 MuteType
     * @throws IllegalArgumentException null이거나 알 수 없는 값인 경우
     */
    public static MuteType fromStorage(String storageValue) {
        if (storageValue == null) {
            throw new IllegalArgumentException("storageValue cannot be null");
        }
        for (MuteType type : values()) {
            if (type.storageValue.equalsIgnoreCase(storageValue)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown mute type: " + storageValue);
    }
}
