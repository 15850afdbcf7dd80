package com.ryuqq.guildkeeper.core.model;

/**
 * 플랫폼 사용자 식별자.
 *
 * <p>길드 소유자 및 명령어 호출자를 식별하는 데 사용됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class UserId {

    private final long value;

    private UserId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("UserId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * UserId 생성.
     *
     * @param value 플랫폼이 부여한 사용자 ID
     * @return UserId 인스턴스
     * @throws IllegalArgumentException 양수가 아닌 경우
     */
    public static UserId of(long value) {
        return new UserId(value);
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId userId = (UserId) o;
        return value == userId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "UserId{" + value + '}';
    }
}
