package com.ryuqq.guildkeeper.core.model;

/**
 * 길드(워크스페이스)의 전역 고유 식별자.
 *
 * <p>채팅 플랫폼이 부여하는 64비트 식별자이며, 길드 설정 캐시와
 * 영속 저장소 모두에서 기본 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>양수만 허용 (0 이하 불가)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class GuildId {

    private final long value;

    private GuildId(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("GuildId must be positive (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * GuildId 생성.
     *
     * @param value 플랫폼이 부여한 길드 ID
     * @return GuildId 인스턴스
     * @throws IllegalArgumentException 양수가 아닌 경우
     */
    public static GuildId of(long value) {
        return new GuildId(value);
    }

    /**
     * GuildId 값 조회.
     *
     * @return 길드 ID
     */
    public long getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GuildId guildId = (GuildId) o;
        return value == guildId.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "GuildId{" + value + '}';
    }
}
