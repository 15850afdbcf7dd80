package com.ryuqq.guildkeeper.core.model;

/**
 * 길드별 명령어 접두사.
 *
 * <p>사용자가 명령어 이름 앞에 입력해야 하는 토큰입니다 (예: {@code -help}).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>공백 문자 포함 불가 ({@link Character#isWhitespace(int)} 또는 {@link Character#isSpaceChar(int)})</li>
 * </ul>
 *
 * <p>생성 시점에 검증하므로 저장소나 캐시에 들어가는 모든 Prefix는
 * 공백을 포함하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Prefix {

    /**
     * 기본 접두사 값.
     */
    public static final String DEFAULT_VALUE = "-";

    /**
     * 기본 접두사.
     */
    public static final Prefix DEFAULT = new Prefix(DEFAULT_VALUE);

    private final String value;

    private Prefix(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Prefix cannot be null or empty");
        }
        if (containsWhitespace(value)) {
            throw new IllegalArgumentException("Prefix cannot contain whitespace: '" + value + "'");
        }
        this.value = value;
    }

    /**
     * Prefix 생성.
     *
     * @param value 접두사 값
     * @return Prefix 인스턴스
     * @throws IllegalArgumentException null, 빈 문자열이거나 공백을 포함하는 경우
     */
    public static Prefix of(String value) {
        if (DEFAULT_VALUE.equals(value)) {
            return DEFAULT;
        }
        return new Prefix(value);
    }

    /**
     * 문자열에 공백 문자가 포함되어 있는지 확인.
     *
     * <p>줄바꿈 금지 공백(U+00A0, U+2007, U+202F) 같은 유니코드 공백 문자도 포함합니다.</p>
     *
     * @param candidate 검사할 문자열
     * @return 공백 문자가 하나라도 있으면 true
     * @throws IllegalArgumentException candidate가 null인 경우
     */
    public static boolean containsWhitespace(String candidate) {
        if (candidate == null) {
            throw new IllegalArgumentException("candidate cannot be null");
        }
        return candidate.codePoints().anyMatch(cp -> Character.isWhitespace(cp) || Character.isSpaceChar(cp));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Prefix prefix = (Prefix) o;
        return value.equals(prefix.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
