package com.ryuqq.guildkeeper.adapter.runner;

/**
 * Presence 루프 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>intervalMs: presence 갱신 주기 (기본 3000ms)</li>
 *   <li>statusTemplate: 상태 문구, {@value #COUNT_PLACEHOLDER} 자리에 길드 수가 들어감</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param intervalMs 갱신 주기 (밀리초, 양수여야 함)
 * @param statusTemplate 상태 문구 템플릿 ({count} 포함)
 */
public record PresenceConfig(long intervalMs, String statusTemplate) {

    public static final String COUNT_PLACEHOLDER = "{count}";

    public static final String DEFAULT_TEMPLATE = "Monitoring a total of {count} guilds | -help";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: intervalMs=3000ms, statusTemplate="Monitoring a total of {count} guilds | -help"</p>
     */
    public PresenceConfig() {
        this(3000, DEFAULT_TEMPLATE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PresenceConfig {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException(
                "intervalMs must be positive (current: " + intervalMs + ")"
            );
        }
        if (statusTemplate == null || !statusTemplate.contains(COUNT_PLACEHOLDER)) {
            throw new IllegalArgumentException(
                "statusTemplate must contain " + COUNT_PLACEHOLDER + " (current: " + statusTemplate + ")"
            );
        }
    }

    /**
     * 길드 수를 넣은 상태 문구.
     */
    public String render(int guildCount) {
        return statusTemplate.replace(COUNT_PLACEHOLDER, Integer.toString(guildCount));
    }

    public PresenceConfig withIntervalMs(long intervalMs) {
        return new PresenceConfig(intervalMs, statusTemplate);
    }

    public PresenceConfig withStatusTemplate(String statusTemplate) {
        return new PresenceConfig(intervalMs, statusTemplate);
    }
}
