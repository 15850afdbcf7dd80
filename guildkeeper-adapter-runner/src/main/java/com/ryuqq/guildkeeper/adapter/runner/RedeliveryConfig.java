package com.ryuqq.guildkeeper.adapter.runner;

/**
 * 라이프사이클 이벤트 재전달 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 대기 이벤트 스캔 주기 (기본 5000ms)</li>
 *   <li>batchSize: 한 번의 스캔에서 처리할 최대 이벤트 수 (기본 50)</li>
 *   <li>maxAttempts: 이벤트당 최대 처리 시도 횟수, 실시간 시도 포함 (기본 5)</li>
 *   <li>baseDelayMs: 첫 재시도 지연 (기본 1000ms)</li>
 *   <li>maxDelayMs: 최대 재시도 지연 (기본 60000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 재시도 지연 (밀리초, baseDelayMs 이상이어야 함)
 */
public record RedeliveryConfig(
    long scanIntervalMs,
    int batchSize,
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=5000ms, batchSize=50, maxAttempts=5,
     * baseDelayMs=1000ms, maxDelayMs=60000ms</p>
     */
    public RedeliveryConfig() {
        this(5000, 50, 5, 1000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedeliveryConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
    }

    public RedeliveryConfig withScanIntervalMs(long scanIntervalMs) {
        return new RedeliveryConfig(scanIntervalMs, batchSize, maxAttempts, baseDelayMs, maxDelayMs);
    }

    public RedeliveryConfig withBatchSize(int batchSize) {
        return new RedeliveryConfig(scanIntervalMs, batchSize, maxAttempts, baseDelayMs, maxDelayMs);
    }

    public RedeliveryConfig withMaxAttempts(int maxAttempts) {
        return new RedeliveryConfig(scanIntervalMs, batchSize, maxAttempts, baseDelayMs, maxDelayMs);
    }

    /**
     * 재시도 지연만 변경한 새 인스턴스 생성.
     */
    public RedeliveryConfig withDelays(long baseDelayMs, long maxDelayMs) {
        return new RedeliveryConfig(scanIntervalMs, batchSize, maxAttempts, baseDelayMs, maxDelayMs);
    }
}
