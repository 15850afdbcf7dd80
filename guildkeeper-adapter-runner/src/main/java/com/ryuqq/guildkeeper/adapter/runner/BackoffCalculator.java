package com.ryuqq.guildkeeper.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 라이프사이클 이벤트 재전달 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>저장소 장애가 이어지는 동안 재전달 시도가 몰리지 않도록
 * 실패 횟수에 따라 대기 시간을 두 배씩 늘리고 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempts-1), maxDelay)
 * delay       = min(exponential + exponential * jitterFactor * random[0,1), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1000ms, maxDelay=60000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attempts=1: 1000-1100ms</li>
 *   <li>attempts=3: 4000-4400ms</li>
 *   <li>attempts=7: 60000ms (maxDelay)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * RedeliveryConfig의 지연 설정으로 생성 (jitterFactor=0.1).
     */
    public BackoffCalculator(RedeliveryConfig config) {
        this(config.baseDelayMs(), config.maxDelayMs(), 0.1, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 첫 재시도 지연 (양수)
     * @param maxDelayMs 최대 지연 (baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @param random [0, 1) 범위 난수 공급자 (테스트에서 고정값 주입)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
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
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * n번째 실패 이후의 대기 시간.
     *
     * @param attempts 지금까지 실패한 횟수 (1부터)
     * @return 대기 시간 (밀리초)
     */
    public long delayAfter(int attempts) {
        if (attempts <= 0) {
            throw new IllegalArgumentException(
                "attempts must be positive (current: " + attempts + ")"
            );
        }
        // 시프트 overflow 방지: 2^62 이상은 어차피 maxDelay
        int shift = Math.min(attempts - 1, 62);
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier ? maxDelayMs : baseDelayMs * multiplier;
        exponential = Math.min(exponential, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    /**
     * 다음 재전달 시각.
     *
     * @param nowMillis 현재 시각 (epoch millis)
     * @param attempts 지금까지 실패한 횟수
     * @return nowMillis + delayAfter(attempts)
     */
    public long nextDueAt(long nowMillis, int attempts) {
        return nowMillis + delayAfter(attempts);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
