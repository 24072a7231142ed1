package com.ryuqq.analysis.application.reliability;

import java.time.Duration;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트는 실제로 잠들지 않는 구현을 주입해 백오프 시간을 기록만 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간만큼 대기.
     *
     * @param duration 대기 시간
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * {@link Thread#sleep(long)} 기반 구현.
     */
    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
