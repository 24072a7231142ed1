package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.exception.CircuitOpenException;
import com.ryuqq.analysis.core.exception.ProviderErrorType;
import com.ryuqq.analysis.core.exception.ProviderExhaustedException;
import com.ryuqq.analysis.core.exception.TerminalProviderException;
import com.ryuqq.analysis.core.exception.TransientProviderException;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;
import com.ryuqq.analysis.core.protection.CircuitBreaker;
import com.ryuqq.analysis.core.protection.CircuitBreakerConfig;
import com.ryuqq.analysis.core.protection.CircuitBreakerState;
import com.ryuqq.analysis.core.spi.ModelGateway;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Provider Reliability Layer.
 *
 * <p>모든 모델 호출을 감싸 deadline, 재시도, Circuit Breaker, Failover를 적용합니다.
 * 일시적 오류는 재시도 예산이 소진될 때까지 이 클래스 밖으로 나가지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * routes = [primary, failover...]
 * For each route:
 *   1. breaker.tryAcquire() 실패 → 네트워크 호출 없이 다음 route
 *   2. gateway.invoke() (deadline 적용)
 *      - 성공 → recordSuccess, 응답 반환
 *      - Terminal → 즉시 TerminalProviderException
 *      - Transient → recordFailure, backoff 후 재시도 (maxAttempts까지)
 *   3. 재시도 소진 후 breaker가 OPEN이면 다음 route, 아니면 ProviderExhaustedException
 * 모든 route 차단 → CircuitOpenException
 * </pre>
 *
 * <p><strong>Deadline:</strong> 호출은 고정 크기 호출 풀에서 실행하고 Resilience4j
 * {@link TimeLimiter}로 기다립니다. 기한을 넘기면 실행 중인 호출 스레드를 interrupt합니다.</p>
 *
 * <p><strong>Circuit Breaker 기록 규칙:</strong></p>
 * <ul>
 *   <li>재시도 대상 오류, 인증 오류, 분류 불가 오류 → 실패로 기록</li>
 *   <li>잘못된 요청 → Provider는 응답했으므로 성공으로 기록 (HALF_OPEN 시험 호출 해소)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ReliableModelClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReliableModelClient.class);

    /**
     * 동시에 실행할 수 있는 모델 호출 수. 초과분은 호출 풀 큐에서 대기합니다.
     */
    public static final int MAX_CONCURRENT_CALLS = 32;

    private final ModelGateway gateway;
    private final RetryPolicy policy;
    private final CircuitBreakerConfig breakerConfig;
    private final BackoffCalculator backoff;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ExecutorService callExecutor;

    private final ConcurrentHashMap<ModelId, Resilience4jCircuitBreakerAdapter> breakers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Duration, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ModelId, HealthCounter> health = new ConcurrentHashMap<>();

    /**
     * 기본 설정으로 생성 (실제 sleep, 시스템 시계).
     */
    public ReliableModelClient(ModelGateway gateway) {
        this(gateway, new RetryPolicy(), new CircuitBreakerConfig(), Clock.systemUTC(), Sleeper.system());
    }

    public ReliableModelClient(ModelGateway gateway, RetryPolicy policy, CircuitBreakerConfig breakerConfig,
                               Clock clock, Sleeper sleeper) {
        this(gateway, policy, breakerConfig, new BackoffCalculator(policy), clock, sleeper);
    }

    /**
     * 생성자.
     *
     * @param gateway 모델 Gateway
     * @param policy 재시도 정책
     * @param breakerConfig Circuit Breaker 설정 (모델마다 별도 인스턴스 생성)
     * @param backoff 백오프 계산기
     * @param clock Circuit Breaker cool-down 계산용 시계
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ReliableModelClient(ModelGateway gateway, RetryPolicy policy, CircuitBreakerConfig breakerConfig,
                               BackoffCalculator backoff, Clock clock, Sleeper sleeper) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (breakerConfig == null) {
            throw new IllegalArgumentException("breakerConfig cannot be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.gateway = gateway;
        this.policy = policy;
        this.breakerConfig = breakerConfig;
        this.backoff = backoff;
        this.classifier = new ErrorClassifier();
        this.clock = clock;
        this.sleeper = sleeper;
        this.callExecutor = Executors.newFixedThreadPool(MAX_CONCURRENT_CALLS, new CallThreadFactory());
    }

    /**
     * Failover 없이 호출.
     *
     * @param request 요청
     * @return 응답
     */
    public ModelResponse call(ModelRequest request) {
        return call(request, List.of());
    }

    /**
     * 신뢰성 계층을 거쳐 모델 호출.
     *
     * @param request 요청 (request.model()이 1순위 route)
     * @param failover 보조 모델 (순서대로 시도)
     * @return 응답
     * @throws TerminalProviderException 재시도하지 않는 오류
     * @throws ProviderExhaustedException 재시도 예산 소진
     * @throws CircuitOpenException 모든 route가 차단된 경우
     */
    public ModelResponse call(ModelRequest request, List<ModelId> failover) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        List<ModelId> routes = routes(request.model(), failover);
        List<ModelId> rejected = new ArrayList<>();
        ProviderExhaustedException lastExhausted = null;

        for (int i = 0; i < routes.size(); i++) {
            ModelId model = routes.get(i);
            CircuitBreaker breaker = breakerFor(model);
            boolean hasNext = i < routes.size() - 1;

            if (!breaker.tryAcquire()) {
                rejected.add(model);
                counterFor(model).rejections.incrementAndGet();
                log.warn("Circuit breaker OPEN for {}, skipping without network call{}", model,
                    hasNext ? "; failing over to " + routes.get(i + 1) : "");
                continue;
            }

            try {
                return attempt(request.withModel(model), breaker);
            } catch (ProviderExhaustedException e) {
                if (hasNext && breaker.getState() == CircuitBreakerState.OPEN) {
                    log.warn("Retries exhausted and circuit opened for {}, failing over to {}", model, routes.get(i + 1));
                    lastExhausted = e;
                    continue;
                }
                throw e;
            }
        }

        if (lastExhausted != null) {
            throw lastExhausted;
        }
        throw new CircuitOpenException(rejected);
    }

    /**
     * 모델 하나에 대한 재시도 루프. 첫 시도의 허가는 호출자가 이미 받았습니다.
     */
    private ModelResponse attempt(ModelRequest request, CircuitBreaker breaker) {
        ModelId model = request.model();
        HealthCounter counter = counterFor(model);
        TransientProviderException lastFailure = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1 && !breaker.tryAcquire()) {
                counter.rejections.incrementAndGet();
                log.warn("Circuit breaker for {} opened during retries, stopping after {} attempt(s)", model, attempt - 1);
                throw new ProviderExhaustedException(model, attempt - 1, lastFailure);
            }

            counter.attempts.incrementAndGet();
            try {
                ModelResponse response = invokeWithDeadline(request);
                breaker.recordSuccess();
                counter.successes.incrementAndGet();
                if (attempt > 1) {
                    log.info("Call to {} succeeded on attempt {}/{}", model, attempt, policy.maxAttempts());
                }
                return response;
            } catch (RuntimeException e) {
                ProviderErrorType type = classifier.classify(e);
                counter.recordFailure(type);

                if (!type.isRetryable()) {
                    if (type == ProviderErrorType.MALFORMED_REQUEST) {
                        breaker.recordSuccess();
                    } else {
                        breaker.recordFailure(e);
                    }
                    log.error("Terminal error from {} ({}), not retrying: {}", model, type, e.getMessage());
                    throw e instanceof TerminalProviderException terminal
                        ? terminal
                        : new TerminalProviderException(model, type, e.getMessage(), e);
                }

                breaker.recordFailure(e);
                lastFailure = e instanceof TransientProviderException transientFailure
                    ? transientFailure
                    : new TransientProviderException(model, type, e.getMessage(), e);

                if (attempt < policy.maxAttempts()) {
                    Duration delay = backoff.calculate(attempt, type);
                    counter.retries.incrementAndGet();
                    log.warn("{}: attempt {}/{} failed ({}: {}), retrying in {}ms",
                        model, attempt, policy.maxAttempts(), type, e.getMessage(), delay.toMillis());
                    sleep(delay);
                }
            }
        }

        log.error("Retries exhausted for {} after {} attempts", model, policy.maxAttempts());
        throw new ProviderExhaustedException(model, policy.maxAttempts(), lastFailure);
    }

    private ModelResponse invokeWithDeadline(ModelRequest request) {
        TimeLimiter timeLimiter = timeLimiterFor(request.deadline());
        Future<ModelResponse> future = callExecutor.submit(() -> gateway.invoke(request));
        try {
            ModelResponse response = timeLimiter.executeFutureSupplier(() -> future);
            if (response == null) {
                throw new TransientProviderException(request.model(), ProviderErrorType.SERVER_ERROR, "Gateway returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            throw new TransientProviderException(request.model(), ProviderErrorType.TIMEOUT,
                "Call exceeded deadline of " + request.deadline().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + request.model(), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            ProviderErrorType type = classifier.classify(e);
            String message = String.valueOf(e.getMessage());
            if (type.isRetryable()) {
                throw new TransientProviderException(request.model(), type, message, e);
            }
            throw new TerminalProviderException(request.model(), type, message, e);
        }
    }

    private TimeLimiter timeLimiterFor(Duration deadline) {
        return timeLimiters.computeIfAbsent(deadline, key -> TimeLimiter.of("model-call-" + key.toMillis() + "ms",
            TimeLimiterConfig.custom()
                .timeoutDuration(key)
                .cancelRunningFuture(true)
                .build()));
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry backoff", e);
        }
    }

    private static List<ModelId> routes(ModelId primary, List<ModelId> failover) {
        Set<ModelId> routes = new LinkedHashSet<>();
        routes.add(primary);
        if (failover != null) {
            routes.addAll(failover);
        }
        return List.copyOf(routes);
    }

    /**
     * 모델별 Circuit Breaker (없으면 생성).
     *
     * @param model 모델
     * @return Circuit Breaker
     */
    public CircuitBreaker breakerFor(ModelId model) {
        return adapterFor(model);
    }

    private Resilience4jCircuitBreakerAdapter adapterFor(ModelId model) {
        return breakers.computeIfAbsent(model,
            key -> new Resilience4jCircuitBreakerAdapter(key.getValue(), breakerConfig, clock));
    }

    /**
     * 모델 하나의 건강 상태.
     *
     * @param model 모델
     * @return 스냅샷
     */
    public ProviderHealthSnapshot health(ModelId model) {
        return counterFor(model).snapshot(model, adapterFor(model));
    }

    /**
     * 호출 이력이 있는 모든 모델의 건강 상태.
     *
     * @return 스냅샷 목록 (모델 이름 순)
     */
    public List<ProviderHealthSnapshot> healthSnapshots() {
        return health.keySet().stream()
            .sorted((a, b) -> a.getValue().compareTo(b.getValue()))
            .map(this::health)
            .toList();
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private HealthCounter counterFor(ModelId model) {
        return health.computeIfAbsent(model, key -> new HealthCounter());
    }

    /**
     * 호출 스레드 정리.
     *
     * <p>진행 중인 호출은 호출 deadline까지만 기다린 뒤 interrupt합니다.</p>
     */
    @Override
    public void close() {
        callExecutor.shutdown();
        try {
            if (!callExecutor.awaitTermination(policy.callDeadline().toMillis(), TimeUnit.MILLISECONDS)) {
                callExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class HealthCounter {
        private final AtomicLong attempts = new AtomicLong();
        private final AtomicLong successes = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong rejections = new AtomicLong();
        private final AtomicLong retries = new AtomicLong();
        private final ConcurrentHashMap<ProviderErrorType, AtomicLong> byType = new ConcurrentHashMap<>();

        void recordFailure(ProviderErrorType type) {
            failures.incrementAndGet();
            byType.computeIfAbsent(type, key -> new AtomicLong()).incrementAndGet();
        }

        ProviderHealthSnapshot snapshot(ModelId model, Resilience4jCircuitBreakerAdapter breaker) {
            Map<ProviderErrorType, Long> failuresByType = new EnumMap<>(ProviderErrorType.class);
            byType.forEach((type, count) -> failuresByType.put(type, count.get()));
            return new ProviderHealthSnapshot(model, breaker.getState(), attempts.get(), successes.get(), failures.get(),
                rejections.get(), retries.get(), failuresByType, breaker.getFailureRate());
        }
    }

    private static final class CallThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "model-call-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
