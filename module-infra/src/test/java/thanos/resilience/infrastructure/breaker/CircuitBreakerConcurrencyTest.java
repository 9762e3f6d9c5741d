package thanos.resilience.infrastructure.breaker;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thanos.resilience.core.domain.config.CircuitConfig;
import thanos.resilience.core.domain.model.CircuitState;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.infrastructure.support.MutableClock;
import thanos.resilience.infrastructure.support.RecordingSink;
import thanos.resilience.infrastructure.support.TestFixtures;

/** 다수 스레드가 동시에 같은 서킷을 두드릴 때의 원자성 검증 */
@DisplayName("CircuitBreaker 동시성")
class CircuitBreakerConcurrencyTest {

  private static final int THREADS = 32;

  @Test
  @DisplayName("HALF_OPEN에서 동시에 allow()해도 halfOpenMaxCalls개만 통과")
  void halfOpenAdmitsExactlyMaxCalls() throws Exception {
    MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    RecordingSink sink = new RecordingSink();
    CircuitBreaker breaker =
        new CircuitBreaker(
            "docs",
            new CircuitConfig(1, Duration.ofSeconds(10), 3, 3),
            clock,
            TestFixtures.syncPublisher(sink));
    breaker.recordFailure(breaker.allow(), CallFailureKind.TRANSIENT);
    clock.advanceSeconds(10);

    AtomicInteger proceeded = new AtomicInteger();
    runConcurrently(
        () -> {
          if (breaker.allow().isAllowed()) {
            proceeded.incrementAndGet();
          }
        });

    assertThat(proceeded.get()).isEqualTo(3);
    assertThat(breaker.state()).isEqualTo(CircuitState.HALF_OPEN);
    // OPEN → HALF_OPEN 전이는 단 한 번
    assertThat(sink.ofType(ObservabilityEventType.CIRCUIT_TRANSITION))
        .filteredOn(event -> event.field("to") == CircuitState.HALF_OPEN)
        .hasSize(1);
  }

  @Test
  @DisplayName("동시 실패가 몰려도 OPEN 전이 이벤트는 1건")
  void concurrentFailuresOpenOnce() throws Exception {
    RecordingSink sink = new RecordingSink();
    CircuitBreaker breaker =
        new CircuitBreaker(
            "docs",
            new CircuitConfig(5, Duration.ofSeconds(60), 1, 1),
            MutableClock.startingAt("2024-01-01T00:00:00Z"),
            TestFixtures.syncPublisher(sink));

    runConcurrently(
        () -> {
          breaker.recordFailure(breaker.allow(), CallFailureKind.TRANSIENT);
        });

    assertThat(breaker.state()).isEqualTo(CircuitState.OPEN);
    assertThat(sink.ofType(ObservabilityEventType.CIRCUIT_TRANSITION)).hasSize(1);
  }

  @Test
  @DisplayName("CLOSED 시절 허가들의 늦은 성공이 동시에 몰려도 HALF_OPEN 복구에 반영되지 않음")
  void lateSuccessesFromEarlierGenerationDoNotCloseHalfOpen() throws Exception {
    MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    CircuitBreaker breaker =
        new CircuitBreaker(
            "docs",
            new CircuitConfig(1, Duration.ofSeconds(10), 1, 2),
            clock,
            TestFixtures.syncPublisher(new RecordingSink()));
    Queue<CircuitPermit> inFlight = new ConcurrentLinkedQueue<>();
    for (int i = 0; i < THREADS; i++) {
      inFlight.add(breaker.allow());
    }
    breaker.recordFailure(breaker.allow(), CallFailureKind.TRANSIENT);
    clock.advanceSeconds(10);
    CircuitPermit trial = breaker.allow();

    runConcurrently(() -> breaker.recordSuccess(inFlight.poll()));

    assertThat(breaker.snapshot())
        .satisfies(
            snapshot -> {
              assertThat(snapshot.state()).isEqualTo(CircuitState.HALF_OPEN);
              assertThat(snapshot.successCount()).isZero();
              assertThat(snapshot.halfOpenInFlight()).isEqualTo(1);
            });
    assertThat(trial.isAllowed()).isTrue();
  }

  private static void runConcurrently(Runnable task) throws InterruptedException {
    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    CountDownLatch done = new CountDownLatch(THREADS);
    try {
      for (int i = 0; i < THREADS; i++) {
        executor.submit(
            () -> {
              try {
                start.await();
                task.run();
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              } finally {
                done.countDown();
              }
            });
      }
      start.countDown();
      assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }
  }
}
