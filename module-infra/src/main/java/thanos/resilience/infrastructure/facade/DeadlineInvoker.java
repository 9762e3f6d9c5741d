package thanos.resilience.infrastructure.facade;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.error.exception.ExecutorSaturatedException;
import thanos.resilience.infrastructure.executor.function.CheckedSupplier;

/**
 * 호출자 데드라인 적용기
 *
 * <p>데드라인이 있으면 전용 executor에서 fetch를 실행하고 Resilience4j {@link TimeLimiter}로 대기합니다. 데드라인은 fetch가
 * 실제로 시작된 시점부터 잽니다. 초과 시 실행 중인 Future를 취소(인터럽트)하고 {@link TimeoutException}을 던집니다. 데드라인이 없으면 호출
 * 스레드에서 그대로 실행합니다.
 *
 * <h3>executor 포화</h3>
 *
 * <p>executor가 작업을 거절하거나 작업이 데드라인 안에 시작되지 못하면 fetch는 한 번도 실행되지 않은 것이므로 {@link
 * ExecutorSaturatedException}을 던집니다. 이 예외는 다운스트림 실패가 아니며 브레이커에 기록되지 않습니다.
 */
@Slf4j
@RequiredArgsConstructor
public class DeadlineInvoker {

  private final ExecutorService fetchExecutor;

  public <T> T invoke(CheckedSupplier<T> task, Duration deadline, String serviceName)
      throws Exception {
    if (deadline == null) {
      return task.get();
    }
    CompletableFuture<Void> started = new CompletableFuture<>();
    Future<T> future = submit(task, started, serviceName);
    awaitStart(started, future, deadline, serviceName);

    TimeLimiter timeLimiter =
        TimeLimiter.of(
            serviceName,
            TimeLimiterConfig.custom()
                .timeoutDuration(deadline)
                .cancelRunningFuture(true)
                .build());
    return timeLimiter.executeFutureSupplier(() -> future);
  }

  private <T> Future<T> submit(
      CheckedSupplier<T> task, CompletableFuture<Void> started, String serviceName) {
    try {
      return fetchExecutor.submit(
          () -> {
            // 대기 중 포기된 작업은 실행하지 않음
            if (!started.complete(null)) {
              throw new CancellationException("fetch abandoned before start");
            }
            return task.get();
          });
    } catch (RejectedExecutionException e) {
      log.warn("[DeadlineInvoker] fetch executor 거절. service={}", serviceName);
      throw new ExecutorSaturatedException(serviceName, e);
    }
  }

  private void awaitStart(
      CompletableFuture<Void> started, Future<?> future, Duration deadline, String serviceName)
      throws Exception {
    try {
      started.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      // cancel이 이기면 작업은 시작하지 않음. 지면 방금 시작된 것이므로 그대로 진행
      if (started.cancel(false)) {
        future.cancel(false);
        log.warn(
            "[DeadlineInvoker] 데드라인 안에 fetch 시작 실패. service={}, deadline={}",
            serviceName,
            deadline);
        throw new ExecutorSaturatedException(serviceName, e);
      }
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }
}
