package thanos.resilience.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.infrastructure.executor.function.CheckedRunnable;
import thanos.resilience.infrastructure.executor.function.CheckedSupplier;
import thanos.resilience.infrastructure.util.InterruptUtils;

/**
 * CheckedLogicExecutor의 기본 구현체
 *
 * <p>모든 작업의 소요 시간을 {@code logic.executor} Timer(component, operation, result 태그)로 기록합니다.
 * dynamicValue는 카디널리티 통제를 위해 로그에만 남깁니다.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultCheckedLogicExecutor implements CheckedLogicExecutor {

  static final String METRIC_NAME = "logic.executor";

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(CheckedSupplier<T> task, TaskContext context) throws Exception {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Exception e) {
      InterruptUtils.restoreInterruptIfNeeded(e);
      throw e;
    }
  }

  @Override
  public <T> T executeUnchecked(
      CheckedSupplier<T> task,
      TaskContext context,
      Function<Exception, ? extends RuntimeException> mapper) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(mapper, "mapper must not be null");

    try {
      return timed(task, context);
    } catch (RuntimeException re) {
      InterruptUtils.restoreInterruptIfNeeded(re);
      throw re;
    } catch (Exception ex) {
      InterruptUtils.restoreInterruptIfNeeded(ex);
      throw applyMapper(mapper, ex);
    }
  }

  @Override
  public <T> T executeWithFinallyUnchecked(
      CheckedSupplier<T> task,
      CheckedRunnable finalizer,
      TaskContext context,
      Function<Exception, ? extends RuntimeException> mapper) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(finalizer, "finalizer must not be null");
    Objects.requireNonNull(context, "context must not be null");
    Objects.requireNonNull(mapper, "mapper must not be null");

    T result = null;
    Exception primary = null;

    try {
      result = timed(task, context);
    } catch (Exception e) {
      primary = e;
    } finally {
      try {
        finalizer.run();
      } catch (Exception fe) {
        if (primary == null) {
          primary = fe;
        } else {
          safeAddSuppressed(primary, fe);
        }
      }
    }

    if (primary == null) {
      return result;
    }
    InterruptUtils.restoreInterruptIfNeeded(primary);
    if (primary instanceof RuntimeException re) {
      throw re;
    }
    RuntimeException mapped = applyMapper(mapper, primary);
    for (Throwable s : primary.getSuppressed()) {
      safeAddSuppressed(mapped, s);
    }
    throw mapped;
  }

  @Override
  public <T> T executeOrDefault(CheckedSupplier<T> task, T defaultValue, TaskContext context) {
    Objects.requireNonNull(task, "task must not be null");
    Objects.requireNonNull(context, "context must not be null");

    try {
      return timed(task, context);
    } catch (Exception e) {
      InterruptUtils.restoreInterruptIfNeeded(e);
      log.warn("[LogicExecutor] 작업 실패, 기본값 반환. task={}", context.toTaskName(), e);
      return defaultValue;
    }
  }

  private <T> T timed(CheckedSupplier<T> task, TaskContext context) throws Exception {
    long start = System.nanoTime();
    String result = "failure";
    try {
      T value = task.get();
      result = "success";
      return value;
    } finally {
      Timer.builder(METRIC_NAME)
          .tag("component", context.component())
          .tag("operation", context.operation())
          .tag("result", result)
          .register(meterRegistry)
          .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    }
  }

  private RuntimeException applyMapper(
      Function<Exception, ? extends RuntimeException> mapper, Exception ex) {
    RuntimeException mapped = mapper.apply(ex);
    if (mapped == null) {
      throw new IllegalStateException(
          "Exception mapper returned null for: " + ex.getClass().getName(), ex);
    }
    return mapped;
  }

  private static void safeAddSuppressed(Throwable primary, Throwable suppressed) {
    if (primary != suppressed && suppressed != null) {
      primary.addSuppressed(suppressed);
    }
  }
}
