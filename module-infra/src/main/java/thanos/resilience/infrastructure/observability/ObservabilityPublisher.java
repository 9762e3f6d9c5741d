package thanos.resilience.infrastructure.observability;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.port.out.ObservabilitySink;
import thanos.resilience.error.exception.InternalSystemException;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;
import thanos.resilience.infrastructure.util.ExceptionUtils;

/**
 * 관측 이벤트 팬아웃 (best-effort)
 *
 * <h4>책임</h4>
 *
 * <ul>
 *   <li>등록된 모든 {@link ObservabilitySink}로 비동기 전달
 *   <li>싱크 실패/큐 포화 흡수: 호출 경로와 락 임계 구역에 절대 영향을 주지 않음
 * </ul>
 *
 * <h4>예외 처리 정책</h4>
 *
 * <ul>
 *   <li><b>RejectedExecutionException</b>: 정책적 드롭 → DEBUG
 *   <li><b>기타 예외</b>: 싱크 실패 → WARN
 * </ul>
 */
@Slf4j
public class ObservabilityPublisher {

  private final List<ObservabilitySink> sinks;
  private final Executor eventExecutor;
  private final CheckedLogicExecutor checkedExecutor;

  public ObservabilityPublisher(
      List<ObservabilitySink> sinks, Executor eventExecutor, CheckedLogicExecutor checkedExecutor) {
    this.sinks = List.copyOf(sinks);
    this.eventExecutor = eventExecutor;
    this.checkedExecutor = checkedExecutor;
  }

  public void publish(ObservabilityEvent event) {
    for (ObservabilitySink sink : sinks) {
      dispatch(sink, event);
    }
  }

  private void dispatch(ObservabilitySink sink, ObservabilityEvent event) {
    TaskContext context =
        TaskContext.of("Observability", "Publish", event.type() + ":" + event.serviceName());
    try {
      CompletableFuture.runAsync(
              () ->
                  checkedExecutor.executeUncheckedVoid(
                      () -> sink.accept(event),
                      context,
                      e -> new InternalSystemException(context.toTaskName(), e)),
              eventExecutor)
          .exceptionally(ex -> handleFailure(ex, event));
    } catch (RejectedExecutionException e) {
      handleFailure(e, event);
    }
  }

  private Void handleFailure(Throwable ex, ObservabilityEvent event) {
    Throwable root = ExceptionUtils.unwrap(ex);
    if (root instanceof RejectedExecutionException) {
      log.debug(
          "[Observability] 이벤트 드롭 (큐 포화, best-effort). type={}, service={}",
          event.type(),
          event.serviceName());
    } else {
      log.warn(
          "[Observability] 싱크 전달 실패 (best-effort). type={}, service={}",
          event.type(),
          event.serviceName(),
          root);
    }
    return null;
  }
}
