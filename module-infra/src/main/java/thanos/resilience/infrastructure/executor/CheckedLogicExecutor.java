package thanos.resilience.infrastructure.executor;

import java.util.function.Function;
import thanos.resilience.infrastructure.executor.function.CheckedRunnable;
import thanos.resilience.infrastructure.executor.function.CheckedSupplier;

/**
 * Checked 예외를 처리하는 IO 경계 전용 Executor
 *
 * <p>폴백 파일 I/O, 커넥터 open/validate/close, 관측 싱크 호출처럼 checked 예외가 발생하는 경계에서 **try-catch 없이** 예외를
 * 번역하는 템플릿을 제공합니다.
 *
 * <h3>핵심 계약</h3>
 *
 * <ul>
 *   <li><b>Error 즉시 전파</b>: VirtualMachineError 등은 매핑/복구 없이 즉시 throw
 *   <li><b>RuntimeException 통과</b>: 이미 unchecked이므로 그대로 throw
 *   <li><b>Exception → mapper 변환</b>: checked 예외만 mapper로 RuntimeException 변환
 *   <li><b>mapper 계약 방어</b>: null 반환 시 IllegalStateException
 *   <li><b>인터럽트 플래그 복원</b>: 예외 그래프에 InterruptedException이 있으면 복원
 * </ul>
 *
 * <h3>사용 패턴</h3>
 *
 * <pre>{@code
 * C handle = checkedExecutor.executeUnchecked(
 *     () -> connector.connect(serviceName),
 *     TaskContext.of("ConnectionPool", "Connect", serviceName),
 *     e -> new CallFailedException(serviceName, CallFailureKind.TRANSIENT, e));
 * }</pre>
 */
public interface CheckedLogicExecutor {

  // ========================================
  // Level 2: throws 전파 (상위에서 처리)
  // ========================================

  /**
   * Checked 예외를 그대로 전파하는 작업을 실행합니다.
   *
   * @throws Exception 작업 중 발생한 예외
   */
  <T> T execute(CheckedSupplier<T> task, TaskContext context) throws Exception;

  // ========================================
  // Level 1: checked → runtime 변환
  // ========================================

  /**
   * Checked 예외를 RuntimeException으로 변환하여 실행합니다.
   *
   * <h4>예외 처리 우선순위</h4>
   *
   * <ol>
   *   <li><b>Error</b>: 즉시 throw (mapper 미호출)
   *   <li><b>RuntimeException</b>: 그대로 throw
   *   <li><b>Exception</b>: mapper.apply(e) 결과를 throw
   * </ol>
   *
   * @param mapper checked Exception → RuntimeException 변환 함수
   */
  <T> T executeUnchecked(
      CheckedSupplier<T> task,
      TaskContext context,
      Function<Exception, ? extends RuntimeException> mapper);

  default void executeUncheckedVoid(
      CheckedRunnable task,
      TaskContext context,
      Function<Exception, ? extends RuntimeException> mapper) {
    executeUnchecked(
        () -> {
          task.run();
          return null;
        },
        context,
        mapper);
  }

  /**
   * Checked 예외를 RuntimeException으로 변환하고, finalizer 실행을 보장합니다.
   *
   * <p>finalizer는 task 성공/실패와 무관하게 정확히 1회 실행됩니다. task가 실패하면 finalizer 예외는 suppressed로 붙습니다.
   */
  <T> T executeWithFinallyUnchecked(
      CheckedSupplier<T> task,
      CheckedRunnable finalizer,
      TaskContext context,
      Function<Exception, ? extends RuntimeException> mapper);

  // ========================================
  // Level 0: 실패 흡수 (best-effort)
  // ========================================

  /**
   * 실패 시 기본값을 반환합니다. Error를 제외한 모든 예외는 WARN 로그 후 흡수됩니다.
   *
   * <p>커넥션 close, 헬스 프로브처럼 실패해도 호출 흐름을 깨면 안 되는 작업에만 사용합니다.
   */
  <T> T executeOrDefault(CheckedSupplier<T> task, T defaultValue, TaskContext context);

  default void executeOrLog(CheckedRunnable task, TaskContext context) {
    executeOrDefault(
        () -> {
          task.run();
          return null;
        },
        null,
        context);
  }
}
