package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

/** fetch 실행 스레드가 작업을 받지 못했거나 마감 전에 시작하지 못함. 다운스트림 실패가 아니므로 브레이커에 기록하지 않음 */
@Getter
public class ExecutorSaturatedException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String serviceName;

  public ExecutorSaturatedException(String serviceName) {
    super(ResilienceErrorCode.EXECUTOR_SATURATED, serviceName);
    this.serviceName = serviceName;
  }

  public ExecutorSaturatedException(String serviceName, Throwable cause) {
    super(ResilienceErrorCode.EXECUTOR_SATURATED, cause, serviceName);
    this.serviceName = serviceName;
  }
}
