package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerRecordMarker;

@Getter
public class CallFailedException extends ServerBaseException implements CircuitBreakerRecordMarker {

  private final String serviceName;
  private final CallFailureKind kind;

  public CallFailedException(String serviceName, CallFailureKind kind) {
    super(ResilienceErrorCode.CALL_FAILED, serviceName, kind);
    this.serviceName = serviceName;
    this.kind = kind;
  }

  // cause를 포함하여 예외 체이닝 지원
  public CallFailedException(String serviceName, CallFailureKind kind, Throwable cause) {
    super(ResilienceErrorCode.CALL_FAILED, cause, serviceName, kind);
    this.serviceName = serviceName;
    this.kind = kind;
  }
}
