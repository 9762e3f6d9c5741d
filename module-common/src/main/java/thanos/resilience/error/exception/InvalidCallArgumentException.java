package thanos.resilience.error.exception;

import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ClientBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

public class InvalidCallArgumentException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  public InvalidCallArgumentException(String detail) {
    super(ResilienceErrorCode.INVALID_CALL_ARGUMENT, detail);
  }

  public InvalidCallArgumentException(String detail, Throwable cause) {
    super(ResilienceErrorCode.INVALID_CALL_ARGUMENT, cause, detail);
  }
}
