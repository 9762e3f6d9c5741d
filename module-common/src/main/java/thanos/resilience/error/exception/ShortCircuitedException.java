package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

@Getter
public class ShortCircuitedException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String serviceName;

  public ShortCircuitedException(String serviceName) {
    super(ResilienceErrorCode.SHORT_CIRCUITED, serviceName);
    this.serviceName = serviceName;
  }
}
