package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

@Getter
public class ThrottledException extends ServerBaseException implements CircuitBreakerIgnoreMarker {

  private final String serviceName;
  private final String limit;

  public ThrottledException(String serviceName, String limit) {
    super(ResilienceErrorCode.THROTTLED, serviceName, limit);
    this.serviceName = serviceName;
    this.limit = limit;
  }
}
