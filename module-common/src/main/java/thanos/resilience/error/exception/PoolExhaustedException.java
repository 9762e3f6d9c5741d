package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

@Getter
public class PoolExhaustedException extends ServerBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String serviceName;

  public PoolExhaustedException(String serviceName, int maxTotal) {
    super(ResilienceErrorCode.POOL_EXHAUSTED, serviceName, maxTotal);
    this.serviceName = serviceName;
  }
}
