package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ClientBaseException;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;

@Getter
public class InvalidServiceConfigurationException extends ClientBaseException
    implements CircuitBreakerIgnoreMarker {

  private final String serviceName;

  public InvalidServiceConfigurationException(String serviceName, String reason) {
    super(ResilienceErrorCode.INVALID_SERVICE_CONFIGURATION, serviceName, reason);
    this.serviceName = serviceName;
  }
}
