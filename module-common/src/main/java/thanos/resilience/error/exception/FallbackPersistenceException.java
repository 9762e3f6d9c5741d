package thanos.resilience.error.exception;

import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;

public class FallbackPersistenceException extends ServerBaseException {

  public FallbackPersistenceException(String key, Throwable cause) {
    super(ResilienceErrorCode.FALLBACK_PERSISTENCE_FAILED, cause, key);
  }
}
