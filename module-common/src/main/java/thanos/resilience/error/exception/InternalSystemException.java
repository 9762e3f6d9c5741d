package thanos.resilience.error.exception;

import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;

/** Executor가 번역한 예상치 못한 checked 예외 */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(ResilienceErrorCode.INTERNAL_SYSTEM_ERROR, cause, taskName);
  }
}
