package thanos.resilience.error.exception;

import lombok.Getter;
import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;

/**
 * 라이브 호출도 폴백도 불가능할 때 호출자에게 전달되는 최종 예외
 *
 * <p>cause에는 폴백으로 넘어가게 만든 원래 실패(차단, 스로틀, 풀 고갈, 호출 실패)가 담깁니다.
 */
@Getter
public class NoFallbackAvailableException extends ServerBaseException {

  private final String serviceName;
  private final String operationName;

  public NoFallbackAvailableException(
      String serviceName, String operationName, Throwable originalFailure) {
    super(ResilienceErrorCode.NO_FALLBACK_AVAILABLE, originalFailure, serviceName, operationName);
    this.serviceName = serviceName;
    this.operationName = operationName;
  }
}
