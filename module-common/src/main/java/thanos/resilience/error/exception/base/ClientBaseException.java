package thanos.resilience.error.exception.base;

import thanos.resilience.error.ErrorCode;

/**
 * ClientBaseException: 호출자가 계약을 어겼을 때 발생하는 예외입니다. 외부 서비스의 건강 상태와 무관하므로 서킷 브레이커에 기록되지 않고 그대로
 * 호출자에게 전파됩니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 동적 인자를 받아 "잘못된 호출 인자입니다: %s" 같은 메시지를 완성합니다.
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ClientBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
