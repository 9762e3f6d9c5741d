package thanos.resilience.error.exception.base;

import thanos.resilience.error.ErrorCode;

/**
 * ServerBaseException: 다운스트림 장애, 로컬 보호 장치의 거절, 내부 오류 등 '서버 측' 예외를 표현하며, 장애 회고를 위한 상세 로그를 남기는 것이 주
 * 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 서비스명, 키 등 구체적인 식별자를 로그에 남기기 위해 추가합니다.
  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  // 실제 에러(cause)를 포함하여 디버깅 정보 확보
  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  // 상세 메시지(args)와 실제 에러(cause)를 동시에 기록
  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
