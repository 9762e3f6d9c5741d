package thanos.resilience.error.exception;

import thanos.resilience.error.ResilienceErrorCode;
import thanos.resilience.error.exception.base.ServerBaseException;

/** 폴백 엔트리 역직렬화 실패. 저장소 내부에서만 쓰이며 호출자에게는 "데이터 없음"으로 보입니다. */
public class FallbackCorruptException extends ServerBaseException {

  public FallbackCorruptException(String key) {
    super(ResilienceErrorCode.FALLBACK_CORRUPT, key);
  }

  public FallbackCorruptException(String key, Throwable cause) {
    super(ResilienceErrorCode.FALLBACK_CORRUPT, cause, key);
  }
}
