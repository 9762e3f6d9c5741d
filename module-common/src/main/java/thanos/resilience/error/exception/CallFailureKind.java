package thanos.resilience.error.exception;

/** 다운스트림 호출 실패 유형. 세 유형 모두 서킷 브레이커 실패로 집계됩니다. */
public enum CallFailureKind {
  /** 일시적 장애 (네트워크 단절, 5xx, 커넥션 생성 실패) */
  TRANSIENT,
  /** 재시도해도 동일하게 실패할 장애 (4xx 응답, 프로토콜 오류) */
  PERMANENT,
  /** 호출자가 지정한 데드라인 초과 */
  TIMEOUT
}
