package thanos.resilience.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 복원력 계층 전역 에러 코드
 *
 * <ul>
 *   <li><b>C</b>: 호출자 측 프로그래밍 오류 (브레이커에 기록하지 않음)
 *   <li><b>R</b>: 로컬 보호 장치에 의한 거절 (폴백 대상)
 *   <li><b>S</b>: 다운스트림 장애 또는 내부 오류
 * </ul>
 */
@Getter
@AllArgsConstructor
public enum ResilienceErrorCode implements ErrorCode {
  // === Caller Errors ===
  INVALID_CALL_ARGUMENT("C001", "잘못된 호출 인자입니다: %s"),
  INVALID_SERVICE_CONFIGURATION("C002", "서비스 설정이 올바르지 않습니다 (서비스: %s, 사유: %s)"),

  // === Local Rejections ===
  SHORT_CIRCUITED("R001", "서킷이 열려 호출이 차단되었습니다 (서비스: %s)"),
  THROTTLED("R002", "호출 한도를 초과했습니다 (서비스: %s, 한도: %s)"),
  POOL_EXHAUSTED("R003", "커넥션 풀이 고갈되었습니다 (서비스: %s, 최대: %s)"),
  EXECUTOR_SATURATED("R004", "호출 실행 스레드가 포화 상태입니다 (서비스: %s)"),

  // === Server Errors ===
  INTERNAL_SYSTEM_ERROR("S000", "내부 시스템 오류가 발생했습니다 (%s)"),
  CALL_FAILED("S001", "외부 서비스 호출 실패 (서비스: %s, 유형: %s)"),
  NO_FALLBACK_AVAILABLE("S002", "사용 가능한 폴백 데이터가 없습니다 (서비스: %s, 작업: %s)"),
  FALLBACK_CORRUPT("S003", "폴백 데이터가 손상되었습니다 (키: %s)"),
  FALLBACK_PERSISTENCE_FAILED("S004", "폴백 데이터 저장 실패 (키: %s)");

  private final String code;
  private final String message;
}
