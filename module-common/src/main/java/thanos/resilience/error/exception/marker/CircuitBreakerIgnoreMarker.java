package thanos.resilience.error.exception.marker;

/**
 * 서킷 브레이커가 실패로 집계하지 않아야 하는 예외 표식
 *
 * <p>로컬 거절(차단, 스로틀, 풀 고갈)과 호출자 프로그래밍 오류가 여기에 해당합니다.
 */
public interface CircuitBreakerIgnoreMarker {}
