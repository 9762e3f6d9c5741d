package thanos.resilience.error.exception.marker;

/** 서킷 브레이커가 실패로 집계해야 하는 다운스트림 장애 예외 표식 */
public interface CircuitBreakerRecordMarker {}
