package thanos.resilience.infrastructure.fallback;

/**
 * 폴백 파일의 JSON 스키마. payload는 Jackson 기본 규칙에 따라 base64로 기록됩니다.
 *
 * @param key 원본 폴백 키 (파일명은 키의 SHA-256)
 * @param createdAtEpochMillis 성공 호출 시각
 * @param ttlSeconds 신선도 기준
 * @param payload 직렬화된 결과 값
 */
public record FallbackDocument(
    String key, Long createdAtEpochMillis, Long ttlSeconds, byte[] payload) {

  boolean isComplete() {
    return key != null && createdAtEpochMillis != null && ttlSeconds != null && payload != null;
  }
}
