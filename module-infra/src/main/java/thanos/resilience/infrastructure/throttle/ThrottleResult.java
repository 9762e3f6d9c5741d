package thanos.resilience.infrastructure.throttle;

/**
 * 스로틀 승인 판정 결과 (Immutable Record)
 *
 * <h4>사용 예시</h4>
 *
 * <pre>{@code
 * ThrottleResult result = throttler.tryAcquire("docs");
 * if (!result.isAdmitted()) {
 *     throw new ThrottledException("docs", result.violatedLimit());
 * }
 * }</pre>
 *
 * @param token 승인 시 동시성 슬롯, 거절 시 null
 * @param violatedLimit 거절 시 위반한 한도 (예: "maxPerSecond=5")
 * @param retryAfterMillis 윈도우 한도 위반 시 다음 슬롯까지 남은 시간, 동시성 위반이면 0
 */
public record ThrottleResult(ThrottleToken token, String violatedLimit, long retryAfterMillis) {

  public static ThrottleResult admitted(ThrottleToken token) {
    return new ThrottleResult(token, null, 0L);
  }

  public static ThrottleResult rejected(String violatedLimit, long retryAfterMillis) {
    return new ThrottleResult(null, violatedLimit, retryAfterMillis);
  }

  public boolean isAdmitted() {
    return token != null;
  }
}
