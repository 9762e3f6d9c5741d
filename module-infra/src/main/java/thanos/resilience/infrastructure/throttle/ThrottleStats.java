package thanos.resilience.infrastructure.throttle;

/** 서비스 1개의 스로틀 현황 */
public record ThrottleStats(
    String serviceName,
    int inFlight,
    int maxConcurrent,
    int callsLastSecond,
    int callsLastMinute,
    long admitted,
    long rejected) {}
