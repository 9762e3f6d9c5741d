package thanos.resilience.infrastructure.pool;

/** 풀 1개의 시점 통계 */
public record PoolStats(
    String serviceName,
    int idle,
    int checkedOut,
    int maxTotal,
    long totalCreated,
    long totalClosed,
    long acquisitions,
    long releases,
    long exhaustions,
    long healthChecks,
    long evictions,
    long creationFailures) {

  public int total() {
    return idle + checkedOut;
  }
}
