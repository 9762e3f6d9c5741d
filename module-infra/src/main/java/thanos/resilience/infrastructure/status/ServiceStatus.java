package thanos.resilience.infrastructure.status;

import thanos.resilience.core.domain.model.CircuitSnapshot;
import thanos.resilience.infrastructure.pool.PoolStats;
import thanos.resilience.infrastructure.throttle.ThrottleStats;

/**
 * 서비스 1건의 운영 상태
 *
 * @param serviceName 서비스 이름
 * @param circuit 서킷 스냅샷
 * @param pool 풀 통계, 아직 풀이 생성되지 않았으면 null
 * @param throttle 스로틀 통계
 */
public record ServiceStatus(
    String serviceName, CircuitSnapshot circuit, PoolStats pool, ThrottleStats throttle) {}
