package thanos.resilience.core.domain.config;

import java.time.Duration;

/**
 * Connection pool limits for one service. Validated by {@link ServiceConfig}.
 *
 * @param minIdle idle connections kept open by the sweeper
 * @param maxTotal upper bound on idle plus checked-out connections
 * @param maxIdle idle time after which a connection is evicted
 * @param healthCheckInterval period of the idle health sweep
 * @param maxLifetime age after which a connection is retired, {@link Duration#ZERO} for unbounded
 */
public record PoolConfig(
    int minIdle, int maxTotal, Duration maxIdle, Duration healthCheckInterval, Duration maxLifetime) {

  public boolean hasMaxLifetime() {
    return maxLifetime != null && !maxLifetime.isZero();
  }
}
