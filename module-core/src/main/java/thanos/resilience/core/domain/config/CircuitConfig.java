package thanos.resilience.core.domain.config;

import java.time.Duration;

/**
 * Circuit breaker thresholds for one service. Validated by {@link ServiceConfig}.
 *
 * @param failureThreshold consecutive failures in CLOSED that open the circuit
 * @param recoveryTimeout minimum time OPEN before a probe is admitted
 * @param halfOpenMaxCalls concurrent probes admitted in HALF_OPEN
 * @param successThreshold probe successes needed to close the circuit
 */
public record CircuitConfig(
    int failureThreshold, Duration recoveryTimeout, int halfOpenMaxCalls, int successThreshold) {}
