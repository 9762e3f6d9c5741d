package thanos.resilience.core.domain.config;

/**
 * Rate and concurrency limits for one service. Validated by {@link ServiceConfig}.
 *
 * @param maxPerSecond admitted calls in any sliding 1 second window
 * @param maxPerMinute admitted calls in any sliding 60 second window
 * @param maxConcurrent calls in flight at once
 */
public record ThrottleConfig(int maxPerSecond, int maxPerMinute, int maxConcurrent) {}
