package thanos.resilience.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.out.ObservabilitySink;

/**
 * Micrometer 메트릭 싱크
 *
 * <ul>
 *   <li>{@code resilience.events{event, service}}: 이벤트 유형별 카운터
 *   <li>{@code resilience.call{service, outcome}}: 호출 지연 Timer (CALL_COMPLETED 전용)
 * </ul>
 */
@RequiredArgsConstructor
public class MicrometerObservabilitySink implements ObservabilitySink {

  static final String EVENT_COUNTER = "resilience.events";
  static final String CALL_TIMER = "resilience.call";

  private final MeterRegistry meterRegistry;

  @Override
  public void accept(ObservabilityEvent event) {
    Counter.builder(EVENT_COUNTER)
        .tag("event", event.type().name())
        .tag("service", event.serviceName())
        .register(meterRegistry)
        .increment();

    if (event.type() == ObservabilityEventType.CALL_COMPLETED
        && event.field("latencyMs") instanceof Long latencyMs) {
      Timer.builder(CALL_TIMER)
          .tag("service", event.serviceName())
          .tag("outcome", String.valueOf(event.field("outcome")))
          .register(meterRegistry)
          .record(Duration.ofMillis(latencyMs));
    }
  }
}
