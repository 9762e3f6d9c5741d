package thanos.resilience.infrastructure.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.out.ObservabilitySink;

/** 수신한 이벤트를 그대로 보관하는 테스트용 싱크 */
public class RecordingSink implements ObservabilitySink {

  private final List<ObservabilityEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void accept(ObservabilityEvent event) {
    events.add(event);
  }

  public List<ObservabilityEvent> events() {
    return List.copyOf(events);
  }

  public List<ObservabilityEvent> ofType(ObservabilityEventType type) {
    return events.stream().filter(e -> e.type() == type).collect(Collectors.toList());
  }

  public void clear() {
    events.clear();
  }
}
