package thanos.resilience.core.port.out;

import thanos.resilience.core.domain.model.ObservabilityEvent;

/**
 * Port receiving structured events from the access layer.
 *
 * <p>Delivery is best-effort and asynchronous; an implementation that throws only loses its own
 * event.
 */
@FunctionalInterface
public interface ObservabilitySink {

  void accept(ObservabilityEvent event);
}
