package thanos.resilience.core.port.in;

/** Connection lent to a fetch operation for the duration of one call. */
public interface ConnectionLease {

  String id();

  String serviceName();

  /**
   * Typed access to the underlying handle.
   *
   * @throws IllegalArgumentException when the handle is not of the requested type
   */
  <C> C handle(Class<C> type);
}
