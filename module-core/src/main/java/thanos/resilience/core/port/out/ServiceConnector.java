package thanos.resilience.core.port.out;

/**
 * Port for opening, probing and closing long-lived connections to one external service.
 *
 * @param <C> connection handle type (HTTP client session, MCP session, socket, ...)
 */
public interface ServiceConnector<C> {

  /** Open a new connection. Any exception is treated as a transient downstream failure. */
  C connect(String serviceName) throws Exception;

  /** Cheap liveness probe of an idle connection. Returning false or throwing marks it unhealthy. */
  boolean validate(C connection) throws Exception;

  /** Close a connection. Failures are logged and ignored by the pool. */
  void close(C connection) throws Exception;
}
