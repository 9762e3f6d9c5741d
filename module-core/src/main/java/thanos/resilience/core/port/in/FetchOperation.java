package thanos.resilience.core.port.in;

/**
 * The live call to an external service, supplied by an adapter.
 *
 * <p>Throw {@code CallFailedException} to classify a failure explicitly. Any other exception is
 * classified by the access layer. Caller-side programming errors ({@code IllegalArgumentException}
 * or {@code InvalidCallArgumentException}) propagate without touching the circuit.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface FetchOperation<T> {

  T fetch(ConnectionLease connection) throws Exception;
}
