package thanos.resilience.infrastructure.executor.function;

/**
 * Exception을 던질 수 있는 Supplier (IO 경계 전용)
 *
 * <p>{@link thanos.resilience.infrastructure.executor.CheckedLogicExecutor}와 함께 사용하여 파일 I/O, 커넥터
 * 호출처럼 checked 예외를 던지는 람다를 받습니다.
 *
 * @param <T> 반환 타입
 */
@FunctionalInterface
public interface CheckedSupplier<T> {

  T get() throws Exception;
}
