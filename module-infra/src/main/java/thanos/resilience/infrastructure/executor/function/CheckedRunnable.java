package thanos.resilience.infrastructure.executor.function;

/** Exception을 던질 수 있는 void 작업 (IO 경계 전용) */
@FunctionalInterface
public interface CheckedRunnable {

  void run() throws Exception;
}
