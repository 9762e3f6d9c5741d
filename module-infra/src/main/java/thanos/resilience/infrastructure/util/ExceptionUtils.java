package thanos.resilience.infrastructure.util;

import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** fetch 실패 분류 전에 비동기/프록시 래퍼를 벗겨내는 유틸리티 */
public final class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * 래퍼 예외를 벗겨 실제 fetch 실패를 반환합니다.
   *
   * <p>대상: {@link CompletionException}, {@link ExecutionException}, {@link
   * UndeclaredThrowableException}. cause가 없는 래퍼는 그대로 반환합니다.
   */
  public static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while (isWrapper(current)) {
      Throwable cause = current.getCause();
      if (cause == null || cause == current) {
        return current;
      }
      current = cause;
    }
    return current;
  }

  private static boolean isWrapper(Throwable t) {
    return t instanceof CompletionException
        || t instanceof ExecutionException
        || t instanceof UndeclaredThrowableException;
  }
}
