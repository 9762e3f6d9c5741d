package thanos.resilience.infrastructure.facade;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;
import thanos.resilience.error.exception.CallFailedException;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.error.exception.marker.CircuitBreakerIgnoreMarker;
import thanos.resilience.infrastructure.util.ExceptionUtils;
import thanos.resilience.infrastructure.util.InterruptUtils;

/**
 * fetch 예외 분류기
 *
 * <h4>분류 규칙</h4>
 *
 * <ul>
 *   <li><b>호출자 오류</b>: {@link CircuitBreakerIgnoreMarker} 구현 예외(예: {@code
 *       InvalidCallArgumentException}) → 브레이커 미기록, 그대로 전파
 *   <li><b>{@link CallFailedException}</b>: 어댑터가 지정한 유형 유지
 *   <li><b>TIMEOUT</b>: {@link TimeoutException}, {@link InterruptedIOException}, {@link
 *       InterruptedException}
 *   <li><b>TRANSIENT</b>: 기타 {@link IOException}, {@link UncheckedIOException}으로 감싼 것 포함
 *   <li><b>PERMANENT</b>: 그 외 모든 예외. 어댑터 내부에서 난 {@link IllegalArgumentException}, {@link
 *       NumberFormatException}도 다운스트림 응답 문제로 보고 여기에 포함
 * </ul>
 */
public class FailureClassifier {

  public boolean isProgrammingError(Throwable failure) {
    Throwable root = ExceptionUtils.unwrap(failure);
    return root instanceof CircuitBreakerIgnoreMarker;
  }

  public CallFailureKind classify(Throwable failure) {
    Throwable root = ExceptionUtils.unwrap(failure);
    if (root instanceof UncheckedIOException unchecked) {
      root = unchecked.getCause();
    }
    InterruptUtils.restoreInterruptIfNeeded(root);
    if (root instanceof CallFailedException callFailed) {
      return callFailed.getKind();
    }
    if (root instanceof TimeoutException
        || root instanceof InterruptedIOException
        || root instanceof InterruptedException) {
      return CallFailureKind.TIMEOUT;
    }
    if (root instanceof IOException) {
      return CallFailureKind.TRANSIENT;
    }
    return CallFailureKind.PERMANENT;
  }
}
