package thanos.resilience.infrastructure.util;

import java.io.InterruptedIOException;

/**
 * 인터럽트 복원 유틸리티
 *
 * <p>예외 그래프(cause chain + suppressed)에서 InterruptedException 또는 InterruptedIOException이 발견되면 현재
 * 스레드의 interrupt 플래그를 복원합니다. 데드라인 초과로 취소된 fetch가 인터럽트 신호를 잃지 않도록 executor와 실패 분류기가 함께 사용합니다.
 */
public final class InterruptUtils {

  /** Throwable 그래프 순회 최대 깊이 (순환 참조 방지) */
  private static final int MAX_GRAPH_DEPTH = 32;

  private InterruptUtils() {}

  public static void restoreInterruptIfNeeded(Throwable t) {
    if (isInterruption(t)) {
      Thread.currentThread().interrupt();
    }
  }

  /** cause chain 또는 suppressed 중 하나라도 인터럽트 계열이면 true */
  public static boolean isInterruption(Throwable t) {
    return t != null && containsInterrupted(t, 0);
  }

  private static boolean containsInterrupted(Throwable t, int depth) {
    if (t == null || depth >= MAX_GRAPH_DEPTH) return false;
    if (t instanceof InterruptedException || t instanceof InterruptedIOException) return true;

    for (Throwable s : t.getSuppressed()) {
      if (containsInterrupted(s, depth + 1)) return true;
    }
    return containsInterrupted(t.getCause(), depth + 1);
  }
}
