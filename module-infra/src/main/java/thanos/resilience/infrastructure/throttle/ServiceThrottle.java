package thanos.resilience.infrastructure.throttle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.ReentrantLock;
import thanos.resilience.core.domain.config.ThrottleConfig;

/**
 * 서비스 1개의 슬라이딩 윈도우 + 동시성 제한
 *
 * <p>1초/60초 윈도우는 승인된 호출의 타임스탬프 로그로 관리하며, 매 판정마다 윈도우 밖 기록을 제거합니다. 거절된 시도는 윈도우 예산을 소비하지
 * 않습니다.
 */
class ServiceThrottle {

  private static final long SECOND_MILLIS = 1_000L;
  private static final long MINUTE_MILLIS = 60_000L;

  private final String serviceName;
  private final ThrottleConfig config;
  private final Semaphore concurrency;
  private final ReentrantLock lock = new ReentrantLock();

  // lock 보호 대상
  private final Deque<Long> lastSecond = new ArrayDeque<>();
  private final Deque<Long> lastMinute = new ArrayDeque<>();
  private long admitted;
  private long rejected;

  ServiceThrottle(String serviceName, ThrottleConfig config) {
    this.serviceName = serviceName;
    this.config = config;
    this.concurrency = new Semaphore(config.maxConcurrent());
  }

  /** 비차단 승인 시도. 승인된 경우에만 윈도우에 기록합니다. */
  ThrottleResult tryAcquire(long nowMillis) {
    lock.lock();
    try {
      prune(nowMillis);
      ThrottleResult result;
      if (lastSecond.size() >= config.maxPerSecond()) {
        result =
            ThrottleResult.rejected(
                "maxPerSecond=" + config.maxPerSecond(),
                SECOND_MILLIS - (nowMillis - lastSecond.peekFirst()));
      } else if (lastMinute.size() >= config.maxPerMinute()) {
        result =
            ThrottleResult.rejected(
                "maxPerMinute=" + config.maxPerMinute(),
                MINUTE_MILLIS - (nowMillis - lastMinute.peekFirst()));
      } else if (!concurrency.tryAcquire()) {
        result = ThrottleResult.rejected("maxConcurrent=" + config.maxConcurrent(), 0L);
      } else {
        lastSecond.addLast(nowMillis);
        lastMinute.addLast(nowMillis);
        admitted++;
        return ThrottleResult.admitted(new ThrottleToken(serviceName, concurrency));
      }
      rejected++;
      return result;
    } finally {
      lock.unlock();
    }
  }

  ThrottleStats stats(long nowMillis) {
    lock.lock();
    try {
      prune(nowMillis);
      return new ThrottleStats(
          serviceName,
          config.maxConcurrent() - concurrency.availablePermits(),
          config.maxConcurrent(),
          lastSecond.size(),
          lastMinute.size(),
          admitted,
          rejected);
    } finally {
      lock.unlock();
    }
  }

  private void prune(long nowMillis) {
    while (!lastSecond.isEmpty() && nowMillis - lastSecond.peekFirst() >= SECOND_MILLIS) {
      lastSecond.pollFirst();
    }
    while (!lastMinute.isEmpty() && nowMillis - lastMinute.peekFirst() >= MINUTE_MILLIS) {
      lastMinute.pollFirst();
    }
  }
}
