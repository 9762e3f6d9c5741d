package thanos.resilience.infrastructure.throttle;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

/** 승인된 호출 1건의 동시성 슬롯. release는 멱등입니다. */
public final class ThrottleToken {

  @Getter private final String serviceName;
  private final Semaphore concurrency;
  private final AtomicBoolean released = new AtomicBoolean();

  ThrottleToken(String serviceName, Semaphore concurrency) {
    this.serviceName = serviceName;
    this.concurrency = concurrency;
  }

  /** @return 이번 호출로 실제 반납되었으면 true */
  public boolean release() {
    if (released.compareAndSet(false, true)) {
      concurrency.release();
      return true;
    }
    return false;
  }

  public boolean isReleased() {
    return released.get();
  }
}
