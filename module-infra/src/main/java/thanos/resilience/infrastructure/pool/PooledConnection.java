package thanos.resilience.infrastructure.pool;

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;
import thanos.resilience.core.port.in.ConnectionLease;

/**
 * 풀이 관리하는 커넥션 1개
 *
 * <p>state, lastUsedAt, useCount는 소유 풀의 락 아래에서만 변경됩니다.
 *
 * @param <C> 커넥터 핸들 타입
 */
public class PooledConnection<C> implements ConnectionLease {

  private final String id;
  private final String serviceName;
  private final C handle;
  @Getter private final Instant createdAt;
  @Getter private volatile Instant lastUsedAt;
  @Getter private volatile int useCount;
  @Getter private volatile ConnectionState state;

  PooledConnection(
      String id, String serviceName, C handle, Instant createdAt, ConnectionState state) {
    this.id = id;
    this.serviceName = serviceName;
    this.handle = handle;
    this.createdAt = createdAt;
    this.lastUsedAt = createdAt;
    this.state = state;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String serviceName() {
    return serviceName;
  }

  @Override
  public <T> T handle(Class<T> type) {
    if (!type.isInstance(handle)) {
      throw new IllegalArgumentException(
          "connection " + id + " holds " + handle.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(handle);
  }

  C rawHandle() {
    return handle;
  }

  void checkOut(Instant now) {
    state = ConnectionState.CHECKED_OUT;
    lastUsedAt = now;
    useCount++;
  }

  void returnIdle(Instant now) {
    state = ConnectionState.IDLE;
    lastUsedAt = now;
  }

  void markClosed() {
    state = ConnectionState.CLOSED;
  }

  boolean idleLongerThan(Duration maxIdle, Instant now) {
    return Duration.between(lastUsedAt, now).compareTo(maxIdle) >= 0;
  }

  boolean olderThan(Duration maxLifetime, Instant now) {
    return Duration.between(createdAt, now).compareTo(maxLifetime) >= 0;
  }

  @Override
  public String toString() {
    return "PooledConnection[" + id + ", " + state + "]";
  }
}
