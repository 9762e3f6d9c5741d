package thanos.resilience.infrastructure.pool;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.config.PoolConfig;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.out.ServiceConnector;
import thanos.resilience.error.exception.CallFailedException;
import thanos.resilience.error.exception.CallFailureKind;
import thanos.resilience.error.exception.PoolExhaustedException;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 서비스 1개의 커넥션 풀
 *
 * <h3>정책</h3>
 *
 * <ul>
 *   <li><b>maxTotal</b>: idle + checked-out + 생성 중 커넥션 상한. 초과 시 대기 없이 {@link
 *       PoolExhaustedException}
 *   <li><b>minIdle</b>: 스윕 이후 idle 커넥션을 minIdle까지 보충
 *   <li><b>maxIdle</b>: 마지막 사용 후 maxIdle 이상 지난 idle 커넥션은 스윕에서 종료
 *   <li><b>maxLifetime</b>: 생성 후 수명을 넘긴 커넥션은 반납/대여 시점에 폐기
 *   <li><b>release(healthy=false)</b>: idle로 돌리지 않고 즉시 종료
 * </ul>
 *
 * <h3>동시성</h3>
 *
 * <p>상태 변경은 모두 풀 전용 {@link ReentrantLock} 아래에서 수행합니다. 커넥터 I/O(open, validate, close)는 락 밖에서
 * 실행되며, 생성 중인 커넥션은 {@code pendingCreates}로 슬롯을 선점합니다.
 *
 * @param <C> 커넥터 핸들 타입
 */
@Slf4j
public class ConnectionPool<C> {

  private static final String COMPONENT = "ConnectionPool";

  @Getter private final String serviceName;
  private final PoolConfig config;
  private final ServiceConnector<C> connector;
  private final Clock clock;
  private final CheckedLogicExecutor checkedExecutor;
  private final ObservabilityPublisher publisher;
  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong sequence = new AtomicLong();

  // lock 보호 대상
  private final Deque<PooledConnection<C>> idle = new ArrayDeque<>();
  private final Set<PooledConnection<C>> checkedOut =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private final Set<PooledConnection<C>> validating =
      Collections.newSetFromMap(new IdentityHashMap<>());
  private int pendingCreates;
  private boolean closed;
  private long totalCreated;
  private long totalClosed;
  private long acquisitions;
  private long releases;
  private long exhaustions;
  private long healthChecks;
  private long evictions;
  private long creationFailures;

  public ConnectionPool(
      String serviceName,
      PoolConfig config,
      ServiceConnector<C> connector,
      Clock clock,
      CheckedLogicExecutor checkedExecutor,
      ObservabilityPublisher publisher) {
    this.serviceName = serviceName;
    this.config = config;
    this.connector = connector;
    this.clock = clock;
    this.checkedExecutor = checkedExecutor;
    this.publisher = publisher;
  }

  /**
   * 커넥션 대여 (비차단)
   *
   * @throws PoolExhaustedException maxTotal 도달
   * @throws CallFailedException 새 커넥션 생성 실패 (TRANSIENT)
   */
  public PooledConnection<C> acquire() {
    List<PooledConnection<C>> retired = new ArrayList<>();
    PooledConnection<C> reused = null;
    boolean exhausted = false;
    lock.lock();
    try {
      ensureOpen();
      Instant now = clock.instant();
      while (!idle.isEmpty() && reused == null) {
        PooledConnection<C> candidate = idle.pollFirst();
        if (lifetimeExceeded(candidate, now)) {
          retire(candidate, retired);
        } else {
          candidate.checkOut(now);
          checkedOut.add(candidate);
          acquisitions++;
          reused = candidate;
        }
      }
      if (reused == null) {
        if (totalLocked() >= config.maxTotal()) {
          exhaustions++;
          exhausted = true;
        } else {
          pendingCreates++;
        }
      }
    } finally {
      lock.unlock();
    }

    closeAll(retired);
    if (reused != null) {
      return reused;
    }
    if (exhausted) {
      onExhausted();
    }
    return createCheckedOut();
  }

  /**
   * 커넥션 반납
   *
   * @param connection 이 풀에서 대여한 커넥션
   * @param healthy false면 idle로 돌리지 않고 종료
   * @throws IllegalStateException 대여 중이 아닌 커넥션 (이중 반납 포함)
   */
  public void release(PooledConnection<?> connection, boolean healthy) {
    List<PooledConnection<C>> toClose = new ArrayList<>();
    lock.lock();
    try {
      PooledConnection<C> owned = ownedCheckedOut(connection);
      releases++;
      Instant now = clock.instant();
      if (!healthy || closed || lifetimeExceeded(owned, now)) {
        retire(owned, toClose);
      } else {
        owned.returnIdle(now);
        idle.offerFirst(owned);
      }
    } finally {
      lock.unlock();
    }
    if (!healthy) {
      log.debug("[ConnectionPool] 비정상 커넥션 폐기. service={}, id={}", serviceName, connection.id());
    }
    closeAll(toClose);
  }

  /** maxIdle 이상 사용되지 않은 idle 커넥션을 종료하고 minIdle까지 보충합니다. */
  public int evictIdle() {
    List<PooledConnection<C>> evicted = new ArrayList<>();
    lock.lock();
    try {
      Instant now = clock.instant();
      Iterator<PooledConnection<C>> it = idle.iterator();
      while (it.hasNext()) {
        PooledConnection<C> conn = it.next();
        if (conn.idleLongerThan(config.maxIdle(), now) || lifetimeExceeded(conn, now)) {
          it.remove();
          evictions++;
          retire(conn, evicted);
        }
      }
    } finally {
      lock.unlock();
    }
    if (!evicted.isEmpty()) {
      log.info("[ConnectionPool] 유휴 커넥션 정리. service={}, evicted={}", serviceName, evicted.size());
    }
    closeAll(evicted);
    ensureMinIdle();
    return evicted.size();
  }

  /**
   * idle 커넥션을 한 번에 하나씩 빌려 락 밖에서 검증하고, 비정상 커넥션을 종료합니다.
   *
   * <p>검증 중인 커넥션은 최대 1개이므로 나머지 idle 커넥션은 검증이 느려도 계속 대여할 수 있습니다. 스윕 시작 이후 대여된 커넥션은 건너뜁니다.
   */
  public int healthCheck() {
    List<PooledConnection<C>> targets;
    lock.lock();
    try {
      targets = new ArrayList<>(idle);
    } finally {
      lock.unlock();
    }

    List<PooledConnection<C>> unhealthy = new ArrayList<>();
    for (PooledConnection<C> conn : targets) {
      if (!takeForValidation(conn)) {
        continue;
      }
      boolean healthy = validate(conn);
      lock.lock();
      try {
        validating.remove(conn);
        healthChecks++;
        if (healthy && !closed) {
          idle.offerLast(conn);
        } else {
          retire(conn, unhealthy);
        }
      } finally {
        lock.unlock();
      }
    }
    if (!unhealthy.isEmpty()) {
      log.warn(
          "[ConnectionPool] 헬스 체크 실패 커넥션 종료. service={}, count={}",
          serviceName,
          unhealthy.size());
    }
    closeAll(unhealthy);
    ensureMinIdle();
    return unhealthy.size();
  }

  /** idle 커넥션을 minIdle까지 보충합니다. 생성 실패 시 로그만 남기고 중단합니다. */
  public void ensureMinIdle() {
    while (reserveWarmupSlot()) {
      C handle;
      try {
        handle = open();
      } catch (CallFailedException e) {
        unreserve(true);
        log.warn("[ConnectionPool] minIdle 보충 중 커넥션 생성 실패. service={}", serviceName, e);
        return;
      }
      List<PooledConnection<C>> discarded = new ArrayList<>();
      lock.lock();
      try {
        pendingCreates--;
        PooledConnection<C> conn = newConnection(handle, ConnectionState.IDLE);
        if (closed) {
          retire(conn, discarded);
        } else {
          idle.offerLast(conn);
        }
      } finally {
        lock.unlock();
      }
      closeAll(discarded);
    }
  }

  /** 풀 종료: idle 커넥션은 즉시, 대여 중인 커넥션은 반납 시 종료됩니다. */
  public void close() {
    List<PooledConnection<C>> toClose = new ArrayList<>();
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      while (!idle.isEmpty()) {
        retire(idle.pollFirst(), toClose);
      }
    } finally {
      lock.unlock();
    }
    log.info("[ConnectionPool] 풀 종료. service={}, closedIdle={}", serviceName, toClose.size());
    closeAll(toClose);
  }

  public PoolStats stats() {
    lock.lock();
    try {
      return new PoolStats(
          serviceName,
          idle.size() + validating.size(),
          checkedOut.size(),
          config.maxTotal(),
          totalCreated,
          totalClosed,
          acquisitions,
          releases,
          exhaustions,
          healthChecks,
          evictions,
          creationFailures);
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  // ========================================
  // Private Helpers
  // ========================================

  private PooledConnection<C> createCheckedOut() {
    C handle;
    try {
      handle = open();
    } catch (RuntimeException e) {
      unreserve(true);
      throw e;
    }
    lock.lock();
    try {
      pendingCreates--;
      PooledConnection<C> conn = newConnection(handle, ConnectionState.CHECKED_OUT);
      conn.checkOut(conn.getCreatedAt());
      checkedOut.add(conn);
      acquisitions++;
      return conn;
    } finally {
      lock.unlock();
    }
  }

  private C open() {
    TaskContext context = TaskContext.of(COMPONENT, "Connect", serviceName);
    try {
      return checkedExecutor.execute(() -> connector.connect(serviceName), context);
    } catch (Exception e) {
      log.warn("[ConnectionPool] 커넥션 생성 실패. service={}", serviceName, e);
      throw new CallFailedException(serviceName, CallFailureKind.TRANSIENT, e);
    }
  }

  /** 아직 idle에 남아 있으면 검증 대상으로 옮김. 그 사이 대여되었거나 풀이 닫혔으면 false */
  private boolean takeForValidation(PooledConnection<C> conn) {
    lock.lock();
    try {
      if (closed || !idle.remove(conn)) {
        return false;
      }
      validating.add(conn);
      return true;
    } finally {
      lock.unlock();
    }
  }

  private boolean validate(PooledConnection<C> conn) {
    return Boolean.TRUE.equals(
        checkedExecutor.executeOrDefault(
            () -> connector.validate(conn.rawHandle()),
            Boolean.FALSE,
            TaskContext.of(COMPONENT, "Validate", conn.id())));
  }

  private void onExhausted() {
    log.warn(
        "[ConnectionPool] 풀 고갈로 대여 거절. service={}, maxTotal={}",
        serviceName,
        config.maxTotal());
    publisher.publish(
        new ObservabilityEvent(
            ObservabilityEventType.POOL_EXHAUSTED,
            serviceName,
            clock.instant(),
            Map.of("maxTotal", config.maxTotal())));
    throw new PoolExhaustedException(serviceName, config.maxTotal());
  }

  private boolean reserveWarmupSlot() {
    lock.lock();
    try {
      if (closed
          || idle.size() + pendingCreates >= config.minIdle()
          || totalLocked() >= config.maxTotal()) {
        return false;
      }
      pendingCreates++;
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void unreserve(boolean failed) {
    lock.lock();
    try {
      pendingCreates--;
      if (failed) {
        creationFailures++;
      }
    } finally {
      lock.unlock();
    }
  }

  @SuppressWarnings("unchecked")
  private PooledConnection<C> ownedCheckedOut(PooledConnection<?> connection) {
    if (!checkedOut.remove(connection)) {
      throw new IllegalStateException(
          "connection is not checked out from pool " + serviceName + ": " + connection);
    }
    return (PooledConnection<C>) connection;
  }

  /** lock 보유 상태에서만 호출 */
  private PooledConnection<C> newConnection(C handle, ConnectionState state) {
    totalCreated++;
    String id = serviceName + "-" + sequence.incrementAndGet();
    return new PooledConnection<>(id, serviceName, handle, clock.instant(), state);
  }

  /** lock 보유 상태에서만 호출 */
  private void retire(PooledConnection<C> conn, List<PooledConnection<C>> toClose) {
    conn.markClosed();
    totalClosed++;
    toClose.add(conn);
  }

  private boolean lifetimeExceeded(PooledConnection<C> conn, Instant now) {
    return config.hasMaxLifetime() && conn.olderThan(config.maxLifetime(), now);
  }

  /** lock 보유 상태에서만 호출 */
  private int totalLocked() {
    return idle.size() + checkedOut.size() + validating.size() + pendingCreates;
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("connection pool is closed: " + serviceName);
    }
  }

  private void closeAll(List<PooledConnection<C>> connections) {
    for (PooledConnection<C> conn : connections) {
      checkedExecutor.executeOrLog(
          () -> connector.close(conn.rawHandle()), TaskContext.of(COMPONENT, "Close", conn.id()));
    }
  }
}
