package thanos.resilience.infrastructure.pool;

/** 풀 커넥션 상태. IDLE과 CHECKED_OUT은 동시에 성립하지 않습니다. */
public enum ConnectionState {
  IDLE,
  CHECKED_OUT,
  CLOSED
}
