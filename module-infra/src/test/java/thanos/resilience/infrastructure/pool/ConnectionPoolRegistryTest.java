package thanos.resilience.infrastructure.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import thanos.resilience.core.domain.config.PoolConfig;
import thanos.resilience.core.domain.config.ServiceConfig;
import thanos.resilience.infrastructure.config.ServiceConfigRegistry;
import thanos.resilience.infrastructure.support.FakeConnector;
import thanos.resilience.infrastructure.support.RecordingSink;
import thanos.resilience.infrastructure.support.TestFixtures;

@DisplayName("ConnectionPoolRegistry 백그라운드 유지 보수")
class ConnectionPoolRegistryTest {

  private ScheduledExecutorService sweeper;
  private FakeConnector docsConnector;
  private ConnectionPoolRegistry registry;

  @BeforeEach
  void setUp() {
    sweeper = Executors.newSingleThreadScheduledExecutor();
    docsConnector = new FakeConnector();
    ServiceConfig docs =
        TestFixtures.service(
            "docs",
            TestFixtures.circuit(3, 60),
            new PoolConfig(
                2, 4, Duration.ofSeconds(300), Duration.ofMillis(100), Duration.ZERO),
            TestFixtures.throttle(100, 1_000, 10),
            Duration.ofSeconds(60));
    registry =
        new ConnectionPoolRegistry(
            new ServiceConfigRegistry(List.of(docs, TestFixtures.service("search"))),
            Map.of("docs", docsConnector),
            new StatelessConnector(),
            Clock.systemUTC(),
            TestFixtures.checkedExecutor(),
            TestFixtures.syncPublisher(new RecordingSink()),
            sweeper);
  }

  @AfterEach
  void tearDown() {
    registry.closeAll();
    sweeper.shutdownNow();
  }

  @Test
  @DisplayName("풀 생성 시 minIdle 워밍업이 백그라운드에서 수행")
  void warmsUpInBackground() {
    registry.forService("docs");

    await()
        .atMost(Duration.ofSeconds(5))
        .untilAsserted(() -> assertThat(registry.stats().get("docs").idle()).isEqualTo(2));
  }

  @Test
  @DisplayName("주기적 헬스 체크가 비정상 idle 커넥션을 교체")
  void periodicHealthCheckReplacesUnhealthy() {
    ConnectionPool<?> pool = registry.forService("docs");
    await()
        .atMost(Duration.ofSeconds(5))
        .until(() -> pool.stats().idle() == 2);

    PooledConnection<?> conn = pool.acquire();
    pool.release(conn, true);
    docsConnector.markUnhealthy(conn.handle(FakeConnector.Handle.class));

    await()
        .atMost(Duration.ofSeconds(5))
        .untilAsserted(
            () -> {
              assertThat(conn.getState()).isEqualTo(ConnectionState.CLOSED);
              assertThat(pool.stats().idle()).isEqualTo(2);
            });
  }

  @Test
  @DisplayName("등록되지 않은 서비스는 기본 커넥터 사용")
  void fallsBackToDefaultConnector() {
    PooledConnection<?> conn = registry.forService("search").acquire();

    assertThat(conn.handle(StatelessConnector.Handle.class).serviceName()).isEqualTo("search");
  }

  @Test
  @DisplayName("closeAll은 모든 풀을 닫음")
  void closeAllClosesPools() {
    ConnectionPool<?> docs = registry.forService("docs");
    ConnectionPool<?> search = registry.forService("search");

    registry.closeAll();

    assertThat(docs.isClosed()).isTrue();
    assertThat(search.isClosed()).isTrue();
  }
}
