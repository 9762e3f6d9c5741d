package thanos.resilience.infrastructure.pool;

import java.util.Objects;
import thanos.resilience.core.port.out.ServiceConnector;

/**
 * 특정 서비스 전용 커넥터 등록 단위
 *
 * <p>빈으로 등록하면 해당 서비스의 풀이 이 커넥터로 연결을 생성합니다. 등록되지 않은 서비스는 {@link StatelessConnector}를
 * 사용합니다.
 *
 * @param serviceName 대상 서비스
 * @param connector 연결 생성/검증/종료 구현
 */
public record NamedServiceConnector(String serviceName, ServiceConnector<?> connector) {

  public NamedServiceConnector {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(connector, "connector");
  }
}
