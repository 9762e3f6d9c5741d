package thanos.resilience.infrastructure.pool;

import thanos.resilience.core.port.out.ServiceConnector;

/**
 * 커넥터가 등록되지 않은 서비스용 기본 커넥터
 *
 * <p>HTTP 클라이언트처럼 자체적으로 연결을 관리하는 어댑터는 풀 슬롯만 동시성 한도로 사용합니다.
 */
public class StatelessConnector implements ServiceConnector<StatelessConnector.Handle> {

  /** 서비스명만 가진 무상태 핸들 */
  public record Handle(String serviceName) {}

  @Override
  public Handle connect(String serviceName) {
    return new Handle(serviceName);
  }

  @Override
  public boolean validate(Handle connection) {
    return true;
  }

  @Override
  public void close(Handle connection) {}
}
