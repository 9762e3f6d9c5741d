package thanos.resilience.infrastructure.cache;

import java.util.Objects;

/**
 * (서비스, 작업, 인자 해시) 캐시 키
 *
 * @param serviceName 서비스명
 * @param operationName 작업명
 * @param argsHash 정규화된 인자 JSON의 SHA-256 hex
 */
public record CallFingerprint(String serviceName, String operationName, String argsHash) {

  public CallFingerprint {
    Objects.requireNonNull(serviceName, "serviceName");
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(argsHash, "argsHash");
  }

  /** 폴백 저장소 키: "service:operation:argsHash" */
  public String key() {
    return serviceName + ":" + operationName + ":" + argsHash;
  }

  @Override
  public String toString() {
    return key();
  }
}
