package thanos.resilience.infrastructure.config;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import thanos.resilience.core.domain.config.ServiceConfig;
import thanos.resilience.error.exception.InvalidServiceConfigurationException;

/** 서비스명 → 검증된 {@link ServiceConfig} 조회. 생성 이후 불변입니다. */
public class ServiceConfigRegistry {

  private final Map<String, ServiceConfig> configs;

  public ServiceConfigRegistry(Collection<ServiceConfig> serviceConfigs) {
    Map<String, ServiceConfig> byName = new LinkedHashMap<>();
    for (ServiceConfig config : serviceConfigs) {
      if (byName.putIfAbsent(config.serviceName(), config) != null) {
        throw new InvalidServiceConfigurationException(config.serviceName(), "duplicate service");
      }
    }
    this.configs = Collections.unmodifiableMap(byName);
  }

  /**
   * 서비스 설정 조회
   *
   * @throws InvalidServiceConfigurationException 설정되지 않은 서비스 (호출자 프로그래밍 오류)
   */
  public ServiceConfig get(String serviceName) {
    ServiceConfig config = configs.get(serviceName);
    if (config == null) {
      throw new InvalidServiceConfigurationException(serviceName, "unknown service");
    }
    return config;
  }

  public boolean contains(String serviceName) {
    return configs.containsKey(serviceName);
  }

  public Set<String> serviceNames() {
    return configs.keySet();
  }

  public Collection<ServiceConfig> all() {
    return configs.values();
  }
}
