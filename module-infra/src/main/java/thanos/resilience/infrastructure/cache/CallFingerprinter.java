package thanos.resilience.infrastructure.cache;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;
import thanos.resilience.core.domain.model.CallRequest;
import thanos.resilience.error.exception.InvalidCallArgumentException;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;

/**
 * 호출 인자의 결정적 지문 생성
 *
 * <p>맵 엔트리는 키 순, 객체 프로퍼티는 알파벳 순으로 직렬화한 JSON의 SHA-256을 사용합니다. 삽입 순서나 실행 환경과 무관하게 같은 인자는 항상 같은
 * 지문을 가집니다.
 */
public class CallFingerprinter {

  private final ObjectMapper canonicalMapper;
  private final CheckedLogicExecutor checkedExecutor;

  public CallFingerprinter(ObjectMapper objectMapper, CheckedLogicExecutor checkedExecutor) {
    this.canonicalMapper = canonicalMapperFrom(objectMapper);
    this.checkedExecutor = checkedExecutor;
  }

  /**
   * 정렬 옵션을 켠 별도 매퍼. 호출자의 매퍼는 변경하지 않습니다.
   *
   * <p>{@link JsonMapper}면 rebuild()로 등록된 모듈과 설정을 그대로 이어받고, 일반 {@link ObjectMapper}면 클래스패스의 모듈을
   * 찾아 등록합니다.
   */
  static ObjectMapper canonicalMapperFrom(ObjectMapper objectMapper) {
    JsonMapper.Builder builder =
        objectMapper instanceof JsonMapper jsonMapper
            ? jsonMapper.rebuild()
            : JsonMapper.builder().findAndAddModules();
    return builder
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .build();
  }

  /**
   * @throws InvalidCallArgumentException 인자를 JSON으로 직렬화할 수 없는 경우 (호출자 오류)
   */
  public CallFingerprint fingerprint(CallRequest<?> request) {
    return new CallFingerprint(
        request.serviceName(), request.operationName(), hashArgs(request.args()));
  }

  public String hashArgs(Map<String, Object> args) {
    return checkedExecutor.executeUnchecked(
        () -> {
          byte[] canonical = canonicalMapper.writeValueAsBytes(args);
          MessageDigest digest = MessageDigest.getInstance("SHA-256");
          return HexFormat.of().formatHex(digest.digest(canonical));
        },
        TaskContext.of("ResultCache", "Fingerprint"),
        e ->
            new InvalidCallArgumentException(
                "args are not JSON-serializable: " + e.getMessage(), e));
  }
}
