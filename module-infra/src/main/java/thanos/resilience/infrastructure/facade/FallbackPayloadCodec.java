package thanos.resilience.infrastructure.facade;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.ClassUtil;
import java.lang.reflect.Type;
import lombok.RequiredArgsConstructor;
import thanos.resilience.error.exception.FallbackCorruptException;
import thanos.resilience.error.exception.FallbackPersistenceException;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;

/** 결과 값 ↔ 폴백 JSON payload 변환, 결과 캐시 값의 요청 타입 검사 */
@RequiredArgsConstructor
public class FallbackPayloadCodec {

  private final ObjectMapper objectMapper;
  private final CheckedLogicExecutor checkedExecutor;

  /** @throws FallbackPersistenceException 직렬화 불가 값 */
  public byte[] encode(String key, Object value) {
    return checkedExecutor.executeUnchecked(
        () -> objectMapper.writeValueAsBytes(value),
        TaskContext.of("FallbackCodec", "Encode", key),
        e -> new FallbackPersistenceException(key, e));
  }

  /** @throws FallbackCorruptException payload가 요청 타입으로 역직렬화되지 않는 경우 */
  public <T> T decode(String key, byte[] payload, Type resultType) {
    JavaType javaType = objectMapper.getTypeFactory().constructType(resultType);
    return checkedExecutor.executeUnchecked(
        () -> objectMapper.readValue(payload, javaType),
        TaskContext.of("FallbackCodec", "Decode", key),
        e -> new FallbackCorruptException(key, e));
  }

  /** 캐시된 값이 요청 타입(원시 타입은 래퍼로 비교)의 인스턴스인지. null은 어떤 참조 타입에도 맞음 */
  public boolean isInstance(Object value, Type resultType) {
    if (value == null) {
      return true;
    }
    Class<?> raw = objectMapper.getTypeFactory().constructType(resultType).getRawClass();
    if (raw.isPrimitive()) {
      raw = ClassUtil.wrapperType(raw);
    }
    return raw.isInstance(value);
  }
}
