package thanos.resilience.infrastructure.fallback;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import thanos.resilience.core.domain.model.FallbackEntry;
import thanos.resilience.core.domain.model.FallbackLookup;
import thanos.resilience.core.domain.model.ObservabilityEvent;
import thanos.resilience.core.domain.model.ObservabilityEventType;
import thanos.resilience.core.port.out.FallbackStore;
import thanos.resilience.error.exception.FallbackCorruptException;
import thanos.resilience.error.exception.FallbackPersistenceException;
import thanos.resilience.infrastructure.executor.CheckedLogicExecutor;
import thanos.resilience.infrastructure.executor.TaskContext;
import thanos.resilience.infrastructure.observability.ObservabilityPublisher;

/**
 * 로컬 디스크 기반 폴백 저장소 (L2)
 *
 * <h3>저장 형식</h3>
 *
 * <ul>
 *   <li>키 1개 = JSON 문서 1개, 파일명은 키의 SHA-256 hex + ".json"
 *   <li>쓰기는 같은 디렉터리의 임시 파일에 기록 후 원자적 rename (동시 쓰기는 last-write-wins)
 *   <li>TTL이 지나도 삭제하지 않고 조회 시 stale로 보고
 * </ul>
 *
 * <h3>손상 처리</h3>
 *
 * <p>파싱 불가, 필수 필드 누락, 키 불일치 문서는 {@link #treatCorruptAsMissing}에서 WARN 로그와 FALLBACK_CORRUPT 이벤트를
 * 남기고 "데이터 없음"으로 취급합니다. {@link #get}은 예외를 던지지 않습니다.
 */
@Slf4j
public class FileFallbackStore implements FallbackStore {

  private static final String SUFFIX = ".json";
  private static final String COMPONENT = "FallbackStore";

  private final Path directory;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final CheckedLogicExecutor checkedExecutor;
  private final ObservabilityPublisher publisher;

  public FileFallbackStore(
      Path directory,
      ObjectMapper objectMapper,
      Clock clock,
      CheckedLogicExecutor checkedExecutor,
      ObservabilityPublisher publisher) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.checkedExecutor = checkedExecutor;
    this.publisher = publisher;
  }

  @Override
  public Optional<FallbackLookup> get(String key) {
    return read(key).map(entry -> entry.lookup(clock.instant()));
  }

  /**
   * 파일에서 엔트리를 읽습니다. 없거나 손상된 경우 empty.
   *
   * <p>존재 여부를 따로 확인하지 않고 바로 읽습니다. 읽는 순간 파일이 없으면(동시 delete/clear 포함) 손상이 아니라 데이터 없음입니다.
   */
  Optional<FallbackEntry> read(String key) {
    Path file = fileFor(key);
    try {
      return checkedExecutor.executeUnchecked(
          () -> {
            byte[] bytes;
            try {
              bytes = readBytes(file);
            } catch (NoSuchFileException missing) {
              return Optional.<FallbackEntry>empty();
            }
            return Optional.of(decode(key, bytes));
          },
          TaskContext.of(COMPONENT, "Read", key),
          e -> new FallbackCorruptException(key, e));
    } catch (FallbackCorruptException e) {
      return treatCorruptAsMissing(key, file, e);
    }
  }

  @Override
  public void put(String key, byte[] payload, Duration ttl) {
    write(new FallbackEntry(key, payload, clock.instant(), ttl.getSeconds()));
  }

  /**
   * 엔트리를 원자적으로 기록합니다.
   *
   * @throws FallbackPersistenceException 디렉터리 생성/쓰기/rename 실패
   */
  void write(FallbackEntry entry) {
    Path target = fileFor(entry.key());
    AtomicReference<Path> temp = new AtomicReference<>();
    checkedExecutor.executeWithFinallyUnchecked(
        () -> {
          Files.createDirectories(directory);
          temp.set(Files.createTempFile(directory, "fallback-", ".tmp"));
          Files.write(temp.get(), encode(entry));
          moveAtomically(temp.get(), target);
          return null;
        },
        () -> {
          if (temp.get() != null) {
            Files.deleteIfExists(temp.get());
          }
        },
        TaskContext.of(COMPONENT, "Write", entry.key()),
        e -> new FallbackPersistenceException(entry.key(), e));
  }

  @Override
  public boolean delete(String key) {
    return checkedExecutor.executeUnchecked(
        () -> Files.deleteIfExists(fileFor(key)),
        TaskContext.of(COMPONENT, "Delete", key),
        e -> new FallbackPersistenceException(key, e));
  }

  /** 저장된 모든 폴백 파일을 삭제하고 삭제 건수를 반환합니다. */
  public int clear() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    return checkedExecutor.executeUnchecked(
        () -> {
          int removed = 0;
          try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
              if (Files.deleteIfExists(file)) {
                removed++;
              }
            }
          }
          return removed;
        },
        TaskContext.of(COMPONENT, "Clear", directory.toString()),
        e -> new FallbackPersistenceException(directory.toString(), e));
  }

  byte[] readBytes(Path file) throws IOException {
    return Files.readAllBytes(file);
  }

  Path fileFor(String key) {
    return directory.resolve(sha256Hex(key) + SUFFIX);
  }

  private Optional<FallbackEntry> treatCorruptAsMissing(
      String key, Path file, FallbackCorruptException e) {
    log.warn("[FallbackStore] 손상된 폴백 엔트리를 데이터 없음으로 처리. key={}, file={}", key, file, e);
    publisher.publish(
        new ObservabilityEvent(
            ObservabilityEventType.FALLBACK_CORRUPT,
            serviceOf(key),
            clock.instant(),
            Map.of("key", key, "reason", String.valueOf(rootMessage(e)))));
    return Optional.empty();
  }

  private FallbackEntry decode(String key, byte[] bytes) throws IOException {
    FallbackDocument doc = objectMapper.readValue(bytes, FallbackDocument.class);
    if (doc == null || !doc.isComplete()) {
      throw new FallbackCorruptException(key);
    }
    if (!key.equals(doc.key())) {
      throw new FallbackCorruptException(key);
    }
    return new FallbackEntry(
        doc.key(),
        doc.payload(),
        Instant.ofEpochMilli(doc.createdAtEpochMillis()),
        Math.max(0, doc.ttlSeconds()));
  }

  private byte[] encode(FallbackEntry entry) throws IOException {
    return objectMapper.writeValueAsBytes(
        new FallbackDocument(
            entry.key(), entry.createdAt().toEpochMilli(), entry.ttlSeconds(), entry.payload()));
  }

  private static void moveAtomically(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("[FallbackStore] 원자적 rename 미지원 파일시스템, 일반 교체로 대체. target={}", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /** 키 형식 "service:operation:fingerprint"의 서비스 부분 */
  private static String serviceOf(String key) {
    int idx = key.indexOf(':');
    return idx > 0 ? key.substring(0, idx) : key;
  }

  private static String rootMessage(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    return root.getClass().getSimpleName() + ": " + root.getMessage();
  }

  static String sha256Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
