package thanos.resilience.core.domain.model;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FallbackEntry age and staleness")
class FallbackEntryTest {

  private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

  private final FallbackEntry entry =
      new FallbackEntry("docs:search:abc", "[1,2]".getBytes(StandardCharsets.UTF_8), CREATED, 3600);

  @Test
  @DisplayName("entry within TTL should be fresh")
  void withinTtl_shouldBeFresh() {
    FallbackLookup lookup = entry.lookup(CREATED.plusSeconds(120));

    assertAll(
        () -> assertEquals(120, lookup.ageSeconds()),
        () -> assertFalse(lookup.stale()),
        () -> assertSame(entry, lookup.entry()));
  }

  @Test
  @DisplayName("entry older than TTL should be reported stale, not dropped")
  void pastTtl_shouldBeStale() {
    FallbackLookup lookup = entry.lookup(CREATED.plusSeconds(7200));

    assertTrue(lookup.stale());
    assertEquals(7200, lookup.ageSeconds());
  }

  @Test
  @DisplayName("clock skew into the past should clamp age to zero")
  void futureCreatedAt_shouldClampAge() {
    assertEquals(0, entry.ageSeconds(CREATED.minusSeconds(10)));
  }

  @Test
  @DisplayName("negative TTL should be rejected")
  void negativeTtl_shouldFail() {
    assertThrows(
        IllegalArgumentException.class, () -> new FallbackEntry("k", new byte[0], CREATED, -1));
  }
}
