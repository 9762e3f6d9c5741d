package thanos.resilience.core.domain.model;

/** A fallback entry together with its age at read time. */
public record FallbackLookup(FallbackEntry entry, long ageSeconds, boolean stale) {}
