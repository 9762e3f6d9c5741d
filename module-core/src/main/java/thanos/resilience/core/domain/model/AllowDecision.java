package thanos.resilience.core.domain.model;

/** Result of asking a circuit whether a call may proceed. */
public enum AllowDecision {
  PROCEED,
  SHORT_CIRCUIT;

  public boolean isAllowed() {
    return this == PROCEED;
  }
}
