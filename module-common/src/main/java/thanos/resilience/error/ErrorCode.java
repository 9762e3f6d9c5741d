package thanos.resilience.error;

public interface ErrorCode {
  String getCode();

  String getMessage();
}
