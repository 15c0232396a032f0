package eventflow.model;

public enum SagaStatus {
  ACTIVE(0),
  COMPLETED(1),
  COMPENSATED(2),
  FAILED(3);

  private final int code;

  SagaStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this != ACTIVE;
  }

  public static SagaStatus fromCode(int code) {
    for (SagaStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown saga status code: " + code);
  }
}
