package eventflow.bus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-entry outcome of an {@link eventflow.spi.EventBus#publish} call, by position.
 */
public final class PublishResult {

  private final List<String> errors;

  private PublishResult(List<String> errors) {
    this.errors = Collections.unmodifiableList(errors);
  }

  /**
   * Every one of {@code count} entries was accepted.
   */
  public static PublishResult allAccepted(int count) {
    List<String> errors = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      errors.add(null);
    }
    return new PublishResult(errors);
  }

  /**
   * Builds a result from per-entry error messages; a {@code null} element means accepted.
   */
  public static PublishResult of(List<String> errors) {
    return new PublishResult(new ArrayList<>(errors));
  }

  public int size() {
    return errors.size();
  }

  public boolean isAccepted(int index) {
    return errors.get(index) == null;
  }

  /**
   * Returns the failure message of the entry at {@code index}, or {@code null} if it was accepted.
   */
  public String errorAt(int index) {
    return errors.get(index);
  }

  public int failedCount() {
    int failed = 0;
    for (String error : errors) {
      if (error != null) failed++;
    }
    return failed;
  }

  @Override
  public String toString() {
    return "PublishResult{size=" + errors.size() + ", failed=" + failedCount() + '}';
  }
}
