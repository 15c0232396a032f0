package eventflow.jdbc;

import java.util.Objects;

/**
 * Default table names and the validation applied to configured ones.
 */
public final class TableNames {
  public static final String EVENTS = "event_store";
  public static final String OUTBOX = "outbox_entry";
  public static final String SAGAS = "saga_state";
  public static final String PROCESSED = "processed_event";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
