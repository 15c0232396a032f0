package eventflow.jdbc;

import java.sql.SQLException;

/**
 * Unchecked exception wrapping a {@link SQLException} raised by a JDBC store.
 */
public class JdbcStoreException extends RuntimeException {

  public JdbcStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns the first SQL state found on the underlying {@link SQLException} chain,
   * or {@code null}. Batch failures carry the state of the failing row.
   */
  public String sqlState() {
    Throwable t = getCause();
    while (t instanceof SQLException e) {
      if (e.getSQLState() != null) {
        return e.getSQLState();
      }
      t = e.getNextException() != null ? e.getNextException() : e.getCause();
    }
    return null;
  }

  /**
   * Returns {@code true} when the statement violated a unique or primary key constraint
   * (SQL state class {@code 23}).
   */
  public boolean isIntegrityViolation() {
    String state = sqlState();
    return state != null && state.startsWith("23");
  }

  /**
   * Returns {@code true} when the database aborted the statement because of a
   * serialization failure or deadlock (SQL states {@code 40001}, {@code 40P01}).
   */
  public boolean isSerializationFailure() {
    String state = sqlState();
    return "40001".equals(state) || "40P01".equals(state);
  }
}
