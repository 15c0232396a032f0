package eventflow.jdbc.outbox;

import eventflow.jdbc.JdbcTemplate;

import java.util.List;

/**
 * H2 outbox store. Primarily for testing and the demo.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcOutboxStore}.
 */
public final class H2OutboxStore extends AbstractJdbcOutboxStore {

  public H2OutboxStore() {
    super();
  }

  public H2OutboxStore(String tableName, JdbcTemplate jdbc) {
    super(tableName, jdbc);
  }

  @Override
  public AbstractJdbcOutboxStore withTable(String tableName, JdbcTemplate jdbc) {
    return new H2OutboxStore(tableName, jdbc);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
