package eventflow.support;

import eventflow.ConcurrencyConflictException;
import eventflow.DomainEvent;
import eventflow.spi.EventStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class InMemoryEventStore implements EventStore {

  private final InMemoryTransactions transactions;
  private final Map<String, List<DomainEvent>> streams = new HashMap<>();
  private volatile Consumer<String> beforeAppend = partition -> {
  };
  private int appendCalls;

  public InMemoryEventStore(InMemoryTransactions transactions) {
    this.transactions = transactions;
  }

  /**
   * Runs before every append with the partition key, e.g. to simulate a concurrent writer.
   */
  public void beforeAppend(Consumer<String> hook) {
    this.beforeAppend = hook;
  }

  public synchronized int appendCalls() {
    return appendCalls;
  }

  @Override
  public long append(Connection conn, String aggregateType, String aggregateId, long expectedVersion,
                     List<DomainEvent> events) {
    String partition = DomainEvent.partitionKey(aggregateType, aggregateId);
    beforeAppend.accept(partition);
    synchronized (this) {
      appendCalls++;
      List<DomainEvent> stream = streams.computeIfAbsent(partition, k -> new ArrayList<>());
      if (stream.size() != expectedVersion) {
        throw new ConcurrencyConflictException(partition, expectedVersion, stream.size());
      }
      long next = expectedVersion;
      for (DomainEvent event : events) {
        if (event.version() != ++next) {
          throw new IllegalArgumentException("Unexpected version " + event.version());
        }
      }
      int from = stream.size();
      stream.addAll(events);
      transactions.undoOnRollback(() -> {
        synchronized (this) {
          stream.subList(from, stream.size()).clear();
        }
      });
      return next;
    }
  }

  /**
   * Appends directly, outside any transaction, as another process would.
   */
  public synchronized void seed(DomainEvent... events) {
    for (DomainEvent event : events) {
      streams.computeIfAbsent(event.partitionKey(), k -> new ArrayList<>()).add(event);
    }
  }

  @Override
  public synchronized List<DomainEvent> load(Connection conn, String aggregateType, String aggregateId) {
    return List.copyOf(streams.getOrDefault(DomainEvent.partitionKey(aggregateType, aggregateId), List.of()));
  }

  @Override
  public synchronized List<DomainEvent> loadAfter(Connection conn, String aggregateType, String aggregateId,
                                                  long afterVersion) {
    List<DomainEvent> result = new ArrayList<>();
    for (DomainEvent event : load(conn, aggregateType, aggregateId)) {
      if (event.version() > afterVersion) {
        result.add(event);
      }
    }
    return result;
  }

  @Override
  public synchronized long currentVersion(Connection conn, String aggregateType, String aggregateId) {
    return streams.getOrDefault(DomainEvent.partitionKey(aggregateType, aggregateId), List.of()).size();
  }

  @Override
  public synchronized boolean contains(Connection conn, String eventId) {
    for (List<DomainEvent> stream : streams.values()) {
      for (DomainEvent event : stream) {
        if (event.eventId().equals(eventId)) {
          return true;
        }
      }
    }
    return false;
  }
}
