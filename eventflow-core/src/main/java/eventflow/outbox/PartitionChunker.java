package eventflow.outbox;

import eventflow.model.OutboxEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits claimed entries into bus calls.
 *
 * <p>Each call holds at most {@code maxPerCall} entries and at most one entry per
 * aggregate. The entries of one aggregate land in successive calls in their input
 * order, so sending the calls in sequence preserves per-aggregate order.
 */
final class PartitionChunker {

  private PartitionChunker() {
  }

  static List<List<OutboxEntry>> chunk(List<OutboxEntry> entries, int maxPerCall) {
    if (maxPerCall <= 0) {
      throw new IllegalArgumentException("maxPerCall must be > 0, got: " + maxPerCall);
    }
    Map<String, Deque<OutboxEntry>> byPartition = new LinkedHashMap<>();
    for (OutboxEntry entry : entries) {
      byPartition.computeIfAbsent(entry.partitionKey(), k -> new ArrayDeque<>()).add(entry);
    }

    List<List<OutboxEntry>> calls = new ArrayList<>();
    List<OutboxEntry> current = new ArrayList<>();
    Set<String> partitionsInCurrent = new HashSet<>();
    int remaining = entries.size();
    while (remaining > 0) {
      for (Map.Entry<String, Deque<OutboxEntry>> partition : byPartition.entrySet()) {
        Deque<OutboxEntry> queue = partition.getValue();
        if (queue.isEmpty()) {
          continue;
        }
        if (current.size() == maxPerCall || partitionsInCurrent.contains(partition.getKey())) {
          calls.add(current);
          current = new ArrayList<>();
          partitionsInCurrent = new HashSet<>();
        }
        current.add(queue.poll());
        partitionsInCurrent.add(partition.getKey());
        remaining--;
      }
    }
    if (!current.isEmpty()) {
      calls.add(current);
    }
    return calls;
  }
}
