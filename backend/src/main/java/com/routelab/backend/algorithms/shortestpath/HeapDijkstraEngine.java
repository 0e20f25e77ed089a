package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Dijkstra on a binary min-heap with lazy decrease-key: an improved cost is
 * pushed as a new entry and outdated entries are skipped when popped.
 * O((V + E) log V) time.
 */
@Component
public class HeapDijkstraEngine extends AbstractDijkstraEngine {

  @Override
  public DijkstraStrategy strategy() {
    return DijkstraStrategy.HEAP;
  }

  @Override
  protected DijkstraRun newRun(WeightedFlightGraph graph, OperationCounters counters) {
    return new HeapRun(graph, counters);
  }

  private record QueueEntry(double cost, int vertex) {

    // vertex indexes follow airport code order
    static final Comparator<QueueEntry> ORDER =
        Comparator.comparingDouble(QueueEntry::cost).thenComparingInt(QueueEntry::vertex);
  }

  private static final class HeapRun extends DijkstraRun {

    private final PriorityQueue<QueueEntry> queue = new PriorityQueue<>(QueueEntry.ORDER);

    HeapRun(WeightedFlightGraph graph, OperationCounters counters) {
      super(graph, counters);
    }

    @Override
    protected void onReached(int vertex, double cost) {
      queue.add(new QueueEntry(cost, vertex));
      counters.heapOperation();
    }

    @Override
    protected int extractMin(SearchObserver observer) {
      while (!queue.isEmpty()) {
        QueueEntry entry = queue.poll();
        counters.heapOperation();
        counters.extractMin();

        if (visited[entry.vertex()]) {
          observer.onStaleEntry(this, new FrontierEntry(graph.codeAt(entry.vertex()), entry.cost()));
          continue;
        }
        return entry.vertex();
      }
      return -1;
    }

    @Override
    public List<FrontierEntry> frontier() {
      List<QueueEntry> snapshot = new ArrayList<>(queue);
      snapshot.sort(QueueEntry.ORDER);

      List<FrontierEntry> entries = new ArrayList<>(snapshot.size());
      for (QueueEntry entry : snapshot) {
        entries.add(new FrontierEntry(graph.codeAt(entry.vertex()), entry.cost()));
      }
      return entries;
    }
  }
}
