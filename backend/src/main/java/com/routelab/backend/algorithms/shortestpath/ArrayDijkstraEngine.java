package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Dijkstra with a linear scan over a visited array: O(V^2) time, no heap.
 */
@Component
public class ArrayDijkstraEngine extends AbstractDijkstraEngine {

  @Override
  public DijkstraStrategy strategy() {
    return DijkstraStrategy.ARRAY;
  }

  @Override
  protected DijkstraRun newRun(WeightedFlightGraph graph, OperationCounters counters) {
    return new ArrayRun(graph, counters);
  }

  private static final class ArrayRun extends DijkstraRun {

    ArrayRun(WeightedFlightGraph graph, OperationCounters counters) {
      super(graph, counters);
    }

    @Override
    protected void onReached(int vertex, double cost) {
      // tentative costs live in dist[] only
    }

    @Override
    protected int extractMin(SearchObserver observer) {
      counters.extractMin();

      int best = -1;
      double bestCost = Double.POSITIVE_INFINITY;
      // ascending index order keeps the smaller airport code on equal cost
      for (int i = 0; i < dist.length; i++) {
        if (visited[i]) {
          continue;
        }
        counters.compare();
        if (dist[i] < bestCost) {
          bestCost = dist[i];
          best = i;
        }
      }
      return best;
    }

    @Override
    public List<FrontierEntry> frontier() {
      List<FrontierEntry> entries = new ArrayList<>();
      for (int i = 0; i < dist.length; i++) {
        if (!visited[i] && dist[i] != Double.POSITIVE_INFINITY) {
          entries.add(new FrontierEntry(graph.codeAt(i), dist[i]));
        }
      }
      entries.sort(Comparator.comparingDouble(FrontierEntry::cost).thenComparing(FrontierEntry::node));
      return entries;
    }
  }
}
