package com.routelab.backend.algorithms.shortestpath;

import com.routelab.backend.algorithms.graph.WeightedFlightGraph;
import com.routelab.backend.algorithms.graph.WeightedFlightGraph.WeightedEdge;
import com.routelab.backend.domain.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Shared Dijkstra main loop. Subclasses only decide how the next airport
 * to finalize is found (linear scan or binary heap).
 */
public abstract class AbstractDijkstraEngine implements ShortestPathEngine {

  private static final Logger log = LoggerFactory.getLogger(AbstractDijkstraEngine.class);

  @Override
  public final ShortestPathResult search(WeightedFlightGraph graph,
      String sourceCode,
      String destinationCode,
      SearchObserver observer) {
    Objects.requireNonNull(graph, "graph must not be null");
    Objects.requireNonNull(observer, "observer must not be null");

    int source = graph.indexOf(sourceCode);
    int target = graph.indexOf(destinationCode);

    OperationCounters counters = new OperationCounters();
    DijkstraRun run = newRun(graph, counters);

    long started = System.nanoTime();
    run.start(source);
    observer.onStart(run);

    boolean found = false;
    // a route needs at least one leg, so source == destination never matches
    if (source != target) {
      int current;
      while ((current = run.extractMin(observer)) >= 0) {
        run.finalizeVertex(current);
        observer.onExtract(run);

        if (current == target) {
          found = true;
          break;
        }

        relaxNeighbors(graph, run, current, counters, observer);
      }
    }
    long elapsed = System.nanoTime() - started;

    Route route = found ? PathReconstructor.reconstruct(graph, run.parents, source, target) : null;
    observer.onFinish(run, Optional.ofNullable(route));

    log.debug("{} Dijkstra {} -> {}: found={}, finalized={}, relaxations={}",
        strategy(), sourceCode, destinationCode, found, run.visitOrder.size(), counters.getRelaxOps());

    return new ShortestPathResult(
        strategy(),
        route,
        run.distances(),
        run.cameFrom(),
        run.visitedCodes(),
        counters,
        elapsed,
        graph.vertexCount(),
        graph.edgeCount(),
        List.of(),
        false
    );
  }

  private void relaxNeighbors(WeightedFlightGraph graph,
      DijkstraRun run,
      int current,
      OperationCounters counters,
      SearchObserver observer) {
    for (WeightedEdge edge : graph.neighbors(current)) {
      int next = edge.target();
      if (run.visited[next]) {
        continue;
      }

      counters.relax();
      counters.compare();
      double candidate = run.dist[current] + edge.weight();
      boolean improved = candidate < run.dist[next];
      if (improved) {
        run.improve(next, candidate, edge);
      }

      observer.onRelax(run, Relaxation.of(
          graph.codeAt(current),
          graph.codeAt(next),
          edge.flight().getFlightNumber(),
          edge.weight(),
          candidate,
          improved
      ));
    }
  }

  protected abstract DijkstraRun newRun(WeightedFlightGraph graph, OperationCounters counters);

  // ---------------------------------------------------------------------------
  // Per-query mutable state
  // ---------------------------------------------------------------------------

  /**
   * Arrays of one search plus the strategy-specific frontier. Doubles as the
   * {@link SearchFrame} handed to observers.
   */
  protected abstract static class DijkstraRun implements SearchFrame {

    protected final WeightedFlightGraph graph;
    protected final OperationCounters counters;
    protected final double[] dist;
    protected final boolean[] visited;
    protected final WeightedEdge[] parents;
    private final List<Integer> visitOrder = new ArrayList<>();
    private int current = -1;

    protected DijkstraRun(WeightedFlightGraph graph, OperationCounters counters) {
      this.graph = graph;
      this.counters = counters;
      int n = graph.vertexCount();
      this.dist = new double[n];
      this.visited = new boolean[n];
      this.parents = new WeightedEdge[n];
      Arrays.fill(dist, Double.POSITIVE_INFINITY);
    }

    void start(int source) {
      dist[source] = 0.0;
      onReached(source, 0.0);
    }

    void finalizeVertex(int vertex) {
      visited[vertex] = true;
      visitOrder.add(vertex);
      current = vertex;
    }

    void improve(int vertex, double cost, WeightedEdge via) {
      dist[vertex] = cost;
      parents[vertex] = via;
      onReached(vertex, cost);
    }

    /**
     * Called whenever a vertex gets a new best-known cost.
     */
    protected abstract void onReached(int vertex, double cost);

    /**
     * Next unvisited vertex with the smallest (cost, index), or -1 when the
     * reachable part of the graph is exhausted.
     */
    protected abstract int extractMin(SearchObserver observer);

    List<String> visitedCodes() {
      List<String> codes = new ArrayList<>(visitOrder.size());
      for (int vertex : visitOrder) {
        codes.add(graph.codeAt(vertex));
      }
      return codes;
    }

    @Override
    public Optional<String> currentNode() {
      return current < 0 ? Optional.empty() : Optional.of(graph.codeAt(current));
    }

    @Override
    public List<String> visited() {
      return List.copyOf(visitedCodes());
    }

    @Override
    public Map<String, Double> distances() {
      Map<String, Double> result = new TreeMap<>();
      for (int i = 0; i < dist.length; i++) {
        if (dist[i] != Double.POSITIVE_INFINITY) {
          result.put(graph.codeAt(i), dist[i]);
        }
      }
      return result;
    }

    @Override
    public Map<String, String> cameFrom() {
      Map<String, String> result = new TreeMap<>();
      for (int i = 0; i < parents.length; i++) {
        if (parents[i] != null) {
          result.put(graph.codeAt(i), parents[i].flight().getOriginCode());
        }
      }
      return result;
    }
  }
}
