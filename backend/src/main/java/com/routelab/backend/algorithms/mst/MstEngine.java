package com.routelab.backend.algorithms.mst;

import com.routelab.backend.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.*;

/**
 * Prim and Kruskal over an {@link UndirectedPriceGraph}.
 *
 * Both algorithms order candidate edges with {@link MstEdge#ORDER}, so on a
 * connected scope they agree on total weight; with equal-weight ties the
 * chosen edge sets may still differ. Tracing never stops the construction.
 */
@Component
public class MstEngine {

  private static final Logger log = LoggerFactory.getLogger(MstEngine.class);

  public MstResult solve(UndirectedPriceGraph graph, MstAlgorithm algorithm, int maxStates) {
    Objects.requireNonNull(graph, "graph must not be null");
    Objects.requireNonNull(algorithm, "algorithm must not be null");
    if (graph.vertexCount() == 0) {
      throw new ValidationException("Spanning tree scope contains no airports");
    }

    MstTraceRecorder recorder = new MstTraceRecorder(maxStates);
    MstRun run = algorithm == MstAlgorithm.PRIM
        ? prim(graph, recorder)
        : kruskal(graph, recorder);

    log.debug("{} over {} airports / {} edges: {} tree edges, total {}",
        algorithm, graph.vertexCount(), graph.edgeCount(), run.accepted.size(), run.total);

    return new MstResult(
        algorithm,
        graph.vertices(),
        run.accepted,
        run.total,
        recorder.states(),
        recorder.isTruncated()
    );
  }

  // ---------------------------------------------------------------------------
  // Prim: grow one tree from the start vertex
  // ---------------------------------------------------------------------------

  MstRun prim(UndirectedPriceGraph graph, MstObserver observer) {
    MstRun run = new MstRun();
    String start = graph.startVertex()
        .orElseThrow(() -> new ValidationException("Spanning tree scope contains no airports"));

    run.visit(start);
    observer.onStart(run);

    PriorityQueue<Candidate> frontier = new PriorityQueue<>(Candidate.ORDER);
    pushIncident(graph, start, run, frontier);

    while (!frontier.isEmpty() && run.visited.size() < graph.vertexCount()) {
      Candidate candidate = frontier.poll();
      if (run.visited.contains(candidate.towards())) {
        observer.onEdgeConsidered(run, candidate.edge(), false);
        continue;
      }

      run.accept(candidate.edge());
      run.visit(candidate.towards());
      observer.onEdgeConsidered(run, candidate.edge(), true);
      pushIncident(graph, candidate.towards(), run, frontier);
    }

    observer.onFinish(run);
    return run;
  }

  private void pushIncident(UndirectedPriceGraph graph, String vertex, MstRun run, PriorityQueue<Candidate> frontier) {
    for (MstEdge edge : graph.incidentEdges(vertex)) {
      String other = edge.opposite(vertex);
      if (!run.visited.contains(other)) {
        frontier.add(new Candidate(edge, other));
      }
    }
  }

  private record Candidate(MstEdge edge, String towards) {

    static final Comparator<Candidate> ORDER =
        Comparator.comparing(Candidate::edge, MstEdge.ORDER).thenComparing(Candidate::towards);
  }

  // ---------------------------------------------------------------------------
  // Kruskal: merge forests in global edge order
  // ---------------------------------------------------------------------------

  MstRun kruskal(UndirectedPriceGraph graph, MstObserver observer) {
    MstRun run = new MstRun();
    observer.onStart(run);

    UnionFind components = new UnionFind(graph.vertices());
    int target = graph.vertexCount() - 1;

    for (MstEdge edge : graph.edges()) {
      if (run.accepted.size() == target) {
        break;
      }
      if (components.union(edge.from(), edge.to())) {
        run.accept(edge);
        run.visit(edge.from());
        run.visit(edge.to());
        observer.onEdgeConsidered(run, edge, true);
      } else {
        observer.onEdgeConsidered(run, edge, false);
      }
    }

    observer.onFinish(run);
    return run;
  }

  // ---------------------------------------------------------------------------
  // Mutable construction state
  // ---------------------------------------------------------------------------

  static final class MstRun implements MstFrame {

    private final Set<String> visited = new LinkedHashSet<>();
    private final List<MstEdge> accepted = new ArrayList<>();
    private BigDecimal total = BigDecimal.ZERO;

    void visit(String code) {
      visited.add(code);
    }

    void accept(MstEdge edge) {
      accepted.add(edge);
      total = total.add(edge.weight());
    }

    @Override
    public List<String> visited() {
      return List.copyOf(visited);
    }

    @Override
    public List<MstEdge> acceptedEdges() {
      return List.copyOf(accepted);
    }

    @Override
    public BigDecimal totalWeight() {
      return total;
    }
  }
}
