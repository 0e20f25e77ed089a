package com.routelab.backend.controller;

import com.routelab.backend.algorithms.analysis.AdjacencyEntry;
import com.routelab.backend.algorithms.analysis.AdjacencyMatrix;
import com.routelab.backend.algorithms.analysis.ConnectedComponents;
import com.routelab.backend.algorithms.analysis.ConnectivityResult;
import com.routelab.backend.algorithms.analysis.GraphStatistics;
import com.routelab.backend.algorithms.analysis.RouteSubgraphAnalysis;
import com.routelab.backend.algorithms.mst.MstAlgorithm;
import com.routelab.backend.algorithms.mst.MstEdge;
import com.routelab.backend.algorithms.mst.MstResult;
import com.routelab.backend.algorithms.mst.MstScope;
import com.routelab.backend.algorithms.mst.MstState;
import com.routelab.backend.algorithms.mst.MstStepKind;
import com.routelab.backend.dto.AdjacencyEntryResponse;
import com.routelab.backend.dto.AdjacencyListResponse;
import com.routelab.backend.dto.AdjacencyMatrixResponse;
import com.routelab.backend.dto.ComponentsResponse;
import com.routelab.backend.dto.ConnectivityResponse;
import com.routelab.backend.dto.GraphStatsResponse;
import com.routelab.backend.dto.MstEdgeResponse;
import com.routelab.backend.dto.MstResponse;
import com.routelab.backend.dto.MstStateResponse;
import com.routelab.backend.dto.RouteAnalysisResponse;
import com.routelab.backend.service.GraphAnalysisService;
import com.routelab.backend.service.MstSimulation;
import com.routelab.backend.service.SimulationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Whole-network views (statistics, adjacency, components) and per-query
 * graph analyses (route subgraph, connectivity, minimum spanning tree).
 */
@RestController
@RequestMapping("/api/graph")
public class GraphController {

  private static final Logger log = LoggerFactory.getLogger(GraphController.class);

  private final GraphAnalysisService graphAnalysisService;
  private final SimulationService simulationService;

  public GraphController(GraphAnalysisService graphAnalysisService, SimulationService simulationService) {
    this.graphAnalysisService = graphAnalysisService;
    this.simulationService = simulationService;
  }

  @GetMapping("/stats")
  public GraphStatsResponse stats() {
    GraphStatistics stats = graphAnalysisService.statistics();
    return new GraphStatsResponse(
        true,
        stats.vertices(),
        stats.edges(),
        stats.density(),
        stats.averageDegree(),
        stats.maxDegree(),
        stats.minDegree(),
        stats.outDegrees(),
        stats.inDegrees()
    );
  }

  @GetMapping("/adjacency-list")
  public AdjacencyListResponse adjacencyList() {
    Map<String, List<AdjacencyEntry>> adjacency = graphAnalysisService.adjacencyList();

    Map<String, List<AdjacencyEntryResponse>> body = new LinkedHashMap<>();
    adjacency.forEach((code, entries) -> body.put(code, entries.stream()
        .map(e -> new AdjacencyEntryResponse(e.to(), e.flightNumber(), e.airline(), e.price(), e.durationMinutes()))
        .toList()));

    return new AdjacencyListResponse(true, body.size(), body);
  }

  @GetMapping("/adjacency-matrix")
  public AdjacencyMatrixResponse adjacencyMatrix() {
    AdjacencyMatrix matrix = graphAnalysisService.adjacencyMatrix();
    return new AdjacencyMatrixResponse(true, matrix.airports(), matrix.cells());
  }

  @GetMapping("/components")
  public ComponentsResponse components() {
    ConnectedComponents components = graphAnalysisService.connectedComponents();
    return new ComponentsResponse(
        true,
        components.count(),
        components.largestSize(),
        components.isConnected(),
        components.components()
    );
  }

  /**
   * Example:
   *   GET /api/graph/route-analysis?source=LHE&dest=JFK&max_hops=3
   */
  @GetMapping("/route-analysis")
  public RouteAnalysisResponse routeAnalysis(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest,
      @RequestParam(value = "max_hops", required = false) Integer maxHops
  ) {
    log.info("Route analysis request: source={}, dest={}, max_hops={}", source, dest, maxHops);

    RouteSubgraphAnalysis analysis = graphAnalysisService.analyzeRoute(source, dest, maxHops);
    return new RouteAnalysisResponse(
        true,
        analysis.source(),
        analysis.destination(),
        analysis.maxHops(),
        analysis.airports(),
        analysis.flights().stream().map(RouteResponses::toLegResponse).toList(),
        analysis.vertexCount(),
        analysis.edgeCount(),
        analysis.density(),
        analysis.totalPaths(),
        analysis.directPaths(),
        analysis.oneStopPaths(),
        analysis.twoStopPaths(),
        analysis.sourceOutDegree(),
        analysis.destinationInDegree(),
        analysis.isConnected()
    );
  }

  @GetMapping("/connectivity")
  public ConnectivityResponse connectivity(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest
  ) {
    log.info("Connectivity request: source={}, dest={}", source, dest);

    ConnectivityResult result = graphAnalysisService.connectivity(source, dest);
    return new ConnectivityResponse(
        true,
        result.source(),
        result.destination(),
        result.reachable(),
        result.hops(),
        result.path(),
        result.reachableAirports()
    );
  }

  /**
   * Example:
   *   GET /api/graph/mst?source=LHE&dest=JFK&algorithm=kruskal&max_states=500&scope=route
   */
  @GetMapping("/mst")
  public MstResponse mst(
      @RequestParam(value = "source", required = false) String source,
      @RequestParam(value = "dest", required = false) String dest,
      @RequestParam(value = "algorithm", defaultValue = "prim") String algorithm,
      @RequestParam(value = "max_states", required = false) Integer maxStates,
      @RequestParam(value = "scope", required = false) String scope
  ) {
    MstAlgorithm mstAlgorithm = MstAlgorithm.fromParameter(algorithm);
    MstScope mstScope = scope == null ? null : MstScope.fromParameter(scope);
    log.info("MST request: source={}, dest={}, algorithm={}, scope={}, max_states={}",
        source, dest, mstAlgorithm.parameterName(), scope, maxStates);

    MstSimulation simulation = simulationService.simulateMst(source, dest, mstAlgorithm, maxStates, mstScope);
    MstResult result = simulation.result();

    List<MstStateResponse> states = result.trace().stream()
        .map(this::toStateResponse)
        .toList();

    return new MstResponse(
        true,
        mstAlgorithm.parameterName(),
        simulation.scope().parameterName(),
        simulation.source(),
        simulation.destination(),
        result.airports(),
        toEdgeResponses(result.edges()),
        result.totalWeight(),
        result.isSpanning(),
        states,
        states.size(),
        result.traceTruncated()
    );
  }

  // ---------------------------------------------------------------------------
  // Mapping
  // ---------------------------------------------------------------------------

  private MstStateResponse toStateResponse(MstState state) {
    Boolean accepted = null;
    if (state.kind() == MstStepKind.ACCEPT || state.kind() == MstStepKind.REJECT) {
      accepted = state.kind() == MstStepKind.ACCEPT;
    }
    return new MstStateResponse(
        state.step(),
        state.kind().name().toLowerCase(Locale.ROOT),
        state.visited(),
        toEdgeResponses(state.mstEdges()),
        state.consideredEdge() == null ? null : toEdgeResponse(state.consideredEdge()),
        accepted,
        state.totalWeight()
    );
  }

  private List<MstEdgeResponse> toEdgeResponses(List<MstEdge> edges) {
    return edges.stream().map(this::toEdgeResponse).toList();
  }

  private MstEdgeResponse toEdgeResponse(MstEdge edge) {
    return new MstEdgeResponse(edge.from(), edge.to(), edge.weight(), edge.flightNumber(), edge.airline());
  }
}
