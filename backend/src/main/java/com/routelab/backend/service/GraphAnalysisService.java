package com.routelab.backend.service;

import com.routelab.backend.algorithms.analysis.*;
import com.routelab.backend.algorithms.graph.FlightGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class GraphAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(GraphAnalysisService.class);

  private final FlightGraphFactory graphFactory;
  private final GraphAnalyzer graphAnalyzer;
  private final int defaultMaxHops;
  private final int maxHopsLimit;

  public GraphAnalysisService(FlightGraphFactory graphFactory,
      GraphAnalyzer graphAnalyzer,
      @Value("${routelab.analysis.default-max-hops:3}") int defaultMaxHops,
      @Value("${routelab.analysis.max-hops-limit:6}") int maxHopsLimit) {
    this.graphFactory = graphFactory;
    this.graphAnalyzer = graphAnalyzer;
    this.defaultMaxHops = defaultMaxHops;
    this.maxHopsLimit = maxHopsLimit;
  }

  public GraphStatistics statistics() {
    return graphAnalyzer.statistics(graphFactory.snapshot());
  }

  public Map<String, List<AdjacencyEntry>> adjacencyList() {
    return graphAnalyzer.adjacencyList(graphFactory.snapshot());
  }

  public AdjacencyMatrix adjacencyMatrix() {
    return graphAnalyzer.adjacencyMatrix(graphFactory.snapshot());
  }

  public ConnectedComponents connectedComponents() {
    return graphAnalyzer.connectedComponents(graphFactory.snapshot());
  }

  public ConnectivityResult connectivity(String source, String destination) {
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);
    return graphAnalyzer.connectivity(graphFactory.snapshot(), sourceCode, destinationCode);
  }

  public RouteSubgraphAnalysis analyzeRoute(String source, String destination, Integer maxHops) {
    String sourceCode = QueryParameters.airportCode("source", source);
    String destinationCode = QueryParameters.airportCode("dest", destination);
    int hops = QueryParameters.intInRange("max_hops", maxHops, defaultMaxHops, 1, maxHopsLimit);

    FlightGraph graph = graphFactory.snapshot();
    RouteSubgraphAnalysis analysis = graphAnalyzer.analyzeRoute(graph, sourceCode, destinationCode, hops);
    log.info("Route analysis {} -> {} within {} hops: {} paths", sourceCode, destinationCode, hops, analysis.totalPaths());
    return analysis;
  }
}
