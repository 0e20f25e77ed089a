package com.routelab.backend.algorithms.analysis;

import java.util.List;

/**
 * Directed reachability between two airports. {@code hops} is -1 and
 * {@code path} empty when the destination cannot be reached.
 */
public record ConnectivityResult(String source,
                                 String destination,
                                 boolean reachable,
                                 int hops,
                                 List<String> path,
                                 List<String> reachableAirports) {
}
