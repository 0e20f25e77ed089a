package com.routelab.backend.service;

import com.routelab.backend.algorithms.mst.MstResult;
import com.routelab.backend.algorithms.mst.MstScope;

public record MstSimulation(String source, String destination, MstScope scope, MstResult result) {
}
