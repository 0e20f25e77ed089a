package com.routelab.backend.dto;

public record FrontierEntryResponse(String node, double cost) {
}
