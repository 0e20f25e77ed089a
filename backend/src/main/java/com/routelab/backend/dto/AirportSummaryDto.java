package com.routelab.backend.dto;

public record AirportSummaryDto(
    String code,
    String city,
    String name,
    String country,
    double latitude,
    double longitude
) {
}
