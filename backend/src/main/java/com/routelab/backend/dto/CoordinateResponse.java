package com.routelab.backend.dto;

public record CoordinateResponse(String code, double latitude, double longitude) {
}
