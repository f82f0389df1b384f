package com.example.dataingest.model;

public record HealthResponse(String status, String message) {
}
