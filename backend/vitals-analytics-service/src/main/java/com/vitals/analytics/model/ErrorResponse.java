package com.vitals.analytics.model;

public record ErrorResponse(String error) {}
