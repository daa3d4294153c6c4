package com.vitals.analytics.service;

public class InvalidMetricException extends IllegalArgumentException {
  public InvalidMetricException(String message) {
    super(message);
  }
}
