package com.symplify.config;

/** Thrown when a {@link SimplifyConfig} is constructed with contradictory or out-of-range settings. */
public class InvalidConfigurationException extends IllegalArgumentException {

  public InvalidConfigurationException(String message) {
    super(message);
  }
}
