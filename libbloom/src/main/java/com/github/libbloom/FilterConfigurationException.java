package com.github.libbloom;

/**
 * Thrown when a filter is constructed, or sized, with parameters outside their domain.
 */
public class FilterConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public FilterConfigurationException(String message) {
    super(message);
  }
}
