package com.verlumen.curvestream.filters;

import com.google.common.collect.ImmutableList;

/** Thrown when one or more filters are invalid. Lists every violated constraint. */
public final class FilterValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final ImmutableList<String> violations;

  public FilterValidationException(ImmutableList<String> violations) {
    super("Invalid filters: " + String.join("; ", violations));
    this.violations = violations;
  }

  public ImmutableList<String> violations() {
    return violations;
  }
}
