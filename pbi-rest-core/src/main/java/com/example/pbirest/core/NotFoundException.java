package com.example.pbirest.core;

/** Raised when a lookup by name (group, dataset, dataflow, report) matches nothing. */
public class NotFoundException extends PowerBiException {

  private final String kind;
  private final String lookup;

  public NotFoundException(final String kind, final String lookup) {
    super("No " + kind + " named '" + lookup + "'");
    this.kind = kind;
    this.lookup = lookup;
  }

  public String kind() {
    return kind;
  }

  public String lookup() {
    return lookup;
  }
}
