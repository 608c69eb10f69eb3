package org.cerespp.domain.activity;

/**
 * Activity indices reported per observation.
 *
 * @since 0.1.0
 */
public enum IndexName {
  S("S"),
  HALPHA("Halpha"),
  HEI("HeI"),
  NAID1("NaID1"),
  NAID2("NaID2"),
  /** Combined sodium doublet index. */
  NAID1D2("NaID1D2");

  private final String label;

  IndexName(String label) {
    this.label = label;
  }

  /** @return name used in tables, logs and step names */
  public String label() {
    return label;
  }
}
