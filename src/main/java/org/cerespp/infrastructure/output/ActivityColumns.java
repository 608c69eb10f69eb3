package org.cerespp.infrastructure.output;

import java.util.List;

/**
 * Fixed column layout of the activity table.
 *
 * @since 0.1.0
 */
public final class ActivityColumns {
  /** Column names in file order. */
  public static final List<String> NAMES = List.of(
      "BJD", "RV", "e_RV", "BIS", "FWHM", "CONTRAST",
      "S", "e_S", "Halpha", "e_Halpha", "HeI", "e_HeI", "NaID1", "NaID2");

  private ActivityColumns() {}

  /**
   * Header line written at the top of every table.
   *
   * @return {@code #} followed by the column names
   */
  public static String headerLine() {
    return "# " + String.join(" ", NAMES);
  }
}
