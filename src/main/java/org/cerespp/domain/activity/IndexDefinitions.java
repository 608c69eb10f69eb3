package org.cerespp.domain.activity;

import java.util.List;

/**
 * Standard band layout for the chromospheric indices.
 *
 * <p>Ca II H and K cores use triangular bands of 1.09 A FWHM; every other band is rectangular.
 * Centers and widths in Angstrom.</p>
 *
 * @since 0.1.0
 */
public final class IndexDefinitions {
  public static final Passband CA_H = Passband.triangular("CaH", 3968.47, 1.09);
  public static final Passband CA_K = Passband.triangular("CaK", 3933.664, 1.09);
  public static final Passband CA_V = Passband.rectangular("V", 3901.0, 20.0);
  public static final Passband CA_R = Passband.rectangular("R", 4001.0, 20.0);

  public static final Passband H_ALPHA = Passband.rectangular("Halpha", 6562.808, 0.678);
  public static final Passband H_ALPHA_BLUE = Passband.rectangular("Halpha-F1", 6550.87, 10.75);
  public static final Passband H_ALPHA_RED = Passband.rectangular("Halpha-F2", 6580.309, 8.75);

  public static final Passband HE_I = Passband.rectangular("HeI", 5875.62, 0.2);
  public static final Passband HE_I_BLUE = Passband.rectangular("HeI-F1", 5874.5, 0.5);
  public static final Passband HE_I_RED = Passband.rectangular("HeI-F2", 5879.0, 0.5);

  public static final Passband NA_D1 = Passband.rectangular("NaD1", 5895.92, 1.0);
  public static final Passband NA_D2 = Passband.rectangular("NaD2", 5889.95, 1.0);
  public static final Passband NA_L = Passband.rectangular("NaL", 5805.0, 10.0);
  public static final Passband NA_R = Passband.rectangular("NaR", 6090.0, 20.0);

  private IndexDefinitions() {}

  /**
   * Builds the full index set.
   *
   * @param sIndexCalibration multiplicative constant of the S index
   * @return definitions in reporting order
   */
  public static List<IndexDefinition> standard(double sIndexCalibration) {
    return List.of(
        new IndexDefinition(IndexName.S, List.of(CA_H, CA_K), List.of(CA_V, CA_R), sIndexCalibration),
        new IndexDefinition(IndexName.HALPHA, List.of(H_ALPHA), List.of(H_ALPHA_BLUE, H_ALPHA_RED), 2.0),
        new IndexDefinition(IndexName.HEI, List.of(HE_I), List.of(HE_I_BLUE, HE_I_RED), 2.0),
        new IndexDefinition(IndexName.NAID1, List.of(NA_D1), List.of(NA_L, NA_R), 2.0),
        new IndexDefinition(IndexName.NAID2, List.of(NA_D2), List.of(NA_L, NA_R), 2.0),
        new IndexDefinition(IndexName.NAID1D2, List.of(NA_D1, NA_D2), List.of(NA_L, NA_R), 1.0));
  }
}
