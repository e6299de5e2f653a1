package rss.specpol.stokes;

import rss.specpol.utils.StokesUtils;

/**
 * Result of merging the waveplate pairs of one observation: unnormalized I, Q, U over
 * wavelength, the variance of each plus the QU covariance, the wavelengths where the result is
 * valid and, for redundant patterns, the primary/secondary consistency diagnostics.
 */
public class CombinedStokes {

  private final double[][] stokes;
  private final double[][] variance;
  private final boolean[] ok;
  private final double[] pairChi2;
  private final boolean haveRedundancyChi;
  private final int redundancyCulls;

  /**
   * Result without redundancy diagnostics
   *
   * @param stokes I, Q, U rows
   * @param variance I, Q, U variance rows and QU covariance row
   * @param ok valid wavelengths
   */
  CombinedStokes(double[][] stokes, double[][] variance, boolean[] ok) {
    this(stokes, variance, ok, null, false, 0);
  }

  /**
   * Result of a redundant pattern
   *
   * @param stokes I, Q, U rows
   * @param variance I, Q, U variance rows and QU covariance row
   * @param ok valid wavelengths
   * @param pairChi2 mean primary/secondary chi-square of each pair (0 where not available)
   * @param haveRedundancyChi true if any pair had both a primary and secondary measurement
   * @param redundancyCulls number of wavelengths invalidated by the chi-square fence
   */
  CombinedStokes(double[][] stokes, double[][] variance, boolean[] ok, double[] pairChi2,
      boolean haveRedundancyChi, int redundancyCulls) {
    this.stokes = stokes;
    this.variance = variance;
    this.ok = ok;
    this.pairChi2 = pairChi2;
    this.haveRedundancyChi = haveRedundancyChi;
    this.redundancyCulls = redundancyCulls;
  }

  /**
   * Copy of this result with new stokes and variance values, as produced by calibration
   *
   * @param newStokes I, Q, U rows
   * @param newVariance I, Q, U variance rows and QU covariance row
   * @return new result sharing the validity mask and diagnostics
   */
  public CombinedStokes withStokes(double[][] newStokes, double[][] newVariance) {
    return new CombinedStokes(newStokes, newVariance, ok, pairChi2, haveRedundancyChi,
        redundancyCulls);
  }

  public double[][] getStokes() {
    return StokesUtils.copyRows(stokes);
  }

  public double[][] getVariance() {
    return StokesUtils.copyRows(variance);
  }

  public boolean[] getValid() {
    return ok.clone();
  }

  /**
   * Bad pixel flags of I, Q and U: set wherever the combination is not valid
   *
   * @return three rows of bad pixel flags
   */
  public boolean[][] getBadPixel() {
    boolean[][] bpm = new boolean[stokes.length][ok.length];
    for (int f = 0; f < bpm.length; ++f) {
      for (int w = 0; w < ok.length; ++w) {
        bpm[f][w] = !ok[w];
      }
    }
    return bpm;
  }

  /**
   * True if primary and secondary measurements could be compared for at least one pair
   *
   * @return whether redundancy chi-square diagnostics exist
   */
  public boolean hasRedundancyChi() {
    return haveRedundancyChi;
  }

  /**
   * Mean primary/secondary chi-square of each pattern pair
   *
   * @return chi-square per pair, or null for a pattern without redundancy
   */
  public double[] getPairChi2() {
    return pairChi2 == null ? null : pairChi2.clone();
  }

  public int getRedundancyCulls() {
    return redundancyCulls;
  }
}
