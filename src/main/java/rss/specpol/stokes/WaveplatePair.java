package rss.specpol.stokes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import rss.specpol.input.ExposureName;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.WavelengthGrid;
import rss.specpol.utils.StokesUtils;

/**
 * The cycle-combined measurement of one waveplate position pair of one object and
 * configuration: the mean of the valid cycles at each wavelength, its variance, the number of
 * cycles that contributed at each wavelength, and the cycle-consistency diagnostics.
 * Created by {@link CycleCombiner}.
 */
public class WaveplatePair {

  private final ExposureName key;
  private final RawStokesExposure reference;
  private final List<String> cycleLabels;
  private final double[][] stokes;
  private final double[][] variance;
  private final int[] cycleCount;
  private final double[] normStokes;
  private final double[] normVariance;
  private final boolean[][] culled;
  private final double[] cycleChi2;
  private final double netChi2;
  private final boolean haveCycleChi;

  WaveplatePair(RawStokesExposure reference, List<String> cycleLabels, double[][] stokes,
      double[][] variance, int[] cycleCount, double[] normStokes, double[] normVariance,
      boolean[][] culled, double[] cycleChi2, double netChi2, boolean haveCycleChi) {
    this.key = reference.getName();
    this.reference = reference;
    this.cycleLabels = Collections.unmodifiableList(new ArrayList<>(cycleLabels));
    this.stokes = stokes;
    this.variance = variance;
    this.cycleCount = cycleCount;
    this.normStokes = normStokes;
    this.normVariance = normVariance;
    this.culled = culled;
    this.cycleChi2 = cycleChi2;
    this.netChi2 = netChi2;
    this.haveCycleChi = haveCycleChi;
  }

  public String getObject() {
    return key.getObject();
  }

  public String getConfig() {
    return key.getConfig();
  }

  /**
   * Two-digit pair code of the waveplate stations (e.g. "04")
   *
   * @return pair code
   */
  public String getPairCode() {
    return key.getPairCode();
  }

  /**
   * First exposure of the pair, for header metadata (pattern, lamp, telescope PA)
   *
   * @return first raw exposure
   */
  public RawStokesExposure getReference() {
    return reference;
  }

  public WavelengthGrid getGrid() {
    return reference.getGrid();
  }

  /**
   * Cycle labels (as written in the file names) of the combined exposures, in cycle order
   *
   * @return cycle labels
   */
  public List<String> getCycleLabels() {
    return cycleLabels;
  }

  public int getCycles() {
    return cycleLabels.size();
  }

  /**
   * Combined sum (row 0) and difference (row 1)
   *
   * @return copy of the combined rows
   */
  public double[][] getStokes() {
    return StokesUtils.copyRows(stokes);
  }

  public double[][] getVariance() {
    return StokesUtils.copyRows(variance);
  }

  /**
   * Number of valid cycles at each wavelength, after culling
   *
   * @return valid cycle counts
   */
  public int[] getCycleCount() {
    return cycleCount.clone();
  }

  /**
   * True where at least one cycle is valid
   *
   * @return validity of each wavelength
   */
  public boolean[] getValid() {
    boolean[] ok = new boolean[cycleCount.length];
    for (int w = 0; w < ok.length; ++w) {
      ok[w] = cycleCount[w] > 0;
    }
    return ok;
  }

  /**
   * True where every cycle of this pair is valid
   *
   * @return wavelengths with complete data
   */
  public boolean[] getAllCyclesValid() {
    boolean[] ok = new boolean[cycleCount.length];
    for (int w = 0; w < ok.length; ++w) {
      ok[w] = cycleCount[w] == cycleLabels.size();
    }
    return ok;
  }

  /**
   * Fractional polarization (difference / sum) of the combined measurement
   *
   * @return normalized stokes, 0 where no cycle is valid
   */
  public double[] getNormStokes() {
    return normStokes.clone();
  }

  public double[] getNormVariance() {
    return normVariance.clone();
  }

  /**
   * Which cycles were culled at which wavelength by the consistency check
   *
   * @return culled flags indexed by cycle then wavelength
   */
  public boolean[][] getCulled() {
    boolean[][] out = new boolean[culled.length][];
    for (int i = 0; i < culled.length; ++i) {
      out[i] = culled[i].clone();
    }
    return out;
  }

  /**
   * Number of wavelengths at which each cycle was culled
   *
   * @return cull counts per cycle
   */
  public int[] getCullCounts() {
    int[] counts = new int[culled.length];
    for (int j = 0; j < culled.length; ++j) {
      for (boolean b : culled[j]) {
        if (b) {
          ++counts[j];
        }
      }
    }
    return counts;
  }

  /**
   * Number of wavelengths at which every cycle was culled
   *
   * @return count of fully culled wavelengths
   */
  public int getNetCulls() {
    if (culled.length == 0) {
      return 0;
    }
    int count = 0;
    for (int w = 0; w < culled[0].length; ++w) {
      boolean all = true;
      for (boolean[] cycle : culled) {
        all &= cycle[w];
      }
      if (all) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Mean chi-square of each cycle against the combined value, over its valid wavelengths
   *
   * @return chi-square per cycle (0 when not available)
   */
  public double[] getCycleChi2() {
    return cycleChi2.clone();
  }

  /**
   * Mean chi-square of all cycles against the combined value
   *
   * @return net mean chi-square (0 when not available)
   */
  public double getNetChi2() {
    return netChi2;
  }

  /**
   * True if at least one wavelength had two valid cycles to compare
   *
   * @return whether cycle chi-square diagnostics exist
   */
  public boolean hasCycleChi() {
    return haveCycleChi;
  }
}
