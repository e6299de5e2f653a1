package rss.specpol.stokes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.WavelengthGrid;
import rss.specpol.utils.StokesUtils;

/**
 * Combines the repeat cycles of one waveplate position pair into a single measurement,
 * removing cycles that are statistically inconsistent with the others.
 *
 * Every pair of cycles is compared at each wavelength where at least two cycles are valid,
 * using the chi-square (1 degree of freedom) of the difference of their fractional
 * polarizations. A wavelength is bad if any comparison exceeds {@link #CHI2_LIMIT}
 * (P &lt; 0.05%, 1 in 2000). At a bad wavelength with fewer than three comparisons (that is,
 * fewer than three valid cycles) no culprit can be singled out and every cycle is flagged.
 * Otherwise one cycle is culled by vote: the comparisons are ordered by increasing chi-square
 * (ties by lower first cycle index, then lower second cycle index), the cycles are listed in
 * order of their first appearance, and the cycle that appears last, i.e. only in the worst
 * comparisons, is culled. If a comparison between the remaining cycles still exceeds the limit,
 * the disagreement has no single culprit and every cycle is flagged at that wavelength.
 */
public class CycleCombiner {

  /**
   * Chi-square limit (1 dof) above which two cycles are considered inconsistent
   */
  public static final double CHI2_LIMIT = 12.2;

  /**
   * Combine the cycles of one waveplate position pair
   *
   * @param exposures Raw stokes exposures of one object, configuration and waveplate position
   * @return combined pair with diagnostics
   */
  public static WaveplatePair combine(List<RawStokesExposure> exposures) {
    if (exposures.isEmpty()) {
      throw new IllegalArgumentException("No exposures to combine");
    }
    List<RawStokesExposure> sorted = new ArrayList<>(exposures);
    sorted.sort(Comparator.comparingInt(e -> e.getName().getCycle()));
    RawStokesExposure first = sorted.get(0);
    WavelengthGrid grid = first.getGrid();
    for (RawStokesExposure exposure : sorted) {
      if (!exposure.getGrid().equals(grid)) {
        throw new IllegalArgumentException("Wavelength grid of " + exposure.getFileName()
            + " does not match " + first.getFileName());
      }
      if (!exposure.getName().getObject().equals(first.getName().getObject())
          || !exposure.getName().getConfig().equals(first.getName().getConfig())
          || !exposure.getName().getWaveplate().equals(first.getName().getWaveplate())) {
        throw new IllegalArgumentException(exposure.getFileName()
            + " does not belong to waveplate pair " + first.getName());
      }
    }

    int cycles = sorted.size();
    int wavs = grid.getLength();
    double[][][] stokes = new double[cycles][][];
    double[][][] variance = new double[cycles][][];
    boolean[][] bad = new boolean[cycles][];
    List<String> labels = new ArrayList<>();
    for (int j = 0; j < cycles; ++j) {
      RawStokesExposure exposure = sorted.get(j);
      stokes[j] = exposure.getStokes();
      variance[j] = exposure.getVariance();
      // a cycle is usable where its intensity row is good
      bad[j] = exposure.getBadPixel()[0];
      labels.add(exposure.getName().getCycleLabel());
    }

    boolean[][] culled = new boolean[cycles][wavs];
    int[] initialCount = countValid(bad, wavs);
    boolean haveCycleChi = false;
    for (int count : initialCount) {
      haveCycleChi |= count > 1;
    }

    if (cycles > 1) {
      cull(stokes, variance, bad, culled, initialCount);
    }

    // mean of valid cycles
    int[] count = countValid(bad, wavs);
    double[][] meanStokes = new double[2][wavs];
    double[][] meanVariance = new double[2][wavs];
    for (int w = 0; w < wavs; ++w) {
      if (count[w] == 0) {
        continue;
      }
      for (int s = 0; s < 2; ++s) {
        double sum = 0.;
        double varSum = 0.;
        for (int j = 0; j < cycles; ++j) {
          if (!bad[j][w]) {
            sum += stokes[j][s][w];
            varSum += variance[j][s][w];
          }
        }
        meanStokes[s][w] = sum / count[w];
        meanVariance[s][w] = varSum / ((double) count[w] * count[w]);
      }
    }

    boolean[] ok = new boolean[wavs];
    for (int w = 0; w < wavs; ++w) {
      ok[w] = count[w] > 0;
    }
    double[] normStokes = StokesUtils.normalize(meanStokes[0], meanStokes[1], ok);
    double[] normVariance = StokesUtils.normalizeVariance(meanStokes[0], meanVariance[1], ok);

    // chi-square of each surviving cycle against the combined value
    double[] cycleChi2 = new double[cycles];
    double netChi2 = 0.;
    if (cycles > 1) {
      double netSum = 0.;
      int netCount = 0;
      for (int j = 0; j < cycles; ++j) {
        double cycleSum = 0.;
        int cycleCount = 0;
        for (int w = 0; w < wavs; ++w) {
          if (count[w] < 2 || bad[j][w]) {
            continue;
          }
          double n = stokes[j][1][w] / stokes[j][0][w];
          double nVar = variance[j][1][w] / (stokes[j][0][w] * stokes[j][0][w]);
          double denominator = nVar - normVariance[w];
          if (!(denominator > 0.)) {
            continue;
          }
          double chi2 = (n - normStokes[w]) * (n - normStokes[w]) / denominator;
          cycleSum += chi2;
          ++cycleCount;
        }
        if (cycleCount > 0) {
          cycleChi2[j] = cycleSum / cycleCount;
        }
        netSum += cycleSum;
        netCount += cycleCount;
      }
      if (netCount > 0) {
        netChi2 = netSum / netCount;
      }
    }

    return new WaveplatePair(first, labels, meanStokes, meanVariance, count, normStokes,
        normVariance, culled, cycleChi2, netChi2, haveCycleChi);
  }

  /**
   * Flag inconsistent cycles. Updates the bad and culled flags in place.
   */
  private static void cull(double[][][] stokes, double[][][] variance, boolean[][] bad,
      boolean[][] culled, int[] count) {
    int cycles = stokes.length;
    int wavs = count.length;

    double[][] norm = new double[cycles][wavs];
    double[][] normVar = new double[cycles][wavs];
    boolean[][] ok = new boolean[cycles][wavs];
    for (int j = 0; j < cycles; ++j) {
      for (int w = 0; w < wavs; ++w) {
        ok[j][w] = count[w] > 1 && !bad[j][w];
      }
      norm[j] = StokesUtils.normalize(stokes[j][0], stokes[j][1], ok[j]);
      normVar[j] = StokesUtils.normalizeVariance(stokes[j][0], variance[j][1], ok[j]);
    }

    List<CycleComparison> comparisons = new ArrayList<>();
    for (int j1 = 0; j1 < cycles; ++j1) {
      for (int j2 = j1 + 1; j2 < cycles; ++j2) {
        comparisons.add(new CycleComparison(j1, j2, norm, normVar, ok));
      }
    }

    for (int w = 0; w < wavs; ++w) {
      List<CycleComparison> valid = new ArrayList<>();
      boolean badWavelength = false;
      for (CycleComparison comparison : comparisons) {
        if (comparison.ok[w]) {
          valid.add(comparison);
          badWavelength |= comparison.chi2[w] > CHI2_LIMIT;
        }
      }
      if (!badWavelength) {
        continue;
      }

      if (valid.size() < 3) {
        flagAll(bad, culled, w);
        continue;
      }

      int cullIndex = vote(valid, w);
      bad[cullIndex][w] = true;
      culled[cullIndex][w] = true;

      for (CycleComparison comparison : valid) {
        if (comparison.first != cullIndex && comparison.second != cullIndex
            && comparison.chi2[w] > CHI2_LIMIT) {
          flagAll(bad, culled, w);
          break;
        }
      }
    }
  }

  /**
   * Pick the cycle to cull at a wavelength: the cycle that first appears latest when the
   * comparisons are listed by increasing chi-square
   *
   * @param comparisons valid comparisons at the wavelength
   * @param w wavelength index
   * @return index of the cycle to cull
   */
  static int vote(List<CycleComparison> comparisons, int w) {
    List<CycleComparison> ordered = new ArrayList<>(comparisons);
    ordered.sort(CycleComparison.orderAt(w));
    Set<Integer> seen = new LinkedHashSet<>();
    for (CycleComparison comparison : ordered) {
      seen.add(comparison.first);
      seen.add(comparison.second);
    }
    int last = -1;
    for (int cycle : seen) {
      last = cycle;
    }
    return last;
  }

  private static void flagAll(boolean[][] bad, boolean[][] culled, int w) {
    for (int j = 0; j < bad.length; ++j) {
      if (!bad[j][w]) {
        culled[j][w] = true;
      }
      bad[j][w] = true;
    }
  }

  private static int[] countValid(boolean[][] bad, int wavs) {
    int[] count = new int[wavs];
    for (boolean[] cycle : bad) {
      for (int w = 0; w < wavs; ++w) {
        if (!cycle[w]) {
          ++count[w];
        }
      }
    }
    return count;
  }

  /**
   * Chi-square of the difference between two cycles' fractional polarization at each wavelength
   */
  static class CycleComparison {

    final int first;
    final int second;
    final double[] chi2;
    final boolean[] ok;

    CycleComparison(int first, int second, double[][] norm, double[][] normVar,
        boolean[][] valid) {
      this.first = first;
      this.second = second;
      int wavs = norm[first].length;
      chi2 = new double[wavs];
      ok = new boolean[wavs];
      for (int w = 0; w < wavs; ++w) {
        ok[w] = valid[first][w] && valid[second][w];
        if (ok[w]) {
          double diff = norm[first][w] - norm[second][w];
          double var = normVar[first][w] + normVar[second][w];
          if (var > 0.) {
            chi2[w] = diff * diff / var;
          } else {
            // noiseless cycles either agree exactly or are inconsistent
            chi2[w] = diff == 0. ? 0. : Double.POSITIVE_INFINITY;
          }
        }
      }
    }

    /**
     * Order by increasing chi-square at a wavelength; ties by cycle indices
     *
     * @param w wavelength index
     * @return comparator
     */
    static Comparator<CycleComparison> orderAt(int w) {
      Comparator<CycleComparison> byChi2 = Comparator.comparingDouble(c -> c.chi2[w]);
      return byChi2.thenComparingInt(c -> c.first).thenComparingInt(c -> c.second);
    }
  }
}
