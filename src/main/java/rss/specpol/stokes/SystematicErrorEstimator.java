package rss.specpol.stokes;

import org.apache.commons.math3.util.FastMath;

/**
 * Estimates the systematic error of an observation from the excess of its mean chi-square
 * (per degree of freedom) over 1. If the excess is more than three times the expected spread
 * {@code sqrt(2/dof)}, the systematic fractional error that, added in quadrature to the
 * statistical variance of q, would explain it is {@code sqrt(dof (chi2 - 1) / sum(1 / var(q)))}.
 * The estimate is a diagnostic and is not added to the output variance.
 */
public class SystematicErrorEstimator {

  private final double meanChi2;
  private final double systematicError;
  private final int dof;

  private SystematicErrorEstimator(double meanChi2, double systematicError, int dof) {
    this.meanChi2 = meanChi2;
    this.systematicError = systematicError;
    this.dof = dof;
  }

  /**
   * Estimate the systematic error of combined, uncalibrated stokes
   *
   * @param pairChi2 mean chi-square of each pattern pair; zero entries are not available
   * @param combined combined stokes of the observation
   * @return estimate
   */
  public static SystematicErrorEstimator estimate(double[] pairChi2, CombinedStokes combined) {
    double sum = 0.;
    int count = 0;
    for (double chi2 : pairChi2) {
      if (chi2 != 0.) {
        sum += chi2;
        ++count;
      }
    }
    double mean = count > 0 ? sum / count : 0.;

    boolean[] ok = combined.getValid();
    double[][] stokes = combined.getStokes();
    double[][] variance = combined.getVariance();
    int dof = 0;
    double weights = 0.;
    for (int w = 0; w < ok.length; ++w) {
      if (ok[w]) {
        ++dof;
        double i = stokes[0][w];
        weights += i * i / variance[1][w];
      }
    }

    double syserr = 0.;
    if (dof > 0) {
      double spread = FastMath.sqrt(2. / dof);
      if (mean - 1. > 3. * spread && weights > 0.) {
        syserr = FastMath.sqrt(dof * (mean - 1.) / weights);
      }
    }
    return new SystematicErrorEstimator(mean, syserr, dof);
  }

  /**
   * Mean of the available pair chi-squares
   *
   * @return mean chi-square, 0 if none is available
   */
  public double getMeanChi2() {
    return meanChi2;
  }

  /**
   * Estimated systematic error of the normalized stokes (a fraction, not percent)
   *
   * @return systematic error, 0 if the chi-square shows no significant excess
   */
  public double getSystematicError() {
    return systematicError;
  }

  public int getDegreesOfFreedom() {
    return dof;
  }
}
