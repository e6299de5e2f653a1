package rss.specpol.output;

import java.util.Locale;
import org.apache.commons.math3.util.FastMath;
import rss.specpol.utils.NumericUtils;

/**
 * Summary of a final stokes spectrum as a single normalized stokes vector: the mean of
 * q = Q/I and u = U/I over the valid wavelengths, each wavelength weighted by the inverse of its
 * mean q, u variance, with the propagated variance, the weighted mean wavelength and the
 * derived degree and position angle of polarization. Used only for reporting.
 */
public class WeightedStokes {

  private final double wavelength;
  private final double q;
  private final double u;
  private final double varQ;
  private final double varU;
  private final double covQU;
  private final int count;

  private WeightedStokes(double wavelength, double q, double u, double varQ, double varU,
      double covQU, int count) {
    this.wavelength = wavelength;
    this.q = q;
    this.u = u;
    this.varQ = varQ;
    this.varU = varU;
    this.covQU = covQU;
    this.count = count;
  }

  /**
   * Weighted average of a final spectrum's valid wavelengths
   *
   * @param spectrum final stokes spectrum
   * @return weighted average; {@link #isValid()} is false if no wavelength could be used
   */
  public static WeightedStokes average(FinalStokesSpectrum spectrum) {
    return average(spectrum.getStokes(), spectrum.getVariance(), spectrum.getValid(),
        spectrum.getGrid().getWavelengths());
  }

  /**
   * Weighted average of unnormalized stokes rows
   *
   * @param stokes I, Q, U rows
   * @param variance I, Q, U variance rows and QU covariance row
   * @param ok wavelengths to include
   * @param wavelengths wavelength of each sample
   * @return weighted average
   */
  public static WeightedStokes average(double[][] stokes, double[][] variance, boolean[] ok,
      double[] wavelengths) {
    double sumWeight = 0.;
    double sumWav = 0.;
    double sumQ = 0.;
    double sumU = 0.;
    double sumVarQ = 0.;
    double sumVarU = 0.;
    double sumCov = 0.;
    int count = 0;
    for (int w = 0; w < ok.length; ++w) {
      if (!ok[w] || stokes[0][w] == 0.) {
        continue;
      }
      double i2 = stokes[0][w] * stokes[0][w];
      double vq = variance[1][w] / i2;
      double vu = variance[2][w] / i2;
      double meanVar = 0.5 * (vq + vu);
      if (!(meanVar > 0.)) {
        continue;
      }
      double weight = 1. / meanVar;
      sumWeight += weight;
      sumWav += weight * wavelengths[w];
      sumQ += weight * stokes[1][w] / stokes[0][w];
      sumU += weight * stokes[2][w] / stokes[0][w];
      sumVarQ += weight * weight * vq;
      sumVarU += weight * weight * vu;
      sumCov += weight * weight * variance[3][w] / i2;
      ++count;
    }
    if (count == 0) {
      return new WeightedStokes(Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
          Double.NaN, 0);
    }
    double norm = sumWeight * sumWeight;
    return new WeightedStokes(sumWav / sumWeight, sumQ / sumWeight, sumU / sumWeight,
        sumVarQ / norm, sumVarU / norm, sumCov / norm, count);
  }

  public boolean isValid() {
    return count > 0;
  }

  public int getCount() {
    return count;
  }

  public double getWavelength() {
    return wavelength;
  }

  public double getQ() {
    return q;
  }

  public double getU() {
    return u;
  }

  public double getVarianceQ() {
    return varQ;
  }

  public double getVarianceU() {
    return varU;
  }

  public double getCovarianceQU() {
    return covQU;
  }

  /**
   * Degree of linear polarization, percent
   *
   * @return 100 sqrt(q^2 + u^2)
   */
  public double getPolarizationPercent() {
    return 100. * FastMath.hypot(q, u);
  }

  /**
   * Error of the degree of polarization, percent
   *
   * @return propagated error
   */
  public double getPolarizationPercentError() {
    double p = FastMath.hypot(q, u);
    if (p == 0.) {
      return 100. * FastMath.sqrt(0.5 * (varQ + varU));
    }
    double var = (q * q * varQ + u * u * varU + 2. * q * u * covQU) / (p * p);
    return 100. * FastMath.sqrt(var);
  }

  /**
   * Position angle of polarization in degrees, in [0, 180)
   *
   * @return position angle
   */
  public double getPositionAngle() {
    double pa = 0.5 * FastMath.toDegrees(FastMath.atan2(u, q));
    return NumericUtils.wrapPositionAngle(pa, 90.);
  }

  /**
   * Error of the position angle in degrees
   *
   * @return position angle error
   */
  public double getPositionAngleError() {
    double p = getPolarizationPercent();
    if (p == 0.) {
      return 90.;
    }
    return FastMath.toDegrees(0.5 * getPolarizationPercentError() / p);
  }

  /**
   * Table of the weighted averages for the log
   *
   * @return two-line table (header and values)
   */
  public String getReport() {
    if (!isValid()) {
      return "   No valid wavelengths to average";
    }
    String header = String.format(Locale.ROOT, "%12s %8s %7s %8s %7s %8s %7s %8s %7s",
        "Wavl", "%P", "err", "PA", "err", "%Q", "err", "%U", "err");
    String values = String.format(Locale.ROOT,
        "%12.2f %8.4f %7.4f %8.3f %7.3f %8.4f %7.4f %8.4f %7.4f",
        wavelength, getPolarizationPercent(), getPolarizationPercentError(),
        getPositionAngle(), getPositionAngleError(), 100. * q, 100. * FastMath.sqrt(varQ),
        100. * u, 100. * FastMath.sqrt(varU));
    return header + "\n" + values;
  }

  @Override
  public String toString() {
    return getReport();
  }
}
