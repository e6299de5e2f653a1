package rss.specpol.utils;

import java.util.Arrays;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;

/**
 * Static operations on Stokes spectra held as row arrays over wavelength. Unnormalized spectra
 * keep intensity in row 0, followed by Q and U (and optionally V); their variance arrays hold
 * I, Q, U, the QU covariance and optionally V. Normalized spectra drop the intensity row so
 * Q starts at index 0.
 */
public class StokesUtils {

  /**
   * Rotate the linear polarization of a Stokes spectrum and its variance by a
   * wavelength-dependent position angle. The rotation is by twice the angle in Stokes space,
   * so a PA change of 90 degrees flips the sign of both Q and U.
   *
   * The variance and QU covariance propagate through the full rotation, so that rotating by an
   * angle and then by its negative returns the original variance.
   * Input arrays are not modified.
   *
   * @param stokes Stokes rows ([I,] Q, U [, V]) indexed by wavelength
   * @param variance Variance rows ([I,] Q, U, QU covariance [, V]) indexed by wavelength
   * @param paDegrees Position angle to rotate by, in degrees. Either one value per wavelength
   * or a single value applied to all wavelengths
   * @param normalized True if no intensity row is present
   * @return Pair of rotated stokes and rotated variance (new arrays)
   */
  public static Pair<double[][], double[][]> rotate(double[][] stokes, double[][] variance,
      double[] paDegrees, boolean normalized) {

    int qIdx = normalized ? 0 : 1;
    int wavs = stokes[qIdx].length;
    double[] pa = paDegrees;
    if (pa.length == 1 && wavs != 1) {
      pa = new double[wavs];
      Arrays.fill(pa, paDegrees[0]);
    }
    if (pa.length != wavs) {
      throw new IllegalArgumentException("Rotation angle length " + pa.length
          + " does not match spectrum length " + wavs);
    }

    double[][] stokesOut = copyRows(stokes);
    double[][] varOut = copyRows(variance);

    for (int w = 0; w < wavs; ++w) {
      double twoTheta = 2. * FastMath.toRadians(pa[w]);
      double c = FastMath.cos(twoTheta);
      double s = FastMath.sin(twoTheta);

      double q = stokes[qIdx][w];
      double u = stokes[qIdx + 1][w];
      stokesOut[qIdx][w] = q * c - u * s;
      stokesOut[qIdx + 1][w] = q * s + u * c;

      double varQ = variance[qIdx][w];
      double varU = variance[qIdx + 1][w];
      double covQU = variance[qIdx + 2][w];
      varOut[qIdx][w] = varQ * c * c + varU * s * s - 2. * c * s * covQU;
      varOut[qIdx + 1][w] = varQ * s * s + varU * c * c + 2. * c * s * covQU;
      varOut[qIdx + 2][w] = c * s * (varQ - varU) + (c * c - s * s) * covQU;
    }

    return new Pair<>(stokesOut, varOut);
  }

  /**
   * Rotate a normalized (q, u) spectrum with no variance, as used for zero-point curves
   *
   * @param qu Two rows, q and u
   * @param paDegrees Position angle per wavelength, degrees
   * @return New q, u rows
   */
  public static double[][] rotateNormalized(double[][] qu, double[] paDegrees) {
    int wavs = qu[0].length;
    double[][] zeroVariance = new double[3][wavs];
    return rotate(qu, zeroVariance, paDegrees, true).getFirst();
  }

  /**
   * Deep copy of a two-dimensional array
   *
   * @param rows Rows to copy
   * @return New array with copied rows
   */
  public static double[][] copyRows(double[][] rows) {
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = rows[i].clone();
    }
    return out;
  }

  /**
   * Fractional polarization of a difference row relative to an intensity row
   *
   * @param intensity Intensity-like row
   * @param difference O-E difference row
   * @param ok Wavelengths to evaluate; others are left at zero
   * @return difference / intensity where ok
   */
  public static double[] normalize(double[] intensity, double[] difference, boolean[] ok) {
    double[] out = new double[intensity.length];
    for (int w = 0; w < out.length; ++w) {
      if (ok[w]) {
        out[w] = difference[w] / intensity[w];
      }
    }
    return out;
  }

  /**
   * Variance of a fractional polarization, neglecting intensity error
   *
   * @param intensity Intensity-like row
   * @param differenceVariance Variance of the difference row
   * @param ok Wavelengths to evaluate; others are left at zero
   * @return variance / intensity^2 where ok
   */
  public static double[] normalizeVariance(double[] intensity, double[] differenceVariance,
      boolean[] ok) {
    double[] out = new double[intensity.length];
    for (int w = 0; w < out.length; ++w) {
      if (ok[w]) {
        out[w] = differenceVariance[w] / (intensity[w] * intensity[w]);
      }
    }
    return out;
  }
}
