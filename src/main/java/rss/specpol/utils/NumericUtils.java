package rss.specpol.utils;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Class containing methods to serve as math functions over masked spectra,
 * mainly statistics restricted to valid wavelengths and angle wrapping
 */
public class NumericUtils {

  /**
   * Percentile of the values at the masked positions. Uses linear interpolation between closest
   * ranks, which is the estimation used by most array-processing libraries (R-7).
   *
   * @param values Data to take the percentile of
   * @param mask Positions to include
   * @param p Percentile, in (0, 100]
   * @return Percentile value, or 0 if the mask selects nothing
   */
  public static double maskedPercentile(double[] values, boolean[] mask, double p) {
    double[] selected = select(values, mask);
    if (selected.length == 0) {
      return 0.;
    }
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    return percentile.evaluate(selected, p);
  }

  /**
   * Number of true entries in a mask
   *
   * @param mask Mask to count
   * @return count of true values
   */
  public static int count(boolean[] mask) {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        ++count;
      }
    }
    return count;
  }

  /**
   * Extract the masked values into a new, dense array
   *
   * @param values Data to select from
   * @param mask Positions to include
   * @return The selected values in original order
   */
  public static double[] select(double[] values, boolean[] mask) {
    double[] out = new double[count(mask)];
    int idx = 0;
    for (int i = 0; i < values.length; ++i) {
      if (mask[i]) {
        out[idx] = values[i];
        ++idx;
      }
    }
    return out;
  }

  /**
   * Wrap a position angle in degrees into the range [center - 90, center + 90)
   *
   * @param angle in degrees
   * @param center center of the wrapped range, in degrees
   * @return same position angle (modulo 180) in the given range
   */
  public static double wrapPositionAngle(double angle, double center) {
    double low = center - 90.;
    double wrapped = ((angle - low) % 180. + 180.) % 180.;
    return wrapped + low;
  }
}
