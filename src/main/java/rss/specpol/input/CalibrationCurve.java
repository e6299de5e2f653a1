package rss.specpol.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.interpolation.UnivariateInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * A wavelength-sampled calibration table: one strictly increasing wavelength column followed by
 * one or more value columns (e.g. half-wave plate efficiency and PA, or telescope q and u
 * zero-points). Values are sampled on other wavelength grids by cubic spline interpolation.
 * Wavelengths outside the table, or inside a table interval with a missing (non-finite) sample,
 * have no calibration and are returned as NaN; the table is never extrapolated.
 */
public class CalibrationCurve {

  private final String name;
  private final double[] wavelengths;
  private final double[][] columns;

  /**
   * Create a calibration curve from in-memory samples
   *
   * @param name Name identifying the table (usually the file name, which carries its version)
   * @param wavelengths Sample wavelengths, strictly increasing
   * @param columns Value columns, each the same length as the wavelengths
   */
  public CalibrationCurve(String name, double[] wavelengths, double[]... columns) {
    if (wavelengths.length < 2) {
      throw new IllegalArgumentException("Calibration table " + name
          + " needs at least 2 samples");
    }
    for (int i = 1; i < wavelengths.length; ++i) {
      if (!(wavelengths[i] > wavelengths[i - 1])) {
        throw new IllegalArgumentException("Wavelengths of calibration table " + name
            + " are not strictly increasing at row " + i);
      }
    }
    for (double[] column : columns) {
      if (column.length != wavelengths.length) {
        throw new IllegalArgumentException("Column length mismatch in calibration table " + name);
      }
    }
    this.name = name;
    this.wavelengths = wavelengths.clone();
    this.columns = new double[columns.length][];
    for (int i = 0; i < columns.length; ++i) {
      this.columns[i] = columns[i].clone();
    }
  }

  /**
   * Load a calibration table from a whitespace-delimited text file. Lines starting with '#' are
   * comments. The first column is wavelength; all rows must have the same number of columns.
   *
   * @param file File to read
   * @return calibration curve named after the file
   * @throws IOException if the file cannot be read or has malformed rows
   */
  public static CalibrationCurve load(File file) throws IOException {
    List<double[]> rows = new ArrayList<>();
    int width = -1;
    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      String line;
      while ((line = br.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] args = line.split("\\s+");
        if (width < 0) {
          width = args.length;
        } else if (args.length != width) {
          throw new IOException("Inconsistent number of columns in calibration file "
              + file.getName());
        }
        double[] row = new double[width];
        for (int i = 0; i < width; ++i) {
          try {
            row[i] = Double.parseDouble(args[i]);
          } catch (NumberFormatException e) {
            throw new IOException("Could not parse value " + args[i] + " in calibration file "
                + file.getName(), e);
          }
        }
        rows.add(row);
      }
    }
    if (width < 2) {
      throw new IOException("Calibration file " + file.getName() + " has no value columns");
    }

    double[] wavs = new double[rows.size()];
    double[][] values = new double[width - 1][rows.size()];
    for (int l = 0; l < rows.size(); ++l) {
      double[] row = rows.get(l);
      wavs[l] = row[0];
      for (int c = 1; c < width; ++c) {
        values[c - 1][l] = row[c];
      }
    }
    return new CalibrationCurve(file.getName(), wavs, values);
  }

  public String getName() {
    return name;
  }

  public int getColumnCount() {
    return columns.length;
  }

  public double[] getWavelengths() {
    return wavelengths.clone();
  }

  /**
   * Interpolate one value column onto the given wavelengths
   *
   * @param column Value column index (0 is the first column after wavelength)
   * @param wavs Wavelengths to sample at
   * @return interpolated values, NaN where the table has no value
   */
  public double[] sample(int column, double[] wavs) {
    double[] values = columns[column];

    double[] finiteX = new double[values.length];
    double[] finiteY = new double[values.length];
    int finite = 0;
    for (int l = 0; l < values.length; ++l) {
      if (Double.isFinite(values[l])) {
        finiteX[finite] = wavelengths[l];
        finiteY[finite] = values[l];
        ++finite;
      }
    }

    double[] out = new double[wavs.length];
    Arrays.fill(out, Double.NaN);
    if (finite < 2) {
      return out;
    }
    finiteX = Arrays.copyOf(finiteX, finite);
    finiteY = Arrays.copyOf(finiteY, finite);

    // natural cubic spline needs 3 knots, fall back to a straight line between two
    UnivariateInterpolator interpolator =
        finite > 2 ? new SplineInterpolator() : new LinearInterpolator();
    PolynomialSplineFunction function =
        (PolynomialSplineFunction) interpolator.interpolate(finiteX, finiteY);

    int last = wavelengths.length - 1;
    for (int w = 0; w < wavs.length; ++w) {
      double x = wavs[w];
      if (!(x >= wavelengths[0] && x <= wavelengths[last])) {
        continue;
      }
      int idx = Arrays.binarySearch(wavelengths, x);
      if (idx >= 0) {
        if (Double.isFinite(values[idx])) {
          out[w] = values[idx];
        }
        continue;
      }
      int upper = -idx - 1;
      int lower = upper - 1;
      if (Double.isFinite(values[lower]) && Double.isFinite(values[upper])) {
        out[w] = function.value(x);
      }
    }
    return out;
  }
}
