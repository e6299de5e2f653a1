package rss.specpol.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import rss.specpol.input.WavelengthGrid;
import rss.specpol.utils.StokesUtils;

/**
 * The final stokes spectrum of one observation: I, Q, U over the configuration's wavelength
 * grid, their variance and QU covariance, bad pixel flags, and the metadata needed to use it
 * (pattern, PA frame, estimated systematic error and calibration history).
 */
public class FinalStokesSpectrum {

  private final String name;
  private final String object;
  private final WavelengthGrid grid;
  private final double[][] stokes;
  private final double[][] variance;
  private final boolean[][] badPixel;
  private final String pattern;
  private final FrameType frame;
  private final double systematicErrorPercent;
  private final List<String> provenance;

  /**
   * Assemble a final spectrum
   *
   * @param name observation name, from which the output file is named
   * @param object object name
   * @param grid wavelength grid
   * @param stokes I, Q, U rows
   * @param variance I, Q, U variance rows followed by the QU covariance row
   * @param badPixel I, Q, U bad pixel rows (true = unusable)
   * @param pattern waveplate pattern name
   * @param frame frame of Q and U
   * @param systematicErrorPercent estimated systematic error, percent
   * @param provenance calibration history lines
   */
  public FinalStokesSpectrum(String name, String object, WavelengthGrid grid, double[][] stokes,
      double[][] variance, boolean[][] badPixel, String pattern, FrameType frame,
      double systematicErrorPercent, List<String> provenance) {
    if (stokes.length != 3 || variance.length != 4 || badPixel.length != 3) {
      throw new IllegalArgumentException("Final stokes needs I,Q,U with variance I,Q,U,QU");
    }
    this.name = name;
    this.object = object;
    this.grid = grid;
    this.stokes = StokesUtils.copyRows(stokes);
    this.variance = StokesUtils.copyRows(variance);
    this.badPixel = new boolean[3][];
    for (int f = 0; f < 3; ++f) {
      this.badPixel[f] = badPixel[f].clone();
    }
    this.pattern = pattern;
    this.frame = frame;
    this.systematicErrorPercent = systematicErrorPercent;
    this.provenance = Collections.unmodifiableList(new ArrayList<>(provenance));
  }

  public String getName() {
    return name;
  }

  public String getObject() {
    return object;
  }

  public WavelengthGrid getGrid() {
    return grid;
  }

  /**
   * Stokes I, Q, U
   *
   * @return copy of the three stokes rows
   */
  public double[][] getStokes() {
    return StokesUtils.copyRows(stokes);
  }

  /**
   * Variance of I, Q, U and the QU covariance
   *
   * @return copy of the four variance rows
   */
  public double[][] getVariance() {
    return StokesUtils.copyRows(variance);
  }

  public boolean[][] getBadPixel() {
    boolean[][] out = new boolean[3][];
    for (int f = 0; f < 3; ++f) {
      out[f] = badPixel[f].clone();
    }
    return out;
  }

  /**
   * Wavelengths where I, Q and U are all good
   *
   * @return validity per wavelength
   */
  public boolean[] getValid() {
    boolean[] ok = new boolean[grid.getLength()];
    for (int w = 0; w < ok.length; ++w) {
      ok[w] = !badPixel[0][w] && !badPixel[1][w] && !badPixel[2][w];
    }
    return ok;
  }

  public String getPattern() {
    return pattern;
  }

  public FrameType getFrame() {
    return frame;
  }

  public double getSystematicErrorPercent() {
    return systematicErrorPercent;
  }

  public List<String> getProvenance() {
    return provenance;
  }

  /**
   * Name of the text file the spectrum is written to
   *
   * @return file name
   */
  public String getFileName() {
    return name + "_stokes.txt";
  }
}
