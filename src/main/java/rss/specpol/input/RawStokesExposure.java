package rss.specpol.input;

import java.util.Locale;
import rss.specpol.utils.StokesUtils;

/**
 * One raw stokes exposure: the wavelength-calibrated O+E sum (row 0) and O-E difference (row 1)
 * for a single waveplate position pair and cycle, with variance and bad-pixel flags for each row,
 * plus the header metadata needed for combination and calibration.
 * Instances are immutable; array getters return copies.
 */
public class RawStokesExposure {

  public static final String NO_LAMP = "NONE";

  private final String fileName;
  private final ExposureName name;
  private final WavelengthGrid grid;
  private final String grating;
  private final String pattern;
  private final String lampId;
  private final double telescopePA;
  private final double trackRho;

  private final double[][] stokes;
  private final double[][] variance;
  private final boolean[][] badPixel;

  /**
   * Build an exposure from its parsed name, metadata and data rows
   *
   * @param fileName Source file (used in log messages and output naming)
   * @param name Grouping keys parsed from the name
   * @param grid Wavelength grid of the data rows
   * @param header Header metadata
   * @param stokes Two rows over wavelength: sum and difference
   * @param variance Variance of each row
   * @param badPixel Bad pixel flag of each row (true = unusable)
   */
  public RawStokesExposure(String fileName, ExposureName name, WavelengthGrid grid,
      Header header, double[][] stokes, double[][] variance, boolean[][] badPixel) {
    if (stokes.length != 2 || variance.length != 2 || badPixel.length != 2) {
      throw new IllegalArgumentException("Raw stokes must have exactly 2 rows: " + fileName);
    }
    for (int s = 0; s < 2; ++s) {
      if (stokes[s].length != grid.getLength() || variance[s].length != grid.getLength()
          || badPixel[s].length != grid.getLength()) {
        throw new IllegalArgumentException("Row length does not match wavelength grid in "
            + fileName);
      }
    }
    this.fileName = fileName;
    this.name = name;
    this.grid = grid;
    this.grating = header.grating;
    this.pattern = header.pattern.toUpperCase(Locale.ROOT);
    this.lampId = header.lampId.trim().toUpperCase(Locale.ROOT);
    this.telescopePA = header.telescopePA;
    this.trackRho = header.trackRho;
    this.stokes = StokesUtils.copyRows(stokes);
    this.variance = StokesUtils.copyRows(variance);
    this.badPixel = new boolean[][]{badPixel[0].clone(), badPixel[1].clone()};
  }

  /**
   * Get a copy of this exposure with its stokes rows replaced (e.g., after zero-point removal)
   *
   * @param newStokes replacement sum and difference rows
   * @return new exposure sharing all other values
   */
  public RawStokesExposure withStokes(double[][] newStokes) {
    Header header = new Header(grating, pattern, lampId, telescopePA, trackRho);
    return new RawStokesExposure(fileName, name, grid, header, newStokes, variance, badPixel);
  }

  public String getFileName() {
    return fileName;
  }

  public ExposureName getName() {
    return name;
  }

  public WavelengthGrid getGrid() {
    return grid;
  }

  public String getGrating() {
    return grating;
  }

  /**
   * Waveplate pattern name, upper case (e.g., "LINEAR-HI")
   *
   * @return pattern name from the header
   */
  public String getPattern() {
    return pattern;
  }

  public String getLampId() {
    return lampId;
  }

  /**
   * True if this is an exposure of a calibration lamp rather than the sky
   *
   * @return true if a lamp was in the beam
   */
  public boolean isLampExposure() {
    return !lampId.isEmpty() && !NO_LAMP.equals(lampId);
  }

  /**
   * Telescope position angle, degrees
   *
   * @return telescope PA
   */
  public double getTelescopePA() {
    return telescopePA;
  }

  /**
   * Tracker rotation angle rho, degrees
   *
   * @return tracker rho
   */
  public double getTrackRho() {
    return trackRho;
  }

  public double[][] getStokes() {
    return StokesUtils.copyRows(stokes);
  }

  public double[][] getVariance() {
    return StokesUtils.copyRows(variance);
  }

  public boolean[][] getBadPixel() {
    return new boolean[][]{badPixel[0].clone(), badPixel[1].clone()};
  }

  /**
   * Header keywords of a raw stokes exposure needed by the reduction
   */
  public static class Header {

    final String grating;
    final String pattern;
    final String lampId;
    final double telescopePA;
    final double trackRho;

    public Header(String grating, String pattern, String lampId, double telescopePA,
        double trackRho) {
      this.grating = grating;
      this.pattern = pattern;
      this.lampId = lampId;
      this.telescopePA = telescopePA;
      this.trackRho = trackRho;
    }
  }
}
