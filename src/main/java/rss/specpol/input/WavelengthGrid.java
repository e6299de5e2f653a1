package rss.specpol.input;

/**
 * Linear wavelength grid shared by all spectra of one configuration: a start wavelength,
 * a constant step and a number of samples (FITS CRVAL1, CDELT1, NAXIS1)
 */
public class WavelengthGrid {

  private final double start;
  private final double step;
  private final int length;

  public WavelengthGrid(double start, double step, int length) {
    if (length < 1) {
      throw new IllegalArgumentException("Wavelength grid must have at least one sample");
    }
    this.start = start;
    this.step = step;
    this.length = length;
  }

  public double getStart() {
    return start;
  }

  public double getStep() {
    return step;
  }

  public int getLength() {
    return length;
  }

  /**
   * Get the wavelength of each sample
   *
   * @return start + step * i for each sample i
   */
  public double[] getWavelengths() {
    double[] wavs = new double[length];
    for (int i = 0; i < length; ++i) {
      wavs[i] = start + step * i;
    }
    return wavs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WavelengthGrid)) {
      return false;
    }
    WavelengthGrid other = (WavelengthGrid) o;
    return Double.compare(start, other.start) == 0
        && Double.compare(step, other.step) == 0
        && length == other.length;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(start);
    result = 31 * result + Double.hashCode(step);
    result = 31 * result + length;
    return result;
  }

  @Override
  public String toString() {
    return start + " + " + step + " * [0, " + length + ")";
  }
}
