package rss.specpol.input;

import java.io.File;
import java.util.Arrays;

/**
 * Grouping keys of a raw stokes file, parsed from its name. Raw stokes files are named
 * {@code object_config_hNN_cycle.ext}, where the configuration starts with 'c', the waveplate
 * position code starts with 'h' and is followed by the two half-wave plate stations making up
 * the pair, and the cycle is a (1-based) number. The object name itself may contain underscores.
 */
public class ExposureName {

  private final String object;
  private final String config;
  private final String waveplate;
  private final String cycle;

  public ExposureName(String object, String config, String waveplate, String cycle) {
    this.object = object;
    this.config = config;
    this.waveplate = waveplate;
    this.cycle = cycle;
  }

  /**
   * Parse the grouping keys out of a file path
   *
   * @param path File path or name of a raw stokes file
   * @return parsed name
   * @throws ExposureNameFormatException if the name does not follow the raw stokes convention
   */
  public static ExposureName parse(String path) throws ExposureNameFormatException {
    String base = new File(path).getName();
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    String[] parts = base.split("_");
    if (parts.length < 4) {
      throw new ExposureNameFormatException("File " + path + " is not a raw stokes file.");
    }
    int n = parts.length;
    String cycle = parts[n - 1];
    String waveplate = parts[n - 2];
    String config = parts[n - 3];
    String object = String.join("_", Arrays.copyOfRange(parts, 0, n - 3));

    if (object.isEmpty() || !config.startsWith("c") || !waveplate.startsWith("h")
        || waveplate.length() < 3 || cycle.isEmpty() || !cycle.chars().allMatch(Character::isDigit)
        || !Character.isDigit(waveplate.charAt(1))) {
      throw new ExposureNameFormatException("File " + path + " is not a raw stokes file.");
    }
    return new ExposureName(object, config, waveplate, cycle);
  }

  public String getObject() {
    return object;
  }

  public String getConfig() {
    return config;
  }

  /**
   * Full waveplate position code, including the leading 'h' (e.g. "h04")
   *
   * @return waveplate code
   */
  public String getWaveplate() {
    return waveplate;
  }

  /**
   * Waveplate pair code without the leading 'h' (e.g. "04"), as listed in pattern tables
   *
   * @return pair code
   */
  public String getPairCode() {
    return waveplate.substring(1);
  }

  /**
   * Half-wave plate station of the first exposure of the pair; each station is 22.5 degrees of
   * polarization angle (11.25 degrees of plate rotation)
   *
   * @return first station number
   */
  public int getFirstStation() {
    return Character.getNumericValue(waveplate.charAt(1));
  }

  /**
   * Cycle as written in the file name
   *
   * @return cycle string
   */
  public String getCycleLabel() {
    return cycle;
  }

  /**
   * Cycle number as an integer (1-based)
   *
   * @return cycle number
   */
  public int getCycle() {
    return Integer.parseInt(cycle);
  }

  @Override
  public String toString() {
    return object + "_" + config + "_" + waveplate + "_" + cycle;
  }

  /**
   * Thrown when a file name does not follow the raw stokes naming convention
   */
  public static class ExposureNameFormatException extends Exception {

    public ExposureNameFormatException(String s) {
      super(s);
    }
  }
}
