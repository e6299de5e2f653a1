package rss.specpol;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.log4j.Logger;
import rss.specpol.input.Configuration;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.output.FinalStokesSpectrum;
import rss.specpol.stokes.FinalStokesPipeline;

/**
 * Command line entry point of the final stokes reduction. Arguments are raw stokes files, and
 * {@code key=value} options:
 * <ul>
 * <li>{@code config=<file>}: configuration XML (default specpol-config.xml in the working
 * directory, created from the embedded default if missing)</li>
 * <li>{@code HW_Cal_override=true}: no half-wave plate calibration (and no zero-points)</li>
 * <li>{@code Linear_PolZeropoint_override=true}: no telescope zero-point (and no PA
 * zero-point)</li>
 * <li>{@code PAZeropoint_override=true}: no PA zero-point</li>
 * <li>{@code output=<folder>}: folder the spectra are written to</li>
 * <li>{@code reports=true}: also write a PDF report of each spectrum</li>
 * </ul>
 */
public class StokesSuite {

  private static final Logger logger = Logger.getLogger(StokesSuite.class);

  /**
   * Parsed command line
   */
  static class Arguments {

    final List<String> files = new ArrayList<>();
    String configPath = null;
    Boolean hwCalOverride = null;
    Boolean polZeropointOverride = null;
    Boolean paZeropointOverride = null;
    String outputFolder = null;
    Boolean writeReports = null;

    /**
     * Parse command line arguments
     *
     * @param args arguments
     * @return parsed arguments
     * @throws IllegalArgumentException for an unknown option
     */
    static Arguments parse(String[] args) {
      Arguments parsed = new Arguments();
      for (String arg : args) {
        int equals = arg.indexOf('=');
        if (equals < 0) {
          parsed.files.add(arg);
          continue;
        }
        String key = arg.substring(0, equals).trim();
        String value = arg.substring(equals + 1).trim();
        switch (key) {
          case "config":
            parsed.configPath = value;
            break;
          case "HW_Cal_override":
            parsed.hwCalOverride = Boolean.parseBoolean(value);
            break;
          case "Linear_PolZeropoint_override":
            parsed.polZeropointOverride = Boolean.parseBoolean(value);
            break;
          case "PAZeropoint_override":
            parsed.paZeropointOverride = Boolean.parseBoolean(value);
            break;
          case "output":
            parsed.outputFolder = value;
            break;
          case "reports":
            parsed.writeReports = Boolean.parseBoolean(value);
            break;
          default:
            throw new IllegalArgumentException("Unknown option " + key);
        }
      }
      return parsed;
    }

    /**
     * Apply the options given on the command line to a configuration
     *
     * @param config configuration to update
     */
    void applyTo(Configuration config) {
      if (hwCalOverride != null) {
        config.setHWCalOverride(hwCalOverride);
      }
      if (polZeropointOverride != null) {
        config.setPolZeropointOverride(polZeropointOverride);
      }
      if (paZeropointOverride != null) {
        config.setPAZeropointOverride(paZeropointOverride);
      }
      if (outputFolder != null) {
        config.setOutputFolder(outputFolder);
      }
      if (writeReports != null) {
        config.setWriteReports(writeReports);
      }
    }
  }

  /**
   * Reduce the given files
   *
   * @param args raw stokes files and options
   */
  public static void main(String[] args) {
    Arguments arguments;
    try {
      arguments = Arguments.parse(args);
    } catch (IllegalArgumentException e) {
      logger.error(e.getMessage());
      System.exit(1);
      return;
    }
    if (arguments.files.isEmpty()) {
      logger.error("No raw stokes files given");
      System.exit(1);
      return;
    }

    Configuration config = arguments.configPath == null ? Configuration.getInstance()
        : Configuration.getInstance(arguments.configPath);
    arguments.applyTo(config);

    FinalStokesPipeline pipeline;
    try {
      pipeline = FinalStokesPipeline.fromConfiguration(config);
    } catch (IOException e) {
      logger.error("Could not load calibration tables", e);
      System.exit(1);
      return;
    }
    List<RawStokesExposure> exposures = FinalStokesPipeline.readExposures(arguments.files);
    List<FinalStokesSpectrum> spectra = pipeline.run(exposures);
    logger.info("\n" + spectra.size() + " final stokes spectra from " + exposures.size()
        + " raw stokes files");
  }
}
