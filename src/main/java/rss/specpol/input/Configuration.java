package rss.specpol.input;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the parameters of a final stokes reduction run.
 * These include the paths of the already-resolved calibration tables (half-wave plate
 * calibration, telescope zero-point, PA zero-point entry, spectrograph zero-point),
 * which calibration stages are overridden, the folder to which output spectra are written,
 * an optional user waveplate pattern table and whether PDF reports are written alongside
 * the spectra.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "specpol-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private String hwCalibrationPath = "";
  private String telZeropointPath = "";
  private String paZeropointVersion = null;
  private double paZeropoint = 0.;
  private String specZeropointPath = "";

  private boolean hwCalOverride = false;
  private boolean polZeropointOverride = false;
  private boolean paZeropointOverride = false;

  private String outputFolder = System.getProperty("user.dir");
  private String patternTablePath = "";
  private boolean writeReports = false;

  Configuration(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      hwCalibrationPath = config.getString("Calibration.HWCalibration", hwCalibrationPath);
      telZeropointPath = config.getString("Calibration.TelZeropoint", telZeropointPath);
      paZeropointVersion = config.getString("Calibration.PAZeropoint.Version", "");
      if (paZeropointVersion.trim().isEmpty()) {
        paZeropointVersion = null;
      }
      paZeropoint = config.getDouble("Calibration.PAZeropoint.Value", 0.);
      specZeropointPath = config.getString("Calibration.SpecZeropoint", specZeropointPath);

      hwCalOverride = config.getBoolean("Overrides.HWCal", false);
      polZeropointOverride = config.getBoolean("Overrides.PolZeropoint", false);
      paZeropointOverride = config.getBoolean("Overrides.PAZeropoint", false);

      String outputFolderParam = config.getString("LocalPaths.OutputPath");
      if (outputFolderParam != null && !outputFolderParam.isEmpty()) {
        outputFolder = outputFolderParam;
      }
      patternTablePath = config.getString("LocalPaths.PatternTable", patternTablePath);
      writeReports = config.getBoolean("Reports.WritePDF", false);

      File loaded = config.getFile();
      if (loaded != null) {
        try {
          loadedConfigPath = loaded.getCanonicalPath();
        } catch (IOException e) {
          logger.warn("Could not resolve configuration path " + configLocation, e);
          loadedConfigPath = configLocation;
        }
      }
      logger.info("Successfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  private static boolean copyEmbedXML(String pathToPlaceFile) {
    File fileOut = new File(pathToPlaceFile);
    try (InputStream stream =
        Configuration.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_PATH)) {
      if (stream == null) {
        logger.error("Major error: config XML file not part of resources!!");
        return false;
      }
      logger.info("Copying over embedded config file to absolute path "
          + fileOut.getAbsolutePath());
      Files.copy(stream, fileOut.toPath());
      return true;
    } catch (IOException e) {
      logger.warn("Could not copy over the file...", e);
    }
    return false;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   *
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance() {
    return getInstance(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
  }

  /**
   * Gets the current instance of the configuration, or creates one from a specified file if none
   * exists. If the file does not exist, the embedded default configuration is written there.
   *
   * @param configLocation Configuration file location to read from
   * @return the current configuration instance
   */
  public static synchronized Configuration getInstance(String configLocation) {
    if (instance == null) {
      File config = new File(configLocation);
      if (!config.exists() && !copyEmbedXML(configLocation)) {
        logger.warn("Could not find or write to specified config location: " + configLocation);
      }
      instance = new Configuration(configLocation);
    }
    return instance;
  }

  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  public String getHWCalibrationPath() {
    return hwCalibrationPath;
  }

  public String getTelZeropointPath() {
    return telZeropointPath;
  }

  /**
   * Version label of the PA zero-point entry (its date), or null if no entry is configured
   *
   * @return PA zero-point version
   */
  public String getPAZeropointVersion() {
    return paZeropointVersion;
  }

  public double getPAZeropoint() {
    return paZeropoint;
  }

  public String getSpecZeropointPath() {
    return specZeropointPath;
  }

  public boolean isHWCalOverride() {
    return hwCalOverride;
  }

  public void setHWCalOverride(boolean hwCalOverride) {
    this.hwCalOverride = hwCalOverride;
  }

  public boolean isPolZeropointOverride() {
    return polZeropointOverride;
  }

  public void setPolZeropointOverride(boolean polZeropointOverride) {
    this.polZeropointOverride = polZeropointOverride;
  }

  public boolean isPAZeropointOverride() {
    return paZeropointOverride;
  }

  public void setPAZeropointOverride(boolean paZeropointOverride) {
    this.paZeropointOverride = paZeropointOverride;
  }

  /**
   * Folder final stokes spectra are written to. Defaults to the working directory.
   *
   * @return output folder path
   */
  public String getOutputFolder() {
    return outputFolder;
  }

  /**
   * Set the output folder. Only accepted if the folder exists and is writable.
   *
   * @param replacement Path of the new output folder
   */
  public void setOutputFolder(String replacement) {
    File folder = new File(replacement);
    if (folder.isDirectory() && folder.canWrite()) {
      outputFolder = replacement;
    } else {
      logger.warn("Output folder " + replacement + " is not a writable directory, keeping "
          + outputFolder);
    }
  }

  /**
   * Path of a user waveplate pattern table, or empty to use the embedded table
   *
   * @return pattern table path
   */
  public String getPatternTablePath() {
    return patternTablePath;
  }

  public boolean isWriteReports() {
    return writeReports;
  }

  public void setWriteReports(boolean writeReports) {
    this.writeReports = writeReports;
  }
}
