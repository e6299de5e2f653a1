package rss.specpol.stokes;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.log4j.Logger;
import rss.specpol.input.CalibrationSet;
import rss.specpol.input.Configuration;
import rss.specpol.input.ExposureName.ExposureNameFormatException;
import rss.specpol.input.ExposureReader;
import rss.specpol.input.ExposureReader.ExposureFormatException;
import rss.specpol.input.Pattern;
import rss.specpol.input.PatternTable;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.output.FinalStokesSpectrum;
import rss.specpol.output.FluxCalibration;
import rss.specpol.output.FrameType;
import rss.specpol.output.StokesReport;
import rss.specpol.output.StokesSpectrumWriter;
import rss.specpol.output.WeightedStokes;

/**
 * Reduces raw stokes exposures to final stokes spectra. Configurations are processed in sorted
 * order; within each, exposures are grouped into observations and every observation is reduced
 * on its own: the telescope zero-point is removed from the raw exposures, the cycles of each
 * waveplate pair are combined, the pairs are combined according to the waveplate pattern,
 * the systematic error is estimated, and the result is calibrated, summarized and written.
 *
 * An observation that cannot be reduced is logged and skipped; the run always continues with the
 * next observation. The log of each observation is contiguous: its name, the combination
 * diagnostics, the weighted averages and the output file.
 */
public class FinalStokesPipeline {

  private static final Logger logger = Logger.getLogger(FinalStokesPipeline.class);

  private final CalibrationSet calibrations;
  private final PatternTable patterns;
  private File outputFolder;
  private boolean writeReports = false;
  private FluxCalibration fluxCalibration = FluxCalibration.NONE;

  /**
   * Create a pipeline
   *
   * @param calibrations calibration curves and enabled stages
   * @param patterns waveplate pattern table
   * @param outputFolder folder to write spectra to, or null to only return them
   */
  public FinalStokesPipeline(CalibrationSet calibrations, PatternTable patterns,
      File outputFolder) {
    this.calibrations = calibrations;
    this.patterns = patterns;
    this.outputFolder = outputFolder;
  }

  /**
   * Create a pipeline with the calibrations, pattern table, output folder and report setting
   * of a configuration
   *
   * @param config run configuration
   * @return pipeline
   * @throws IOException if a calibration table or the pattern table cannot be read
   */
  public static FinalStokesPipeline fromConfiguration(Configuration config) throws IOException {
    CalibrationSet calibrations = CalibrationSet.fromConfiguration(config);
    PatternTable patterns = PatternTable.load(config.getPatternTablePath());
    FinalStokesPipeline pipeline =
        new FinalStokesPipeline(calibrations, patterns, new File(config.getOutputFolder()));
    pipeline.setWriteReports(config.isWriteReports());
    return pipeline;
  }

  /**
   * Read raw stokes files. Files that are not raw stokes files, by name or by content, are
   * logged and left out.
   *
   * @param filenames paths of the files to read
   * @return exposures that could be read
   */
  public static List<RawStokesExposure> readExposures(List<String> filenames) {
    List<RawStokesExposure> exposures = new ArrayList<>();
    for (String filename : filenames) {
      try {
        exposures.add(ExposureReader.read(filename));
      } catch (ExposureNameFormatException e) {
        logger.info(e.getMessage());
      } catch (ExposureFormatException e) {
        logger.error("File " + filename + " could not be read: " + e.getMessage());
      } catch (IOException e) {
        logger.error("File " + filename + " could not be read", e);
      }
    }
    return exposures;
  }

  public void setOutputFolder(File outputFolder) {
    this.outputFolder = outputFolder;
  }

  public void setWriteReports(boolean writeReports) {
    this.writeReports = writeReports;
  }

  public void setFluxCalibration(FluxCalibration fluxCalibration) {
    this.fluxCalibration = fluxCalibration;
  }

  /**
   * Reduce all observations of a set of exposures
   *
   * @param exposures raw stokes exposures, of any configurations
   * @return final spectra of the observations that could be reduced, in processing order
   */
  public List<FinalStokesSpectrum> run(List<RawStokesExposure> exposures) {
    List<FinalStokesSpectrum> spectra = new ArrayList<>();
    String paType = calibrations.isHWCalEnabled() ? FrameType.EQUATORIAL.getName()
        : FrameType.INSTRUMENTAL.getName();
    logger.info("  PA type: " + paType);
    logger.info("  " + String.join("\n  ", calibrations.getProvenance()));

    for (String config : ObservationGrouper.getConfigurations(exposures)) {
      logger.info("\nConfiguration: " + config);
      List<RawStokesExposure> configExposures =
          ObservationGrouper.selectConfiguration(exposures, config);
      CalibrationApplier applier =
          new CalibrationApplier(calibrations, configExposures.get(0).getGrid());
      for (Observation observation : ObservationGrouper.group(configExposures)) {
        logger.info("\n  Observation: " + observation.getName());
        try {
          spectra.add(reduce(observation, applier));
        } catch (ObservationSkippedException e) {
          logger.info("  " + e.getMessage());
        }
      }
    }
    return spectra;
  }

  /**
   * Reduce one observation
   *
   * @param observation exposures of one object and configuration
   * @param applier calibration sampled on the configuration's grid
   * @return final spectrum
   * @throws ObservationSkippedException if the observation cannot be reduced
   */
  FinalStokesSpectrum reduce(Observation observation, CalibrationApplier applier)
      throws ObservationSkippedException {
    observation.checkGrid(applier.getGrid());

    String patternName = observation.getPatternName();
    PatternType type = PatternType.fromName(patternName);
    if (type == null) {
      throw new ObservationSkippedException("Pattern " + patternName + " not supported, "
          + "skipping observation");
    }
    PatternCombination combination = type.createCombination();
    Pattern pattern = patterns.get(patternName);
    if (pattern == null) {
      throw new ObservationSkippedException("Pattern " + patternName
          + " not in waveplate pattern table, skipping observation");
    }

    int[] indices = observation.getPairIndices(pattern);
    WaveplatePair[] pairs = new WaveplatePair[pattern.getPairCount()];
    List<List<RawStokesExposure>> pairExposures = observation.getPairs();
    for (int k = 0; k < indices.length; ++k) {
      List<RawStokesExposure> cycles = new ArrayList<>();
      for (RawStokesExposure raw : pairExposures.get(k)) {
        cycles.add(applier.applyZeropoint(raw));
      }
      pairs[indices[k]] = CycleCombiner.combine(cycles);
    }

    CombinedStokes combined = combination.combine(pairs, applier.getCalibratable());

    double systematicError = logDiagnostics(pattern, pairs, combined);

    CombinedStokes calibrated = applier.calibrate(combined, observation.getReference());
    FinalStokesSpectrum spectrum = new FinalStokesSpectrum(observation.getName(),
        observation.getObject(), applier.getGrid(), calibrated.getStokes(),
        calibrated.getVariance(), calibrated.getBadPixel(), pattern.getName(),
        applier.getFrame(observation.getReference()), 100. * systematicError,
        calibrations.getProvenance());

    WeightedStokes average = WeightedStokes.average(spectrum);
    logger.info(average.getReport());

    if (outputFolder != null) {
      write(spectrum, average);
    }
    return spectrum;
  }

  /**
   * Log the cycle and redundancy chi-square diagnostics and estimate the systematic error
   *
   * @return systematic error (fraction), 0 if no chi-square is available
   */
  private double logDiagnostics(Pattern pattern, WaveplatePair[] pairs,
      CombinedStokes combined) {
    int patPairs = pairs.length;
    List<String> codes = pattern.getPairCodes();
    boolean haveCycleChi = false;
    int maxCycles = 0;
    for (WaveplatePair pair : pairs) {
      if (pair != null) {
        haveCycleChi |= pair.hasCycleChi();
        maxCycles = Math.max(maxCycles, pair.getCycles());
      }
    }
    if (!haveCycleChi && !combined.hasRedundancyChi()) {
      return 0.;
    }

    double[] chi2 = new double[patPairs];
    if (haveCycleChi) {
      String width = String.valueOf(7 * patPairs);
      logger.info(String.format(Locale.ROOT, "%14s%-" + width + "s%-" + width + "s", "",
          "culled", "mean chisq"));
      StringBuilder header = new StringBuilder("         HW ");
      for (int i = 0; i < 2; ++i) {
        for (String code : codes) {
          header.append(String.format(Locale.ROOT, " %6s", code));
        }
      }
      logger.info(header.toString());

      if (maxCycles > 2) {
        for (int j = 0; j < maxCycles; ++j) {
          int[] culls = new int[patPairs];
          double[] cycleChi2 = new double[patPairs];
          for (int p = 0; p < patPairs; ++p) {
            if (pairs[p] != null && j < pairs[p].getCycles()) {
              culls[p] = pairs[p].getCullCounts()[j];
              cycleChi2[p] = pairs[p].getCycleChi2()[j];
            }
          }
          logger.info(String.format(Locale.ROOT, "   cycle %2d: ", j + 1)
              + formatRow(culls, cycleChi2));
        }
      }

      int[] netCulls = new int[patPairs];
      for (int p = 0; p < patPairs; ++p) {
        if (pairs[p] != null) {
          netCulls[p] = pairs[p].getNetCulls();
          chi2[p] = pairs[p].getNetChi2();
        }
      }
      logger.info("    net    : " + formatRow(netCulls, chi2));
    }

    if (combined.hasRedundancyChi()) {
      logger.info(String.format(Locale.ROOT, "   Wavelengths culled by linhi Chisq: %5d\n",
          combined.getRedundancyCulls()));
      StringBuilder header = new StringBuilder("          HW ");
      for (String code : codes) {
        header.append(String.format(Locale.ROOT, " %6s", code));
      }
      logger.info(header.toString());
      chi2 = combined.getPairChi2();
      StringBuilder row = new StringBuilder("   Pair Chisq: ");
      for (double value : chi2) {
        row.append(String.format(Locale.ROOT, "%6.2f ", value));
      }
      logger.info(row.toString());
    }

    SystematicErrorEstimator estimate = SystematicErrorEstimator.estimate(chi2, combined);
    logger.info(String.format(Locale.ROOT, "\n   Mean Chisq: %6.2f  Estimated sys %%error: %5.2f",
        estimate.getMeanChi2(), 100. * estimate.getSystematicError()));
    return estimate.getSystematicError();
  }

  private static String formatRow(int[] counts, double[] values) {
    StringBuilder sb = new StringBuilder();
    for (int count : counts) {
      sb.append(String.format(Locale.ROOT, "%6d ", count));
    }
    for (double value : values) {
      sb.append(String.format(Locale.ROOT, "%6.2f ", value));
    }
    return sb.toString();
  }

  /**
   * Write a spectrum, its optional report, and run the flux calibration on it. Failures are
   * logged; the spectrum is still returned to the caller.
   */
  private void write(FinalStokesSpectrum spectrum, WeightedStokes average) {
    File written;
    try {
      written = StokesSpectrumWriter.write(spectrum, outputFolder);
    } catch (IOException e) {
      logger.error("Could not write " + spectrum.getFileName(), e);
      return;
    }
    logger.info("\n    " + written.getName() + " Stokes I,Q,U");

    if (writeReports) {
      try {
        File report = StokesReport.write(spectrum, average, outputFolder);
        logger.info("    " + report.getName() + " report");
      } catch (IOException e) {
        logger.error("Could not write report of " + spectrum.getName(), e);
      }
    }

    try {
      fluxCalibration.apply(written, spectrum);
    } catch (IOException e) {
      logger.error("Flux calibration of " + written.getName() + " failed", e);
    }
  }
}
