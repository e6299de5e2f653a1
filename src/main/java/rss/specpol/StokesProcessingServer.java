package rss.specpol;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;
import rss.specpol.input.CalibrationCurve;
import rss.specpol.input.CalibrationSet;
import rss.specpol.input.PatternTable;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.output.FinalStokesSpectrum;
import rss.specpol.output.StokesResult;
import rss.specpol.output.WeightedStokes;
import rss.specpol.stokes.FinalStokesPipeline;

/**
 * StokesProcessingServer allows for running the final stokes reduction from a python
 * environment using Py4J, so that it can be called at the end of a python reduction script
 * with calibration files the script has already selected.
 *
 * It uses the Py4J default port: 25333. If a process is already using that port it silently
 * terminates.
 */
public class StokesProcessingServer {

  public StokesProcessingServer() {
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new StokesProcessingServer());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      System.exit(0);
    }
    System.out.println("Gateway Server Started");
  }

  /**
   * Reduce raw stokes files to final stokes spectra
   *
   * @param files raw stokes files
   * @param hwCalibrationFile half-wave plate calibration table, or empty for no calibration
   * @param telZeropointFile telescope zero-point table, or empty for none
   * @param paZeropointVersion version of the PA zero-point entry, or empty for none
   * @param paZeropoint PA zero-point, degrees
   * @param outputFolder folder to write spectra to, or empty to only return them
   * @param withImages true to include PNG plots in the results
   * @return one result per final spectrum
   * @throws IOException if a calibration table cannot be read or a plot cannot be encoded
   */
  public List<StokesResult> runFinalStokes(List<String> files, String hwCalibrationFile,
      String telZeropointFile, String paZeropointVersion, double paZeropoint,
      String outputFolder, boolean withImages) throws IOException {
    CalibrationCurve hw = isBlank(hwCalibrationFile) ? null
        : CalibrationCurve.load(new File(hwCalibrationFile));
    CalibrationCurve tel = isBlank(telZeropointFile) ? null
        : CalibrationCurve.load(new File(telZeropointFile));
    String version = isBlank(paZeropointVersion) ? null : paZeropointVersion;
    CalibrationSet calibrations = new CalibrationSet(hw, tel, version, paZeropoint, null);

    File folder = isBlank(outputFolder) ? null : new File(outputFolder);
    FinalStokesPipeline pipeline =
        new FinalStokesPipeline(calibrations, PatternTable.loadEmbedded(), folder);

    List<RawStokesExposure> exposures = FinalStokesPipeline.readExposures(files);
    List<StokesResult> results = new ArrayList<>();
    for (FinalStokesSpectrum spectrum : pipeline.run(exposures)) {
      WeightedStokes average = WeightedStokes.average(spectrum);
      results.add(StokesResult.buildFinalStokesData(spectrum, average, withImages));
    }
    return results;
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
