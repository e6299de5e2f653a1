package rss.specpol.output;

import java.io.File;
import java.io.IOException;

/**
 * Downstream flux calibration, run on each final stokes file after it is written.
 * Flux calibration itself is done outside this program; the default does nothing.
 */
public interface FluxCalibration {

  /**
   * Flux calibration that leaves the spectrum unchanged
   */
  FluxCalibration NONE = (stokesFile, spectrum) -> {
  };

  /**
   * Calibrate a written final stokes file
   *
   * @param stokesFile file the spectrum was written to
   * @param spectrum the spectrum that was written
   * @throws IOException if the calibration cannot read or write its files
   */
  void apply(File stokesFile, FinalStokesSpectrum spectrum) throws IOException;
}
