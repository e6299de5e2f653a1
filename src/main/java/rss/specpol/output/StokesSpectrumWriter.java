package rss.specpol.output;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Writes final stokes spectra as whitespace-delimited text tables. The file starts with
 * {@code # KEY = value} header lines (the same convention as raw stokes files) and one
 * {@code # HISTORY =} line per calibration step, followed by one row per wavelength:
 * wavelength, I, Q, U, var I, var Q, var U, QU covariance, and the I, Q, U bad pixel flags.
 */
public class StokesSpectrumWriter {

  static final String COLUMNS =
      "# wavelength I Q U var_I var_Q var_U cov_QU bpm_I bpm_Q bpm_U";

  /**
   * Write a spectrum into a folder, replacing any existing file of the same name
   *
   * @param spectrum spectrum to write
   * @param folder output folder
   * @return the written file
   * @throws IOException if the file cannot be written
   */
  public static File write(FinalStokesSpectrum spectrum, File folder) throws IOException {
    File out = new File(folder, spectrum.getFileName());
    double[] wavs = spectrum.getGrid().getWavelengths();
    double[][] stokes = spectrum.getStokes();
    double[][] variance = spectrum.getVariance();
    boolean[][] bpm = spectrum.getBadPixel();

    try (PrintWriter pw = new PrintWriter(new BufferedWriter(new FileWriter(out)))) {
      pw.println("# OBJECT = " + spectrum.getObject());
      pw.println("# CTYPE3 = I,Q,U");
      pw.println("# CRVAL1 = " + spectrum.getGrid().getStart());
      pw.println("# CDELT1 = " + spectrum.getGrid().getStep());
      pw.println("# WPPATERN = " + spectrum.getPattern());
      pw.println("# PATYPE = " + spectrum.getFrame().getName());
      pw.println(String.format(Locale.ROOT, "# SYSERR = %.4f",
          spectrum.getSystematicErrorPercent()));
      for (String line : spectrum.getProvenance()) {
        pw.println("# HISTORY = " + line);
      }
      pw.println(COLUMNS);
      for (int w = 0; w < wavs.length; ++w) {
        pw.println(String.format(Locale.ROOT,
            "%10.3f %14.6e %14.6e %14.6e %14.6e %14.6e %14.6e %14.6e %d %d %d",
            wavs[w], stokes[0][w], stokes[1][w], stokes[2][w],
            variance[0][w], variance[1][w], variance[2][w], variance[3][w],
            bpm[0][w] ? 1 : 0, bpm[1][w] ? 1 : 0, bpm[2][w] ? 1 : 0));
      }
      if (pw.checkError()) {
        throw new IOException("Could not write " + out.getAbsolutePath());
      }
    }
    return out;
  }
}
