package rss.specpol.input;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.log4j.Logger;
import rss.specpol.input.ExposureName.ExposureNameFormatException;
import rss.specpol.input.RawStokesExposure.Header;

/**
 * Reads raw stokes exposures from whitespace-delimited text files. The file starts with header
 * lines of the form {@code # KEY = value}; the keys used are GRATING, CRVAL1 (first wavelength),
 * CDELT1 (wavelength step), TELPA, TRKRHO, LAMPID and WPPATERN. Every following non-comment line
 * is one wavelength sample with six columns: sum, difference, sum variance, difference variance,
 * sum bad-pixel flag, difference bad-pixel flag (0 = good).
 */
public class ExposureReader {

  private static final Logger logger = Logger.getLogger(ExposureReader.class);

  private static final int COLUMNS = 6;

  /**
   * Read a raw stokes file
   *
   * @param filename Path of the file to read; its name must follow the raw stokes convention
   * @return exposure read from the file
   * @throws IOException If the file cannot be read
   * @throws ExposureNameFormatException If the file name cannot be parsed into grouping keys
   * @throws ExposureFormatException If the file content is malformed
   */
  public static RawStokesExposure read(String filename)
      throws IOException, ExposureNameFormatException, ExposureFormatException {
    ExposureName name = ExposureName.parse(filename);
    File file = new File(filename);

    Map<String, String> keywords = new HashMap<>();
    List<double[]> rows = new ArrayList<>();

    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      String line;
      int lineNumber = 0;
      while ((line = br.readLine()) != null) {
        ++lineNumber;
        line = line.trim();
        if (line.isEmpty()) {
          continue;
        }
        if (line.startsWith("#")) {
          int equals = line.indexOf('=');
          if (equals > 0) {
            String key = line.substring(1, equals).trim().toUpperCase(Locale.ROOT);
            keywords.put(key, line.substring(equals + 1).trim());
          }
          continue;
        }
        String[] args = line.split("\\s+");
        if (args.length != COLUMNS) {
          throw new ExposureFormatException("Expected " + COLUMNS + " columns at line "
              + lineNumber + " of " + file.getName() + ", found " + args.length);
        }
        double[] row = new double[COLUMNS];
        for (int i = 0; i < COLUMNS; ++i) {
          try {
            row[i] = Double.parseDouble(args[i]);
          } catch (NumberFormatException e) {
            throw new ExposureFormatException("Value " + args[i] + " at line " + lineNumber
                + " of " + file.getName() + " could not be parsed");
          }
        }
        rows.add(row);
      }
    }

    if (rows.isEmpty()) {
      throw new ExposureFormatException("No data rows in " + file.getName());
    }

    double start = getDouble(keywords, "CRVAL1", file);
    double step = getDouble(keywords, "CDELT1", file);
    WavelengthGrid grid = new WavelengthGrid(start, step, rows.size());

    String pattern = keywords.get("WPPATERN");
    if (pattern == null) {
      throw new ExposureFormatException("Missing WPPATERN keyword in " + file.getName());
    }
    String grating = keywords.getOrDefault("GRATING", "");
    String lamp = keywords.getOrDefault("LAMPID", RawStokesExposure.NO_LAMP);
    double telpa = keywords.containsKey("TELPA") ? getDouble(keywords, "TELPA", file) : 0.;
    double trkrho = keywords.containsKey("TRKRHO") ? getDouble(keywords, "TRKRHO", file) : 0.;
    if (!keywords.containsKey("TELPA")) {
      logger.warn("No TELPA keyword in " + file.getName() + ", assuming 0");
    }

    int wavs = rows.size();
    double[][] stokes = new double[2][wavs];
    double[][] variance = new double[2][wavs];
    boolean[][] badPixel = new boolean[2][wavs];
    for (int w = 0; w < wavs; ++w) {
      double[] row = rows.get(w);
      for (int s = 0; s < 2; ++s) {
        stokes[s][w] = row[s];
        variance[s][w] = row[2 + s];
        badPixel[s][w] = row[4 + s] != 0.;
      }
    }

    Header header = new Header(grating, pattern, lamp, telpa, trkrho);
    return new RawStokesExposure(filename, name, grid, header, stokes, variance, badPixel);
  }

  private static double getDouble(Map<String, String> keywords, String key, File file)
      throws ExposureFormatException {
    String value = keywords.get(key);
    if (value == null) {
      throw new ExposureFormatException("Missing " + key + " keyword in " + file.getName());
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new ExposureFormatException("Keyword " + key + " in " + file.getName()
          + " is not a number: " + value);
    }
  }

  /**
   * Exception thrown when a raw stokes file does not have the expected content
   */
  public static class ExposureFormatException extends Exception {

    public ExposureFormatException(String s) {
      super(s);
    }
  }
}
