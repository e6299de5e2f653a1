package rss.specpol.input;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.apache.log4j.Logger;

/**
 * Table of waveplate patterns, read once per run and shared by all observations.
 * Each non-comment line is {@code NAME stokes positions s0 s1 s0 s1 ...}, giving the pattern
 * name, the number of final stokes parameters, the number of waveplate positions and then the
 * station pairs. The table embedded in the jar is used unless a user table is given.
 */
public class PatternTable {

  static final String EMBEDDED_TABLE = "wppatterns.txt";

  private static final Logger logger = Logger.getLogger(PatternTable.class);

  private final Map<String, Pattern> patterns;

  private PatternTable(Map<String, Pattern> patterns) {
    this.patterns = Collections.unmodifiableMap(patterns);
  }

  /**
   * Load the pattern table embedded in the program resources
   *
   * @return pattern table
   * @throws IOException if the embedded table is missing or malformed
   */
  public static PatternTable loadEmbedded() throws IOException {
    try (InputStream stream =
        PatternTable.class.getClassLoader().getResourceAsStream(EMBEDDED_TABLE)) {
      if (stream == null) {
        throw new IOException("Pattern table " + EMBEDDED_TABLE + " not part of resources");
      }
      return read(stream, EMBEDDED_TABLE);
    }
  }

  /**
   * Load the user pattern table at the given path, or the embedded one if the path is empty
   *
   * @param path table path (may be null or empty)
   * @return pattern table
   * @throws IOException if the table cannot be read or is malformed
   */
  public static PatternTable load(String path) throws IOException {
    if (path == null || path.trim().isEmpty()) {
      return loadEmbedded();
    }
    try (InputStream stream = new FileInputStream(path)) {
      return read(stream, path);
    }
  }

  private static PatternTable read(InputStream stream, String source) throws IOException {
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    try (BufferedReader br =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = br.readLine()) != null) {
        line = line.trim();
        if (line.isEmpty() || line.startsWith("#")) {
          continue;
        }
        String[] args = line.split("\\s+");
        if (args.length < 5) {
          throw new IOException("Pattern line in " + source + " too short: " + line);
        }
        try {
          int stokes = Integer.parseInt(args[1]);
          int[] stations = new int[args.length - 3];
          for (int i = 3; i < args.length; ++i) {
            stations[i - 3] = Integer.parseInt(args[i]);
          }
          Pattern pattern = new Pattern(args[0], stokes, stations);
          patterns.put(pattern.getName(), pattern);
        } catch (IllegalArgumentException e) {
          throw new IOException("Malformed pattern line in " + source + ": " + line, e);
        }
      }
    }
    logger.debug("Read " + patterns.size() + " waveplate patterns from " + source);
    return new PatternTable(patterns);
  }

  /**
   * Get a pattern by name (case insensitive)
   *
   * @param name Pattern name
   * @return the pattern, or null if the table has no such pattern
   */
  public Pattern get(String name) {
    return patterns.get(name.toUpperCase(Locale.ROOT));
  }

  public Map<String, Pattern> getPatterns() {
    return patterns;
  }
}
