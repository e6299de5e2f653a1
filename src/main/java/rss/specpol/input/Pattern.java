package rss.specpol.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A waveplate measurement pattern: how many final stokes parameters it produces and which
 * half-wave plate station pairs make up its measurements. Pair indices used throughout the
 * reduction are positions in the sorted list of pair codes (for LINEAR-HI: 04, 15, 26, 37).
 */
public class Pattern {

  private final String name;
  private final int stokesCount;
  private final List<String> pairCodes;

  /**
   * Create a pattern definition
   *
   * @param name Pattern name (e.g. "LINEAR")
   * @param stokesCount Number of final (unnormalized) stokes parameters, including I
   * @param stations Station numbers, two per pair, in table order
   */
  public Pattern(String name, int stokesCount, int[] stations) {
    if (stations.length == 0 || stations.length % 2 != 0) {
      throw new IllegalArgumentException("Pattern " + name
          + " must list an even, nonzero number of waveplate stations");
    }
    this.name = name.toUpperCase(Locale.ROOT);
    this.stokesCount = stokesCount;
    List<String> codes = new ArrayList<>();
    for (int i = 0; i < stations.length; i += 2) {
      codes.add(String.valueOf(stations[i]) + stations[i + 1]);
    }
    Collections.sort(codes);
    this.pairCodes = Collections.unmodifiableList(codes);
  }

  public String getName() {
    return name;
  }

  /**
   * Number of final stokes parameters produced, including intensity
   *
   * @return stokes count (e.g. 3 for I, Q, U)
   */
  public int getStokesCount() {
    return stokesCount;
  }

  /**
   * Number of waveplate position pairs in a complete observation
   *
   * @return pair count
   */
  public int getPairCount() {
    return pairCodes.size();
  }

  /**
   * Sorted two-digit pair codes of this pattern
   *
   * @return unmodifiable list of pair codes
   */
  public List<String> getPairCodes() {
    return pairCodes;
  }

  /**
   * Index of the given pair code in this pattern
   *
   * @param pairCode two-digit pair code (e.g. "26")
   * @return index, or -1 if the pair is not part of this pattern
   */
  public int indexOf(String pairCode) {
    return pairCodes.indexOf(pairCode);
  }

  @Override
  public String toString() {
    return name + " " + pairCodes;
  }
}
