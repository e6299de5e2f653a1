package rss.specpol.stokes;

/**
 * Enumerated type defining each waveplate pattern that can appear in a raw stokes header, and
 * for creating the combination that merges its waveplate pairs into final stokes parameters.
 *
 * Only the linear patterns can be combined. The circular and all-stokes patterns are listed so
 * that they are recognized and rejected explicitly rather than being mistaken for a linear
 * pattern; creating a combination for one of them skips the observation.
 */
public enum PatternType {

  LINEAR("LINEAR") {
    @Override
    public PatternCombination createCombination() {
      return new LinearCombination();
    }
  },
  LINEAR_HI("LINEAR-HI") {
    @Override
    public PatternCombination createCombination() {
      return new LinearHiCombination();
    }
  },
  CIRCULAR("CIRCULAR"),
  CIRCULAR_HI("CIRCULAR-HI"),
  ALL_STOKES("ALL-STOKES");

  private final String name;

  PatternType(String name) {
    this.name = name;
  }

  /**
   * Get the pattern type of a header pattern name (case insensitive)
   *
   * @param patternName pattern name, e.g. "Linear-Hi"
   * @return pattern type, or null if the name is not a known pattern
   */
  public static PatternType fromName(String patternName) {
    for (PatternType type : values()) {
      if (type.name.equalsIgnoreCase(patternName.trim())) {
        return type;
      }
    }
    return null;
  }

  /**
   * Create the combination that merges the waveplate pairs of this pattern
   *
   * @return new combination instance
   * @throws ObservationSkippedException if the pattern cannot be combined
   */
  public PatternCombination createCombination() throws ObservationSkippedException {
    throw new ObservationSkippedException("Pattern " + name + " not supported, skipping "
        + "observation");
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
