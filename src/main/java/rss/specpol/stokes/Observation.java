package rss.specpol.stokes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import rss.specpol.input.Pattern;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.WavelengthGrid;

/**
 * All raw stokes exposures of one object and configuration: a list of waveplate pairs, in
 * waveplate order, each a list of its cycles in cycle order. Built by
 * {@link ObservationGrouper}.
 */
public class Observation {

  private final String object;
  private final String config;
  private final String name;
  private final List<List<RawStokesExposure>> pairs;

  Observation(String object, String config, List<List<RawStokesExposure>> pairs) {
    this.object = object;
    this.config = config;
    List<List<RawStokesExposure>> copy = new ArrayList<>();
    for (List<RawStokesExposure> pair : pairs) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(pair)));
    }
    this.pairs = Collections.unmodifiableList(copy);
    this.name = buildName();
  }

  /**
   * Name documenting which cycles of each pair were included: object and configuration,
   * followed for each pair by an underscore and the last digit of each of its cycles. When all
   * pairs have the same number of cycles only the first pair's digits are given.
   */
  private String buildName() {
    StringBuilder sb = new StringBuilder(object).append('_').append(config);
    boolean sameCycles = true;
    for (List<RawStokesExposure> pair : pairs) {
      sameCycles &= pair.size() == pairs.get(0).size();
    }
    List<List<RawStokesExposure>> named = sameCycles ? pairs.subList(0, 1) : pairs;
    for (List<RawStokesExposure> pair : named) {
      sb.append('_');
      for (RawStokesExposure exposure : pair) {
        String cycle = exposure.getName().getCycleLabel();
        sb.append(cycle.charAt(cycle.length() - 1));
      }
    }
    return sb.toString();
  }

  public String getObject() {
    return object;
  }

  public String getConfig() {
    return config;
  }

  public String getName() {
    return name;
  }

  /**
   * Name of the final stokes file written for this observation
   *
   * @return output file name
   */
  public String getOutputFileName() {
    return name + "_stokes.txt";
  }

  /**
   * Exposures of each pair present, in waveplate order
   *
   * @return unmodifiable lists of cycles
   */
  public List<List<RawStokesExposure>> getPairs() {
    return pairs;
  }

  public int getPairCount() {
    return pairs.size();
  }

  /**
   * First exposure of the observation, supplying header metadata
   *
   * @return reference exposure
   */
  public RawStokesExposure getReference() {
    return pairs.get(0).get(0);
  }

  /**
   * Waveplate pattern named in the header of the observation's exposures
   *
   * @return pattern name, upper case
   */
  public String getPatternName() {
    return getReference().getPattern();
  }

  public WavelengthGrid getGrid() {
    return getReference().getGrid();
  }

  /**
   * Position of each present pair within the pattern
   *
   * @param pattern waveplate pattern of the observation
   * @return pattern pair index of each present pair, in waveplate order
   * @throws ObservationSkippedException if a pair's waveplate positions are not in the pattern
   */
  public int[] getPairIndices(Pattern pattern) throws ObservationSkippedException {
    int[] indices = new int[pairs.size()];
    for (int k = 0; k < pairs.size(); ++k) {
      String code = pairs.get(k).get(0).getName().getPairCode();
      indices[k] = pattern.indexOf(code);
      if (indices[k] < 0) {
        throw new ObservationSkippedException("Waveplate pair " + code + " not part of pattern "
            + pattern.getName() + ", skipping observation");
      }
    }
    return indices;
  }

  /**
   * Check that every exposure shares the wavelength grid of the configuration
   *
   * @param grid grid of the configuration
   * @throws ObservationSkippedException if an exposure has another grid
   */
  public void checkGrid(WavelengthGrid grid) throws ObservationSkippedException {
    for (List<RawStokesExposure> pair : pairs) {
      for (RawStokesExposure exposure : pair) {
        if (!grid.equals(exposure.getGrid())) {
          throw new ObservationSkippedException("Wavelength grid of " + exposure.getFileName()
              + " does not match configuration " + config + ", skipping observation");
        }
      }
    }
  }
}
