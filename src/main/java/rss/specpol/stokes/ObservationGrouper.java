package rss.specpol.stokes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import rss.specpol.input.ExposureName;
import rss.specpol.input.RawStokesExposure;

/**
 * Groups raw stokes exposures into observations. Exposures are sorted by configuration, object,
 * waveplate position and cycle; consecutive exposures with the same object, configuration and
 * waveplate position are the cycles of one pair, and consecutive pairs with the same object and
 * configuration make up one observation.
 */
public class ObservationGrouper {

  static final Comparator<RawStokesExposure> EXPOSURE_ORDER =
      Comparator.comparing((RawStokesExposure e) -> e.getName().getConfig())
          .thenComparing(e -> e.getName().getObject())
          .thenComparing(e -> e.getName().getWaveplate())
          .thenComparingInt(e -> e.getName().getCycle());

  /**
   * Distinct configurations of a set of exposures, sorted
   *
   * @param exposures raw stokes exposures
   * @return configuration names in processing order
   */
  public static List<String> getConfigurations(List<RawStokesExposure> exposures) {
    TreeSet<String> configs = new TreeSet<>();
    for (RawStokesExposure exposure : exposures) {
      configs.add(exposure.getName().getConfig());
    }
    return new ArrayList<>(configs);
  }

  /**
   * Exposures of one configuration, in processing order
   *
   * @param exposures raw stokes exposures
   * @param config configuration to select
   * @return sorted exposures of that configuration
   */
  public static List<RawStokesExposure> selectConfiguration(List<RawStokesExposure> exposures,
      String config) {
    List<RawStokesExposure> selected = new ArrayList<>();
    for (RawStokesExposure exposure : exposures) {
      if (exposure.getName().getConfig().equals(config)) {
        selected.add(exposure);
      }
    }
    selected.sort(EXPOSURE_ORDER);
    return selected;
  }

  /**
   * Group exposures into observations
   *
   * @param exposures raw stokes exposures, of any configurations
   * @return observations in processing order
   */
  public static List<Observation> group(List<RawStokesExposure> exposures) {
    List<RawStokesExposure> sorted = new ArrayList<>(exposures);
    sorted.sort(EXPOSURE_ORDER);

    List<Observation> observations = new ArrayList<>();
    List<List<RawStokesExposure>> pairs = new ArrayList<>();
    List<RawStokesExposure> cycles = new ArrayList<>();
    RawStokesExposure previous = null;

    for (RawStokesExposure exposure : sorted) {
      if (previous != null) {
        ExposureName last = previous.getName();
        ExposureName next = exposure.getName();
        boolean sameObservation = last.getObject().equals(next.getObject())
            && last.getConfig().equals(next.getConfig());
        boolean samePair = sameObservation && last.getWaveplate().equals(next.getWaveplate());
        if (!samePair) {
          pairs.add(cycles);
          cycles = new ArrayList<>();
        }
        if (!sameObservation) {
          observations.add(new Observation(last.getObject(), last.getConfig(), pairs));
          pairs = new ArrayList<>();
        }
      }
      cycles.add(exposure);
      previous = exposure;
    }
    if (previous != null) {
      pairs.add(cycles);
      ExposureName last = previous.getName();
      observations.add(new Observation(last.getObject(), last.getConfig(), pairs));
    }
    return observations;
  }
}
