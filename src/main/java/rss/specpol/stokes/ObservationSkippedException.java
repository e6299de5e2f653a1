package rss.specpol.stokes;

/**
 * Thrown when an observation cannot be reduced to a final stokes spectrum: its pattern is not
 * supported, it has too few waveplate pairs, or its exposures are structurally inconsistent.
 * The message is the reason logged for the skip. Skipping one observation never stops the run.
 */
public class ObservationSkippedException extends Exception {

  public ObservationSkippedException(String reason) {
    super(reason);
  }
}
