package rss.specpol.output;

/**
 * Reference frame of the position angle of a final stokes spectrum
 */
public enum FrameType {

  INSTRUMENTAL("Instrumental"),
  EQUATORIAL("Equatorial");

  private final String name;

  FrameType(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
