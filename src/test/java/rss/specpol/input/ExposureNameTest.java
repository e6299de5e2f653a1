package rss.specpol.input;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import rss.specpol.input.ExposureName.ExposureNameFormatException;

public class ExposureNameTest {

  @Test
  public void parsesGroupingKeys() throws ExposureNameFormatException {
    ExposureName name = ExposureName.parse("/data/night1/HD_12345_c0_h15_02.txt");
    assertEquals("HD_12345", name.getObject());
    assertEquals("c0", name.getConfig());
    assertEquals("h15", name.getWaveplate());
    assertEquals("15", name.getPairCode());
    assertEquals(1, name.getFirstStation());
    assertEquals("02", name.getCycleLabel());
    assertEquals(2, name.getCycle());
    assertEquals("HD_12345_c0_h15_02", name.toString());
  }

  @Test
  public void parsesNameWithoutExtension() throws ExposureNameFormatException {
    ExposureName name = ExposureName.parse("star_c1_h26_1");
    assertEquals("star", name.getObject());
    assertEquals("c1", name.getConfig());
    assertEquals(2, name.getFirstStation());
    assertEquals(1, name.getCycle());
  }

  @Test(expected = ExposureNameFormatException.class)
  public void tooFewParts() throws ExposureNameFormatException {
    ExposureName.parse("star_h04_01.txt");
  }

  @Test(expected = ExposureNameFormatException.class)
  public void configMustStartWithC() throws ExposureNameFormatException {
    ExposureName.parse("star_x0_h04_01.txt");
  }

  @Test(expected = ExposureNameFormatException.class)
  public void waveplateMustStartWithH() throws ExposureNameFormatException {
    ExposureName.parse("star_c0_p04_01.txt");
  }

  @Test(expected = ExposureNameFormatException.class)
  public void cycleMustBeNumeric() throws ExposureNameFormatException {
    ExposureName.parse("star_c0_h04_a.txt");
  }
}
