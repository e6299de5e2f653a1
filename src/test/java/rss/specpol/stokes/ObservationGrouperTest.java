package rss.specpol.stokes;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import rss.specpol.input.PatternTable;
import rss.specpol.input.RawStokesExposure;
import rss.specpol.input.WavelengthGrid;
import rss.specpol.test.TestUtils;

public class ObservationGrouperTest {

  private static RawStokesExposure raw(String object, String config, String waveplate,
      String cycle) {
    return TestUtils.exposure(object, config, waveplate, cycle, "LINEAR", 0.01);
  }

  @Test
  public void groupsByObjectConfigurationAndPair() {
    List<RawStokesExposure> exposures = Arrays.asList(
        raw("vega", "c1", "h04", "01"),
        raw("vega", "c0", "h26", "02"),
        raw("deneb", "c0", "h04", "01"),
        raw("vega", "c0", "h04", "02"),
        raw("vega", "c0", "h26", "01"),
        raw("vega", "c0", "h04", "01"),
        raw("deneb", "c0", "h26", "01"));

    assertEquals(Arrays.asList("c0", "c1"), ObservationGrouper.getConfigurations(exposures));

    List<RawStokesExposure> c0 = ObservationGrouper.selectConfiguration(exposures, "c0");
    assertEquals(6, c0.size());
    List<Observation> observations = ObservationGrouper.group(c0);
    assertEquals(2, observations.size());

    Observation deneb = observations.get(0);
    assertEquals("deneb", deneb.getObject());
    assertEquals("deneb_c0_1", deneb.getName());
    assertEquals("deneb_c0_1_stokes.txt", deneb.getOutputFileName());

    Observation vega = observations.get(1);
    assertEquals(2, vega.getPairCount());
    assertEquals("vega_c0_12", vega.getName());
    List<List<RawStokesExposure>> pairs = vega.getPairs();
    assertEquals("h04", pairs.get(0).get(0).getName().getWaveplate());
    assertEquals("01", pairs.get(0).get(0).getName().getCycleLabel());
    assertEquals("02", pairs.get(0).get(1).getName().getCycleLabel());
    assertEquals("h26", pairs.get(1).get(0).getName().getWaveplate());
    assertEquals("LINEAR", vega.getPatternName());
  }

  @Test
  public void unequalCyclesNameEveryPair() {
    List<Observation> observations = ObservationGrouper.group(Arrays.asList(
        raw("vega", "c0", "h04", "11"),
        raw("vega", "c0", "h04", "12"),
        raw("vega", "c0", "h26", "11")));
    assertEquals(1, observations.size());
    assertEquals("vega_c0_12_1", observations.get(0).getName());
  }

  @Test
  public void pairIndicesFollowPattern() throws IOException, ObservationSkippedException {
    Observation observation = ObservationGrouper.group(Arrays.asList(
        raw("vega", "c0", "h37", "01"),
        raw("vega", "c0", "h15", "01"))).get(0);
    int[] indices = observation.getPairIndices(PatternTable.loadEmbedded().get("LINEAR-HI"));
    assertArrayEquals(new int[]{1, 3}, indices);
  }

  @Test
  public void pairOutsidePatternIsSkipped() throws IOException {
    Observation observation = ObservationGrouper.group(Arrays.asList(
        raw("vega", "c0", "h04", "01"),
        raw("vega", "c0", "h15", "01"))).get(0);
    try {
      observation.getPairIndices(PatternTable.loadEmbedded().get("LINEAR"));
      fail();
    } catch (ObservationSkippedException e) {
      assertEquals("Waveplate pair 15 not part of pattern LINEAR, skipping observation",
          e.getMessage());
    }
  }

  @Test(expected = ObservationSkippedException.class)
  public void gridMismatchIsSkipped() throws ObservationSkippedException {
    Observation observation = ObservationGrouper.group(Arrays.asList(
        raw("vega", "c0", "h04", "01"),
        raw("vega", "c0", "h26", "01"))).get(0);
    observation.checkGrid(new WavelengthGrid(TestUtils.START + 1., TestUtils.STEP,
        TestUtils.WAVS));
  }
}
