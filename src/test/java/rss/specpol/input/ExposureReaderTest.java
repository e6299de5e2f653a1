package rss.specpol.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import rss.specpol.input.ExposureName.ExposureNameFormatException;
import rss.specpol.input.ExposureReader.ExposureFormatException;
import rss.specpol.test.TestUtils;

public class ExposureReaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File write(String name, String... lines) throws IOException {
    File out = new File(folder.getRoot(), name);
    try (PrintWriter pw = new PrintWriter(new FileWriter(out))) {
      for (String line : lines) {
        pw.println(line);
      }
    }
    return out;
  }

  @Test
  public void readsHeaderAndRows() throws Exception {
    File file = write("vega_c0_h04_01.txt",
        "# GRATING = PG0900",
        "# CRVAL1 = 4000.0",
        "# CDELT1 = 2.5",
        "# TELPA = 31.5",
        "# TRKRHO = -0.25",
        "# LAMPID = Ar ",
        "# WPPATERN = Linear-Hi",
        "1000 10 100 1 0 0",
        "1100 -11 110 1.1 0 1",
        "",
        "1200 12 120 1.2 1 0");

    RawStokesExposure raw = ExposureReader.read(file.getPath());
    assertEquals("vega", raw.getName().getObject());
    assertEquals(new WavelengthGrid(4000., 2.5, 3), raw.getGrid());
    assertEquals("PG0900", raw.getGrating());
    assertEquals("LINEAR-HI", raw.getPattern());
    assertEquals("AR", raw.getLampId());
    assertTrue(raw.isLampExposure());
    assertEquals(31.5, raw.getTelescopePA(), 0.);
    assertEquals(-0.25, raw.getTrackRho(), 0.);

    double[][] stokes = raw.getStokes();
    assertArrayEquals(new double[]{1000., 1100., 1200.}, stokes[0], 0.);
    assertArrayEquals(new double[]{10., -11., 12.}, stokes[1], 0.);
    double[][] variance = raw.getVariance();
    assertArrayEquals(new double[]{100., 110., 120.}, variance[0], 0.);
    assertArrayEquals(new double[]{1., 1.1, 1.2}, variance[1], 0.);
    boolean[][] bpm = raw.getBadPixel();
    assertFalse(bpm[0][1]);
    assertTrue(bpm[1][1]);
    assertTrue(bpm[0][2]);
  }

  @Test
  public void missingLampIsSkyExposure() throws Exception {
    File file = TestUtils.writeExposure(folder.getRoot(), "vega_c0_h26_01.txt", "LINEAR",
        10., 0.01);
    RawStokesExposure raw = ExposureReader.read(file.getPath());
    assertEquals(RawStokesExposure.NO_LAMP, raw.getLampId());
    assertFalse(raw.isLampExposure());
    assertEquals(TestUtils.WAVS, raw.getGrid().getLength());
  }

  @Test(expected = ExposureFormatException.class)
  public void missingWavelengthKeyword() throws Exception {
    File file = write("vega_c0_h04_01.txt",
        "# CDELT1 = 2.5",
        "# WPPATERN = LINEAR",
        "1000 10 100 1 0 0");
    ExposureReader.read(file.getPath());
  }

  @Test(expected = ExposureFormatException.class)
  public void wrongColumnCount() throws Exception {
    File file = write("vega_c0_h04_01.txt",
        "# CRVAL1 = 4000.0",
        "# CDELT1 = 2.5",
        "# WPPATERN = LINEAR",
        "1000 10 100 1 0");
    ExposureReader.read(file.getPath());
  }

  @Test(expected = ExposureFormatException.class)
  public void noDataRows() throws Exception {
    File file = write("vega_c0_h04_01.txt",
        "# CRVAL1 = 4000.0",
        "# CDELT1 = 2.5",
        "# WPPATERN = LINEAR");
    ExposureReader.read(file.getPath());
  }

  @Test(expected = ExposureNameFormatException.class)
  public void nameIsCheckedFirst() throws Exception {
    File file = write("vega_sum.txt", "1000 10 100 1 0 0");
    ExposureReader.read(file.getPath());
  }
}
