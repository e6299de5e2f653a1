package rss.specpol.output;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import javax.imageio.ImageIO;
import org.jfree.chart.JFreeChart;

/**
 * Easy interface by which external programs (e.g., a Python reduction script through
 * {@link rss.specpol.StokesProcessingServer}) can read a final stokes reduction. A result holds
 * three maps: string descriptors to numeric arrays (the spectrum and its summary values),
 * string descriptors to text metadata, and string descriptors to PNG images of the plots, stored
 * as byte arrays so they can be passed across the gateway directly.
 */
public class StokesResult {

  private final Map<String, double[]> numerMap;
  private final Map<String, String> textMap;
  private final Map<String, byte[]> imageMap;

  private StokesResult() {
    numerMap = new HashMap<>();
    textMap = new HashMap<>();
    imageMap = new HashMap<>();
  }

  /**
   * Collect the data of a final stokes spectrum
   *
   * @param spectrum final stokes spectrum
   * @param average weighted average of the spectrum
   * @param withImages true to render the plots as PNG images
   * @return object holding these values in easily-accessed maps with variable descriptions
   * @throws IOException if a plot cannot be encoded
   */
  public static StokesResult buildFinalStokesData(FinalStokesSpectrum spectrum,
      WeightedStokes average, boolean withImages) throws IOException {
    StokesResult out = new StokesResult();
    double[][] stokes = spectrum.getStokes();
    double[][] variance = spectrum.getVariance();
    boolean[][] bpm = spectrum.getBadPixel();
    out.numerMap.put("Wavelength", spectrum.getGrid().getWavelengths());
    String[] names = {"I", "Q", "U"};
    for (int f = 0; f < names.length; ++f) {
      out.numerMap.put("Stokes_" + names[f], stokes[f]);
      out.numerMap.put("Variance_" + names[f], variance[f]);
      double[] flags = new double[bpm[f].length];
      for (int w = 0; w < flags.length; ++w) {
        flags[w] = bpm[f][w] ? 1. : 0.;
      }
      out.numerMap.put("Bad_pixel_" + names[f], flags);
    }
    out.numerMap.put("Covariance_QU", variance[3]);
    out.numerMap.put("Systematic_error_percent",
        new double[]{spectrum.getSystematicErrorPercent()});
    out.numerMap.put("Weighted_mean_wavelength", new double[]{average.getWavelength()});
    out.numerMap.put("Weighted_percent_polarization", new double[]{
        average.getPolarizationPercent(), average.getPolarizationPercentError()});
    out.numerMap.put("Weighted_position_angle", new double[]{
        average.getPositionAngle(), average.getPositionAngleError()});

    out.textMap.put("Name", spectrum.getName());
    out.textMap.put("Object", spectrum.getObject());
    out.textMap.put("Pattern", spectrum.getPattern());
    out.textMap.put("PA_type", spectrum.getFrame().getName());
    out.textMap.put("Calibration_history", String.join("\n", spectrum.getProvenance()));

    if (withImages) {
      JFreeChart[] charts = StokesReport.createCharts(spectrum);
      out.imageMap.put("Intensity_plot", toPNG(charts[0]));
      out.imageMap.put("Polarization_plot", toPNG(charts[1]));
    }
    return out;
  }

  private static byte[] toPNG(JFreeChart chart) throws IOException {
    ByteArrayOutputStream stream = new ByteArrayOutputStream();
    ImageIO.write(chart.createBufferedImage(StokesReport.CHART_WIDTH, StokesReport.CHART_HEIGHT),
        "png", stream);
    return stream.toByteArray();
  }

  /**
   * Get the numeric data of the result
   *
   * @return Map from descriptors to arrays of values
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

  /**
   * Get the text metadata of the result
   *
   * @return Map from descriptors to text
   */
  public Map<String, String> getTextMap() {
    return textMap;
  }

  /**
   * Get the plots of the result
   *
   * @return Map from plot names to PNG-encoded images
   */
  public Map<String, byte[]> getImageMap() {
    return imageMap;
  }
}
