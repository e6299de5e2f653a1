package rss.specpol.output;

import java.io.File;
import java.io.IOException;
import java.util.Locale;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.JFreeChart;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import rss.specpol.utils.ReportingUtils;

/**
 * PDF report of a final stokes spectrum: plots of intensity and of percent Q and U over the
 * valid wavelengths, followed by a page with the header metadata, calibration history and
 * weighted averages.
 */
public class StokesReport {

  static final int CHART_WIDTH = 640;
  static final int CHART_HEIGHT = 300;

  /**
   * Build the plots of a spectrum
   *
   * @param spectrum final stokes spectrum
   * @return intensity chart and polarization chart
   */
  public static JFreeChart[] createCharts(FinalStokesSpectrum spectrum) {
    double[] wavs = spectrum.getGrid().getWavelengths();
    double[][] stokes = spectrum.getStokes();
    boolean[] ok = spectrum.getValid();

    XYSeries intensity = new XYSeries("I");
    XYSeries percentQ = new XYSeries("%Q");
    XYSeries percentU = new XYSeries("%U");
    for (int w = 0; w < wavs.length; ++w) {
      if (!ok[w] || stokes[0][w] == 0.) {
        continue;
      }
      intensity.add(wavs[w], stokes[0][w]);
      percentQ.add(wavs[w], 100. * stokes[1][w] / stokes[0][w]);
      percentU.add(wavs[w], 100. * stokes[2][w] / stokes[0][w]);
    }

    XYSeriesCollection intensityData = new XYSeriesCollection(intensity);
    XYSeriesCollection polarizationData = new XYSeriesCollection();
    polarizationData.addSeries(percentQ);
    polarizationData.addSeries(percentU);

    JFreeChart intensityChart = ChartFactory.createXYLineChart(
        spectrum.getName() + " intensity", "Wavelength (Ang)", "I", intensityData);
    JFreeChart polarizationChart = ChartFactory.createXYLineChart(
        spectrum.getName() + " linear polarization (" + spectrum.getFrame().getName() + ")",
        "Wavelength (Ang)", "Percent", polarizationData);
    return new JFreeChart[]{intensityChart, polarizationChart};
  }

  /**
   * Text summary of a spectrum for the report
   *
   * @param spectrum final stokes spectrum
   * @param average weighted average of the spectrum
   * @return multi-line summary
   */
  public static String getSummary(FinalStokesSpectrum spectrum, WeightedStokes average) {
    StringBuilder sb = new StringBuilder();
    sb.append("Observation: ").append(spectrum.getName()).append('\n');
    sb.append("Pattern: ").append(spectrum.getPattern()).append('\n');
    sb.append("PA type: ").append(spectrum.getFrame().getName()).append('\n');
    sb.append("Estimated sys %error: ")
        .append(String.format(Locale.ROOT, "%.2f", spectrum.getSystematicErrorPercent()))
        .append('\n');
    sb.append('\n');
    for (String line : spectrum.getProvenance()) {
      sb.append(line).append('\n');
    }
    sb.append('\n');
    sb.append(average.getReport()).append('\n');
    return sb.toString();
  }

  /**
   * Write the report of a spectrum next to its text file
   *
   * @param spectrum final stokes spectrum
   * @param average weighted average of the spectrum
   * @param folder output folder
   * @return the written PDF
   * @throws IOException if the PDF cannot be written
   */
  public static File write(FinalStokesSpectrum spectrum, WeightedStokes average, File folder)
      throws IOException {
    File out = new File(folder, spectrum.getName() + "_stokes.pdf");
    try (PDDocument pdf = new PDDocument()) {
      ReportingUtils.chartsToPDFPage(CHART_WIDTH, CHART_HEIGHT, pdf, createCharts(spectrum));
      ReportingUtils.textToPDFPage(getSummary(spectrum, average), pdf);
      pdf.save(out);
    }
    return out;
  }
}
