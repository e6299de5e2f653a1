package rss.specpol.utils;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.jfree.chart.JFreeChart;

/**
 * This class defines functions relevant to creating report files, such as images of plots
 * and PDF pages. These methods are all static. Charts are drawn straight to images, so reports
 * can be written on a headless machine.
 */
public class ReportingUtils {

  /**
   * Add a buffered image to a PDDocument page
   *
   * @param bi BufferedImage to be added to PDF
   * @param pdf PDF to have BufferedImage appended to
   * @throws IOException if the image cannot be encoded into the document
   */
  private static void bufferedImageToPDFPage(BufferedImage bi, PDDocument pdf)
      throws IOException {
    PDRectangle rec = new PDRectangle(bi.getWidth(), bi.getHeight());
    PDPage page = new PDPage(rec);
    PDImageXObject pdImageXObject = LosslessFactory.createFromImage(pdf, bi);
    pdf.addPage(page);
    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page,
        PDPageContentStream.AppendMode.OVERWRITE, true, false)) {
      contentStream.drawImage(pdImageXObject, 0, 0, bi.getWidth(), bi.getHeight());
    }
  }

  /**
   * Converts a series of charts into a buffered image. Each chart has the dimensions given as
   * the width and height parameters, and the charts are concatenated vertically
   *
   * @param width width of each chart plot
   * @param height height of each chart plot
   * @param charts series of charts to be plotted in
   * @return buffered image consisting of the concatenation of the given charts
   */
  public static BufferedImage chartsToImage(int width, int height, JFreeChart... charts) {
    BufferedImage[] bis = new BufferedImage[charts.length];
    for (int i = 0; i < charts.length; ++i) {
      bis[i] = charts[i].createBufferedImage(width, height);
    }
    return mergeBufferedImages(bis);
  }

  /**
   * Takes in a series of charts and produces a PDF page of those charts
   *
   * @param width Width of each chart to be added to the PDF
   * @param height Height of each chart to be added to the PDF
   * @param pdf PDF document to have the data appended to
   * @param charts series of charts to place in the PDF
   * @throws IOException if the page cannot be written
   */
  public static void chartsToPDFPage(int width, int height, PDDocument pdf,
      JFreeChart... charts) throws IOException {
    BufferedImage bi = chartsToImage(width, height, charts);
    bufferedImageToPDFPage(bi, pdf);
  }

  /**
   * Utility function to combine a series of buffered images into a single buffered image.
   * Images are concatenated vertically and centered horizontally into an image as wide as the
   * widest passed-in image
   *
   * @param images Buffered images to send in
   * @return Single concatenated buffered image
   */
  private static BufferedImage mergeBufferedImages(BufferedImage... images) {
    int maxWidth = 0;
    int totalHeight = 0;
    for (BufferedImage bi : images) {
      maxWidth = Math.max(maxWidth, bi.getWidth());
      totalHeight += bi.getHeight();
    }

    BufferedImage out = new BufferedImage(maxWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = out.createGraphics();
    int heightIndex = 0;
    for (BufferedImage bi : images) {
      int centeringOffset = (maxWidth - bi.getWidth()) / 2;
      g.drawImage(bi, null, centeringOffset, heightIndex);
      heightIndex += bi.getHeight();
    }
    g.dispose();
    return out;
  }

  /**
   * Add a page to a PDF document consisting of textual data. Lines longer than the page are
   * wrapped at spaces.
   *
   * @param toWrite String to add to a new PDF page
   * @param pdf Document to append the page to
   * @throws IOException if the text cannot be measured or written
   */
  public static void textToPDFPage(String toWrite, PDDocument pdf) throws IOException {
    if (toWrite.length() == 0) {
      return;
    }

    PDPage page = new PDPage();
    pdf.addPage(page);

    PDFont pdfFont = PDType1Font.COURIER;
    float fontSize = 10;
    float leading = 1.5f * fontSize;

    PDRectangle mediaBox = page.getMediaBox();
    float margin = 72;
    float width = mediaBox.getWidth() - 2 * margin;
    float startX = mediaBox.getLowerLeftX() + margin;
    float startY = mediaBox.getUpperRightY() - margin;

    List<String> lines = new ArrayList<>();
    for (String text : toWrite.split("\n")) {
      if (text.isEmpty()) {
        lines.add(text);
        continue;
      }
      int lastSpace = -1;
      while (text.length() > 0) {
        int spaceIndex = text.indexOf(' ', lastSpace + 1);
        if (spaceIndex < 0) {
          spaceIndex = text.length();
        }
        String subString = text.substring(0, spaceIndex);
        float size = fontSize * pdfFont.getStringWidth(subString) / 1000;
        if (size > width) {
          if (lastSpace < 0) {
            lastSpace = spaceIndex;
          }
          lines.add(text.substring(0, lastSpace));
          text = text.substring(lastSpace).trim();
          lastSpace = -1;
        } else if (spaceIndex == text.length()) {
          lines.add(text);
          text = "";
        } else {
          lastSpace = spaceIndex;
        }
      }
    }

    try (PDPageContentStream contentStream = new PDPageContentStream(pdf, page)) {
      contentStream.beginText();
      contentStream.setFont(pdfFont, fontSize);
      contentStream.newLineAtOffset(startX, startY);
      for (String line : lines) {
        contentStream.showText(line);
        contentStream.newLineAtOffset(0, -leading);
      }
      contentStream.endText();
    }
  }
}
