package nl.adgroot.pdftojpeg.convert;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

public class PdfBoxPageRasterizer implements PageRasterizer {

  /**
   * Renders all pages as RGB images (JPEG has no alpha channel).
   *
   * <p>All page rasters of the document are held in memory at once.</p>
   */
  @Override
  public List<BufferedImage> rasterize(Path pdfFile, int dpi) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfFile.toFile())) {
      int pages = document.getNumberOfPages();
      if (pages == 0) {
        throw new IOException("PDF has no pages: " + pdfFile.getFileName());
      }

      PDFRenderer renderer = new PDFRenderer(document);

      List<BufferedImage> images = new ArrayList<>(pages);
      for (int i = 0; i < pages; i++) {
        if (Thread.currentThread().isInterrupted()) {
          throw new IOException("Rendering interrupted at page " + (i + 1) + " of " + pages);
        }
        images.add(renderer.renderImageWithDPI(i, dpi, ImageType.RGB));
      }
      return images;
    }
  }
}
