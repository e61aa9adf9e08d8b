package nl.adgroot.pdftojpeg.convert;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Renders every page of a PDF file, in page order.
 */
public interface PageRasterizer {

  List<BufferedImage> rasterize(Path pdfFile, int dpi) throws IOException;
}
