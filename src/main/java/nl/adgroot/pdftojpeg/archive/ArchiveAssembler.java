package nl.adgroot.pdftojpeg.archive;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

import nl.adgroot.pdftojpeg.config.AppConfig;
import nl.adgroot.pdftojpeg.convert.ConversionResult;
import nl.adgroot.pdftojpeg.convert.PageImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs converted pages into a zip archive.
 *
 * <p>Documents are written sorted by id, pages in page order, so the layout never depends on the
 * order in which conversions finished. Every page becomes a JPEG at the configured quality. With
 * more than one document in scope a {@code summary.json} entry can be added that accounts for
 * every document, failed ones included.</p>
 */
public class ArchiveAssembler {

  private static final Logger LOG = LoggerFactory.getLogger(ArchiveAssembler.class);
  private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final float jpegQuality;
  private final boolean includeSummary;
  private final String summaryEntryName;

  public ArchiveAssembler(AppConfig.ArchiveConfig cfg) {
    this.jpegQuality = Math.max(0f, Math.min(1f, cfg.jpegQuality));
    this.includeSummary = cfg.includeSummary;
    this.summaryEntryName = cfg.summaryEntryName;
  }

  public byte[] assemble(List<ConversionResult> results, NamingMode mode)
      throws EmptyArchiveException, IOException {
    return zip(entries(results, mode));
  }

  /**
   * Encodes every page and lays out the entries, summary last.
   *
   * @throws EmptyArchiveException when no result is a success
   */
  public List<ArchiveEntry> entries(List<ConversionResult> results, NamingMode mode)
      throws EmptyArchiveException, IOException {
    List<ConversionResult> succeeded = results.stream()
        .filter(ConversionResult::isSuccess)
        .sorted(Comparator.comparing(ConversionResult::id))
        .toList();
    if (succeeded.isEmpty()) {
      throw new EmptyArchiveException(results.size());
    }

    // documents in scope = every document processed, failed ones included
    boolean singleDocument = results.size() == 1;
    Set<String> usedPaths = new HashSet<>();
    List<ArchiveEntry> entries = new ArrayList<>();

    for (ConversionResult result : succeeded) {
      for (PageImage page : result.pages()) {
        String path = uniquePath(pagePath(result.id(), page.pageNumber(), mode, singleDocument), usedPaths);
        entries.add(new ArchiveEntry(path, encodeJpeg(page.image())));
      }
    }

    if (includeSummary && !singleDocument) {
      byte[] summary = MAPPER.writeValueAsBytes(RunSummary.of(results));
      entries.add(new ArchiveEntry(uniquePath(summaryEntryName, usedPaths), summary));
    }
    return entries;
  }

  static String pagePath(String docId, int pageNumber, NamingMode mode, boolean singleDocument) {
    if (singleDocument) {
      return "page_" + pageNumber + ".jpg";
    }
    return mode == NamingMode.GROUPED
        ? docId + "/page_" + pageNumber + ".jpg"
        : docId + "_page_" + pageNumber + ".jpg";
  }

  // ids are unique per run; this only matters when a user id looks like a generated suffix
  private static String uniquePath(String path, Set<String> used) {
    if (used.add(path)) return path;

    int dot = path.lastIndexOf('.');
    String stem = dot > 0 ? path.substring(0, dot) : path;
    String ext = dot > 0 ? path.substring(dot) : "";
    int k = 2;
    String candidate;
    do {
      candidate = stem + "_" + k++ + ext;
    } while (!used.add(candidate));
    LOG.warn("Archive path {} already taken, using {}", path, candidate);
    return candidate;
  }

  byte[] encodeJpeg(BufferedImage image) throws IOException {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
    if (!writers.hasNext()) {
      throw new IOException("No JPEG writer available");
    }
    ImageWriter writer = writers.next();

    ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(jpegQuality);

    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (ImageOutputStream ios = new MemoryCacheImageOutputStream(baos)) {
      writer.setOutput(ios);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
    return baos.toByteArray();
  }

  static byte[] zip(List<ArchiveEntry> entries) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (ZipOutputStream zos = new ZipOutputStream(baos)) {
      zos.setMethod(ZipOutputStream.DEFLATED);
      for (ArchiveEntry entry : entries) {
        zos.putNextEntry(new ZipEntry(entry.path()));
        zos.write(entry.bytes());
        zos.closeEntry();
      }
    }
    LOG.debug("Archive holds {} entries, {} bytes", entries.size(), baos.size());
    return baos.toByteArray();
  }
}
