package nl.adgroot.pdftojpeg.convert;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

import nl.adgroot.pdftojpeg.extract.ExtractedDocument;
import nl.adgroot.pdftojpeg.extract.ExtractionException;
import nl.adgroot.pdftojpeg.extract.ExtractionStrategy;
import nl.adgroot.pdftojpeg.extract.PayloadExtractor;
import nl.adgroot.pdftojpeg.extract.PdfBytes;
import nl.adgroot.pdftojpeg.fetch.FetchException;
import nl.adgroot.pdftojpeg.fetch.RemoteFetcher;
import nl.adgroot.pdftojpeg.input.ExtractionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves one task to PDF bytes and renders them. Every fault ends up as a failure
 * {@link ConversionResult}; nothing is thrown to the caller.
 */
public class ConversionWorker {

  private static final Logger LOG = LoggerFactory.getLogger(ConversionWorker.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DATA_URI_PREFIX = Pattern.compile("^data:[^,]*;base64,", Pattern.CASE_INSENSITIVE);

  private final PageRasterizer rasterizer;
  private final RemoteFetcher fetcher;
  private final PayloadExtractor extractor;
  private final ExecutorService rasterizerPool;
  private final Duration rasterizeTimeout;

  /**
   * @param rasterizerPool rasterizer calls run here so the worker thread can stop waiting after
   *                       {@code rasterizeTimeout}
   */
  public ConversionWorker(
      PageRasterizer rasterizer,
      RemoteFetcher fetcher,
      PayloadExtractor extractor,
      ExecutorService rasterizerPool,
      Duration rasterizeTimeout
  ) {
    this.rasterizer = rasterizer;
    this.fetcher = fetcher;
    this.extractor = extractor;
    this.rasterizerPool = rasterizerPool;
    this.rasterizeTimeout = rasterizeTimeout;
  }

  /**
   * Converts one task. An envelope holding several PDFs gives one result per document, with ids
   * {@code <task id>_1}, {@code <task id>_2}, ... in envelope order.
   *
   * @param workDir directory owned by this task; PDFs are written here for the rasterizer
   */
  public List<ConversionResult> convert(ExtractionTask task, Path workDir) {
    List<ExtractedDocument> docs;
    try {
      docs = resolve(task);
    } catch (ExtractionException e) {
      return List.of(fail(task.id(), FailureKind.EXTRACTION, e.getMessage()));
    } catch (FetchException e) {
      return List.of(fail(task.id(), FailureKind.FETCH, e.getMessage()));
    } catch (RuntimeException e) {
      return List.of(fail(task.id(), FailureKind.INVALID_CONTENT, describe(e)));
    }

    if (docs.size() == 1) {
      return List.of(render(task.id(), docs.get(0), task.dpi(), workDir));
    }

    LOG.info("Task {} holds {} documents", task.id(), docs.size());
    List<ConversionResult> results = new ArrayList<>(docs.size());
    for (int i = 0; i < docs.size(); i++) {
      results.add(render(task.id() + "_" + (i + 1), docs.get(i), task.dpi(), workDir));
    }
    return results;
  }

  List<ExtractedDocument> resolve(ExtractionTask task) throws ExtractionException, FetchException {
    String value = task.source().value();

    switch (task.source().kind()) {
      case INLINE_CONTENT:
      case MULTIPART_BLOB: {
        // a payload that is one base64 PDF is used whole; the extractor would cut it at the first %%EOF
        byte[] direct = decodeDirect(value);
        if (direct != null) {
          return List.of(new ExtractedDocument(direct, ExtractionStrategy.DIRECT));
        }
        return extractor.extract(value);
      }
      case REMOTE_URL: {
        byte[] fetched = fetcher.fetch(value);
        if (PdfBytes.startsWithSignature(fetched)) {
          return List.of(new ExtractedDocument(fetched, ExtractionStrategy.DIRECT));
        }
        return extractor.extract(fetched);
      }
      default:
        throw new IllegalStateException("Unknown source kind: " + task.source().kind());
    }
  }

  private ConversionResult render(String docId, ExtractedDocument doc, int dpi, Path workDir) {
    long startNs = System.nanoTime();
    Path pdfPath = workDir.resolve(docId + ".pdf");

    try {
      Files.createDirectories(workDir);
      Files.write(pdfPath, doc.bytes());
    } catch (IOException e) {
      return fail(docId, FailureKind.CONVERSION, "Could not stage PDF: " + describe(e));
    }

    LOG.debug("Rendering {} ({} bytes via {}) at {} dpi", docId, doc.length(), doc.strategy(), dpi);
    Future<List<BufferedImage>> rendering;
    try {
      rendering = rasterizerPool.submit(() -> rasterizer.rasterize(pdfPath, dpi));
    } catch (RejectedExecutionException e) {
      deleteQuietly(pdfPath);
      return fail(docId, FailureKind.CONVERSION, "Rasterizer pool is shut down");
    }

    try {
      List<BufferedImage> images = rendering.get(rasterizeTimeout.toMillis(), TimeUnit.MILLISECONDS);
      if (images == null || images.isEmpty()) {
        return fail(docId, FailureKind.CONVERSION, "Rasterizer returned no pages");
      }

      List<PageImage> pages = new ArrayList<>(images.size());
      for (int i = 0; i < images.size(); i++) {
        pages.add(new PageImage(i + 1, images.get(i)));
      }

      LOG.info("Converted {}: {} page(s) in {}ms", docId, pages.size(), (System.nanoTime() - startNs) / 1_000_000);
      return ConversionResult.success(docId, pages);
    } catch (TimeoutException e) {
      rendering.cancel(true);
      return fail(docId, FailureKind.TIMEOUT, "Rendering took longer than " + rasterizeTimeout.toSeconds() + "s");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      return fail(docId, FailureKind.CONVERSION, describe(cause));
    } catch (InterruptedException e) {
      rendering.cancel(true);
      Thread.currentThread().interrupt();
      return fail(docId, FailureKind.CONVERSION, "Interrupted while rendering");
    } finally {
      deleteQuietly(pdfPath);
    }
  }

  private static ConversionResult fail(String id, FailureKind kind, String message) {
    LOG.warn("Document {} failed ({}): {}", id, kind, message);
    return ConversionResult.failure(id, kind, message);
  }

  /** The decoded bytes when {@code value} is a base64 (or base64url) PDF, else null. */
  static byte[] decodeDirect(String value) {
    String compact = WHITESPACE.matcher(DATA_URI_PREFIX.matcher(value).replaceFirst("")).replaceAll("");
    for (Base64.Decoder decoder : List.of(Base64.getDecoder(), Base64.getUrlDecoder())) {
      try {
        byte[] decoded = decoder.decode(compact);
        if (PdfBytes.startsWithSignature(decoded)) {
          return decoded;
        }
      } catch (IllegalArgumentException notThisAlphabet) {
        LOG.trace("Payload does not decode as base64: {}", notThisAlphabet.getMessage());
      }
    }
    return null;
  }

  private static String describe(Throwable t) {
    String msg = t.getMessage();
    return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      // the workspace is removed as a whole at the end of the invocation
      LOG.debug("Could not delete {}: {}", path, e.getMessage());
    }
  }
}
