package nl.adgroot.pdftojpeg.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import nl.adgroot.pdftojpeg.TestPdfs;
import nl.adgroot.pdftojpeg.extract.ExtractedDocument;
import nl.adgroot.pdftojpeg.extract.ExtractionStrategy;
import nl.adgroot.pdftojpeg.extract.PayloadExtractor;
import nl.adgroot.pdftojpeg.fetch.FetchException;
import nl.adgroot.pdftojpeg.fetch.RemoteFetcher;
import nl.adgroot.pdftojpeg.input.ExtractionTask;
import nl.adgroot.pdftojpeg.input.TaskOptions;
import nl.adgroot.pdftojpeg.input.TaskSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversionWorkerTest {

  private static final int DPI = 36;

  private final ExecutorService rasterizerPool = Executors.newCachedThreadPool();

  @TempDir
  Path workDir;

  @AfterEach
  void tearDown() {
    rasterizerPool.shutdownNow();
  }

  @Test
  void convert_inlineBase64Pdf_rendersEveryPageInOrder() throws Exception {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());
    ExtractionTask task = task("report", TaskSource.inline(TestPdfs.base64(TestPdfs.pdf(3))));

    List<ConversionResult> results = worker.convert(task, workDir);

    assertEquals(1, results.size());
    ConversionResult r = results.get(0);
    assertTrue(r.isSuccess(), () -> "expected success, got " + r.error());
    assertEquals("report", r.id());
    assertEquals(List.of(1, 2, 3), r.pages().stream().map(PageImage::pageNumber).toList());
    assertTrue(r.pages().get(0).image().getWidth() > 0);
  }

  @Test
  void convert_dataUriPrefix_isStripped() throws Exception {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());
    String content = "data:application/pdf;base64," + TestPdfs.base64(TestPdfs.pdf(1));

    List<ConversionResult> results = worker.convert(task("d", TaskSource.inline(content)), workDir);

    assertTrue(results.get(0).isSuccess());
    assertEquals(1, results.get(0).pageCount());
  }

  @Test
  void resolve_base64PdfWithIncrementalUpdate_keepsEveryRevision() throws Exception {
    byte[] pdf = TestPdfs.incrementalPdf();
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());

    for (TaskSource source : List.of(
        TaskSource.inline(TestPdfs.base64(pdf)),
        TaskSource.multipart(TestPdfs.base64(pdf)),
        TaskSource.inline(Base64.getUrlEncoder().encodeToString(pdf)))) {
      List<ExtractedDocument> docs = worker.resolve(task("rev", source));

      assertEquals(1, docs.size(), source::toString);
      assertEquals(ExtractionStrategy.DIRECT, docs.get(0).strategy());
      assertArrayEquals(pdf, docs.get(0).bytes());
    }
  }

  @Test
  void convert_base64PdfWithIncrementalUpdate_rendersAllPages() throws Exception {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());
    String blob = TestPdfs.base64(TestPdfs.incrementalPdf());

    List<ConversionResult> results = worker.convert(task("rev", TaskSource.multipart(blob)), workDir);

    assertTrue(results.get(0).isSuccess(), () -> "expected success, got " + results.get(0).error());
    assertEquals(2, results.get(0).pageCount());
  }

  @Test
  void convert_envelopeWithTwoPdfs_givesOneResultPerDocumentWithSuffixedIds() throws Exception {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());
    String blob = TestPdfs.encodedEnvelope(
        TestPdfs.base64Part("a.pdf", TestPdfs.pdf(1)),
        TestPdfs.base64Part("b.pdf", TestPdfs.pdf(2)));

    List<ConversionResult> results = worker.convert(task("upload", TaskSource.multipart(blob)), workDir);

    assertEquals(2, results.size());
    assertEquals("upload_1", results.get(0).id());
    assertEquals("upload_2", results.get(1).id());
    assertEquals(1, results.get(0).pageCount());
    assertEquals(2, results.get(1).pageCount());
  }

  @Test
  void convert_remoteUrl_usesFetchedBytes() throws Exception {
    byte[] pdf = TestPdfs.pdf(2);
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), url -> pdf);

    List<ConversionResult> results =
        worker.convert(task("remote", TaskSource.url("https://example.com/x.pdf")), workDir);

    assertTrue(results.get(0).isSuccess());
    assertEquals(2, results.get(0).pageCount());
  }

  @Test
  void convert_fetchFails_reportsFetchFailure() {
    RemoteFetcher failing = url -> {
      throw new FetchException("HTTP 404 for " + url);
    };
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), failing);

    List<ConversionResult> results =
        worker.convert(task("gone", TaskSource.url("https://example.com/gone.pdf")), workDir);

    assertEquals(1, results.size());
    assertFalse(results.get(0).isSuccess());
    assertEquals(FailureKind.FETCH, results.get(0).failureKind());
    assertTrue(results.get(0).error().contains("404"));
  }

  @Test
  void convert_payloadWithoutPdf_reportsExtractionFailure() {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());

    List<ConversionResult> results =
        worker.convert(task("junk", TaskSource.multipart("definitely not a pdf")), workDir);

    assertEquals(FailureKind.EXTRACTION, results.get(0).failureKind());
    assertEquals("junk", results.get(0).id());
  }

  @Test
  void convert_corruptPdf_reportsConversionFailure() {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());
    String content = TestPdfs.base64(TestPdfs.fakePdf("broken"));

    List<ConversionResult> results = worker.convert(task("broken", TaskSource.inline(content)), workDir);

    assertFalse(results.get(0).isSuccess());
    assertEquals(FailureKind.CONVERSION, results.get(0).failureKind());
  }

  @Test
  void convert_rasterizerThrows_reportsConversionFailureWithMessage() throws Exception {
    PageRasterizer failing = (file, dpi) -> {
      throw new IOException("renderer exploded");
    };
    ConversionWorker worker = worker(failing, new NoFetcher());

    List<ConversionResult> results =
        worker.convert(task("x", TaskSource.inline(TestPdfs.base64(TestPdfs.pdf(1)))), workDir);

    assertEquals(FailureKind.CONVERSION, results.get(0).failureKind());
    assertEquals("renderer exploded", results.get(0).error());
  }

  @Test
  void convert_slowRasterizer_reportsTimeout() throws Exception {
    PageRasterizer slow = (file, dpi) -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted", e);
      }
      return List.<BufferedImage>of();
    };
    ConversionWorker worker = new ConversionWorker(slow, new NoFetcher(), new PayloadExtractor(),
        rasterizerPool, Duration.ofMillis(200));

    long start = System.nanoTime();
    List<ConversionResult> results =
        worker.convert(task("slow", TaskSource.inline(TestPdfs.base64(TestPdfs.pdf(1)))), workDir);
    long tookMs = (System.nanoTime() - start) / 1_000_000;

    assertEquals(FailureKind.TIMEOUT, results.get(0).failureKind());
    assertTrue(tookMs < 5_000, "worker should stop waiting after the timeout, took " + tookMs + "ms");
  }

  @Test
  void convert_removesStagedPdfAfterwards() throws Exception {
    ConversionWorker worker = worker(new PdfBoxPageRasterizer(), new NoFetcher());

    worker.convert(task("tidy", TaskSource.inline(TestPdfs.base64(TestPdfs.pdf(1)))), workDir);

    try (Stream<Path> files = Files.list(workDir)) {
      assertEquals(0, files.filter(p -> p.toString().endsWith(".pdf")).count());
    }
  }

  private ConversionWorker worker(PageRasterizer rasterizer, RemoteFetcher fetcher) {
    return new ConversionWorker(rasterizer, fetcher, new PayloadExtractor(), rasterizerPool, Duration.ofSeconds(60));
  }

  private static ExtractionTask task(String id, TaskSource source) {
    return new ExtractionTask(id, source, new TaskOptions(DPI));
  }

  private static final class NoFetcher implements RemoteFetcher {
    @Override
    public byte[] fetch(String url) throws FetchException {
      throw new FetchException("no network in tests: " + url);
    }
  }
}
