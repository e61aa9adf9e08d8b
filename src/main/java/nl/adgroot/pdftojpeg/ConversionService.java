package nl.adgroot.pdftojpeg;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

import nl.adgroot.pdftojpeg.archive.ArchiveAssembler;
import nl.adgroot.pdftojpeg.archive.EmptyArchiveException;
import nl.adgroot.pdftojpeg.archive.NamingMode;
import nl.adgroot.pdftojpeg.archive.RunSummary;
import nl.adgroot.pdftojpeg.config.AppConfig;
import nl.adgroot.pdftojpeg.convert.ConversionResult;
import nl.adgroot.pdftojpeg.convert.ConversionWorker;
import nl.adgroot.pdftojpeg.convert.PageRasterizer;
import nl.adgroot.pdftojpeg.convert.PdfBoxPageRasterizer;
import nl.adgroot.pdftojpeg.extract.PayloadExtractor;
import nl.adgroot.pdftojpeg.fetch.OkHttpRemoteFetcher;
import nl.adgroot.pdftojpeg.fetch.RemoteFetcher;
import nl.adgroot.pdftojpeg.input.ExtractionTask;
import nl.adgroot.pdftojpeg.input.InputNormalizer;
import nl.adgroot.pdftojpeg.input.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One invocation end to end: normalize the request, convert every task with bounded
 * concurrency, assemble the archive. Always answers with a {@link ConversionResponse}.
 */
public class ConversionService {

  private static final Logger LOG = LoggerFactory.getLogger(ConversionService.class);

  private final AppConfig cfg;
  private final InputNormalizer normalizer;
  private final PayloadExtractor extractor;
  private final PageRasterizer rasterizer;
  private final RemoteFetcher fetcher;
  private final ArchiveAssembler assembler;

  /** Production default */
  public ConversionService(AppConfig cfg) {
    this(cfg, new PdfBoxPageRasterizer(), new OkHttpRemoteFetcher(cfg.fetch));
  }

  /** Injectable for tests / alternative renderers */
  public ConversionService(AppConfig cfg, PageRasterizer rasterizer, RemoteFetcher fetcher) {
    this.cfg = cfg;
    this.normalizer = new InputNormalizer(cfg);
    this.extractor = new PayloadExtractor(cfg.extraction);
    this.rasterizer = rasterizer;
    this.fetcher = fetcher;
    this.assembler = new ArchiveAssembler(cfg.archive);
  }

  public ConversionResponse handle(String body) {
    return handle(body, NamingMode.parse(cfg.archive.namingMode), cfg.concurrency.maxConcurrent);
  }

  /**
   * @param requestedConcurrency caller's wish; clamped to the hard ceiling and the task count
   */
  public ConversionResponse handle(String body, NamingMode mode, int requestedConcurrency) {
    try {
      return process(body, mode, requestedConcurrency);
    } catch (RuntimeException e) {
      LOG.error("Invocation failed unexpectedly", e);
      return ConversionResponse.failed(RunSummary.of(List.of()), "Unexpected error: " + e.getMessage());
    }
  }

  private ConversionResponse process(String body, NamingMode mode, int requestedConcurrency) {
    long startNs = System.nanoTime();

    List<ExtractionTask> tasks;
    try {
      tasks = normalizer.normalize(body);
    } catch (InvalidInputException e) {
      LOG.warn("Rejected request: {}", e.getMessage());
      return ConversionResponse.invalidInput(e.getMessage());
    }
    LOG.info("Processing {} task(s)", tasks.size());

    List<ConversionResult> results;
    try {
      results = convertAll(tasks, requestedConcurrency);
    } catch (IOException e) {
      LOG.error("Could not set up a workspace", e);
      return ConversionResponse.failed(RunSummary.of(List.of()), "Could not set up a workspace: " + e.getMessage());
    }

    RunSummary summary = RunSummary.of(results);
    try {
      byte[] zip = assembler.assemble(results, mode);
      int totalPages = results.stream().mapToInt(ConversionResult::pageCount).sum();

      LOG.info("Converted {}/{} document(s), {} page(s), archive {} bytes in {}ms",
          summary.succeeded(), summary.total(), totalPages, zip.length, (System.nanoTime() - startNs) / 1_000_000);
      return ConversionResponse.ok(summary, totalPages, Base64.getEncoder().encodeToString(zip));
    } catch (EmptyArchiveException e) {
      LOG.warn(e.getMessage());
      return ConversionResponse.failed(summary, e.getMessage());
    } catch (IOException e) {
      LOG.error("Could not build the archive", e);
      return ConversionResponse.failed(summary, "Could not build the archive: " + e.getMessage());
    }
  }

  List<ConversionResult> convertAll(List<ExtractionTask> tasks, int requestedConcurrency) throws IOException {
    try (Workspace workspace = Workspace.create(cfg.workspace.root)) {
      int cap = BoundedScheduler.capFor(requestedConcurrency, cfg.concurrency.maxConcurrent,
          cfg.concurrency.hardCeiling, tasks.size());

      try (AppExecutors exec = AppExecutors.create(cap)) {
        ConversionWorker worker = new ConversionWorker(
            rasterizer,
            fetcher,
            extractor,
            exec.rasterizerPool(),
            Duration.ofSeconds(cfg.conversion.rasterizeTimeoutSeconds)
        );
        BoundedScheduler scheduler = new BoundedScheduler(worker::convert, cfg.concurrency);
        return scheduler.run(tasks, requestedConcurrency, exec.convertPool(), workspace);
      }
    }
  }
}
