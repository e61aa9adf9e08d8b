package nl.adgroot.pdftojpeg.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public ConcurrencyConfig concurrency = new ConcurrencyConfig();
  public ConversionConfig conversion = new ConversionConfig();
  public ExtractionConfig extraction = new ExtractionConfig();
  public FetchConfig fetch = new FetchConfig();
  public ArchiveConfig archive = new ArchiveConfig();
  public WorkspaceConfig workspace = new WorkspaceConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ConcurrencyConfig {
    // documents converted at the same time (effective cap = min(this, task count))
    public int maxConcurrent = 3;

    // requests above this are clamped, whatever the caller asks for
    public int hardCeiling = 5;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ConversionConfig {
    public int defaultDpi = 150;
    public int maxDpi = 600;
    public int rasterizeTimeoutSeconds = 120;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExtractionConfig {
    // a "--" line only counts as a multipart boundary when longer than this
    public int minBoundaryLength = 10;

    // object fields at least this long are treated as encoded PDF payloads
    public int minPayloadFieldLength = 100;

    // max chars of payload text that may end up in a TRACE diagnostic
    public int previewChars = 64;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class FetchConfig {
    public int timeoutSeconds = 30;
    public long maxBytes = 100L * 1024 * 1024;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ArchiveConfig {
    public float jpegQuality = 0.85f;

    // "flat" or "grouped"
    public String namingMode = "flat";
    public boolean includeSummary = true;
    public String summaryEntryName = "summary.json";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class WorkspaceConfig {
    // null -> system temp dir
    public String root;
  }
}
