package nl.adgroot.pdftojpeg.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ConfigLoader {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String DEFAULT_RESOURCE = "config.json";

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) throws IOException {
    if (!Files.exists(configPath)) {
      throw new IOException("Config file not found: " + configPath.toAbsolutePath());
    }
    AppConfig cfg = MAPPER.readValue(configPath.toFile(), AppConfig.class);
    LOG.debug("Loaded config from {}", configPath.toAbsolutePath());
    return normalize(cfg);
  }

  /** Reads {@code config.json} from the classpath, or returns defaults when it is not there. */
  public static AppConfig loadDefault() throws IOException {
    try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (is == null) {
        LOG.debug("No {} on classpath, using defaults", DEFAULT_RESOURCE);
        return new AppConfig();
      }
      return normalize(MAPPER.readValue(is, AppConfig.class));
    }
  }

  // JSON "null" for a whole section would otherwise leave us with NPEs later on
  private static AppConfig normalize(AppConfig cfg) {
    if (cfg.concurrency == null) cfg.concurrency = new AppConfig.ConcurrencyConfig();
    if (cfg.conversion == null) cfg.conversion = new AppConfig.ConversionConfig();
    if (cfg.extraction == null) cfg.extraction = new AppConfig.ExtractionConfig();
    if (cfg.fetch == null) cfg.fetch = new AppConfig.FetchConfig();
    if (cfg.archive == null) cfg.archive = new AppConfig.ArchiveConfig();
    if (cfg.workspace == null) cfg.workspace = new AppConfig.WorkspaceConfig();
    return cfg;
  }
}
