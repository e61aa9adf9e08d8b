package nl.adgroot.pdftojpeg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Base64;

import nl.adgroot.pdftojpeg.config.AppConfig;
import nl.adgroot.pdftojpeg.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Usage: {@code Main <request-file> [output-zip] [config.json]}
 *
 * <p>The request file holds the request body exactly as a caller would send it (JSON or a bare
 * base64 payload). The archive is written to {@code output-zip} (default {@code pdf_images.zip});
 * the response, minus the archive, is printed as JSON.</p>
 */
public class Main {

  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws Exception {
    if (args.length < 1) {
      System.err.println("Usage: Main <request-file> [output-zip] [config.json]");
      System.exit(2);
    }

    Path requestPath = Paths.get(args[0]);
    Path outputPath = Paths.get(args.length > 1 ? args[1] : ConversionResponse.ARCHIVE_FILE_NAME);

    // read config
    AppConfig cfg = args.length > 2 ? ConfigLoader.load(Paths.get(args[2])) : ConfigLoader.loadDefault();

    String body = Files.readString(requestPath, StandardCharsets.UTF_8);
    LOG.info("Read request of {} chars from {}", body.length(), requestPath.toAbsolutePath());

    ConversionResponse response = new ConversionService(cfg).handle(body);

    if (response.archive() != null) {
      Files.write(outputPath, Base64.getDecoder().decode(response.archive()));
      LOG.info("Wrote archive to {}", outputPath.toAbsolutePath());
    }

    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    System.out.println(mapper.writeValueAsString(response.withoutArchive()));

    System.exit(response.success() ? 0 : 1);
  }
}
