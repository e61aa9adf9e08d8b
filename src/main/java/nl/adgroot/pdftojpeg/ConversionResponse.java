package nl.adgroot.pdftojpeg;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import nl.adgroot.pdftojpeg.archive.DocumentStatus;
import nl.adgroot.pdftojpeg.archive.RunSummary;

/**
 * Result of one invocation. {@code statusCode} follows HTTP: 200 when at least one document was
 * converted, 400 for a rejected request, 500 when nothing could be converted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversionResponse(
    @JsonProperty("status_code") int statusCode,
    boolean success,
    int total,
    int succeeded,
    int failed,
    @JsonProperty("total_pages") int totalPages,
    @JsonProperty("file_name") String fileName,
    String archive,
    List<DocumentStatus> documents,
    String error
) {

  public static final String ARCHIVE_FILE_NAME = "pdf_images.zip";

  public static ConversionResponse ok(RunSummary summary, int totalPages, String archiveBase64) {
    return new ConversionResponse(200, true, summary.total(), summary.succeeded(), summary.failed(),
        totalPages, ARCHIVE_FILE_NAME, archiveBase64, summary.documents(), null);
  }

  public static ConversionResponse invalidInput(String error) {
    return new ConversionResponse(400, false, 0, 0, 0, 0, null, null, List.of(), error);
  }

  public static ConversionResponse failed(RunSummary summary, String error) {
    return new ConversionResponse(500, false, summary.total(), summary.succeeded(), summary.failed(),
        0, null, null, summary.documents(), error);
  }

  /** Same response without the (large) archive, for printing. */
  public ConversionResponse withoutArchive() {
    return new ConversionResponse(statusCode, success, total, succeeded, failed, totalPages, fileName,
        null, documents, error);
  }
}
