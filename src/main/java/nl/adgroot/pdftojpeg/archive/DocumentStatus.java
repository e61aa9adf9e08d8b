package nl.adgroot.pdftojpeg.archive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import nl.adgroot.pdftojpeg.convert.ConversionResult;

/**
 * Per-document line of the summary, also returned in the response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentStatus(
    String id,
    String status,
    int pages,
    @JsonProperty("failure_kind") String failureKind,
    String error
) {

  public static DocumentStatus of(ConversionResult r) {
    return new DocumentStatus(
        r.id(),
        r.isSuccess() ? "success" : "failure",
        r.pageCount(),
        r.failureKind() == null ? null : r.failureKind().name().toLowerCase(),
        r.error()
    );
  }
}
