package nl.adgroot.pdftojpeg.convert;

import java.util.List;
import java.util.Objects;

/**
 * Outcome for one document. Success carries the pages in document order, failure carries the
 * kind and a message; the other side is empty/null.
 */
public record ConversionResult(
    String id,
    Status status,
    List<PageImage> pages,
    FailureKind failureKind,
    String error
) {

  public enum Status { SUCCESS, FAILURE }

  public ConversionResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    pages = pages == null ? List.of() : List.copyOf(pages);
  }

  public static ConversionResult success(String id, List<PageImage> pages) {
    return new ConversionResult(id, Status.SUCCESS, pages, null, null);
  }

  public static ConversionResult failure(String id, FailureKind kind, String error) {
    return new ConversionResult(id, Status.FAILURE, List.of(), kind, error);
  }

  public ConversionResult withId(String newId) {
    return new ConversionResult(newId, status, pages, failureKind, error);
  }

  public boolean isSuccess() {
    return status == Status.SUCCESS;
  }

  public int pageCount() {
    return pages.size();
  }
}
