package nl.adgroot.pdftojpeg.archive;

import java.util.Comparator;
import java.util.List;
import nl.adgroot.pdftojpeg.convert.ConversionResult;

/**
 * Counts plus per-id status for one run, ordered by id.
 */
public record RunSummary(int total, int succeeded, int failed, List<DocumentStatus> documents) {

  public static RunSummary of(List<ConversionResult> results) {
    List<DocumentStatus> documents = results.stream()
        .sorted(Comparator.comparing(ConversionResult::id))
        .map(DocumentStatus::of)
        .toList();
    int ok = (int) results.stream().filter(ConversionResult::isSuccess).count();
    return new RunSummary(results.size(), ok, results.size() - ok, documents);
  }
}
