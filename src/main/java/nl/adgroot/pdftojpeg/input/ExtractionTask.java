package nl.adgroot.pdftojpeg.input;

/**
 * One unit of work: a document (or envelope of documents) to convert.
 *
 * @param id unique within one invocation; used for archive paths and the work directory
 * @param source where the PDF bytes come from
 * @param options per-task render options
 */
public record ExtractionTask(String id, TaskSource source, TaskOptions options) {

  public int dpi() {
    return options.dpi();
  }
}
