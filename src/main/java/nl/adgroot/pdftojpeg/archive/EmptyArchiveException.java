package nl.adgroot.pdftojpeg.archive;

/**
 * No document was converted, so there is nothing to put in an archive.
 */
public class EmptyArchiveException extends Exception {

  private final int documents;

  public EmptyArchiveException(int documents) {
    super("Failed to convert any PDFs (0 of " + documents + " succeeded)");
    this.documents = documents;
  }

  public int getDocuments() {
    return documents;
  }
}
