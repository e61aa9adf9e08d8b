package nl.adgroot.pdftojpeg.extract;

/**
 * Thrown when an encoded payload yields no recoverable PDF document.
 */
public class ExtractionException extends Exception {

  private final int blobLength;

  public ExtractionException(String diagnosis, int blobLength) {
    super("Could not extract PDF content from payload of " + blobLength + " chars: " + diagnosis);
    this.blobLength = blobLength;
  }

  public int getBlobLength() {
    return blobLength;
  }
}
