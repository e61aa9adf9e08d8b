package nl.adgroot.pdftojpeg.fetch;

/**
 * Remote retrieval failed: bad URL, network error, timeout, non-2xx status or oversized body.
 */
public class FetchException extends Exception {

  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
