package nl.adgroot.pdftojpeg.input;

/**
 * The request is empty or has no shape we know how to turn into tasks.
 */
public class InvalidInputException extends Exception {

  public InvalidInputException(String message) {
    super(message);
  }
}
