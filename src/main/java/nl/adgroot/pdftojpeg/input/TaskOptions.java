package nl.adgroot.pdftojpeg.input;

public record TaskOptions(int dpi) {

  public TaskOptions {
    if (dpi <= 0) {
      throw new IllegalArgumentException("dpi must be positive: " + dpi);
    }
  }
}
