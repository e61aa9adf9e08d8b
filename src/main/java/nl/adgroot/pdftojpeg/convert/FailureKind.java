package nl.adgroot.pdftojpeg.convert;

public enum FailureKind {
  EXTRACTION,
  FETCH,
  CONVERSION,
  TIMEOUT,
  INVALID_CONTENT
}
