package nl.adgroot.pdftojpeg.extract;

/** How a document's bytes were recovered. */
public enum ExtractionStrategy {
  /** The payload already was a PDF, no envelope to strip. */
  DIRECT,
  /** Base64 body of a multipart section. */
  BASE64_SECTION,
  /** Binary body of a multipart section, taken byte for byte. */
  RAW_SECTION,
  /** Signature scan over the raw buffer, used when no section could be decoded. */
  BINARY_SCAN
}
