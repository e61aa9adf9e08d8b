package nl.adgroot.pdftojpeg.extract;

/**
 * A recovered PDF byte stream. Construction fails unless the bytes start with {@code %PDF}.
 */
public record ExtractedDocument(byte[] bytes, ExtractionStrategy strategy) {

  public ExtractedDocument {
    if (!PdfBytes.startsWithSignature(bytes)) {
      throw new IllegalArgumentException("Not a PDF stream: missing %PDF signature");
    }
  }

  public int length() {
    return bytes.length;
  }
}
