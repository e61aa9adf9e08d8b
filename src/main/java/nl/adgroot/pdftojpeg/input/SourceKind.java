package nl.adgroot.pdftojpeg.input;

public enum SourceKind {
  /** Base64 PDF content given directly. */
  INLINE_CONTENT,
  /** Base64 envelope (multipart form data and the like) that has to go through the extractor. */
  MULTIPART_BLOB,
  /** PDF to download first. */
  REMOTE_URL
}
