package nl.adgroot.pdftojpeg;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/**
 * Builds PDFs and multipart envelopes for tests.
 */
public final class TestPdfs {

  public static final String BOUNDARY = "----WebKitFormBoundary7MA4YWxkTrZu0gW";

  private TestPdfs() {
  }

  /** A real PDF with {@code pages} pages, page i showing "PAGE-i". */
  public static byte[] pdf(int pages) throws IOException {
    try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (int i = 1; i <= pages; i++) {
        PDPage page = new PDPage();
        doc.addPage(page);
        try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
          cs.beginText();
          cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 24);
          cs.newLineAtOffset(72, 700);
          cs.showText("PAGE-" + i);
          cs.endText();
        }
      }
      doc.save(out);
      return out.toByteArray();
    }
  }

  /**
   * Two pages in two revisions: page 2 arrives in an incremental update, so the file carries two
   * {@code %%EOF} markers.
   */
  public static byte[] incrementalPdf() throws IOException {
    try (PDDocument doc = Loader.loadPDF(pdf(1)); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDPage page = new PDPage();
      doc.addPage(page);
      doc.getDocumentCatalog().getCOSObject().setNeedToBeUpdated(true);
      doc.getPages().getCOSObject().setNeedToBeUpdated(true);
      page.getCOSObject().setNeedToBeUpdated(true);
      doc.saveIncremental(out);
      return out.toByteArray();
    }
  }

  /** Small, plain-text stand-in for a PDF; enough for signature checks, not for rendering. */
  public static byte[] fakePdf(String marker) {
    return ("%PDF-1.4\n1 0 obj << /Marker (" + marker + ") >> endobj\ntrailer << >>\n%%EOF")
        .getBytes(StandardCharsets.ISO_8859_1);
  }

  public static String base64(byte[] bytes) {
    return Base64.getEncoder().encodeToString(bytes);
  }

  /** Base64 wrapped at 76 chars with CRLF, the way mail and form encoders do it. */
  public static String mimeBase64(byte[] bytes) {
    return Base64.getMimeEncoder().encodeToString(bytes);
  }

  /**
   * One form-data part with a base64 body. Not closed: append {@link #closing()} after the last part.
   */
  public static String base64Part(String fileName, byte[] content) {
    return "--" + BOUNDARY + "\r\n"
        + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName + "\"\r\n"
        + "Content-Type: application/pdf\r\n"
        + "Content-Transfer-Encoding: base64\r\n"
        + "\r\n"
        + mimeBase64(content) + "\r\n";
  }

  /** One form-data part with the PDF bytes inline, as browsers send them. */
  public static byte[] rawPart(String fileName, byte[] content) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] head = ("--" + BOUNDARY + "\r\n"
        + "Content-Disposition: form-data; name=\"file\"; filename=\"" + fileName + "\"\r\n"
        + "Content-Type: application/pdf\r\n"
        + "\r\n").getBytes(StandardCharsets.ISO_8859_1);
    out.writeBytes(head);
    out.writeBytes(content);
    out.writeBytes("\r\n".getBytes(StandardCharsets.ISO_8859_1));
    return out.toByteArray();
  }

  public static String closing() {
    return "--" + BOUNDARY + "--\r\n";
  }

  public static String textField(String name, String value) {
    return "--" + BOUNDARY + "\r\n"
        + "Content-Disposition: form-data; name=\"" + name + "\"\r\n"
        + "\r\n"
        + value + "\r\n";
  }

  /** A whole envelope, base64-encoded as an API gateway would hand it over. */
  public static String encodedEnvelope(String... parts) {
    StringBuilder sb = new StringBuilder();
    for (String p : parts) sb.append(p);
    sb.append(closing());
    return base64(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
  }
}
