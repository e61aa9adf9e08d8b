package nl.adgroot.pdftojpeg.extract;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

import nl.adgroot.pdftojpeg.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers PDF byte streams from loosely structured, multipart-like payloads.
 *
 * <p>The payload is decoded from base64 (or taken as-is when it is not base64), turned into text and
 * scanned line by line with a small state machine:
 * <ul>
 *   <li>{@link ScanState#SEEKING_MARKER}: a line mentioning {@code application/pdf} or a
 *       {@code filename=...pdf} opens a section;</li>
 *   <li>{@link ScanState#IN_HEADERS}: the section's own header lines, up to the first blank line;</li>
 *   <li>{@link ScanState#IN_BODY}: the payload, up to the next boundary line or end of input.</li>
 * </ul>
 * Every section body is tried as base64 first and as raw bytes second. Sections that fail both are
 * skipped. When no section yields a PDF, the raw bytes are scanned for {@code %PDF ... %%EOF} spans.
 */
public class PayloadExtractor {

  private static final Logger LOG = LoggerFactory.getLogger(PayloadExtractor.class);

  private static final Pattern PDF_FILENAME = Pattern.compile(
      "filename\\*?=\\s*\"?[^\";]*\\.pdf(\"|;|\\s|$)",
      Pattern.CASE_INSENSITIVE
  );
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  enum ScanState { SEEKING_MARKER, IN_HEADERS, IN_BODY }

  /** Line range [bodyStart, bodyEnd) of one candidate section; markerLine opened it. */
  record Section(int markerLine, int bodyStart, int bodyEnd) {}

  /** Decoded payload plus the charset that turned it into text (needed to get raw bytes back). */
  record DecodedText(String text, Charset charset) {}

  private final int minBoundaryLength;
  private final int previewChars;

  public PayloadExtractor() {
    this(new AppConfig.ExtractionConfig());
  }

  public PayloadExtractor(AppConfig.ExtractionConfig cfg) {
    this(cfg.minBoundaryLength, cfg.previewChars);
  }

  /**
   * @param minBoundaryLength a line starting with {@code --} is a boundary only when longer than this
   * @param previewChars max characters of payload text that may appear in TRACE output
   */
  public PayloadExtractor(int minBoundaryLength, int previewChars) {
    this.minBoundaryLength = Math.max(2, minBoundaryLength);
    this.previewChars = Math.max(0, previewChars);
  }

  /**
   * Extracts every PDF document from an encoded payload.
   *
   * @param blob base64 text of the envelope, or the envelope text itself
   * @return one or more documents, each starting with {@code %PDF}
   * @throws ExtractionException when nothing could be recovered
   */
  public List<ExtractedDocument> extract(String blob) throws ExtractionException {
    if (blob == null || blob.isBlank()) {
      throw new ExtractionException("payload is empty", blob == null ? 0 : blob.length());
    }
    LOG.debug("Extracting from payload of {} chars", blob.length());
    LOG.trace("Payload preview: {}", PdfBytes.preview(blob, previewChars));

    return extractFromDecoded(decodeOuter(blob), blob.length());
  }

  /**
   * Same as {@link #extract(String)} for an envelope that is already raw bytes.
   */
  public List<ExtractedDocument> extract(byte[] raw) throws ExtractionException {
    if (raw == null || raw.length == 0) {
      throw new ExtractionException("payload is empty", 0);
    }
    return extractFromDecoded(raw, raw.length);
  }

  private List<ExtractedDocument> extractFromDecoded(byte[] raw, int blobLength) throws ExtractionException {
    DecodedText decoded = decodeText(raw);
    List<String> lines = Arrays.asList(decoded.text().split("\n", -1));

    List<Section> sections = scanSections(lines);
    List<ExtractedDocument> docs = new ArrayList<>();
    int skipped = 0;

    for (Section section : sections) {
      ExtractedDocument doc = decodeSection(lines, section, decoded.charset());
      if (doc != null) {
        docs.add(doc);
      } else {
        skipped++;
      }
    }

    if (!docs.isEmpty()) {
      if (skipped > 0) {
        LOG.warn("Skipped {} of {} multipart section(s) that held no decodable PDF", skipped, sections.size());
      }
      return docs;
    }

    LOG.debug("{} section(s) found, none usable; falling back to binary scan over {} bytes",
        sections.size(), raw.length);
    docs = scanForSignatures(raw);
    if (!docs.isEmpty()) {
      return docs;
    }

    String diagnosis = sections.isEmpty()
        ? "no PDF section markers and no %PDF signature in " + raw.length + " decoded bytes"
        : sections.size() + " candidate section(s) failed base64 and raw decoding, and no %PDF signature in "
            + raw.length + " decoded bytes";
    throw new ExtractionException(diagnosis, blobLength);
  }

  /**
   * Runs the section state machine over the payload lines.
   */
  List<Section> scanSections(List<String> lines) {
    List<Section> sections = new ArrayList<>();
    ScanState state = ScanState.SEEKING_MARKER;
    int markerLine = -1;
    int bodyStart = -1;

    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);

      switch (state) {
        case SEEKING_MARKER -> {
          if (isSectionMarker(line)) {
            markerLine = i;
            state = ScanState.IN_HEADERS;
            LOG.debug("Section marker at line {}", i);
          }
        }
        case IN_HEADERS -> {
          // further markers here (Content-Disposition + Content-Type) belong to the same section
          if (line.strip().isEmpty()) {
            bodyStart = i + 1;
            state = ScanState.IN_BODY;
          } else if (isBoundary(line)) {
            LOG.debug("Section opened at line {} hit a boundary before any body, dropped", markerLine);
            state = ScanState.SEEKING_MARKER;
          }
        }
        case IN_BODY -> {
          if (isBoundary(line)) {
            sections.add(new Section(markerLine, bodyStart, i));
            LOG.debug("Section body lines [{}, {})", bodyStart, i);
            state = ScanState.SEEKING_MARKER;
          }
        }
      }
    }

    if (state == ScanState.IN_BODY) {
      sections.add(new Section(markerLine, bodyStart, lines.size()));
      LOG.debug("Section body lines [{}, {}) runs to end of input", bodyStart, lines.size());
    } else if (state == ScanState.IN_HEADERS) {
      LOG.debug("Section opened at line {} never reached a body", markerLine);
    }
    return sections;
  }

  boolean isSectionMarker(String line) {
    String lower = line.toLowerCase();
    return lower.contains("application/pdf") || PDF_FILENAME.matcher(line).find();
  }

  // raw length: a CRLF line counts its trailing \r
  boolean isBoundary(String line) {
    return line.startsWith("--") && line.length() > minBoundaryLength;
  }

  private ExtractedDocument decodeSection(List<String> lines, Section section, Charset charset) {
    String body = String.join("\n", lines.subList(section.bodyStart(), section.bodyEnd())).strip();
    if (body.isEmpty()) {
      LOG.debug("Section at line {} has an empty body", section.markerLine());
      return null;
    }
    LOG.trace("Section body preview: {}", PdfBytes.preview(body, previewChars));

    try {
      byte[] decoded = Base64.getDecoder().decode(WHITESPACE.matcher(body).replaceAll(""));
      if (PdfBytes.startsWithSignature(decoded)) {
        LOG.debug("Section at line {}: base64 body, {} bytes", section.markerLine(), decoded.length);
        return new ExtractedDocument(decoded, ExtractionStrategy.BASE64_SECTION);
      }
      LOG.debug("Section at line {}: base64 decoded but no %PDF signature", section.markerLine());
    } catch (IllegalArgumentException e) {
      LOG.debug("Section at line {}: not base64 ({})", section.markerLine(), e.getMessage());
    }

    // re-encode with the charset the text came from, so the bytes are the original ones
    byte[] raw = body.getBytes(charset);
    if (PdfBytes.startsWithSignature(raw)) {
      LOG.debug("Section at line {}: raw body, {} bytes", section.markerLine(), raw.length);
      return new ExtractedDocument(raw, ExtractionStrategy.RAW_SECTION);
    }
    return null;
  }

  /**
   * Finds every {@code %PDF} in the buffer. A document runs to the following {@code %%EOF}
   * (inclusive), else up to the next signature, else to the end of the buffer.
   */
  List<ExtractedDocument> scanForSignatures(byte[] raw) {
    List<ExtractedDocument> docs = new ArrayList<>();
    int start = PdfBytes.indexOf(raw, PdfBytes.SIGNATURE, 0);

    while (start >= 0) {
      int nextSignature = PdfBytes.indexOf(raw, PdfBytes.SIGNATURE, start + PdfBytes.SIGNATURE.length);
      int eof = PdfBytes.indexOf(raw, PdfBytes.EOF_MARKER, start + PdfBytes.SIGNATURE.length);

      int end;
      if (eof >= 0 && (nextSignature < 0 || eof < nextSignature)) {
        end = eof + PdfBytes.EOF_MARKER.length;
      } else if (nextSignature >= 0) {
        end = nextSignature;
      } else {
        end = raw.length;
      }

      LOG.debug("Binary scan: PDF span [{}, {})", start, end);
      docs.add(new ExtractedDocument(Arrays.copyOfRange(raw, start, end), ExtractionStrategy.BINARY_SCAN));
      start = PdfBytes.indexOf(raw, PdfBytes.SIGNATURE, end);
    }
    return docs;
  }

  /**
   * Strips the outer base64 layer. Text that is not valid base64 is the envelope itself.
   */
  static byte[] decodeOuter(String blob) {
    String compact = WHITESPACE.matcher(blob).replaceAll("");
    try {
      return Base64.getDecoder().decode(compact);
    } catch (IllegalArgumentException notStandard) {
      try {
        return Base64.getUrlDecoder().decode(compact);
      } catch (IllegalArgumentException notUrlSafe) {
        LOG.debug("Payload is not base64, treating it as the envelope text");
        return blob.chars().allMatch(c -> c <= 0xFF)
            ? blob.getBytes(StandardCharsets.ISO_8859_1)
            : blob.getBytes(StandardCharsets.UTF_8);
      }
    }
  }

  /**
   * UTF-8 when the bytes are valid UTF-8, otherwise ISO-8859-1, which maps every byte to a char.
   */
  static DecodedText decodeText(byte[] raw) {
    try {
      String text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(raw))
          .toString();
      return new DecodedText(text, StandardCharsets.UTF_8);
    } catch (CharacterCodingException e) {
      LOG.debug("Payload is not valid UTF-8, decoding as ISO-8859-1");
      return new DecodedText(new String(raw, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1);
    }
  }
}
