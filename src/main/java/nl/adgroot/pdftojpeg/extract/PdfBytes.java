package nl.adgroot.pdftojpeg.extract;

import java.nio.charset.StandardCharsets;

/**
 * Byte-level helpers for recognising PDF streams inside arbitrary buffers.
 */
public final class PdfBytes {

  public static final byte[] SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);
  public static final byte[] EOF_MARKER = "%%EOF".getBytes(StandardCharsets.US_ASCII);

  private PdfBytes() {
    // utility class
  }

  public static boolean startsWithSignature(byte[] data) {
    return data != null && data.length >= SIGNATURE.length && regionMatches(data, 0, SIGNATURE);
  }

  /**
   * Returns the first index of {@code needle} in {@code haystack} at or after {@code from}, or -1.
   */
  public static int indexOf(byte[] haystack, byte[] needle, int from) {
    if (haystack == null || needle.length == 0) return -1;
    int last = haystack.length - needle.length;
    for (int i = Math.max(0, from); i <= last; i++) {
      if (haystack[i] == needle[0] && regionMatches(haystack, i, needle)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Printable, length-capped rendering of a payload fragment for diagnostics.
   * Control and non-ASCII characters are escaped so log lines stay on one line.
   */
  public static String preview(CharSequence s, int maxChars) {
    if (s == null) return "";
    int n = Math.min(Math.max(0, maxChars), s.length());
    StringBuilder sb = new StringBuilder(n + 16);
    for (int i = 0; i < n; i++) {
      char c = s.charAt(i);
      if (c < 32 || c > 126) sb.append(String.format("\\u%04X", (int) c));
      else sb.append(c);
    }
    if (n < s.length()) sb.append("...(").append(s.length()).append(" chars)");
    return sb.toString();
  }

  private static boolean regionMatches(byte[] data, int offset, byte[] expected) {
    for (int j = 0; j < expected.length; j++) {
      if (data[offset + j] != expected[j]) return false;
    }
    return true;
  }
}
