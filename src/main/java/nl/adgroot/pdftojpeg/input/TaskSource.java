package nl.adgroot.pdftojpeg.input;

import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * Where a task's PDF comes from. {@code value} is the encoded payload or the URL.
 */
public record TaskSource(SourceKind kind, String value, String fileName) {

  public TaskSource {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
  }

  public static TaskSource inline(String content) {
    return new TaskSource(SourceKind.INLINE_CONTENT, content, null);
  }

  public static TaskSource multipart(String blob) {
    return new TaskSource(SourceKind.MULTIPART_BLOB, blob, null);
  }

  public static TaskSource url(String url) {
    return new TaskSource(SourceKind.REMOTE_URL, url, null);
  }

  /** Keeps payloads out of logs and exception messages. */
  @NotNull
  @Override
  public String toString() {
    String shown = kind == SourceKind.REMOTE_URL ? value : value.length() + " chars";
    return "TaskSource[" + kind + ", " + shown + (fileName != null ? ", " + fileName : "") + "]";
  }
}
