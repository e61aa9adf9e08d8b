package nl.adgroot.pdftojpeg.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import nl.adgroot.pdftojpeg.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a request body into an ordered list of {@link ExtractionTask}s.
 *
 * <p>Accepted shapes, first match wins:
 * <ol>
 *   <li>a JSON array of descriptors ({@code content}, {@code data}, {@code url} or
 *       {@code file_name}+{@code content}, each with optional {@code id} and {@code dpi});</li>
 *   <li>a JSON object with one or more long string fields, each holding an encoded payload
 *       ({@code content} is always taken as one inline PDF);</li>
 *   <li>a JSON object with {@code pdf_url};</li>
 *   <li>a JSON object with a (short) {@code content} field;</li>
 *   <li>a bare string: a JSON string literal, or any body that is not JSON at all.</li>
 * </ol>
 */
public class InputNormalizer {

  private static final Logger LOG = LoggerFactory.getLogger(InputNormalizer.class);
  // "12ab..." must not parse as the number 12
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
  private static final Set<String> URL_FIELDS = Set.of("pdf_url", "url");
  private static final String CONTENT_FIELD = "content";

  private final int defaultDpi;
  private final int maxDpi;
  private final int minPayloadFieldLength;

  public InputNormalizer(AppConfig cfg) {
    this.defaultDpi = cfg.conversion.defaultDpi;
    this.maxDpi = cfg.conversion.maxDpi;
    this.minPayloadFieldLength = cfg.extraction.minPayloadFieldLength;
  }

  public List<ExtractionTask> normalize(String body) throws InvalidInputException {
    if (body == null || body.isBlank()) {
      throw new InvalidInputException("Request body is empty");
    }

    JsonNode node;
    try {
      node = MAPPER.readTree(body);
    } catch (JsonProcessingException notJson) {
      LOG.info("Request body is not JSON, treating it as one encoded PDF payload");
      return List.of(bareTask(body.strip()));
    }
    if (node == null || node.isMissingNode()) {
      return List.of(bareTask(body.strip()));
    }
    return normalize(node);
  }

  public List<ExtractionTask> normalize(JsonNode node) throws InvalidInputException {
    if (node == null || node.isNull() || node.isMissingNode()) {
      throw new InvalidInputException("Request body is empty");
    }
    if (node.isArray()) {
      return fromDescriptors(node);
    }
    if (node.isObject()) {
      return fromObject(node);
    }
    if (node.isTextual()) {
      if (node.asText().isBlank()) {
        throw new InvalidInputException("Request body is an empty string");
      }
      return List.of(bareTask(node.asText().strip()));
    }
    throw new InvalidInputException("Unsupported request: JSON " + node.getNodeType().name().toLowerCase());
  }

  private List<ExtractionTask> fromDescriptors(JsonNode array) throws InvalidInputException {
    if (array.isEmpty()) {
      throw new InvalidInputException("No PDFs provided for processing");
    }
    LOG.info("Request holds a list of {} document descriptor(s)", array.size());

    IdAllocator ids = new IdAllocator();
    List<ExtractionTask> tasks = new ArrayList<>(array.size());

    for (int i = 0; i < array.size(); i++) {
      JsonNode item = array.get(i);

      if (item.isTextual() && !item.asText().isBlank()) {
        tasks.add(new ExtractionTask(ids.allocate(null, i), TaskSource.inline(item.asText().strip()),
            new TaskOptions(defaultDpi)));
        continue;
      }
      if (!item.isObject()) {
        throw new InvalidInputException("Descriptor " + (i + 1) + " is not an object");
      }

      String fileName = firstText(item, "file_name", "filename", "fileName");
      TaskSource source = descriptorSource(item, fileName);
      if (source == null) {
        throw new InvalidInputException(
            "Descriptor " + (i + 1) + " has none of 'content', 'data' or 'url'");
      }

      String explicitId = firstText(item, "id");
      if (explicitId == null && fileName != null) {
        explicitId = fileName.replaceAll("(?i)\\.pdf$", "");
      }

      tasks.add(new ExtractionTask(ids.allocate(explicitId, i), source, options(item)));
    }
    return tasks;
  }

  private static TaskSource descriptorSource(JsonNode item, String fileName) {
    String url = firstText(item, "url", "pdf_url");
    if (url != null) {
      return new TaskSource(SourceKind.REMOTE_URL, url.strip(), fileName);
    }
    String data = firstText(item, "data");
    if (data != null) {
      return new TaskSource(SourceKind.MULTIPART_BLOB, data.strip(), fileName);
    }
    String content = firstText(item, "content");
    if (content != null) {
      return new TaskSource(SourceKind.INLINE_CONTENT, content.strip(), fileName);
    }
    return null;
  }

  private List<ExtractionTask> fromObject(JsonNode object) throws InvalidInputException {
    TaskOptions options = options(object);

    // lexicographic by field name, so task order never depends on JSON key order
    Map<String, String> payloadFields = new TreeMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (value.isTextual()
          && !URL_FIELDS.contains(field.getKey())
          && value.asText().length() > minPayloadFieldLength) {
        payloadFields.put(field.getKey(), value.asText().strip());
      }
    }

    if (!payloadFields.isEmpty()) {
      LOG.info("Request object holds {} payload field(s): {}", payloadFields.size(), payloadFields.keySet());
      IdAllocator ids = new IdAllocator();
      List<ExtractionTask> tasks = new ArrayList<>(payloadFields.size());
      int position = 0;
      for (Map.Entry<String, String> field : payloadFields.entrySet()) {
        // "content" holds one inline PDF whatever its length; other fields may be envelopes
        TaskSource source = CONTENT_FIELD.equals(field.getKey())
            ? TaskSource.inline(field.getValue())
            : TaskSource.multipart(field.getValue());
        tasks.add(new ExtractionTask(ids.allocate(field.getKey(), position++), source, options));
      }
      return tasks;
    }

    String url = firstText(object, "pdf_url");
    if (url != null) {
      LOG.info("Request names a single remote PDF");
      return List.of(new ExtractionTask(new IdAllocator().allocate(firstText(object, "id"), 0),
          TaskSource.url(url.strip()), options));
    }

    String content = firstText(object, CONTENT_FIELD);
    if (content != null) {
      return List.of(new ExtractionTask(new IdAllocator().allocate(firstText(object, "id"), 0),
          TaskSource.inline(content.strip()), options));
    }

    throw new InvalidInputException(
        "Request object has no 'pdf_url', no 'content' and no string field of at least "
            + minPayloadFieldLength + " chars");
  }

  private ExtractionTask bareTask(String payload) {
    return new ExtractionTask(new IdAllocator().allocate(null, 0), TaskSource.inline(payload),
        new TaskOptions(defaultDpi));
  }

  private TaskOptions options(JsonNode node) {
    return new TaskOptions(resolveDpi(node.get("dpi")));
  }

  int resolveDpi(JsonNode dpiNode) {
    if (dpiNode == null || dpiNode.isNull()) return defaultDpi;

    int dpi;
    if (dpiNode.isNumber()) {
      dpi = dpiNode.asInt();
    } else if (dpiNode.isTextual()) {
      try {
        dpi = Integer.parseInt(dpiNode.asText().strip());
      } catch (NumberFormatException e) {
        LOG.warn("Ignoring non-numeric dpi '{}', using {}", dpiNode.asText(), defaultDpi);
        return defaultDpi;
      }
    } else {
      return defaultDpi;
    }

    if (dpi <= 0) return defaultDpi;
    return Math.min(dpi, maxDpi);
  }

  private static String firstText(JsonNode node, String... names) {
    for (String name : names) {
      JsonNode value = node.get(name);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  /**
   * Hands out ids that are path-safe and unique within one request.
   */
  static final class IdAllocator {
    private final Set<String> used = new HashSet<>();

    String allocate(String requested, int position) {
      String base = requested == null || requested.isBlank()
          ? "doc_" + (position + 1)
          : UNSAFE_ID_CHARS.matcher(requested.strip()).replaceAll("_");
      // "." and ".." would escape the task's work directory
      if (base.chars().allMatch(c -> c == '.')) {
        base = "doc_" + (position + 1);
      }

      String id = base;
      int k = 2;
      while (!used.add(id)) {
        id = base + "_" + k++;
      }
      return id;
    }
  }
}
