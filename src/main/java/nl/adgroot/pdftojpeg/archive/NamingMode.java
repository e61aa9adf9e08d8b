package nl.adgroot.pdftojpeg.archive;

/**
 * Layout of page entries in the archive.
 */
public enum NamingMode {
  /** {@code page_<n>.jpg} for a single document, {@code <id>_page_<n>.jpg} otherwise. */
  FLAT,
  /** {@code <id>/page_<n>.jpg}; with a single document this falls back to the flat names. */
  GROUPED;

  public static NamingMode parse(String value) {
    if (value == null || value.isBlank()) return FLAT;
    for (NamingMode mode : values()) {
      if (mode.name().equalsIgnoreCase(value.strip())) return mode;
    }
    throw new IllegalArgumentException("Unknown naming mode: " + value + " (expected flat or grouped)");
  }
}
