package nl.adgroot.pdftojpeg.archive;

public record ArchiveEntry(String path, byte[] bytes) {}
