package nl.adgroot.pdftojpeg.convert;

import java.awt.image.BufferedImage;

/**
 * One rendered page; {@code pageNumber} is 1-based within its document.
 */
public record PageImage(int pageNumber, BufferedImage image) {}
