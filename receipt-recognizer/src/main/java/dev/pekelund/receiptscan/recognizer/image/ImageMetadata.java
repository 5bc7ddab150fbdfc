package dev.pekelund.receiptscan.recognizer.image;

/**
 * @param width pixel width, 0 when the image could not be decoded
 * @param height pixel height, 0 when the image could not be decoded
 * @param format lower-case format name such as {@code jpeg} or {@code png}
 */
public record ImageMetadata(int width, int height, String format, long sizeBytes) {

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }
}
