package dev.pekelund.receiptscan.recognizer.image;

import java.util.Base64;

/**
 * Image re-encoded for the model.
 */
public record PreprocessedImage(byte[] content, String mimeType, int width, int height, long originalSize) {

    public long processedSize() {
        return content.length;
    }

    public String base64() {
        return Base64.getEncoder().encodeToString(content);
    }

    @Override
    public String toString() {
        return "PreprocessedImage{mimeType='" + mimeType + "', " + width + "x" + height + ", originalSize="
            + originalSize + ", processedSize=" + content.length + '}';
    }
}
