package dev.pekelund.receiptscan.recognizer.image;

import org.springframework.util.StringUtils;

/**
 * Uploaded receipt photo as handed to the recognizer.
 */
public record ReceiptImage(String fileName, String contentType, byte[] content) {

    public ReceiptImage {
        fileName = StringUtils.hasText(fileName) ? fileName : "receipt.jpg";
        content = content != null ? content : new byte[0];
    }

    public long sizeBytes() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    @Override
    public String toString() {
        return "ReceiptImage{fileName='" + fileName + "', contentType='" + contentType + "', size=" + content.length
            + '}';
    }
}
