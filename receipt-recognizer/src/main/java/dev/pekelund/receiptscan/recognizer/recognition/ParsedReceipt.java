package dev.pekelund.receiptscan.recognizer.recognition;

import dev.pekelund.receiptscan.recognizer.model.LineItem;
import java.math.BigDecimal;
import java.util.List;

/**
 * @param modelTotal the total the model reported, {@code null} when absent; advisory only
 */
public record ParsedReceipt(List<LineItem> items, double confidence, BigDecimal modelTotal) {

    public ParsedReceipt {
        items = List.copyOf(items);
    }
}
