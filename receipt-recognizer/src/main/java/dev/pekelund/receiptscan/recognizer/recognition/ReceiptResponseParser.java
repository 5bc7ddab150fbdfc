package dev.pekelund.receiptscan.recognizer.recognition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receiptscan.recognizer.model.LineItem;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Turns the model's free-text answer into validated line items.
 */
public class ReceiptResponseParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptResponseParser.class);

    static final double DEFAULT_CONFIDENCE = 0.8;
    private static final int MAX_NAME_LENGTH = 100;
    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("1000000000");
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    // Lines the model sometimes reports as items although they are not products
    private static final List<Pattern> NON_PRODUCT_LINES = List.of(
        Pattern.compile("^(小计|合计|总计|subtotal|sub total|total|totalt|summa|delsumma|att betala)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(找零|change|应收|收款|växel|växel tillbaka)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(税|tax|vat|moms|服务费|service)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(店名|商店|超市|store|butik)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(地址|address|adress|电话|phone|tel|telefon)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(日期|date|datum|时间|time|tid)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(收银员|cashier|kassör|kassa|营业员)$", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^(谢谢|thank you|thanks|tack|欢迎|welcome|välkommen)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
        Pattern.compile("^[-=*\\s]{2,}$"),
        Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$"),
        Pattern.compile("^\\d{2}:\\d{2}"));

    private final ObjectMapper objectMapper;

    public ReceiptResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ReceiptParsingException when the answer holds no JSON object, no {@code items} array or no
     *     valid item
     */
    public ParsedReceipt parse(String response) {
        if (!StringUtils.hasText(response)) {
            throw new ReceiptParsingException("Model returned an empty response");
        }
        Matcher matcher = JSON_OBJECT.matcher(response);
        if (!matcher.find()) {
            throw new ReceiptParsingException("Model response did not contain a JSON object");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(matcher.group());
        } catch (JsonProcessingException ex) {
            throw new ReceiptParsingException("Model response contained malformed JSON", ex);
        }
        JsonNode itemsNode = root.path("items");
        if (!itemsNode.isArray()) {
            throw new ReceiptParsingException("Model response did not contain an items array");
        }

        List<LineItem> items = new ArrayList<>();
        int rejected = 0;
        for (JsonNode node : itemsNode) {
            LineItem item = toLineItem(node);
            if (item != null) {
                items.add(item);
            } else {
                rejected++;
            }
        }
        if (items.isEmpty()) {
            throw new ReceiptParsingException("Model response did not contain any valid items");
        }
        if (rejected > 0) {
            LOGGER.info("Dropped {} invalid or non-product line(s) from the model response", rejected);
        }

        BigDecimal modelTotal = decimal(root.has("totalAmount") ? root.get("totalAmount") : root.get("total"));
        if (modelTotal != null) {
            BigDecimal computed = items.stream().map(LineItem::totalPrice).reduce(BigDecimal.ZERO, BigDecimal::add);
            if (computed.subtract(modelTotal).abs().compareTo(TOLERANCE) > 0) {
                LOGGER.info("Model reported total {} but items sum to {}; using the item sum", modelTotal, computed);
            }
        }
        return new ParsedReceipt(items, confidence(root.get("confidence")), modelTotal);
    }

    private LineItem toLineItem(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String name = text(node.has("name") ? node.get("name") : node.get("itemName"));
        if (name == null || name.isEmpty() || name.length() > MAX_NAME_LENGTH || isNonProductLine(name)) {
            LOGGER.debug("Rejected item name '{}'", name);
            return null;
        }
        BigDecimal unitPrice = decimal(node.has("unitPrice") ? node.get("unitPrice") : node.get("price"));
        // LineItem keeps prices in cents, so anything below half a cent would become a zero price
        if (unitPrice == null || unitPrice.setScale(2, RoundingMode.HALF_UP).signum() <= 0) {
            LOGGER.debug("Rejected item '{}' with unit price {}", name, unitPrice);
            return null;
        }
        Integer quantity = quantity(node.get("quantity"));
        if (quantity == null) {
            LOGGER.debug("Rejected item '{}' with quantity {}", name, node.get("quantity"));
            return null;
        }
        BigDecimal expected = unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
        BigDecimal reported = decimal(node.has("totalPrice") ? node.get("totalPrice") : node.get("total"));
        if (reported != null && reported.subtract(expected).abs().compareTo(TOLERANCE) > 0) {
            LOGGER.debug("Repaired total of '{}' from {} to {}", name, reported, expected);
        }
        return LineItem.recognised(name, unitPrice, quantity);
    }

    static boolean isNonProductLine(String name) {
        String trimmed = name.trim();
        return NON_PRODUCT_LINES.stream().anyMatch(pattern -> pattern.matcher(trimmed).find());
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText().trim();
    }

    /**
     * Missing quantity means one unit; anything present must be a positive whole number.
     */
    private static Integer quantity(JsonNode node) {
        if (node == null || node.isNull()) {
            return 1;
        }
        BigDecimal value = decimal(node);
        if (value == null || value.signum() <= 0 || value.stripTrailingZeros().scale() > 0) {
            return null;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException ex) {
            LOGGER.debug("Quantity {} out of range", value);
            return null;
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
                LOGGER.debug("Ignoring non-finite value {}", node);
                return null;
            }
            return plausible(node.decimalValue());
        }
        if (node.isTextual() && StringUtils.hasText(node.asText())) {
            String normalised = node.asText().trim().replace(',', '.');
            try {
                return plausible(new BigDecimal(normalised));
            } catch (NumberFormatException ex) {
                LOGGER.debug("Ignoring non-numeric value '{}'", normalised);
                return null;
            }
        }
        return null;
    }

    private static BigDecimal plausible(BigDecimal value) {
        if (value.abs().compareTo(MAX_AMOUNT) > 0) {
            LOGGER.debug("Ignoring out-of-range value {}", value);
            return null;
        }
        return value;
    }

    private static double confidence(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return DEFAULT_CONFIDENCE;
        }
        double value = node.asDouble();
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
