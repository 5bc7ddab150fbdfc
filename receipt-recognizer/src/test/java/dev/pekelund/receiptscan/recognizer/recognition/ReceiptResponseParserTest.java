package dev.pekelund.receiptscan.recognizer.recognition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receiptscan.recognizer.model.LineItem;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ReceiptResponseParserTest {

    private final ReceiptResponseParser parser = new ReceiptResponseParser(new ObjectMapper());

    @Test
    void extractsJsonSurroundedByProse() {
        String response = """
            Sure! Here is the receipt:
            ```json
            {"items": [
              {"name": "Mjölk", "unitPrice": 12.5, "quantity": 2, "totalPrice": 25.0},
              {"name": "Bröd", "unitPrice": 30, "quantity": 1, "totalPrice": 30}
            ], "totalAmount": 55.0, "confidence": 0.93}
            ```
            """;

        ParsedReceipt parsed = parser.parse(response);

        assertThat(parsed.items())
            .extracting(LineItem::name, LineItem::quantity, LineItem::totalPrice)
            .containsExactly(tuple("Mjölk", 2, new BigDecimal("25.00")), tuple("Bröd", 1, new BigDecimal("30.00")));
        assertThat(parsed.confidence()).isEqualTo(0.93);
        assertThat(parsed.modelTotal()).isEqualByComparingTo("55.0");
    }

    @Test
    void repairsLineTotalsThatDisagreeWithUnitPriceTimesQuantity() {
        ParsedReceipt parsed = parser.parse("""
            {"items": [{"name": "Apples", "unitPrice": 3.10, "quantity": 3, "totalPrice": 12.00}]}
            """);

        assertThat(parsed.items()).singleElement()
            .satisfies(item -> assertThat(item.totalPrice()).isEqualByComparingTo("9.30"));
    }

    @Test
    void acceptsAlternativeFieldNamesAndDefaultsQuantity() {
        ParsedReceipt parsed = parser.parse("""
            {"items": [{"itemName": "Coffee", "price": "4,50"}], "total": 4.5}
            """);

        assertThat(parsed.items()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("Coffee");
            assertThat(item.quantity()).isEqualTo(1);
            assertThat(item.unitPrice()).isEqualByComparingTo("4.50");
            assertThat(item.placeholder()).isFalse();
        });
        assertThat(parsed.confidence()).isEqualTo(ReceiptResponseParser.DEFAULT_CONFIDENCE);
    }

    @Test
    void dropsInvalidAndNonProductLines() {
        ParsedReceipt parsed = parser.parse("""
            {"items": [
              {"name": "Cheese", "unitPrice": 45, "quantity": 1},
              {"name": "Subtotal", "unitPrice": 45, "quantity": 1},
              {"name": "MOMS", "unitPrice": 9, "quantity": 1},
              {"name": "合计", "unitPrice": 45, "quantity": 1},
              {"name": "-----", "unitPrice": 1, "quantity": 1},
              {"name": "2024-05-01", "unitPrice": 1, "quantity": 1},
              {"name": "Free sample", "unitPrice": 0, "quantity": 1},
              {"name": "Half a melon", "unitPrice": 10, "quantity": 0.5},
              {"name": "", "unitPrice": 5, "quantity": 1}
            ], "confidence": 1.7}
            """);

        assertThat(parsed.items()).extracting(LineItem::name).containsExactly("Cheese");
        assertThat(parsed.confidence()).isEqualTo(1.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"total", "Tack", "Kassör", "thank you", "12:45:10", "Address", "=== ==="})
    void recognisesNonProductLines(String line) {
        assertThat(ReceiptResponseParser.isNonProductLine(line)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Totally Tropical Juice", "Tomatoes", "Milk 1.5%"})
    void keepsProductNamesThatOnlyResembleNonProductLines(String line) {
        assertThat(ReceiptResponseParser.isNonProductLine(line)).isFalse();
    }

    @Test
    void rejectsResponsesWithoutJson() {
        assertThatThrownBy(() -> parser.parse("I could not read this receipt."))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("did not contain a JSON object");
    }

    @Test
    void rejectsMalformedJsonKeepingTheCause() {
        assertThatThrownBy(() -> parser.parse("{\"items\": [ {\"name\": \"x\", }"))
            .isInstanceOf(ReceiptParsingException.class)
            .hasCauseInstanceOf(JsonProcessingException.class);
    }

    @Test
    void rejectsResponsesWithoutValidItems() {
        assertThatThrownBy(() -> parser.parse("{\"items\": [{\"name\": \"Total\", \"unitPrice\": 10}]}"))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("any valid items");
        assertThatThrownBy(() -> parser.parse("{\"lines\": []}"))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("items array");
    }

    @Test
    void dropsPricesThatRoundToZeroCents() {
        ParsedReceipt parsed = parser.parse("""
            {"items": [
              {"name": "Screw", "unitPrice": 0.004, "quantity": 1, "totalPrice": 0.004},
              {"name": "Washer", "unitPrice": 0.005, "quantity": 10}
            ]}
            """);

        assertThat(parsed.items()).singleElement().satisfies(item -> {
            assertThat(item.name()).isEqualTo("Washer");
            assertThat(item.unitPrice()).isEqualByComparingTo("0.01");
        });
        assertThatThrownBy(() -> parser.parse("{\"items\": [{\"name\": \"Screw\", \"unitPrice\": 0.004}]}"))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("any valid items");
    }

    @Test
    void treatsOverflowingNumbersAsMissing() {
        ParsedReceipt parsed = parser.parse("""
            {"items": [
              {"name": "Coffee", "unitPrice": 1e400, "quantity": 1},
              {"name": "Tea", "unitPrice": "2e400", "quantity": 1},
              {"name": "Bun", "unitPrice": 18, "quantity": 1}
            ], "totalAmount": -1e400}
            """);

        assertThat(parsed.items()).extracting(LineItem::name).containsExactly("Bun");
        assertThat(parsed.modelTotal()).isNull();
        assertThatThrownBy(() -> parser.parse("{\"items\": [{\"name\": \"Coffee\", \"unitPrice\": 1e400}]}"))
            .isInstanceOf(ReceiptParsingException.class)
            .hasMessageContaining("any valid items");
    }
}
