package dev.pekelund.receiptscan.recognizer.recognition;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so log lines emitted while a receipt
 * is recognised share the same identifiers (request id, file name, stage).
 */
final class RecognitionMdc {

    static final String KEY_REQUEST_ID = "receipt.requestId";
    static final String KEY_FILE = "receipt.file";
    static final String KEY_STAGE = "receipt.stage";

    private RecognitionMdc() {
        // Utility class
    }

    static Context open(String requestId, String fileName) {
        return new Context(requestId, fileName);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String requestId, String fileName) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_REQUEST_ID, requestId);
            putIfHasText(KEY_FILE, fileName);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
