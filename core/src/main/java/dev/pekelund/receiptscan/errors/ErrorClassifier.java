package dev.pekelund.receiptscan.errors;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import javax.imageio.IIOException;
import org.springframework.util.StringUtils;

/**
 * Maps any raised failure to an {@link ErrorInfo}.
 *
 * <p>The whole cause chain is inspected. Exception types are matched first (caller registered
 * mappings, then well known JDK and Jackson types), then the combined message text is matched
 * against phrase rules in a fixed order. Anything left over is {@link ErrorKind#UNKNOWN}.
 * Classification never throws.
 */
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private static final List<MessageRule> MESSAGE_RULES = List.of(
        new MessageRule(ErrorKind.NETWORK_ERROR,
            "econnrefused|enotfound|etimedout|connection refused|connection reset|network"),
        new MessageRule(ErrorKind.API_TIMEOUT, "timeout|timed out"),
        new MessageRule(ErrorKind.RATE_LIMITED, "rate limit|throttl|too many requests|\\b429\\b"),
        new MessageRule(ErrorKind.AUTHENTICATION_ERROR,
            "unauthori[sz]ed|authentication|forbidden|api key|\\b401\\b|\\b403\\b"),
        new MessageRule(ErrorKind.SERVICE_UNAVAILABLE,
            "service unavailable|bad gateway|gateway timeout|\\b502\\b|\\b503\\b|\\b504\\b"),
        new MessageRule(ErrorKind.IMAGE_PROCESSING_ERROR, "image|decode"),
        new MessageRule(ErrorKind.PARSING_ERROR, "parse|json"));

    private final Map<Class<? extends Throwable>, ErrorKind> typeMappings;
    private final Clock clock;

    public ErrorClassifier() {
        this(Map.of(), Clock.systemUTC());
    }

    public ErrorClassifier(Map<Class<? extends Throwable>, ErrorKind> typeMappings, Clock clock) {
        this.typeMappings = typeMappings != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(typeMappings))
            : Map.of();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public ErrorInfo classify(Throwable error) {
        return classify(error, Map.of());
    }

    public ErrorInfo classify(Throwable error, Map<String, ?> context) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (context != null) {
            details.putAll(context);
        }
        if (error == null) {
            return new ErrorInfo(ErrorKind.UNKNOWN, Severity.MEDIUM, "No error details available", details,
                clock.instant());
        }
        details.putIfAbsent("exceptionType", error.getClass().getName());

        List<Throwable> chain = causeChain(error);
        for (Throwable candidate : chain) {
            if (candidate instanceof ClassifiedFailureException classified) {
                ErrorInfo previous = classified.getErrorInfo();
                details.putAll(previous.context());
                return new ErrorInfo(previous.kind(), previous.severity(), previous.message(), details,
                    clock.instant());
            }
        }

        String message = describe(error);
        ErrorKind kind = classifyByType(chain);
        if (kind == null) {
            kind = classifyByMessage(chain);
        }
        return new ErrorInfo(kind, kind.defaultSeverity(), message, details, clock.instant());
    }

    private ErrorKind classifyByType(List<Throwable> chain) {
        for (Throwable candidate : chain) {
            for (Map.Entry<Class<? extends Throwable>, ErrorKind> mapping : typeMappings.entrySet()) {
                if (mapping.getKey().isInstance(candidate)) {
                    return mapping.getValue();
                }
            }
        }
        for (Throwable candidate : chain) {
            ErrorKind kind = builtInTypeKind(candidate);
            if (kind != null) {
                return kind;
            }
        }
        return null;
    }

    private static ErrorKind builtInTypeKind(Throwable candidate) {
        if (candidate instanceof TimeoutException
            || candidate instanceof SocketTimeoutException
            || candidate instanceof HttpTimeoutException) {
            return ErrorKind.API_TIMEOUT;
        }
        if (candidate instanceof ConnectException
            || candidate instanceof UnknownHostException
            || candidate instanceof NoRouteToHostException) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (candidate instanceof JsonProcessingException) {
            return ErrorKind.PARSING_ERROR;
        }
        if (candidate instanceof IIOException) {
            return ErrorKind.IMAGE_PROCESSING_ERROR;
        }
        return null;
    }

    private static ErrorKind classifyByMessage(List<Throwable> chain) {
        StringBuilder text = new StringBuilder();
        for (Throwable candidate : chain) {
            if (StringUtils.hasText(candidate.getMessage())) {
                text.append(candidate.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
            }
        }
        if (text.isEmpty()) {
            return ErrorKind.UNKNOWN;
        }
        String combined = text.toString();
        for (MessageRule rule : MESSAGE_RULES) {
            if (rule.pattern().matcher(combined).find()) {
                return rule.kind();
            }
        }
        return ErrorKind.UNKNOWN;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return StringUtils.hasText(message) ? message : error.getClass().getSimpleName();
    }

    private record MessageRule(ErrorKind kind, Pattern pattern) {

        private MessageRule(ErrorKind kind, String regex) {
            this(kind, Pattern.compile(regex));
        }
    }
}
