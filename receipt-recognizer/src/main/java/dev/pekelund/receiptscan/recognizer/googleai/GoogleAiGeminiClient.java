package dev.pekelund.receiptscan.recognizer.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.receiptscan.recognizer.image.PreprocessedImage;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client that invokes Google AI Studio's Gemini API using an API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GeminiRequestOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GeminiRequestOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GeminiRequestOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GeminiRequestOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(String prompt, PreprocessedImage image, GeminiRequestOptions overrides) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        Assert.notNull(image, "Image must not be null");
        GeminiRequestOptions resolvedOptions = defaultOptions.merge(overrides);
        String model = resolveModel(resolvedOptions);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(model).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with prompt length {} and image of {} bytes", model,
                prompt.length(), image.processedSize());
            GenerateContentRequest request = buildRequest(prompt, image, resolvedOptions);
            GenerateContentResponse response = executeRequest(model, request);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public boolean probe() {
        String model = resolveModel(defaultOptions);
        try {
            restClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}")
                    .queryParam("key", apiKey)
                    .build(model))
                .retrieve()
                .toBodilessEntity();
            return true;
        } catch (RestClientException ex) {
            LOGGER.warn("Gemini connectivity probe for model '{}' failed: {}", model,
                NestedExceptionUtils.getMostSpecificCause(ex).getMessage());
            return false;
        }
    }

    private String resolveModel(GeminiRequestOptions options) {
        String model = StringUtils.hasText(options.getModel()) ? options.getModel() : defaultOptions.getModel();
        if (!StringUtils.hasText(model)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        return model;
    }

    private GenerateContentRequest buildRequest(String promptText, PreprocessedImage image,
        GeminiRequestOptions options) {
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user", List.of(
            GenerateContentRequest.Part.ofText(promptText),
            GenerateContentRequest.Part.ofInlineData(image.mimeType(), image.base64())));
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(content), generationConfig);
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(model))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            // Status code only: the response body and URL may echo the API key
            throw new GeminiApiException("Gemini API returned HTTP " + ex.getStatusCode().value(),
                ex.getStatusCode().value());
        } catch (ResourceAccessException ex) {
            Throwable cause = ex.getCause() != null ? NestedExceptionUtils.getMostSpecificCause(ex) : ex;
            String detail = cause != ex ? cause.getMessage() : "I/O error";
            throw new GeminiApiException("Gemini API could not be reached: " + detail, cause);
        } catch (RestClientException ex) {
            throw new GeminiResponseException("Gemini response could not be read", ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new GeminiResponseException("Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new GeminiResponseException("Gemini response did not contain any text parts"));
    }

    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, InlineData inlineData) {

            static Part ofText(String text) {
                return new Part(text, null);
            }

            static Part ofInlineData(String mimeType, String data) {
                return new Part(null, new InlineData(mimeType, data));
            }
        }

        private record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            String responseMimeType) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates) {

        private record Candidate(Content content) {
        }

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }
}
