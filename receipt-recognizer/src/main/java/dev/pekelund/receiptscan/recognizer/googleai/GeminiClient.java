package dev.pekelund.receiptscan.recognizer.googleai;

import dev.pekelund.receiptscan.recognizer.image.PreprocessedImage;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API with a receipt photo.
 */
public interface GeminiClient {

    /**
     * @return the default request options configured for the client.
     */
    GeminiRequestOptions getDefaultOptions();

    /**
     * Sends the prompt together with the image and returns the first text part of the answer.
     *
     * @param prompt the instructions for the model
     * @param image the photo to read
     * @param overrides optional overrides for the default options; may be {@code null}
     * @throws GeminiApiException when the API could not be reached or answered with an error status
     * @throws GeminiResponseException when the API answered without any usable text
     */
    String generateContent(String prompt, PreprocessedImage image, GeminiRequestOptions overrides);

    /**
     * Lightweight reachability check against the configured model.
     *
     * @return {@code true} when the API answered successfully
     */
    boolean probe();
}
