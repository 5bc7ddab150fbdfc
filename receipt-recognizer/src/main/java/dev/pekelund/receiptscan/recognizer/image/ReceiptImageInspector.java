package dev.pekelund.receiptscan.recognizer.image;

/**
 * Image handling collaborator of the recognizer.
 */
public interface ReceiptImageInspector {

    /**
     * Checks that the payload is an image the recognizer can work with. Never throws for bad input;
     * problems are reported in the returned {@link ImageValidation}.
     */
    ImageValidation validate(ReceiptImage image);

    /**
     * Grades how likely the image is to be read correctly.
     */
    ImageQualityAnalysis analyzeQuality(ReceiptImage image);

    /**
     * Resizes and re-encodes the image for the model.
     *
     * @throws ReceiptImageException when the image cannot be decoded or encoded
     */
    PreprocessedImage preprocess(ReceiptImage image);
}
