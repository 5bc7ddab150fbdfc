package dev.pekelund.receiptscan.recognizer.image;

import java.util.List;

public record ImageValidation(boolean valid, List<String> errors, List<String> warnings) {

    public ImageValidation {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
