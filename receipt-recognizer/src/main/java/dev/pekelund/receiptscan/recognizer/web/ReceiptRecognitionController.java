package dev.pekelund.receiptscan.recognizer.web;

import dev.pekelund.receiptscan.recognizer.image.ReceiptImage;
import dev.pekelund.receiptscan.recognizer.model.RecognitionResult;
import dev.pekelund.receiptscan.recognizer.recognition.BatchRecognitionResult;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptRecognitionException;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptRecognitionService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for recognising uploaded receipt photos. Nothing is persisted; the caller receives the
 * recognised items and stores them itself.
 */
@RestController
@RequestMapping(path = "/api/receipts")
public class ReceiptRecognitionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptRecognitionController.class);

    private final ReceiptRecognitionService recognitionService;

    public ReceiptRecognitionController(ReceiptRecognitionService recognitionService) {
        this.recognitionService = recognitionService;
    }

    @PostMapping(path = "/recognize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public RecognitionResult recognize(@RequestPart("file") MultipartFile file,
        @RequestParam(name = "enableFallback", defaultValue = "true") boolean enableFallback) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty image must be provided as the 'file' part");
        }
        ReceiptImage image = toImage(file);
        LOGGER.info("Recognising receipt {} (fallback {})", image, enableFallback ? "enabled" : "disabled");
        return recognitionService.recognize(image, enableFallback);
    }

    @PostMapping(path = "/recognize/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public BatchRecognitionResult recognizeBatch(@RequestPart("files") List<MultipartFile> files,
        @RequestParam(name = "enableFallback", defaultValue = "true") boolean enableFallback) throws IOException {
        List<ReceiptImage> images = new ArrayList<>();
        if (files != null) {
            for (MultipartFile file : files) {
                if (file != null && !file.isEmpty()) {
                    images.add(toImage(file));
                }
            }
        }
        if (images.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "At least one non-empty image must be provided as 'files' parts");
        }
        LOGGER.info("Recognising batch of {} receipt(s)", images.size());
        return recognitionService.recognizeBatch(images, enableFallback);
    }

    @ExceptionHandler(ReceiptRecognitionException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleRecognitionException(ReceiptRecognitionException exception) {
        LOGGER.warn("Receipt recognition failed: {} ({})", exception.getMessage(), exception.getKind());
        return Map.of("error", exception.getMessage(), "kind", exception.getKind().name());
    }

    private static ReceiptImage toImage(MultipartFile file) throws IOException {
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : null;
        return new ReceiptImage(fileName, file.getContentType(), file.getBytes());
    }
}
