package dev.pekelund.receiptscan.recognizer.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.pekelund.receiptscan.errors.ErrorInfo;
import dev.pekelund.receiptscan.errors.ErrorKind;
import dev.pekelund.receiptscan.recognizer.fallback.FallbackRecognizer;
import dev.pekelund.receiptscan.recognizer.image.ReceiptImage;
import dev.pekelund.receiptscan.recognizer.model.FallbackStrategy;
import dev.pekelund.receiptscan.recognizer.model.LineItem;
import dev.pekelund.receiptscan.recognizer.model.RecognitionResult;
import dev.pekelund.receiptscan.recognizer.recognition.BatchRecognitionResult;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptRecognitionException;
import dev.pekelund.receiptscan.recognizer.recognition.ReceiptRecognitionService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ReceiptRecognitionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReceiptRecognitionService recognitionService;

    @InjectMocks
    private ReceiptRecognitionController controller;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void returnsRecognisedItems() throws Exception {
        RecognitionResult result = RecognitionResult.recognised(List.of(
            LineItem.recognised("Bananas", new BigDecimal("2.50"), 4),
            LineItem.recognised("Oat milk", new BigDecimal("21.90"), 1)), 0.9, null);
        when(recognitionService.recognize(any(ReceiptImage.class), eq(true))).thenReturn(result);
        MockMultipartFile file = new MockMultipartFile("file", "ica.jpg", "image/jpeg", new byte[] {1, 2, 3});

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/recognize").file(file))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items[0].name").value("Bananas"))
            .andExpect(jsonPath("$.items[0].totalPrice").value(10.00))
            .andExpect(jsonPath("$.totalAmount").value(31.90))
            .andExpect(jsonPath("$.fallbackUsed").value(false));

        ArgumentCaptor<ReceiptImage> image = ArgumentCaptor.forClass(ReceiptImage.class);
        verify(recognitionService).recognize(image.capture(), eq(true));
        assertThat(image.getValue().fileName()).isEqualTo("ica.jpg");
        assertThat(image.getValue().contentType()).isEqualTo("image/jpeg");
    }

    @Test
    void passesFallbackFlagAndReportsFallbackDetails() throws Exception {
        ErrorInfo timeout = ErrorInfo.of(ErrorKind.API_TIMEOUT, "Read timed out");
        ReceiptImage upload = new ReceiptImage("receipt.jpg", "image/jpeg", new byte[] {1});
        RecognitionResult fallback = new FallbackRecognizer().recognize(upload, null, timeout);
        when(recognitionService.recognize(any(ReceiptImage.class), eq(true))).thenReturn(fallback);
        MockMultipartFile file = new MockMultipartFile("file", "receipt.jpg", "image/jpeg", new byte[] {1});

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/recognize").file(file)
                .param("enableFallback", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.fallbackUsed").value(true))
            .andExpect(jsonPath("$.fallbackDetails.strategy").value(FallbackStrategy.ENHANCED_HEURISTIC.name()));
    }

    @Test
    void rejectsEmptyUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.jpg", "image/jpeg", new byte[0]);

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/recognize").file(file))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(recognitionService);
    }

    @Test
    void mapsRecognitionFailureToUnprocessableEntity() throws Exception {
        when(recognitionService.recognize(any(ReceiptImage.class), eq(false))).thenThrow(
            new ReceiptRecognitionException(ErrorInfo.of(ErrorKind.NETWORK_ERROR, "Connection refused"), null));
        MockMultipartFile file = new MockMultipartFile("file", "receipt.jpg", "image/jpeg", new byte[] {1});

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/recognize").file(file)
                .param("enableFallback", "false"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("NETWORK_ERROR"))
            .andExpect(jsonPath("$.error").value(ErrorKind.NETWORK_ERROR.userMessage()));
    }

    @Test
    void recognisesBatchOfUploads() throws Exception {
        RecognitionResult result = RecognitionResult.recognised(List.of(
            LineItem.recognised("Coffee", new BigDecimal("39.00"), 1)), 0.85, null);
        BatchRecognitionResult batch = new BatchRecognitionResult(List.of(
            new BatchRecognitionResult.ImageOutcome("one.jpg", result, null),
            new BatchRecognitionResult.ImageOutcome("two.jpg", null, ErrorKind.IMAGE_PROCESSING_ERROR.userMessage())),
            2, 1, 1, 0, List.of("two.jpg"));
        when(recognitionService.recognizeBatch(anyList(), anyBoolean())).thenReturn(batch);

        mockMvc.perform(MockMvcRequestBuilders.multipart("/api/receipts/recognize/batch")
                .file(new MockMultipartFile("files", "one.jpg", "image/jpeg", new byte[] {1}))
                .file(new MockMultipartFile("files", "two.jpg", "image/jpeg", new byte[] {2})))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.failed").value(1))
            .andExpect(jsonPath("$.failures[0]").value("two.jpg"))
            .andExpect(jsonPath("$.results[0].result.items[0].name").value("Coffee"));
    }
}
