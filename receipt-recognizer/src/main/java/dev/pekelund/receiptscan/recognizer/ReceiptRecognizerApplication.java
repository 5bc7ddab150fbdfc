package dev.pekelund.receiptscan.recognizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the receipt recognition service.
 */
@SpringBootApplication
public class ReceiptRecognizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReceiptRecognizerApplication.class, args);
    }
}
