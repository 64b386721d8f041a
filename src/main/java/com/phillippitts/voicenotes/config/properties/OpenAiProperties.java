package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Provider endpoint settings: base URL, model names and HTTP timeouts.
 */
@ConfigurationProperties(prefix = "voicenotes.openai")
@Validated
public class OpenAiProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com";

    @NotBlank
    private String transcriptionModel = "whisper-1";

    @NotBlank
    private String extractionModel = "gpt-4o";

    @Positive
    private int connectTimeoutMs = 10_000;

    /** Read timeout for transcription and extraction calls (long audio takes a while). */
    @Positive
    private int readTimeoutMs = 120_000;

    /** Bounded wait for credential verification, applied to both connect and read. */
    @Positive
    private int verifyTimeoutMs = 10_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTranscriptionModel() {
        return transcriptionModel;
    }

    public void setTranscriptionModel(String transcriptionModel) {
        this.transcriptionModel = transcriptionModel;
    }

    public String getExtractionModel() {
        return extractionModel;
    }

    public void setExtractionModel(String extractionModel) {
        this.extractionModel = extractionModel;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public int getVerifyTimeoutMs() {
        return verifyTimeoutMs;
    }

    public void setVerifyTimeoutMs(int verifyTimeoutMs) {
        this.verifyTimeoutMs = verifyTimeoutMs;
    }
}
