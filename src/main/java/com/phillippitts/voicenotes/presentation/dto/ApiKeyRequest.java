package com.phillippitts.voicenotes.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code PUT /api/credentials} and {@code POST /api/credentials/verify}.
 */
public record ApiKeyRequest(@NotBlank String apiKey) {

    @Override
    public String toString() {
        return "ApiKeyRequest[apiKey=***]";
    }
}
