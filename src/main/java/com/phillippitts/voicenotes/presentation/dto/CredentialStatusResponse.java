package com.phillippitts.voicenotes.presentation.dto;

/**
 * Whether a key is configured, and from which source. Never carries the key.
 */
public record CredentialStatusResponse(boolean configured, String source, Boolean verified) {}
