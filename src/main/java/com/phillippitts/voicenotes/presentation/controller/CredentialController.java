package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.exception.CredentialMissingException;
import com.phillippitts.voicenotes.presentation.dto.ApiKeyRequest;
import com.phillippitts.voicenotes.presentation.dto.CredentialStatusResponse;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.credential.CredentialVerifier;
import com.phillippitts.voicenotes.service.credential.SecureStoreCredentialSource;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Settings endpoints for the provider API key. Keys are accepted but never returned.
 */
@RestController
@RequestMapping("/api/credentials")
class CredentialController {

    private final SecureStoreCredentialSource secureStore;
    private final CredentialResolver resolver;
    private final CredentialVerifier verifier;

    CredentialController(SecureStoreCredentialSource secureStore,
                         CredentialResolver resolver,
                         CredentialVerifier verifier) {
        this.secureStore = secureStore;
        this.resolver = resolver;
        this.verifier = verifier;
    }

    @GetMapping
    CredentialStatusResponse status() {
        try {
            Credential credential = resolver.resolve();
            return new CredentialStatusResponse(true, credential.source(), null);
        } catch (CredentialMissingException e) {
            return new CredentialStatusResponse(false, null, null);
        }
    }

    /**
     * Verifies the key with the provider, then stores it in the secure store.
     */
    @PutMapping
    CredentialStatusResponse store(@Valid @RequestBody ApiKeyRequest request) {
        verifier.verify(request.apiKey());
        secureStore.store(request.apiKey());
        return new CredentialStatusResponse(true, secureStore.name(), true);
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        secureStore.clear();
        return ResponseEntity.noContent().build();
    }

    /**
     * Verifies the given key, or the configured one when the body is absent.
     */
    @PostMapping("/verify")
    CredentialStatusResponse verify(@Valid @RequestBody(required = false) ApiKeyRequest request) {
        if (request != null) {
            verifier.verify(request.apiKey());
            return new CredentialStatusResponse(true, null, true);
        }
        Credential credential = verifier.verifyConfigured();
        return new CredentialStatusResponse(true, credential.source(), true);
    }
}
