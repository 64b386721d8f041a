package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.exception.CredentialInvalidException;
import com.phillippitts.voicenotes.exception.CredentialMissingException;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.credential.CredentialVerifier;
import com.phillippitts.voicenotes.service.credential.SecureStoreCredentialSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CredentialController.class)
class CredentialControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private SecureStoreCredentialSource secureStore;

    @MockBean
    private CredentialResolver resolver;

    @MockBean
    private CredentialVerifier verifier;

    @Test
    void statusNamesSourceButNeverTheKey() throws Exception {
        when(resolver.resolve()).thenReturn(new Credential("sk-live-secret", "environment"));

        mvc.perform(get("/api/credentials"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.configured").value(true))
                .andExpect(jsonPath("$.source").value("environment"))
                .andExpect(content().string(not(containsString("sk-live-secret"))));
    }

    @Test
    void statusWhenNothingConfigured() throws Exception {
        when(resolver.resolve()).thenThrow(new CredentialMissingException());

        mvc.perform(get("/api/credentials"))
                .andExpect(jsonPath("$.configured").value(false))
                .andExpect(jsonPath("$.source").doesNotExist());
    }

    @Test
    void verifiedKeyIsStored() throws Exception {
        when(secureStore.name()).thenReturn("secure-store");

        mvc.perform(put("/api/credentials").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\"sk-new\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.source").value("secure-store"));

        verify(verifier).verify("sk-new");
        verify(secureStore).store("sk-new");
    }

    @Test
    void rejectedKeyIsNotStored() throws Exception {
        doThrow(new CredentialInvalidException("Incorrect API key provided (status=401)", "models"))
                .when(verifier).verify("sk-bad");

        mvc.perform(put("/api/credentials").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\"sk-bad\"}"))
                .andExpect(status().isUnauthorized());

        verify(secureStore, never()).store(anyString());
    }

    @Test
    void blankKeyIsBadRequest() throws Exception {
        mvc.perform(put("/api/credentials").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"apiKey\":\" \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void verifyWithoutBodyChecksConfiguredKey() throws Exception {
        when(verifier.verifyConfigured()).thenReturn(new Credential("sk-x", "local"));

        mvc.perform(post("/api/credentials/verify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("local"));
    }
}
