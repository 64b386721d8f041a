package com.phillippitts.voicenotes.service.extraction;

import com.phillippitts.voicenotes.domain.ExtractedContent;
import com.phillippitts.voicenotes.service.credential.Credential;

/**
 * Structured-generation provider port. One call is one attempt.
 */
public interface ExtractionGateway {

    /**
     * @param transcript transcript to analyse
     * @param language   detected language hint, may be null
     * @return content that already satisfies the item schema
     * @throws com.phillippitts.voicenotes.exception.SchemaValidationException if the output breaks the schema
     * @throws com.phillippitts.voicenotes.exception.CredentialInvalidException if the key is rejected
     * @throws com.phillippitts.voicenotes.exception.TransientApiException on any other provider failure
     */
    ExtractedContent extract(String transcript, String language, Credential credential);

    String endpoint();
}
