package com.phillippitts.voicenotes.service.transcription;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.service.credential.Credential;

/**
 * Speech-to-text provider port. One call is one attempt; retrying is the stage's concern.
 */
public interface TranscriptionGateway {

    /**
     * @throws com.phillippitts.voicenotes.exception.CredentialInvalidException if the key is rejected
     * @throws com.phillippitts.voicenotes.exception.TransientApiException on any other provider failure
     */
    Transcript transcribe(AudioPayload audio, Credential credential);

    /** Logical endpoint name used for rate limiting and error reports. */
    String endpoint();
}
