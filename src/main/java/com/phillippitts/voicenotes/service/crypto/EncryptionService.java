package com.phillippitts.voicenotes.service.crypto;

/**
 * Symmetric encryption of text at rest.
 */
public interface EncryptionService {

    /**
     * Encrypts UTF-8 text.
     *
     * @return base64 text safe to write to a file
     * @throws com.phillippitts.voicenotes.exception.EncryptionException if encryption fails
     */
    String encrypt(String plaintext);

    /**
     * Reverses {@link #encrypt(String)}.
     *
     * @throws com.phillippitts.voicenotes.exception.EncryptionException if the input is not
     *         valid ciphertext for this key
     */
    String decrypt(String encoded);
}
