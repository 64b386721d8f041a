/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.voicenotes.exception.VoiceNotesException}
 * and carry an {@link com.phillippitts.voicenotes.exception.ErrorKind}. Retry decisions and
 * HTTP response mapping branch on the kind:
 * <ul>
 *   <li>{@link com.phillippitts.voicenotes.exception.InvalidAudioException} - VALIDATION</li>
 *   <li>{@link com.phillippitts.voicenotes.exception.CredentialMissingException} - CREDENTIAL_MISSING</li>
 *   <li>{@link com.phillippitts.voicenotes.exception.CredentialInvalidException} - CREDENTIAL_INVALID</li>
 *   <li>{@link com.phillippitts.voicenotes.exception.RateLimitException} - RATE_LIMIT</li>
 *   <li>{@link com.phillippitts.voicenotes.exception.TransientApiException} - TRANSIENT_API</li>
 *   <li>{@link com.phillippitts.voicenotes.exception.SchemaValidationException} - SCHEMA_VALIDATION</li>
 * </ul>
 *
 * @see com.phillippitts.voicenotes.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voicenotes.exception;
