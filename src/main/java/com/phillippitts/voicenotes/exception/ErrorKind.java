package com.phillippitts.voicenotes.exception;

/**
 * Closed classification of every failure the pipeline can surface.
 *
 * <p>Retry decisions, HTTP status mapping and failed-recording classification are all
 * exhaustive switches over this enum, so adding a constant forces each of them to decide.
 */
public enum ErrorKind {

    /** Bad input, rejected before any network call. */
    VALIDATION,

    /** No API key in any configured source. */
    CREDENTIAL_MISSING,

    /** The provider rejected the API key. */
    CREDENTIAL_INVALID,

    /** Refused by the local token bucket; carries a retry-after estimate. */
    RATE_LIMIT,

    /** Network failure, timeout or provider-side error that may succeed later. */
    TRANSIENT_API,

    /** Provider response does not match the item schema. */
    SCHEMA_VALIDATION,

    /** Anything not classified above. */
    UNKNOWN
}
