/**
 * Global exception handling for REST API responses.
 *
 * <p>{@link com.phillippitts.voicenotes.presentation.exception.GlobalExceptionHandler} maps
 * every {@link com.phillippitts.voicenotes.exception.ErrorKind} to one status code and returns
 * a structured {@code ApiError} body with sanitized details.
 */
package com.phillippitts.voicenotes.presentation.exception;
