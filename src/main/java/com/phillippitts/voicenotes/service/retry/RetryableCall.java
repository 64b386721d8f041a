package com.phillippitts.voicenotes.service.retry;

/**
 * A single attempt of a provider call.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RetryableCall<T> {

    T call() throws Exception;
}
