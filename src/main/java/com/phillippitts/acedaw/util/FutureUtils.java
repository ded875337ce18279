package com.phillippitts.acedaw.util;

import com.phillippitts.acedaw.exception.AceDawException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Helpers for the blocking edge of the asynchronous storage API (controllers, startup code).
 */
public final class FutureUtils {

    private FutureUtils() {}

    /**
     * Waits for the future and rethrows the original failure instead of the
     * {@link CompletionException} wrapper, so exception handlers see domain types.
     *
     * @param future future to wait for
     * @param <T>    result type
     * @return the completed value
     */
    public static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new AceDawException("Asynchronous operation failed", cause);
        }
    }
}
