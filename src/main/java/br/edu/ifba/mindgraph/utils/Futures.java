package br.edu.ifba.mindgraph.utils;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Blocking helpers for the {@link CompletableFuture}-based storage API.
 */
public final class Futures {

    private Futures() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Waits for the future and rethrows the original runtime failure instead of
     * the {@link CompletionException} wrapper.
     */
    public static <T> T await(@NotNull CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /**
     * Returns the underlying cause of a future failure as an unchecked exception.
     */
    @NotNull
    public static RuntimeException unwrap(@NotNull Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new CompletionException(cause);
    }
}
