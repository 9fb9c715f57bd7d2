package io.weaver.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/// Suspension helpers used by asynchronous generated programs.
public final class Async {

    private Async() {}

    /// Waits for an asynchronous node result.
    ///
    /// @param stage the stage returned by the node function, may be null
    /// @return the completed value, or null for a null stage
    /// @throws RuntimeException the stage's failure, unwrapped
    public static <T> T await(CompletionStage<T> stage) {
        if (stage == null) {
            return null;
        }
        try {
            return stage.toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /// Runs a workflow body on the context's executor.
    public static <T> CompletableFuture<T> run(WorkflowContext context, Supplier<T> body) {
        return CompletableFuture.supplyAsync(body, context.executor());
    }

    private static RuntimeException unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error e) {
            throw e;
        }
        return new CompletionException(cause);
    }
}
