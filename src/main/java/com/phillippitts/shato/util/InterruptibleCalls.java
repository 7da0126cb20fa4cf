package com.phillippitts.shato.util;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs OkHttp calls so that interrupting the waiting thread cancels the call.
 *
 * <p>{@link Call#execute()} blocks in a socket read that ignores interrupts. Here the call is
 * enqueued on the client's dispatcher and the caller waits on a future; an interrupt cancels the
 * call and closes any response that still arrives.
 */
public final class InterruptibleCalls {

    private InterruptibleCalls() {
    }

    /**
     * Executes a call, waiting for its response.
     *
     * @param call call to run (not yet executed)
     * @return response; the caller must close it
     * @throws IOException          if the call fails or times out
     * @throws InterruptedException if the calling thread is interrupted; the call is cancelled
     */
    public static Response execute(Call call) throws IOException, InterruptedException {
        CompletableFuture<Response> future = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                if (!future.complete(response)) {
                    response.close();
                }
            }
        });

        try {
            return future.get();
        } catch (InterruptedException e) {
            call.cancel();
            if (!future.cancel(false) && !future.isCompletedExceptionally()) {
                future.join().close();
            }
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }
}
