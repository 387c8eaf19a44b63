package com.techStack.accessSys.util.firebase;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.techStack.accessSys.exception.service.CustomException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

public final class FirestoreUtils {

    private FirestoreUtils() {
    }

    public static <T> Mono<T> apiFutureToMono(ApiFuture<T> apiFuture) {
        return Mono.defer(() -> {
            CompletableFuture<T> completableFuture = new CompletableFuture<>();
            ApiFutures.addCallback(apiFuture, new ApiFutureCallback<>() {
                @Override
                public void onSuccess(T result) {
                    completableFuture.complete(result);
                }

                @Override
                public void onFailure(Throwable t) {
                    completableFuture.completeExceptionally(t);
                }
            }, Runnable::run);
            return Mono.fromFuture(completableFuture);
        });
    }

    /**
     * Firestore wraps exceptions thrown inside a transaction callback; this digs
     * the domain exception back out so callers see the original status.
     */
    public static Throwable unwrapDomainException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CustomException) {
                return current;
            }
            current = current.getCause();
        }
        return error;
    }
}
