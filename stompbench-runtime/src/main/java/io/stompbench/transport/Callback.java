/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.transport;

import java.util.function.Consumer;

/**
 * Completion of an asynchronous transport operation. Exactly one of the two methods is invoked,
 * at most once, on the issuing client's dispatch queue.
 *
 * @param <T> result type
 */
public interface Callback<T> {

    void onSuccess(T value);

    void onFailure(Throwable cause);

    static <T> Callback<T> of(Consumer<? super T> onSuccess, Consumer<Throwable> onFailure) {
        return new Callback<>() {
            @Override
            public void onSuccess(T value) {
                onSuccess.accept(value);
            }

            @Override
            public void onFailure(Throwable cause) {
                onFailure.accept(cause);
            }
        };
    }
}
