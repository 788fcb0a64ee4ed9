/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Per-client connection lifecycle and the producer/consumer loops built on it.
 *
 * <pre>
 *   Init ─► Disconnected ⇄ Connecting ─► Connected ─► Closing ─► Disconnected
 * </pre>
 *
 * <p>A {@link io.stompbench.internal.client.ClientStateMachine} owns all of its state exclusively and
 * mutates it only from its own {@link io.stompbench.dispatch.DispatchQueue}.
 * {@link io.stompbench.internal.client.ProducerClient} and
 * {@link io.stompbench.internal.client.ConsumerClient} supply the reconnect action that runs each time
 * the machine settles in {@code Disconnected}.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.stompbench.internal.client;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
