/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Asynchronous, callback-completed transport contract consumed by the load clients.
 *
 * <p>Every callback handed to a {@link io.stompbench.transport.StompConnector} or
 * {@link io.stompbench.transport.StompConnection} is completed on the
 * {@link io.stompbench.dispatch.DispatchQueue} of the client that issued the operation.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.stompbench.transport;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
