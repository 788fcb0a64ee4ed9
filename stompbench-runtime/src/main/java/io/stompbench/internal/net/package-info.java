/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Netty implementation of the STOMP transport.
 *
 * <pre>
 *   NettyStompConnector ──connect()──► Channel (on the client's event loop)
 *                                         │
 *                     [ssl] → [networkLogger] → decoder/encoder → [frameLogger] → StompClientHandler
 *                                                                                     │
 *                                                            CONNECTED ──► NettyStompConnection
 * </pre>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.stompbench.internal.net;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
