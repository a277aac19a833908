//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package org.webtunnel.relay;

import java.util.EventListener;
import javax.servlet.http.HttpServletRequest;

/**
 * <p>Observes the bytes a {@link RelayHandler} shuttles between clients and destinations.</p>
 * <p>Listeners are invoked from the thread handling the exchange, before it is answered.</p>
 */
public interface TrafficListener extends EventListener
{
    /**
     * <p>Invoked after the payload of a write exchange has been written to the destination.</p>
     *
     * @param clientAddress the address of the client that issued the exchange
     * @param destinationAddress the {@code host:port} of the destination
     * @param request the exchange
     * @param bytes the number of bytes written to the destination
     */
    default void onBytesSent(String clientAddress, String destinationAddress, HttpServletRequest request, long bytes)
    {
    }

    /**
     * <p>Invoked after a read exchange obtained bytes from the destination.</p>
     *
     * @param clientAddress the address of the client that issued the exchange
     * @param destinationAddress the {@code host:port} of the destination
     * @param request the exchange
     * @param bytes the number of bytes read from the destination
     */
    default void onBytesReceived(String clientAddress, String destinationAddress, HttpServletRequest request, long bytes)
    {
    }
}
