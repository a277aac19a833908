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

package org.webtunnel.client;

import org.eclipse.jetty.util.Callback;

/**
 * <p>A payload queued by an application write, acknowledged through its {@link Callback}
 * once the exchange carrying it completed.</p>
 */
class OutboundItem
{
    /**
     * Queued by {@link TunnelConnection#close()} to wake up a worker waiting for items.
     */
    static final OutboundItem STOP = new OutboundItem(new byte[0], Callback.NOOP);

    private final byte[] payload;
    private final Callback callback;

    OutboundItem(byte[] payload, Callback callback)
    {
        this.payload = payload;
        this.callback = callback;
    }

    byte[] getPayload()
    {
        return payload;
    }

    int length()
    {
        return payload.length;
    }

    void succeeded()
    {
        callback.succeeded();
    }

    void failed(Throwable x)
    {
        callback.failed(x);
    }

    @Override
    public String toString()
    {
        return this == STOP ? "STOP" : String.format("%s[%d bytes]", getClass().getSimpleName(), payload.length);
    }
}
