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

import java.util.concurrent.Executor;

/**
 * <p>Configuration of a {@link TunnelConnection}.</p>
 * <p>Only the {@link #setDialer(Dialer) dialer} is mandatory.</p>
 */
public class TunnelConfig
{
    private Dialer dialer;
    private long idleTimeout = 70000;
    private boolean bufferRequests;
    private long flushTimeout = 15;
    private int maxRequestSize = 65536;
    private Executor executor;
    private String host;

    public TunnelConfig()
    {
    }

    public TunnelConfig(Dialer dialer)
    {
        this.dialer = dialer;
    }

    public Dialer getDialer()
    {
        return dialer;
    }

    public void setDialer(Dialer dialer)
    {
        this.dialer = dialer;
    }

    /**
     * @return the time, in milliseconds, with no traffic after which the tunnel closes itself
     */
    public long getIdleTimeout()
    {
        return idleTimeout;
    }

    /**
     * @param idleTimeout the time, in milliseconds, with no traffic after which the tunnel closes itself
     */
    public void setIdleTimeout(long idleTimeout)
    {
        this.idleTimeout = idleTimeout;
    }

    /**
     * @return whether writes return once queued, to be coalesced with other writes into fewer exchanges
     */
    public boolean isBufferRequests()
    {
        return bufferRequests;
    }

    public void setBufferRequests(boolean bufferRequests)
    {
        this.bufferRequests = bufferRequests;
    }

    /**
     * @return how long, in milliseconds, buffered writes wait for further writes to coalesce with
     */
    public long getFlushTimeout()
    {
        return flushTimeout;
    }

    public void setFlushTimeout(long flushTimeout)
    {
        this.flushTimeout = flushTimeout;
    }

    /**
     * @return the size, in bytes, at which coalescing of buffered writes stops
     */
    public int getMaxRequestSize()
    {
        return maxRequestSize;
    }

    public void setMaxRequestSize(int maxRequestSize)
    {
        this.maxRequestSize = maxRequestSize;
    }

    /**
     * @return the executor running the tunnel workers, or null to run each worker in its own thread
     */
    public Executor getExecutor()
    {
        return executor;
    }

    public void setExecutor(Executor executor)
    {
        this.executor = executor;
    }

    /**
     * @return the {@code Host} of the first exchange, or null to use the address of the relay connection
     */
    public String getHost()
    {
        return host;
    }

    public void setHost(String host)
    {
        this.host = host;
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[idleTimeout=%d,bufferRequests=%b,flushTimeout=%d,maxRequestSize=%d]",
            getClass().getSimpleName(),
            hashCode(),
            idleTimeout,
            bufferRequests,
            flushTimeout,
            maxRequestSize);
    }
}
