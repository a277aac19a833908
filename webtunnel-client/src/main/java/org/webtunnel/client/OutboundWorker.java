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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;

/**
 * <p>Turns application writes into a strict sequence of write exchanges with the relay.</p>
 * <p>Exchanges are not pipelined: intervening proxies may not deliver concurrent requests
 * to the relay in order, and the stream is split across the bodies of successive requests.</p>
 * <p>The first exchange opens the session; its response, carrying the session id and pin,
 * is handed to the {@link InboundWorker} through {@link TunnelConnection#established(ExchangeResponse)}.</p>
 */
class OutboundWorker implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(OutboundWorker.class);

    private final TunnelConnection tunnel;
    private final TunnelConfig config;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private RelayConnection connection;
    private List<OutboundItem> batch;
    private long sequence;
    private boolean first = true;

    OutboundWorker(TunnelConnection tunnel)
    {
        this.tunnel = tunnel;
        this.config = tunnel.getConfig();
    }

    @Override
    public void run()
    {
        Throwable failure = null;
        try
        {
            process();
        }
        catch (Throwable x)
        {
            failure = x;
            if (first)
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Unable to open {}", tunnel, x);
            }
            else
            {
                LOG.warn("Unable to issue write request on {}", tunnel, x);
            }
        }
        finally
        {
            cleanup(failure);
        }
    }

    private void process() throws IOException, InterruptedException
    {
        while (true)
        {
            if (tunnel.isStopping())
                return;

            OutboundItem item = tunnel.pollRequest(config.getIdleTimeout(), TimeUnit.MILLISECONDS);
            if (item == null)
            {
                if (tunnel.isIdle())
                {
                    if (LOG.isDebugEnabled())
                        LOG.debug("Idle timeout {}ms expired for {}", config.getIdleTimeout(), tunnel);
                    return;
                }
                continue;
            }
            if (item == OutboundItem.STOP)
                return;

            batch = new ArrayList<>();
            batch.add(item);
            coalesce();
            send();
            for (OutboundItem sent : batch)
            {
                sent.succeeded();
            }
            batch = null;
        }
    }

    private void coalesce() throws InterruptedException
    {
        // The first exchange opens the session on its own.
        if (first || !config.isBufferRequests())
            return;

        int size = batch.get(0).length();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getFlushTimeout());
        while (size < config.getMaxRequestSize())
        {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0)
                break;
            OutboundItem next = tunnel.pollRequest(remaining, TimeUnit.NANOSECONDS);
            if (next == null || next == OutboundItem.STOP)
                break;
            batch.add(next);
            size += next.length();
        }
    }

    private void send() throws IOException
    {
        connection = tunnel.reconnectIfNecessary(connection);

        ExchangeRequest request = new ExchangeRequest(TunnelOp.WRITE)
            .field(TunnelHeader.SEQ, String.valueOf(sequence))
            .content(join(batch));
        if (first)
            request.field(TunnelHeader.DEST_ADDR, tunnel.getDestination());
        else
            request.field(TunnelHeader.ID, tunnel.getSessionId()).field(TunnelHeader.PIN, tunnel.getPin());

        ExchangeResponse response = connection.exchange(request);
        response.verify(sequence);
        ++sequence;

        if (first)
        {
            tunnel.established(response);
            if (tunnel.getPin() != null)
                connection.setHost(tunnel.getPin());
            first = false;
        }
    }

    private static byte[] join(List<OutboundItem> items)
    {
        if (items.size() == 1)
            return items.get(0).getPayload();
        int length = 0;
        for (OutboundItem item : items)
        {
            length += item.length();
        }
        byte[] content = new byte[length];
        int offset = 0;
        for (OutboundItem item : items)
        {
            System.arraycopy(item.getPayload(), 0, content, offset, item.length());
            offset += item.length();
        }
        return content;
    }

    private void cleanup(Throwable failure)
    {
        try
        {
            if (batch != null)
            {
                for (OutboundItem item : batch)
                {
                    item.failed(failure);
                }
            }

            // From now on writes are rejected, so the queue can be drained for good.
            Throwable reason = tunnel.requestsTerminated(failure);
            OutboundItem item;
            while ((item = tunnel.pollRequest()) != null)
            {
                if (item != OutboundItem.STOP)
                    item.failed(reason);
            }

            if (connection != null)
                connection.close();
            if (LOG.isDebugEnabled())
                LOG.debug("Stopped processing requests for {}", tunnel);
        }
        finally
        {
            terminated.countDown();
        }
    }

    void awaitTermination() throws InterruptedException
    {
        terminated.await();
    }
}
