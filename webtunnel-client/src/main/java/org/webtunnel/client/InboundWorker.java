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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webtunnel.TunnelException;
import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;

/**
 * <p>Polls the relay for data sent by the destination, one read exchange at a time.</p>
 * <p>Starts from the response to the first write exchange, whose payload is delivered
 * before any poll is issued, and stops at end-of-stream, on failure, on close, or once
 * writes stopped and the tunnel went idle.</p>
 */
class InboundWorker implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(InboundWorker.class);

    private final TunnelConnection tunnel;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private RelayConnection connection;
    private long sequence;

    InboundWorker(TunnelConnection tunnel)
    {
        this.tunnel = tunnel;
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
            LOG.warn("Unable to issue read request on {}", tunnel, x);
        }
        finally
        {
            // A failed write also terminates reads abnormally.
            Throwable writeFailure = tunnel.getFailure();
            if (failure == null && writeFailure != null)
                failure = new TunnelException("Writes to " + tunnel.getDestination() + " failed", writeFailure);
            cleanup(failure);
        }
    }

    private void process() throws IOException, InterruptedException
    {
        ExchangeResponse response;
        try
        {
            response = tunnel.awaitInitialResponse();
        }
        catch (ExecutionException x)
        {
            // The dialer already reported this failure.
            if (LOG.isDebugEnabled())
                LOG.debug("Not polling, {} was never opened", tunnel, x.getCause());
            return;
        }

        while (deliver(response))
        {
            if (tunnel.isStopping())
                return;
            if (tunnel.isDoneRequesting() && tunnel.isIdle())
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("Stopped polling idle {}", tunnel);
                return;
            }

            connection = tunnel.reconnectIfNecessary(connection);
            ExchangeRequest request = new ExchangeRequest(TunnelOp.READ)
                .field(TunnelHeader.ID, tunnel.getSessionId())
                .field(TunnelHeader.PIN, tunnel.getPin())
                .field(TunnelHeader.SEQ, String.valueOf(sequence));
            response = connection.exchange(request);
            response.verify(sequence);
            ++sequence;
        }
    }

    /**
     * @return whether polling should go on
     */
    private boolean deliver(ExchangeResponse response) throws InterruptedException
    {
        byte[] content = response.getContent();
        if (content.length > 0)
        {
            tunnel.onActivity();
            if (!tunnel.offerResponse(InboundItem.of(content)))
                return false;
        }
        if (response.isEOF())
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Destination closed {}", tunnel);
            return false;
        }
        return true;
    }

    private void cleanup(Throwable failure)
    {
        try
        {
            if (connection != null)
                connection.close();
            tunnel.responsesTerminated(failure);
            if (LOG.isDebugEnabled())
                LOG.debug("Stopped processing responses for {}", tunnel);
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
