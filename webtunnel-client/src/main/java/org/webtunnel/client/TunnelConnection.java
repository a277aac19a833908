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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.util.Callback;
import org.eclipse.jetty.util.FutureCallback;
import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webtunnel.TunnelException;
import org.webtunnel.TunnelHeader;

/**
 * <p>A duplex byte stream to a destination, carried by sequential exchanges with a relay.</p>
 * <p>Application reads and writes never touch the relay: writes are queued to an
 * {@link OutboundWorker}, reads consume what an {@link InboundWorker} polled, so that at most
 * one exchange per direction is ever in flight.</p>
 * <p>Typical usage:</p>
 * <pre>
 * TunnelConfig config = new TunnelConfig(address -&gt; new Socket("relay.example.com", 8080));
 * try (TunnelConnection tunnel = TunnelConnection.dial("example.com:80", config))
 * {
 *     tunnel.getOutputStream().write(request);
 *     tunnel.getInputStream().read(buffer);
 * }
 * </pre>
 * <p>A tunnel with no traffic for the {@link TunnelConfig#getIdleTimeout() idle timeout}
 * closes itself; afterwards reads return end-of-stream and writes throw {@link EofException}.</p>
 */
public class TunnelConnection implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(TunnelConnection.class);
    private static final int MAX_PENDING_WRITES = 64;

    private final String destination;
    private final TunnelConfig config;
    private final BlockingQueue<OutboundItem> requests = new LinkedBlockingQueue<>();
    private final BlockingQueue<InboundItem> responses = new ArrayBlockingQueue<>(1);
    private final CompletableFuture<ExchangeResponse> initialResponse = new CompletableFuture<>();
    private final ReadWriteLock requestLock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final AtomicInteger pendingReads = new AtomicInteger();
    private final OutboundWorker outbound;
    private final InboundWorker inbound;
    private final TunnelInputStream input = new TunnelInputStream();
    private final TunnelOutputStream output = new TunnelOutputStream();
    private boolean doneRequesting;
    private volatile boolean stopping;
    private volatile InboundItem terminal;
    private volatile long lastActivity = System.nanoTime();
    private volatile String sessionId;
    private volatile String pin;

    /**
     * <p>Opens a tunnel to the given destination.</p>
     * <p>Returns only once the relay answered the first exchange, so that failing to reach
     * the relay or the relay failing to reach the destination are reported here.</p>
     *
     * @param address the destination, in the form {@code host:port}
     * @param config the tunnel configuration
     * @return an open tunnel
     * @throws IOException if the tunnel could not be opened
     */
    public static TunnelConnection dial(String address, TunnelConfig config) throws IOException
    {
        Objects.requireNonNull(address, "address");
        if (address.indexOf('\r') >= 0 || address.indexOf('\n') >= 0)
            throw new IllegalArgumentException("Invalid destination address");
        if (config.getDialer() == null)
            throw new IllegalArgumentException("No dialer configured");

        TunnelConnection tunnel = new TunnelConnection(address, config);
        tunnel.start();
        try
        {
            tunnel.initialResponse.get();
            if (LOG.isDebugEnabled())
                LOG.debug("Opened {}", tunnel);
            return tunnel;
        }
        catch (ExecutionException x)
        {
            IO.close(tunnel);
            Throwable cause = x.getCause();
            if (cause instanceof IOException)
                throw (IOException)cause;
            throw new TunnelException("Unable to open tunnel to " + address, cause);
        }
        catch (InterruptedException x)
        {
            Thread.currentThread().interrupt();
            IO.close(tunnel);
            throw new InterruptedIOException("Interrupted opening tunnel to " + address);
        }
    }

    private TunnelConnection(String destination, TunnelConfig config)
    {
        this.destination = destination;
        this.config = config;
        this.outbound = new OutboundWorker(this);
        this.inbound = new InboundWorker(this);
    }

    private void start()
    {
        // The first exchange opens the session even if the application never writes.
        requests.offer(new OutboundItem(new byte[0], Callback.NOOP));
        execute(outbound, "out");
        execute(inbound, "in");
    }

    private void execute(Runnable worker, String direction)
    {
        Executor executor = config.getExecutor();
        if (executor != null)
        {
            executor.execute(worker);
        }
        else
        {
            Thread thread = new Thread(worker, String.format("tunnel-%s-%s", direction, destination));
            thread.setDaemon(true);
            thread.start();
        }
    }

    public String getDestination()
    {
        return destination;
    }

    public TunnelConfig getConfig()
    {
        return config;
    }

    /**
     * @return the session id assigned by the relay, or null before the first exchange completed
     */
    public String getSessionId()
    {
        return sessionId;
    }

    /**
     * @return the relay instance this tunnel is pinned to, or null if the relay did not send one
     */
    public String getPin()
    {
        return pin;
    }

    public InputStream getInputStream()
    {
        return input;
    }

    public OutputStream getOutputStream()
    {
        return output;
    }

    /**
     * @return whether the tunnel is neither closed nor terminated
     */
    public boolean isOpen()
    {
        return !closed.get() && terminal == null;
    }

    /**
     * <p>Closes the tunnel, waiting for both workers to terminate.</p>
     * <p>Buffered writes are flushed first; an exchange in flight is completed, not aborted,
     * and writes still queued are failed with {@link EofException}.</p>
     *
     * @throws IOException if flushing buffered writes failed
     */
    @Override
    public void close() throws IOException
    {
        if (!closed.compareAndSet(false, true))
            return;

        IOException flushFailure = null;
        if (config.isBufferRequests() && isEstablished())
        {
            try
            {
                output.flushPending();
            }
            catch (IOException x)
            {
                flushFailure = x;
            }
        }

        stop();
        try
        {
            outbound.awaitTermination();
            inbound.awaitTermination();
        }
        catch (InterruptedException x)
        {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted closing " + this);
        }
        if (LOG.isDebugEnabled())
            LOG.debug("Closed {}", this);

        if (flushFailure != null)
            throw flushFailure;
    }

    private boolean isEstablished()
    {
        return initialResponse.isDone() && !initialResponse.isCompletedExceptionally();
    }

    void stop()
    {
        stopping = true;
        requests.offer(OutboundItem.STOP);
    }

    boolean isStopping()
    {
        return stopping;
    }

    /**
     * @return whether nothing happened for the idle timeout and nobody waits to read
     */
    boolean isIdle()
    {
        long idleFor = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastActivity);
        return pendingReads.get() == 0 && idleFor >= config.getIdleTimeout();
    }

    void onActivity()
    {
        lastActivity = System.nanoTime();
    }

    Throwable getFailure()
    {
        return failure.get();
    }

    private void fail(Throwable x)
    {
        failure.compareAndSet(null, x);
        stop();
    }

    RelayConnection reconnectIfNecessary(RelayConnection connection) throws IOException
    {
        if (connection != null)
        {
            if (connection.isUsable())
                return connection;
            if (LOG.isDebugEnabled())
                LOG.debug("Redialing relay, {} not usable for {}", connection, this);
            connection.close();
        }

        Socket socket = config.getDialer().dial(destination);
        try
        {
            return new RelayConnection(socket, pin != null ? pin : config.getHost());
        }
        catch (IOException x)
        {
            IO.close(socket);
            throw x;
        }
    }

    OutboundItem pollRequest()
    {
        return requests.poll();
    }

    OutboundItem pollRequest(long timeout, TimeUnit unit) throws InterruptedException
    {
        return requests.poll(timeout, unit);
    }

    /**
     * @return whether the item was queued, false if writes are no longer accepted
     */
    private boolean submitRequest(OutboundItem item)
    {
        Lock lock = requestLock.readLock();
        lock.lock();
        try
        {
            if (doneRequesting)
                return false;
            requests.offer(item);
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    boolean isDoneRequesting()
    {
        Lock lock = requestLock.readLock();
        lock.lock();
        try
        {
            return doneRequesting;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * <p>Stops accepting writes, once the {@link OutboundWorker} terminated.</p>
     *
     * @param cause the failure that terminated the worker, or null if it terminated cleanly
     * @return the failure for the writes still queued
     */
    Throwable requestsTerminated(Throwable cause)
    {
        Lock lock = requestLock.writeLock();
        lock.lock();
        try
        {
            doneRequesting = true;
        }
        finally
        {
            lock.unlock();
        }

        // Stopped cleanly, but possibly because reads failed.
        Throwable failed = cause != null ? cause : failure.get();
        Throwable reason;
        if (failed == null)
        {
            reason = new EofException("Tunnel to " + destination + " no longer accepts writes");
        }
        else
        {
            reason = new TunnelException("Tunnel to " + destination + " terminated abnormally", failed);
            if (cause != null && isEstablished())
                fail(cause);
        }
        initialResponse.completeExceptionally(cause != null ? cause : reason);
        return reason;
    }

    void established(ExchangeResponse response) throws TunnelException
    {
        String id = response.getHeader(TunnelHeader.ID);
        if (id == null)
            throw new TunnelException("Relay did not assign a session to " + destination);
        sessionId = id;
        pin = response.getHeader(TunnelHeader.PIN);
        initialResponse.complete(response);
    }

    ExchangeResponse awaitInitialResponse() throws InterruptedException, ExecutionException
    {
        return initialResponse.get();
    }

    /**
     * <p>Hands polled content to the application, waiting for it to be read.</p>
     *
     * @return whether the content was queued, false if the tunnel is stopping
     */
    boolean offerResponse(InboundItem item) throws InterruptedException
    {
        while (!responses.offer(item, 100, TimeUnit.MILLISECONDS))
        {
            if (isStopping())
                return false;
        }
        return true;
    }

    /**
     * <p>Signals end-of-stream, or the failure, to readers, once the {@link InboundWorker} terminated.</p>
     */
    void responsesTerminated(Throwable cause)
    {
        terminal = cause == null ? InboundItem.EOF : InboundItem.failed(cause);
        // Wakes up a blocked reader, otherwise the next read finds the terminal item.
        responses.offer(terminal);
        if (cause != null)
            fail(cause);
        else
            stop();
    }

    private IOException rejection()
    {
        Throwable cause = failure.get();
        if (cause == null)
            return new EofException("Tunnel to " + destination + " no longer accepts writes");
        return new TunnelException("Tunnel to " + destination + " failed", cause);
    }

    private static void await(FutureCallback callback) throws IOException
    {
        try
        {
            callback.get();
        }
        catch (InterruptedException x)
        {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException();
        }
        catch (ExecutionException x)
        {
            Throwable cause = x.getCause();
            if (cause instanceof IOException)
                throw (IOException)cause;
            throw new TunnelException("Write failed", cause);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[dest=%s,pin=%s,id=%s,open=%b]",
            getClass().getSimpleName(),
            hashCode(),
            destination,
            pin,
            sessionId,
            isOpen());
    }

    private class TunnelInputStream extends InputStream
    {
        private InboundItem current;
        private int offset;

        @Override
        public int read() throws IOException
        {
            byte[] one = new byte[1];
            int read = read(one, 0, 1);
            return read < 0 ? -1 : one[0] & 0xFF;
        }

        @Override
        public synchronized int read(byte[] b, int off, int len) throws IOException
        {
            Objects.checkFromIndexSize(off, len, b.length);
            if (len == 0)
                return 0;

            while (current == null || offset == current.getContent().length)
            {
                if (closed.get())
                    return -1;
                InboundItem item = next();
                if (item.isTerminal())
                {
                    Throwable cause = item.getFailure();
                    if (cause == null)
                        return -1;
                    throw new TunnelException("Tunnel to " + destination + " terminated abnormally", cause);
                }
                current = item;
                offset = 0;
            }

            byte[] content = current.getContent();
            int length = Math.min(len, content.length - offset);
            System.arraycopy(content, offset, b, off, length);
            offset += length;
            onActivity();
            return length;
        }

        private InboundItem next() throws IOException
        {
            InboundItem item = responses.poll();
            if (item != null)
                return item;
            InboundItem last = terminal;
            if (last != null)
            {
                // Content may have been queued just before the terminal item was set.
                item = responses.poll();
                return item != null ? item : last;
            }

            pendingReads.incrementAndGet();
            try
            {
                return responses.take();
            }
            catch (InterruptedException x)
            {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException();
            }
            finally
            {
                pendingReads.decrementAndGet();
            }
        }

        @Override
        public synchronized int available()
        {
            return current == null ? 0 : current.getContent().length - offset;
        }

        @Override
        public void close() throws IOException
        {
            TunnelConnection.this.close();
        }
    }

    private class TunnelOutputStream extends OutputStream
    {
        private final Deque<FutureCallback> pending = new ArrayDeque<>();

        @Override
        public void write(int b) throws IOException
        {
            write(new byte[]{(byte)b}, 0, 1);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) throws IOException
        {
            Objects.checkFromIndexSize(off, len, b.length);
            if (closed.get())
                throw new EofException("Tunnel to " + destination + " closed");
            if (len == 0)
                return;

            boolean buffered = config.isBufferRequests();
            if (buffered)
                completePending(false);

            FutureCallback callback = new FutureCallback();
            if (!submitRequest(new OutboundItem(Arrays.copyOfRange(b, off, off + len), callback)))
                throw rejection();
            onActivity();

            if (buffered)
            {
                pending.add(callback);
                while (pending.size() > MAX_PENDING_WRITES)
                {
                    await(pending.poll());
                }
            }
            else
            {
                await(callback);
                onActivity();
            }
        }

        @Override
        public void flush() throws IOException
        {
            flushPending();
        }

        synchronized void flushPending() throws IOException
        {
            completePending(true);
        }

        private void completePending(boolean block) throws IOException
        {
            while (!pending.isEmpty() && (block || pending.peek().isDone()))
            {
                await(pending.poll());
            }
        }

        @Override
        public void close() throws IOException
        {
            TunnelConnection.this.close();
        }
    }
}
