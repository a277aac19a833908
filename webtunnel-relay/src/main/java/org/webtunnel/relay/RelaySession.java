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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>An entry of the {@link SessionTable}: the destination connection pinned to one tunnel session.</p>
 * <p>Exchanges run while holding the shared side of an entry lock, so that a write and a
 * read of the same session may proceed together; eviction needs the exclusive side and
 * therefore never races an exchange in flight.</p>
 */
public class RelaySession implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(RelaySession.class);

    private final String id;
    private final String destination;
    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong writeSequence = new AtomicLong();
    private final AtomicLong readSequence = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private volatile long lastActivity = System.nanoTime();

    public RelaySession(String id, String destination, Socket socket) throws IOException
    {
        this.id = id;
        this.destination = destination;
        this.socket = socket;
        this.input = socket.getInputStream();
        this.output = socket.getOutputStream();
    }

    public String getId()
    {
        return id;
    }

    public String getDestination()
    {
        return destination;
    }

    public long getBytesSent()
    {
        return bytesSent.get();
    }

    public long getBytesReceived()
    {
        return bytesReceived.get();
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    /**
     * @return whether the session can serve an exchange, which must then {@link #release()} it
     */
    public boolean acquire()
    {
        lock.readLock().lock();
        if (closed.get())
        {
            lock.readLock().unlock();
            return false;
        }
        touch();
        return true;
    }

    public void release()
    {
        touch();
        lock.readLock().unlock();
    }

    private void touch()
    {
        lastActivity = System.nanoTime();
    }

    /**
     * @param idleTimeout the idle timeout in milliseconds
     * @return whether the session was idle and not in use, and has been closed
     */
    boolean evictIfIdle(long idleTimeout)
    {
        Lock exclusive = lock.writeLock();
        if (!exclusive.tryLock())
            return false;
        try
        {
            long idleFor = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastActivity);
            if (idleFor < idleTimeout)
                return false;
            if (LOG.isDebugEnabled())
                LOG.debug("Evicting {} idle for {}ms", this, idleFor);
            close();
            return true;
        }
        finally
        {
            exclusive.unlock();
        }
    }

    /**
     * @param sequence the sequence number of a write exchange
     * @return whether it is the write exchange expected next
     */
    boolean nextWrite(long sequence)
    {
        return writeSequence.compareAndSet(sequence, sequence + 1);
    }

    /**
     * @param sequence the sequence number of a read exchange
     * @return whether it is the read exchange expected next
     */
    boolean nextRead(long sequence)
    {
        return readSequence.compareAndSet(sequence, sequence + 1);
    }

    void write(byte[] bytes, int offset, int length) throws IOException
    {
        output.write(bytes, offset, length);
        bytesSent.addAndGet(length);
    }

    void flush() throws IOException
    {
        output.flush();
    }

    /**
     * <p>Reads what the destination sent, waiting at most the given time for the first byte.</p>
     *
     * @param buffer the buffer to read into
     * @param timeout the time to wait, in milliseconds
     * @return the number of bytes read, 0 if nothing arrived in time, or -1 at end-of-stream
     * @throws IOException if the destination connection failed
     */
    int read(byte[] buffer, long timeout) throws IOException
    {
        socket.setSoTimeout((int)Math.max(1, timeout));
        int read;
        try
        {
            read = input.read(buffer, 0, buffer.length);
        }
        catch (SocketTimeoutException x)
        {
            return 0;
        }
        if (read > 0)
        {
            int more = Math.min(input.available(), buffer.length - read);
            if (more > 0)
                read += input.read(buffer, read, more);
            bytesReceived.addAndGet(read);
        }
        return read;
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true))
        {
            IO.close(socket);
            if (LOG.isDebugEnabled())
                LOG.debug("Closed {}", this);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[id=%s,dest=%s,sent=%d,received=%d,closed=%b]",
            getClass().getSimpleName(),
            hashCode(),
            id,
            destination,
            bytesSent.get(),
            bytesReceived.get(),
            closed.get());
    }
}
