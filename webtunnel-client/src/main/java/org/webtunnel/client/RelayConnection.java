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

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.http.BadMessageException;
import org.eclipse.jetty.http.HttpField;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpHeaderValue;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpParser;
import org.eclipse.jetty.http.HttpVersion;
import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.util.BufferUtil;
import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webtunnel.TunnelException;
import org.webtunnel.TunnelHeader;

/**
 * <p>A persistent HTTP/1.1 connection to the relay, carrying one exchange at a time.</p>
 * <p>Requests are written in the clear onto the socket obtained from the {@link Dialer};
 * responses are parsed with Jetty's {@link HttpParser}.</p>
 * <p>Not thread safe: each tunnel worker owns its own connection.</p>
 */
public class RelayConnection implements Closeable
{
    private static final Logger LOG = LoggerFactory.getLogger(RelayConnection.class);

    /**
     * A connection unused for longer than this is probed for a close by the relay before reuse.
     */
    private static final long PROBE_AFTER_IDLE = 1000;

    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;
    private final ByteBuffer buffer;
    private final ResponseHandler handler = new ResponseHandler();
    private final HttpParser parser = new HttpParser(handler);
    private String host;
    private boolean usable = true;
    private long lastUsed = System.nanoTime();

    public RelayConnection(Socket socket, String host) throws IOException
    {
        this(socket, host, 8192);
    }

    public RelayConnection(Socket socket, String host, int bufferSize) throws IOException
    {
        this.socket = socket;
        this.input = socket.getInputStream();
        this.output = socket.getOutputStream();
        this.buffer = BufferUtil.allocate(bufferSize);
        this.host = host == null ? toHost(socket.getRemoteSocketAddress()) : host;
    }

    private static String toHost(SocketAddress address)
    {
        if (address instanceof InetSocketAddress)
        {
            InetSocketAddress inet = (InetSocketAddress)address;
            return inet.getHostString() + ":" + inet.getPort();
        }
        return String.valueOf(address);
    }

    public String getHost()
    {
        return host;
    }

    /**
     * @param host the {@code Host} for subsequent exchanges, typically the relay pin
     */
    public void setHost(String host)
    {
        this.host = host;
    }

    public Socket getSocket()
    {
        return socket;
    }

    /**
     * @return whether another exchange may be issued on this connection
     */
    public boolean isUsable()
    {
        if (!usable || socket.isClosed() || socket.isInputShutdown() || socket.isOutputShutdown())
            return false;
        if (TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastUsed) >= PROBE_AFTER_IDLE && isClosedByRelay())
            usable = false;
        return usable;
    }

    private boolean isClosedByRelay()
    {
        try
        {
            int timeout = socket.getSoTimeout();
            socket.setSoTimeout(1);
            try
            {
                // Nothing is expected between exchanges, so any bytes are as bad as a close.
                return fill() != 0;
            }
            catch (SocketTimeoutException x)
            {
                return false;
            }
            finally
            {
                socket.setSoTimeout(timeout);
            }
        }
        catch (IOException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Probe failed {}", this, x);
            return true;
        }
    }

    /**
     * <p>Sends the request and blocks until the whole response has been received.</p>
     *
     * @param request the exchange to send
     * @return the relay response
     * @throws IOException if the exchange fails, after which this connection is no longer usable
     */
    public ExchangeResponse exchange(ExchangeRequest request) throws IOException
    {
        if (!usable)
            throw new TunnelException("Relay connection not usable " + this);
        try
        {
            send(request);
            ExchangeResponse response = receive();
            if (LOG.isDebugEnabled())
                LOG.debug("{} -> {} on {}", request, response, this);
            return response;
        }
        catch (IOException | RuntimeException x)
        {
            usable = false;
            throw x;
        }
        finally
        {
            lastUsed = System.nanoTime();
        }
    }

    private void send(ExchangeRequest request) throws IOException
    {
        byte[] content = request.getContent();
        StringBuilder head = new StringBuilder(256);
        head.append(HttpMethod.POST.asString()).append(" / ").append(HttpVersion.HTTP_1_1.asString()).append("\r\n");
        appendField(head, HttpHeader.HOST.asString(), host);
        for (Map.Entry<TunnelHeader, String> field : request.getFields().entrySet())
        {
            appendField(head, field.getKey().asString(), field.getValue());
        }
        appendField(head, HttpHeader.CONTENT_LENGTH.asString(), String.valueOf(content.length));
        head.append("\r\n");

        output.write(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (content.length > 0)
            output.write(content);
        output.flush();
    }

    private static void appendField(StringBuilder head, String name, String value)
    {
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0)
            throw new IllegalArgumentException("Invalid value for " + name);
        head.append(name).append(": ").append(value).append("\r\n");
    }

    private ExchangeResponse receive() throws IOException
    {
        handler.reset();
        while (!handler.complete)
        {
            if (BufferUtil.isEmpty(buffer) && fill() < 0)
            {
                parser.atEOF();
                parser.parseNext(buffer);
                if (!handler.complete)
                    throw new EofException("Relay closed the connection before completing the response");
                break;
            }
            parser.parseNext(buffer);
            if (handler.failure != null)
                throw new TunnelException("Bad response from relay", handler.failure);
            if (handler.earlyEOF)
                throw new EofException("Early EOF from relay");
        }

        if (handler.version != HttpVersion.HTTP_1_1 ||
            HttpHeaderValue.CLOSE.is(handler.headers.get(HttpHeader.CONNECTION.asString())))
            usable = false;
        else
            parser.reset();
        return new ExchangeResponse(handler.status, handler.reason, handler.headers, handler.content.toByteArray());
    }

    private int fill() throws IOException
    {
        BufferUtil.clear(buffer);
        int pos = BufferUtil.flipToFill(buffer);
        try
        {
            int read = input.read(buffer.array(), buffer.arrayOffset() + buffer.position(), buffer.remaining());
            if (read > 0)
                buffer.position(buffer.position() + read);
            return read;
        }
        finally
        {
            BufferUtil.flipToFlush(buffer, pos);
        }
    }

    @Override
    public void close()
    {
        usable = false;
        IO.close(socket);
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[%s,usable=%b]", getClass().getSimpleName(), hashCode(), host, usable);
    }

    private static class ResponseHandler implements HttpParser.ResponseHandler
    {
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final ByteArrayOutputStream content = new ByteArrayOutputStream();
        private HttpVersion version;
        private int status;
        private String reason;
        private boolean complete;
        private boolean earlyEOF;
        private BadMessageException failure;

        private void reset()
        {
            headers.clear();
            content.reset();
            version = null;
            status = 0;
            reason = null;
            complete = false;
            earlyEOF = false;
            failure = null;
        }

        @Override
        public void startResponse(HttpVersion version, int status, String reason)
        {
            this.version = version;
            this.status = status;
            this.reason = reason;
        }

        @Override
        public void parsedHeader(HttpField field)
        {
            headers.put(field.getName(), field.getValue());
        }

        @Override
        public boolean headerComplete()
        {
            return false;
        }

        @Override
        public boolean content(ByteBuffer item)
        {
            byte[] bytes = BufferUtil.toArray(item);
            content.write(bytes, 0, bytes.length);
            return false;
        }

        @Override
        public boolean contentComplete()
        {
            return false;
        }

        @Override
        public boolean messageComplete()
        {
            complete = true;
            return true;
        }

        @Override
        public void earlyEOF()
        {
            earlyEOF = true;
        }

        @Override
        public void badMessage(BadMessageException failure)
        {
            this.failure = failure;
        }
    }
}
