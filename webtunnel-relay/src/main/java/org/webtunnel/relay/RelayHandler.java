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

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpHeaderValue;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.HandlerWrapper;
import org.eclipse.jetty.util.HostPort;
import org.eclipse.jetty.util.IO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;

/**
 * <p>Relays tunnel exchanges to the destination connections pinned to their sessions.</p>
 * <p>An exchange without a session id opens a new session: the destination named by
 * {@link TunnelHeader#DEST_ADDR} is dialed and the response carries the minted session id
 * and this relay's pin. Further exchanges either write their payload to the destination,
 * or long-poll it for at most the {@link #getPollTimeout() poll timeout}.</p>
 * <p>Requests that are not tunnel exchanges are passed on to the wrapped handler, if any.</p>
 */
public class RelayHandler extends HandlerWrapper
{
    private static final Logger LOG = LoggerFactory.getLogger(RelayHandler.class);

    private final Set<String> whiteList = new HashSet<>();
    private final Set<String> blackList = new HashSet<>();
    private final List<TrafficListener> listeners = new CopyOnWriteArrayList<>();
    private final SessionTable sessions;
    private String pin;
    private long connectTimeout = 15000;
    private long pollTimeout = 1000;
    private int bufferSize = 8192;

    public RelayHandler()
    {
        this(null);
    }

    public RelayHandler(Handler handler)
    {
        this(handler, new SessionTable());
    }

    public RelayHandler(Handler handler, SessionTable sessions)
    {
        setHandler(handler);
        this.sessions = sessions;
        addBean(sessions);
    }

    public SessionTable getSessionTable()
    {
        return sessions;
    }

    /**
     * @return the identity of this relay instance, returned to clients so that a load balancer
     * can route all the exchanges of a session to the same instance
     */
    public String getPin()
    {
        return pin;
    }

    public void setPin(String pin)
    {
        this.pin = pin;
    }

    /**
     * @return the timeout, in milliseconds, to connect to the destination
     */
    public long getConnectTimeout()
    {
        return connectTimeout;
    }

    /**
     * @param connectTimeout the timeout, in milliseconds, to connect to the destination
     */
    public void setConnectTimeout(long connectTimeout)
    {
        this.connectTimeout = connectTimeout;
    }

    /**
     * @return how long, in milliseconds, a read exchange waits for the destination to send data
     */
    public long getPollTimeout()
    {
        return pollTimeout;
    }

    public void setPollTimeout(long pollTimeout)
    {
        this.pollTimeout = pollTimeout;
    }

    /**
     * @return the idle timeout, in milliseconds, of sessions
     */
    public long getIdleTimeout()
    {
        return sessions.getIdleTimeout();
    }

    public void setIdleTimeout(long idleTimeout)
    {
        sessions.setIdleTimeout(idleTimeout);
    }

    /**
     * @return the maximum payload, in bytes, of a read exchange
     */
    public int getBufferSize()
    {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize)
    {
        this.bufferSize = bufferSize;
    }

    public void addTrafficListener(TrafficListener listener)
    {
        listeners.add(listener);
    }

    public void removeTrafficListener(TrafficListener listener)
    {
        listeners.remove(listener);
    }

    public List<TrafficListener> getTrafficListeners()
    {
        return listeners;
    }

    public Set<String> getWhiteListHosts()
    {
        return whiteList;
    }

    public void setWhiteListHosts(Set<String> whiteList)
    {
        this.whiteList.clear();
        this.whiteList.addAll(whiteList);
    }

    public Set<String> getBlackListHosts()
    {
        return blackList;
    }

    public void setBlackListHosts(Set<String> blackList)
    {
        this.blackList.clear();
        this.blackList.addAll(blackList);
    }

    @Override
    protected void doStart() throws Exception
    {
        if (pin == null)
            pin = defaultPin();
        super.doStart();
    }

    private static String defaultPin()
    {
        try
        {
            return InetAddress.getLocalHost().getHostName();
        }
        catch (UnknownHostException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Unknown local host name, using a random pin", x);
            return UUID.randomUUID().toString();
        }
    }

    @Override
    public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException
    {
        String opValue = request.getHeader(TunnelHeader.OP.asString());
        if (opValue == null)
        {
            super.handle(target, baseRequest, request, response);
            return;
        }

        baseRequest.setHandled(true);
        TunnelOp op = TunnelOp.fromString(opValue);
        if (op == null)
        {
            sendError(request, response, HttpStatus.BAD_REQUEST_400, "Unknown operation " + opValue);
            return;
        }

        long sequence;
        try
        {
            String seq = request.getHeader(TunnelHeader.SEQ.asString());
            sequence = seq == null ? -1 : Long.parseLong(seq);
        }
        catch (NumberFormatException x)
        {
            sendError(request, response, HttpStatus.BAD_REQUEST_400, "Bad sequence number");
            return;
        }

        String id = request.getHeader(TunnelHeader.ID.asString());
        RelaySession session;
        if (id == null)
        {
            session = open(request, response);
            if (session == null)
                return;
        }
        else
        {
            session = sessions.get(id);
            if (session == null)
            {
                sendError(request, response, HttpStatus.GONE_410, "Unknown session " + id);
                return;
            }
        }

        if (!session.acquire())
        {
            sendError(request, response, HttpStatus.GONE_410, "Closed session " + id);
            return;
        }
        try
        {
            if (sequence >= 0 && !(op == TunnelOp.WRITE ? session.nextWrite(sequence) : session.nextRead(sequence)))
            {
                sendError(request, response, HttpStatus.CONFLICT_409, "Out of order " + op + " " + sequence);
                return;
            }

            response.setHeader(TunnelHeader.ID.asString(), session.getId());
            response.setHeader(TunnelHeader.PIN.asString(), pin);
            if (sequence >= 0)
                response.setHeader(TunnelHeader.SEQ.asString(), String.valueOf(sequence));

            if (op == TunnelOp.WRITE)
                handleWrite(request, response, session);
            else
                handleRead(request, response, session);
        }
        finally
        {
            session.release();
        }
    }

    /**
     * <p>Dials the destination of a new session.</p>
     *
     * @return the new session, or null if the exchange has been answered with an error
     */
    protected RelaySession open(HttpServletRequest request, HttpServletResponse response) throws IOException
    {
        String address = request.getHeader(TunnelHeader.DEST_ADDR.asString());
        if (address == null)
        {
            sendError(request, response, HttpStatus.BAD_REQUEST_400, "Missing " + TunnelHeader.DEST_ADDR);
            return null;
        }

        HostPort hostPort;
        try
        {
            hostPort = new HostPort(address);
        }
        catch (IllegalArgumentException x)
        {
            sendError(request, response, HttpStatus.BAD_REQUEST_400, "Bad destination " + address);
            return null;
        }
        String host = hostPort.getHost();
        int port = hostPort.getPort();
        if (port <= 0)
        {
            sendError(request, response, HttpStatus.BAD_REQUEST_400, "Missing port in destination " + address);
            return null;
        }

        if (!validateDestination(host, port))
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Destination {}:{} forbidden", host, port);
            sendError(request, response, HttpStatus.FORBIDDEN_403, "Forbidden destination " + address);
            return null;
        }

        Socket socket = new Socket();
        try
        {
            socket.setTcpNoDelay(true);
            if (LOG.isDebugEnabled())
                LOG.debug("Connecting to {} for {}", address, request.getRemoteAddr());
            socket.connect(new InetSocketAddress(host, port), (int)getConnectTimeout());
            return sessions.create(address, socket);
        }
        catch (IOException x)
        {
            IO.close(socket);
            if (LOG.isDebugEnabled())
                LOG.debug("Unable to connect to {}", address, x);
            sendError(request, response, HttpStatus.BAD_GATEWAY_502, "Unable to connect to " + address);
            return null;
        }
    }

    private void handleWrite(HttpServletRequest request, HttpServletResponse response, RelaySession session) throws IOException
    {
        InputStream content = request.getInputStream();
        byte[] buffer = new byte[getBufferSize()];
        long written = 0;
        try
        {
            while (true)
            {
                int read = content.read(buffer);
                if (read < 0)
                    break;
                try
                {
                    session.write(buffer, 0, read);
                }
                catch (IOException x)
                {
                    onDestinationFailure(request, response, session, x);
                    return;
                }
                written += read;
            }
            try
            {
                session.flush();
            }
            catch (IOException x)
            {
                onDestinationFailure(request, response, session, x);
                return;
            }
        }
        finally
        {
            if (written > 0)
                notifyBytesSent(request, session, written);
        }

        response.setStatus(HttpStatus.OK_200);
        response.setContentLength(0);
    }

    private void handleRead(HttpServletRequest request, HttpServletResponse response, RelaySession session) throws IOException
    {
        byte[] buffer = new byte[getBufferSize()];
        int read;
        try
        {
            read = session.read(buffer, getPollTimeout());
        }
        catch (IOException x)
        {
            onDestinationFailure(request, response, session, x);
            return;
        }

        response.setStatus(HttpStatus.OK_200);
        if (read < 0)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Destination closed {}", session);
            sessions.remove(session);
            response.setHeader(TunnelHeader.EOF.asString(), Boolean.TRUE.toString());
            response.setContentLength(0);
            return;
        }

        if (read > 0)
            notifyBytesReceived(request, session, read);
        response.setContentLength(read);
        if (read > 0)
            response.getOutputStream().write(buffer, 0, read);
    }

    private void onDestinationFailure(HttpServletRequest request, HttpServletResponse response, RelaySession session, IOException failure)
    {
        boolean lost = session.isClosed();
        sessions.remove(session);
        if (lost)
        {
            sendError(request, response, HttpStatus.GONE_410, "Closed session " + session.getId());
        }
        else
        {
            LOG.warn("Destination {} of session {} failed", session.getDestination(), session.getId(), failure);
            sendError(request, response, HttpStatus.BAD_GATEWAY_502, "Destination failed");
        }
    }

    /**
     * <p>Checks the given destination against the white and black lists.</p>
     *
     * @param host the host of the destination
     * @param port the port of the destination
     * @return true if the destination is allowed, false otherwise
     */
    public boolean validateDestination(String host, int port)
    {
        String hostPort = host + ":" + port;
        if (!whiteList.isEmpty() && !whiteList.contains(host) && !whiteList.contains(hostPort))
            return false;
        return !blackList.contains(host) && !blackList.contains(hostPort);
    }

    private void notifyBytesSent(HttpServletRequest request, RelaySession session, long bytes)
    {
        for (TrafficListener listener : listeners)
        {
            try
            {
                listener.onBytesSent(request.getRemoteAddr(), session.getDestination(), request, bytes);
            }
            catch (Throwable x)
            {
                LOG.info("Failure while notifying listener {}", listener, x);
            }
        }
    }

    private void notifyBytesReceived(HttpServletRequest request, RelaySession session, long bytes)
    {
        for (TrafficListener listener : listeners)
        {
            try
            {
                listener.onBytesReceived(request.getRemoteAddr(), session.getDestination(), request, bytes);
            }
            catch (Throwable x)
            {
                LOG.info("Failure while notifying listener {}", listener, x);
            }
        }
    }

    private void sendError(HttpServletRequest request, HttpServletResponse response, int status, String reason)
    {
        if (LOG.isDebugEnabled())
            LOG.debug("Answering {} {}: {}", request.getRemoteAddr(), status, reason);
        try
        {
            response.setStatus(status);
            response.setHeader(HttpHeader.CONNECTION.asString(), HttpHeaderValue.CLOSE.asString());
            response.setContentLength(0);
            response.getOutputStream().close();
        }
        catch (IOException x)
        {
            if (LOG.isDebugEnabled())
                LOG.debug("Unable to answer {}", request.getRemoteAddr(), x);
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[pin=%s,%s]", getClass().getSimpleName(), hashCode(), pin, sessions);
    }
}
