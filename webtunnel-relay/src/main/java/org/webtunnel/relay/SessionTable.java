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
import java.net.Socket;
import java.util.ArrayList;
import java.util.Collection;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import org.eclipse.jetty.util.component.ContainerLifeCycle;
import org.eclipse.jetty.util.thread.ScheduledExecutorScheduler;
import org.eclipse.jetty.util.thread.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Maps session ids to the {@link RelaySession}s holding their destination connections.</p>
 * <p>While started, sessions idle for longer than the {@link #getIdleTimeout() idle timeout}
 * are periodically evicted and their destination connections closed.</p>
 */
public class SessionTable extends ContainerLifeCycle
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionTable.class);

    private final ConcurrentMap<String, RelaySession> sessions = new ConcurrentHashMap<>();
    private Scheduler scheduler;
    private long idleTimeout = 70000;
    private Scheduler.Task sweeper;

    public Scheduler getScheduler()
    {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler)
    {
        updateBean(this.scheduler, scheduler);
        this.scheduler = scheduler;
    }

    /**
     * @return the time, in milliseconds, after which a session with no exchanges is evicted
     */
    public long getIdleTimeout()
    {
        return idleTimeout;
    }

    /**
     * @param idleTimeout the time, in milliseconds, after which a session with no exchanges is evicted
     */
    public void setIdleTimeout(long idleTimeout)
    {
        this.idleTimeout = idleTimeout;
    }

    @Override
    protected void doStart() throws Exception
    {
        if (scheduler == null)
            setScheduler(new ScheduledExecutorScheduler("relay-sessions", true));
        super.doStart();
        scheduleSweep();
    }

    @Override
    protected void doStop() throws Exception
    {
        Scheduler.Task task = sweeper;
        if (task != null)
            task.cancel();
        for (RelaySession session : sessions.values())
        {
            session.close();
        }
        sessions.clear();
        super.doStop();
    }

    /**
     * <p>Registers a new session for an already connected destination.</p>
     *
     * @param destination the {@code host:port} of the destination
     * @param socket the connection to the destination, owned by the session from now on
     * @return the new session, with a freshly minted id
     * @throws IOException if the destination connection is unusable
     */
    public RelaySession create(String destination, Socket socket) throws IOException
    {
        RelaySession session = new RelaySession(UUID.randomUUID().toString(), destination, socket);
        sessions.put(session.getId(), session);
        if (LOG.isDebugEnabled())
            LOG.debug("Created {}", session);
        return session;
    }

    public RelaySession get(String id)
    {
        return sessions.get(id);
    }

    /**
     * <p>Removes the session and closes its destination connection.</p>
     */
    public void remove(RelaySession session)
    {
        if (sessions.remove(session.getId(), session) && LOG.isDebugEnabled())
            LOG.debug("Removed {}", session);
        session.close();
    }

    public Collection<RelaySession> getSessions()
    {
        return new ArrayList<>(sessions.values());
    }

    public int size()
    {
        return sessions.size();
    }

    private void scheduleSweep()
    {
        if (isRunning() || isStarting())
        {
            long period = Math.max(100, idleTimeout / 2);
            sweeper = scheduler.schedule(this::sweep, period, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * <p>Evicts the idle sessions, skipping those with an exchange in flight.</p>
     */
    void sweep()
    {
        try
        {
            for (RelaySession session : sessions.values())
            {
                if (session.isClosed() || session.evictIfIdle(idleTimeout))
                    sessions.remove(session.getId(), session);
            }
        }
        catch (Throwable x)
        {
            LOG.warn("Failed to evict idle sessions", x);
        }
        finally
        {
            scheduleSweep();
        }
    }

    @Override
    public String toString()
    {
        return String.format("%s@%x[sessions=%d,idleTimeout=%d]", getClass().getSimpleName(), hashCode(), sessions.size(), idleTimeout);
    }
}
