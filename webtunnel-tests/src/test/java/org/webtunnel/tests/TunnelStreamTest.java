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

package org.webtunnel.tests;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.handler.HandlerWrapper;
import org.eclipse.jetty.util.IO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;
import org.webtunnel.client.TunnelConfig;
import org.webtunnel.client.TunnelConnection;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TunnelStreamTest extends AbstractTunnelTest
{
    private ServerSocket destination;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    public void disposeDestination()
    {
        IO.close(destination);
        executor.shutdownNow();
    }

    private String startDestination(DestinationBehavior behavior) throws IOException
    {
        destination = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        executor.execute(() ->
        {
            while (!destination.isClosed())
            {
                try
                {
                    Socket socket = destination.accept();
                    executor.execute(() ->
                    {
                        try (Socket s = socket)
                        {
                            behavior.serve(s);
                        }
                        catch (IOException x)
                        {
                            // The relay went away.
                        }
                    });
                }
                catch (IOException x)
                {
                    return;
                }
            }
        });
        return "localhost:" + destination.getLocalPort();
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    public void testEcho(boolean buffered) throws Exception
    {
        String address = startDestination(socket -> IO.copy(socket.getInputStream(), socket.getOutputStream()));
        prepareRelay();

        Random random = new Random(1234);
        ByteArrayOutputStream expected = new ByteArrayOutputStream();
        try (TunnelConnection tunnel = TunnelConnection.dial(address, newConfig(buffered)))
        {
            byte[][] chunks = new byte[50][];
            for (int i = 0; i < chunks.length; ++i)
            {
                chunks[i] = new byte[1 + random.nextInt(20000)];
                random.nextBytes(chunks[i]);
                expected.write(chunks[i], 0, chunks[i].length);
            }
            int total = expected.size();

            InputStream input = tunnel.getInputStream();
            Future<byte[]> echoed = executor.submit(() -> input.readNBytes(total));

            OutputStream output = tunnel.getOutputStream();
            for (byte[] chunk : chunks)
            {
                output.write(chunk);
            }
            output.flush();

            assertArrayEquals(expected.toByteArray(), echoed.get(30, TimeUnit.SECONDS));
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    public void testOrderingWithAlternatingLatency(boolean buffered) throws Exception
    {
        ByteArrayOutputStream collected = new ByteArrayOutputStream();
        CountDownLatch closed = new CountDownLatch(1);
        String address = startDestination(socket ->
        {
            InputStream input = socket.getInputStream();
            byte[] buffer = new byte[1024];
            int read;
            while ((read = input.read(buffer)) >= 0)
            {
                synchronized (collected)
                {
                    collected.write(buffer, 0, read);
                }
            }
            closed.countDown();
        });
        prepareRelay(new DelayingHandler(sequence -> sequence % 2 == 1 ? 50 : 0));

        StringBuilder expected = new StringBuilder();
        TunnelConfig config = newConfig(buffered);
        config.setFlushTimeout(5);
        try (TunnelConnection tunnel = TunnelConnection.dial(address, config))
        {
            OutputStream output = tunnel.getOutputStream();
            for (int i = 0; i < 40; ++i)
            {
                String chunk = String.format("chunk-%02d;", i);
                expected.append(chunk);
                output.write(chunk.getBytes(StandardCharsets.UTF_8));
                if (i % 3 == 0)
                    Thread.sleep(10);
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline)
        {
            synchronized (collected)
            {
                if (collected.size() >= expected.length())
                    break;
            }
            Thread.sleep(20);
        }
        synchronized (collected)
        {
            assertThat(collected.toString(StandardCharsets.UTF_8), is(expected.toString()));
        }
    }

    @Test
    public void testCloseWithWriteInFlight() throws Exception
    {
        String address = startDestination(socket ->
        {
            InputStream input = socket.getInputStream();
            while (input.read() >= 0)
            {
                // Discard.
            }
        });
        prepareRelay(new DelayingHandler(sequence -> sequence > 0 ? 1000 : 0));

        TunnelConnection tunnel = TunnelConnection.dial(address, newConfig(false));
        CountDownLatch writeStarted = new CountDownLatch(1);
        CountDownLatch writeCompleted = new CountDownLatch(1);
        AtomicReference<Throwable> writeResult = new AtomicReference<>();
        executor.execute(() ->
        {
            try
            {
                writeStarted.countDown();
                tunnel.getOutputStream().write(newRequest("/slow"));
            }
            catch (Throwable x)
            {
                writeResult.set(x);
            }
            finally
            {
                writeCompleted.countDown();
            }
        });
        assertTrue(writeStarted.await(5, TimeUnit.SECONDS));
        Thread.sleep(200);

        long start = System.nanoTime();
        tunnel.close();
        long elapsed = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start);

        assertTrue(elapsed < 10);
        assertTrue(writeCompleted.await(5, TimeUnit.SECONDS));
        Throwable failure = writeResult.get();
        assertTrue(failure == null || failure instanceof IOException, String.valueOf(failure));
    }

    @FunctionalInterface
    private interface DestinationBehavior
    {
        void serve(Socket socket) throws IOException;
    }

    @FunctionalInterface
    private interface Latency
    {
        long delayFor(long sequence);
    }

    /**
     * Delays write exchanges before the relay handles them.
     */
    private static class DelayingHandler extends HandlerWrapper
    {
        private final Latency latency;

        private DelayingHandler(Latency latency)
        {
            this.latency = latency;
        }

        @Override
        public void handle(String target, Request baseRequest, HttpServletRequest request, HttpServletResponse response) throws IOException, ServletException
        {
            String seq = request.getHeader(TunnelHeader.SEQ.asString());
            if (TunnelOp.WRITE.is(request.getHeader(TunnelHeader.OP.asString())) && seq != null)
            {
                long delay = latency.delayFor(Long.parseLong(seq));
                if (delay > 0)
                {
                    try
                    {
                        Thread.sleep(delay);
                    }
                    catch (InterruptedException x)
                    {
                        throw new ServletException(x);
                    }
                }
            }
            super.handle(target, baseRequest, request, response);
        }
    }
}
