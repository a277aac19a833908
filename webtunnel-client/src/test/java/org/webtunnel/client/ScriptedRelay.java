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

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.jetty.util.IO;
import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;

/**
 * A relay answering each exchange with a scripted raw HTTP response.
 */
public class ScriptedRelay implements Closeable
{
    public interface Script
    {
        /**
         * @return the raw response, or null to close the connection without answering
         */
        String respond(Exchange exchange) throws Exception;
    }

    public static class Exchange
    {
        private final String requestLine;
        private final Map<String, String> headers;
        private final byte[] content;

        private Exchange(String requestLine, Map<String, String> headers, byte[] content)
        {
            this.requestLine = requestLine;
            this.headers = headers;
            this.content = content;
        }

        public String getRequestLine()
        {
            return requestLine;
        }

        public String getHeader(String name)
        {
            return headers.get(name);
        }

        public String getHeader(TunnelHeader header)
        {
            return headers.get(header.asString());
        }

        public TunnelOp getOp()
        {
            return TunnelOp.fromString(getHeader(TunnelHeader.OP));
        }

        public String getContent()
        {
            return new String(content, StandardCharsets.UTF_8);
        }
    }

    private final ServerSocket server;
    private final Script script;
    private final BlockingQueue<Exchange> exchanges = new LinkedBlockingQueue<>();
    private final List<Socket> sockets = new ArrayList<>();
    private final AtomicInteger connections = new AtomicInteger();

    public ScriptedRelay(Script script) throws IOException
    {
        this.script = script;
        this.server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(this::accept, "scripted-relay");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    public int getPort()
    {
        return server.getLocalPort();
    }

    public Dialer newDialer()
    {
        return address -> new Socket(InetAddress.getLoopbackAddress(), getPort());
    }

    public int getConnections()
    {
        return connections.get();
    }

    public Exchange nextExchange() throws InterruptedException
    {
        return exchanges.poll(5, TimeUnit.SECONDS);
    }

    /**
     * @return the exchanges received so far with the given operation
     */
    public List<Exchange> getExchanges(TunnelOp op)
    {
        List<Exchange> result = new ArrayList<>();
        for (Exchange exchange : exchanges)
        {
            if (exchange.getOp() == op)
                result.add(exchange);
        }
        return result;
    }

    private void accept()
    {
        while (!server.isClosed())
        {
            try
            {
                Socket socket = server.accept();
                connections.incrementAndGet();
                synchronized (sockets)
                {
                    sockets.add(socket);
                }
                Thread thread = new Thread(() -> serve(socket), "scripted-relay-connection");
                thread.setDaemon(true);
                thread.start();
            }
            catch (IOException x)
            {
                return;
            }
        }
    }

    private void serve(Socket socket)
    {
        try (Socket s = socket)
        {
            InputStream input = new BufferedInputStream(s.getInputStream());
            OutputStream output = s.getOutputStream();
            while (true)
            {
                String requestLine = readLine(input);
                if (requestLine == null)
                    return;
                Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                String line;
                while ((line = readLine(input)) != null && !line.isEmpty())
                {
                    int colon = line.indexOf(':');
                    headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                }
                int length = Integer.parseInt(headers.getOrDefault("Content-Length", "0"));
                byte[] content = input.readNBytes(length);
                Exchange exchange = new Exchange(requestLine, headers, content);
                exchanges.offer(exchange);

                String response = script.respond(exchange);
                if (response == null)
                    return;
                output.write(response.getBytes(StandardCharsets.UTF_8));
                output.flush();
            }
        }
        catch (Exception x)
        {
            // The client went away.
        }
    }

    private static String readLine(InputStream input) throws IOException
    {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = input.read()) >= 0)
        {
            if (b == '\n')
                return line.toString(StandardCharsets.ISO_8859_1).replace("\r", "");
            line.write(b);
        }
        return null;
    }

    public static String response(int status, String content, String... headers)
    {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        StringBuilder builder = new StringBuilder();
        builder.append("HTTP/1.1 ").append(status).append(" Scripted\r\n");
        for (int i = 0; i + 1 < headers.length; i += 2)
        {
            builder.append(headers[i]).append(": ").append(headers[i + 1]).append("\r\n");
        }
        builder.append("Content-Length: ").append(bytes.length).append("\r\n\r\n");
        builder.append(content);
        return builder.toString();
    }

    /**
     * @return a successful response for the given exchange, echoing its sequence number
     */
    public static String ok(Exchange exchange, String content, String... headers)
    {
        List<String> all = new ArrayList<>(List.of(headers));
        all.add(TunnelHeader.ID.asString());
        all.add("session-1");
        all.add(TunnelHeader.PIN.asString());
        all.add("relay-1");
        String seq = exchange.getHeader(TunnelHeader.SEQ);
        if (seq != null)
        {
            all.add(TunnelHeader.SEQ.asString());
            all.add(seq);
        }
        return response(200, content, all.toArray(new String[0]));
    }

    @Override
    public void close()
    {
        IO.close(server);
        synchronized (sockets)
        {
            for (Socket socket : sockets)
            {
                IO.close(socket);
            }
        }
    }
}
