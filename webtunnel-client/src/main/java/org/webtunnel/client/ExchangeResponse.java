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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.eclipse.jetty.http.HttpStatus;
import org.webtunnel.RelayStatusException;
import org.webtunnel.SessionLostException;
import org.webtunnel.TunnelException;
import org.webtunnel.TunnelHeader;

/**
 * <p>The relay response to one {@link ExchangeRequest}.</p>
 */
public class ExchangeResponse
{
    private final int status;
    private final String reason;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final byte[] content;

    public ExchangeResponse(int status, String reason, Map<String, String> headers, byte[] content)
    {
        this.status = status;
        this.reason = reason;
        this.headers.putAll(headers);
        this.content = content;
    }

    public int getStatus()
    {
        return status;
    }

    public String getReason()
    {
        return reason;
    }

    public String getHeader(String name)
    {
        return headers.get(name);
    }

    public String getHeader(TunnelHeader header)
    {
        return headers.get(header.asString());
    }

    public Map<String, String> getHeaders()
    {
        return Collections.unmodifiableMap(headers);
    }

    public byte[] getContent()
    {
        return content;
    }

    /**
     * @return whether the relay reported end-of-stream from the destination
     */
    public boolean isEOF()
    {
        return Boolean.parseBoolean(getHeader(TunnelHeader.EOF));
    }

    /**
     * <p>Verifies that the relay accepted the exchange and answered the expected sequence number.</p>
     *
     * @param sequence the sequence number the request was sent with
     * @throws TunnelException if the exchange failed
     */
    public void verify(long sequence) throws TunnelException
    {
        if (status == HttpStatus.GONE_410)
            throw new SessionLostException(String.format("Session lost: %d %s", status, reason));
        if (status != HttpStatus.OK_200)
            throw new RelayStatusException(status, String.format("Unexpected relay response: %d %s", status, reason));
        String echo = getHeader(TunnelHeader.SEQ);
        if (echo != null && !echo.equals(String.valueOf(sequence)))
            throw new TunnelException(String.format("Out of order relay response: expected %d, got %s", sequence, echo));
    }

    @Override
    public String toString()
    {
        return String.format("%s[%d %s,%s,%d bytes]", getClass().getSimpleName(), status, reason, headers, content.length);
    }
}
