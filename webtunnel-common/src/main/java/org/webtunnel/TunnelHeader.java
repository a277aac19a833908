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

package org.webtunnel;

/**
 * <p>The HTTP header fields that carry the tunnel protocol on each exchange.</p>
 */
public enum TunnelHeader
{
    /**
     * Request: which operation the exchange performs, see {@link TunnelOp}.
     */
    OP("X-Tunnel-Op"),

    /**
     * Request: the {@code host:port} of the destination, only on the first exchange of a session.
     */
    DEST_ADDR("X-Tunnel-Dest-Addr"),

    /**
     * Request and response: the session token minted by the relay.
     */
    ID("X-Tunnel-Id"),

    /**
     * Request and response: the relay instance holding the destination connection.
     */
    PIN("X-Tunnel-Pin"),

    /**
     * Request and response: per-direction exchange sequence number.
     */
    SEQ("X-Tunnel-Seq"),

    /**
     * Response: the destination reported end-of-stream.
     */
    EOF("X-Tunnel-EOF");

    private final String _string;

    TunnelHeader(String s)
    {
        _string = s;
    }

    public boolean is(String s)
    {
        return _string.equalsIgnoreCase(s);
    }

    public String asString()
    {
        return _string;
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
