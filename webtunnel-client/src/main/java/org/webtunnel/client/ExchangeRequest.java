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
import java.util.EnumMap;
import java.util.Map;

import org.webtunnel.TunnelHeader;
import org.webtunnel.TunnelOp;

/**
 * <p>One exchange to be sent to the relay: an operation, the tunnel header fields and the payload.</p>
 */
public class ExchangeRequest
{
    private static final byte[] NO_CONTENT = new byte[0];

    private final TunnelOp op;
    private final Map<TunnelHeader, String> fields = new EnumMap<>(TunnelHeader.class);
    private byte[] content = NO_CONTENT;

    public ExchangeRequest(TunnelOp op)
    {
        this.op = op;
        fields.put(TunnelHeader.OP, op.asString());
    }

    public TunnelOp getOp()
    {
        return op;
    }

    public ExchangeRequest field(TunnelHeader header, String value)
    {
        if (value == null)
            fields.remove(header);
        else
            fields.put(header, value);
        return this;
    }

    public String getField(TunnelHeader header)
    {
        return fields.get(header);
    }

    public Map<TunnelHeader, String> getFields()
    {
        return Collections.unmodifiableMap(fields);
    }

    public ExchangeRequest content(byte[] content)
    {
        this.content = content;
        return this;
    }

    public byte[] getContent()
    {
        return content;
    }

    @Override
    public String toString()
    {
        return String.format("%s[%s,%s,%d bytes]", getClass().getSimpleName(), op, fields, content.length);
    }
}
