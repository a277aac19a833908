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
 * <p>The operation requested by an exchange.</p>
 */
public enum TunnelOp
{
    /**
     * The request body is copied to the destination connection.
     */
    WRITE("write"),

    /**
     * The response body carries whatever the destination sent, possibly nothing.
     */
    READ("read");

    private final String _string;

    TunnelOp(String s)
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

    /**
     * @param value the value of the {@link TunnelHeader#OP} header, may be null
     * @return the matching operation, or null if the value names no operation
     */
    public static TunnelOp fromString(String value)
    {
        if (value == null)
            return null;
        for (TunnelOp op : values())
        {
            if (op.is(value.trim()))
                return op;
        }
        return null;
    }

    @Override
    public String toString()
    {
        return _string;
    }
}
