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

/**
 * <p>The outcome of one read exchange, handed to the application reader: a non empty
 * payload, end-of-stream, or the failure that terminated the tunnel.</p>
 */
class InboundItem
{
    static final InboundItem EOF = new InboundItem(null, null);

    private final byte[] content;
    private final Throwable failure;

    private InboundItem(byte[] content, Throwable failure)
    {
        this.content = content;
        this.failure = failure;
    }

    static InboundItem of(byte[] content)
    {
        return new InboundItem(content, null);
    }

    static InboundItem failed(Throwable failure)
    {
        return new InboundItem(null, failure);
    }

    byte[] getContent()
    {
        return content;
    }

    Throwable getFailure()
    {
        return failure;
    }

    boolean isTerminal()
    {
        return content == null;
    }

    @Override
    public String toString()
    {
        if (this == EOF)
            return "EOF";
        if (failure != null)
            return String.format("%s[%s]", getClass().getSimpleName(), failure);
        return String.format("%s[%d bytes]", getClass().getSimpleName(), content.length);
    }
}
