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

import java.io.IOException;
import java.net.Socket;

/**
 * <p>Opens a connection to the relay.</p>
 * <p>The tunnel never cares how the connection is established: it may be a plain
 * TCP socket or a TLS socket layered by the caller.</p>
 */
@FunctionalInterface
public interface Dialer
{
    /**
     * @param address the {@code host:port} of the final destination, for dialers that pick a relay per destination
     * @return a connected socket to the relay
     * @throws IOException if the relay cannot be reached
     */
    Socket dial(String address) throws IOException;
}
