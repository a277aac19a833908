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

import java.io.IOException;

/**
 * <p>A failure of a tunnel session.</p>
 * <p>Thrown to application code when the session terminated abnormally; a clean
 * termination (close or idle timeout) is reported as end-of-stream instead.</p>
 */
public class TunnelException extends IOException
{
    public TunnelException(String message)
    {
        super(message);
    }

    public TunnelException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
