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

import org.eclipse.jetty.http.HttpStatus;

/**
 * <p>The relay no longer knows the session token, or its destination connection is gone.</p>
 * <p>Fatal for the session: the destination is never silently redialed.</p>
 */
public class SessionLostException extends RelayStatusException
{
    public SessionLostException(String message)
    {
        super(HttpStatus.GONE_410, message);
    }
}
