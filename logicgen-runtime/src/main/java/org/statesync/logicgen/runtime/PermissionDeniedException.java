/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.statesync.logicgen.runtime;

import org.statesync.logicgen.annotation.PublicEvolving;

/**
 * Thrown by a generated handler before any node runs when the sender fails the handler's
 * permission checks.
 */
@PublicEvolving
public class PermissionDeniedException extends HandlerException {

    private static final long serialVersionUID = 1L;

    public static final String NOT_HOST_MESSAGE = "only host can perform this action";
    public static final String NOT_ALLOWED_MESSAGE = "player not allowed to perform this action";

    public PermissionDeniedException(String message) {
        super(message);
    }

    /** The sender is not the host of a host-only handler. */
    public static PermissionDeniedException notHost() {
        return new PermissionDeniedException(NOT_HOST_MESSAGE);
    }

    /** The sender does not match the player parameter or is missing from the allow-list. */
    public static PermissionDeniedException notAllowed() {
        return new PermissionDeniedException(NOT_ALLOWED_MESSAGE);
    }
}
