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

package org.statesync.logicgen.codegen.validate;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.graph.FragmentKind;

import javax.annotation.Nullable;

import java.io.Serializable;
import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** One validation finding, located by fragment and node where applicable. */
@PublicEvolving
public final class ValidationIssue implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Severity severity;
    @Nullable private final FragmentKind fragmentKind;
    @Nullable private final String fragmentName;
    @Nullable private final String nodeId;
    private final String message;

    public ValidationIssue(
            Severity severity,
            @Nullable FragmentKind fragmentKind,
            @Nullable String fragmentName,
            @Nullable String nodeId,
            String message) {
        this.severity = checkNotNull(severity);
        this.fragmentKind = fragmentKind;
        this.fragmentName = fragmentName;
        this.nodeId = nodeId;
        this.message = checkNotNull(message);
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Nullable
    public FragmentKind getFragmentKind() {
        return fragmentKind;
    }

    @Nullable
    public String getFragmentName() {
        return fragmentName;
    }

    @Nullable
    public String getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValidationIssue that = (ValidationIssue) o;
        return severity == that.severity
                && fragmentKind == that.fragmentKind
                && Objects.equals(fragmentName, that.fragmentName)
                && Objects.equals(nodeId, that.nodeId)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, fragmentKind, fragmentName, nodeId, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(severity.name());
        if (fragmentKind != null) {
            sb.append(' ')
                    .append(fragmentKind.getDisplayName())
                    .append(" '")
                    .append(fragmentName)
                    .append('\'');
        }
        if (nodeId != null) {
            sb.append(fragmentKind != null ? ", " : " ")
                    .append("node '")
                    .append(nodeId)
                    .append('\'');
        }
        return sb.append(": ").append(message).toString();
    }
}
