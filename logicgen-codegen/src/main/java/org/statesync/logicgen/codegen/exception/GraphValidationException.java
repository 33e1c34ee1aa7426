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

package org.statesync.logicgen.codegen.exception;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.validate.ValidationIssue;
import org.statesync.logicgen.exception.LogicGenException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Thrown when validation finds errors. Carries every issue found, warnings included. */
@PublicEvolving
public class GraphValidationException extends LogicGenException {

    private static final long serialVersionUID = 1L;

    private final List<ValidationIssue> issues;

    public GraphValidationException(List<ValidationIssue> issues) {
        super(buildMessage(issues));
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String buildMessage(List<ValidationIssue> issues) {
        int errors = 0;
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                errors++;
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Graph validation failed with ").append(errors).append(" error(s):");
        for (ValidationIssue issue : issues) {
            sb.append("\n  ").append(issue);
        }
        return sb.toString();
    }
}
