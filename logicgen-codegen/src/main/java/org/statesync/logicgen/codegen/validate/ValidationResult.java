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
import org.statesync.logicgen.codegen.exception.GraphValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** All issues found by one run of the {@link GraphValidator}, in discovery order. */
@PublicEvolving
public final class ValidationResult {

    private final List<ValidationIssue> issues;

    public ValidationResult(List<ValidationIssue> issues) {
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public List<ValidationIssue> getErrors() {
        return filter(Severity.ERROR);
    }

    public List<ValidationIssue> getWarnings() {
        return filter(Severity.WARNING);
    }

    public boolean isValid() {
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                return false;
            }
        }
        return true;
    }

    /** @throws GraphValidationException if any issue is an error */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new GraphValidationException(issues);
        }
    }

    private List<ValidationIssue> filter(Severity severity) {
        List<ValidationIssue> filtered = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.getSeverity() == severity) {
                filtered.add(issue);
            }
        }
        return filtered;
    }
}
