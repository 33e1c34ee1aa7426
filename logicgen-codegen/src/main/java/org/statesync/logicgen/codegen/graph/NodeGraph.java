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

package org.statesync.logicgen.codegen.graph;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The whole input of one compilation: event handlers, filters, functions and views, in document
 * order. Instances are immutable.
 */
@PublicEvolving
public final class NodeGraph {

    private final String version;
    private final String packageName;
    private final List<EventHandler> handlers;
    private final List<FilterDefinition> filters;
    private final List<FunctionDefinition> functions;
    private final List<ViewDefinition> views;

    public NodeGraph(
            String version,
            String packageName,
            List<EventHandler> handlers,
            List<FilterDefinition> filters,
            List<FunctionDefinition> functions,
            List<ViewDefinition> views) {
        this.version = version;
        this.packageName = packageName;
        this.handlers = Collections.unmodifiableList(new ArrayList<>(handlers));
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
        this.views = Collections.unmodifiableList(new ArrayList<>(views));
    }

    public String getVersion() {
        return version;
    }

    public String getPackageName() {
        return packageName;
    }

    public List<EventHandler> getHandlers() {
        return handlers;
    }

    public List<FilterDefinition> getFilters() {
        return filters;
    }

    public List<FunctionDefinition> getFunctions() {
        return functions;
    }

    public List<ViewDefinition> getViews() {
        return views;
    }

    /** Handlers, then filters, then functions. */
    public List<GraphFragment> getFragments() {
        List<GraphFragment> fragments =
                new ArrayList<>(handlers.size() + filters.size() + functions.size());
        fragments.addAll(handlers);
        fragments.addAll(filters);
        fragments.addAll(functions);
        return fragments;
    }

    @Nullable
    public FunctionDefinition findFunction(String name) {
        for (FunctionDefinition function : functions) {
            if (function.getName().equals(name)) {
                return function;
            }
        }
        return null;
    }

    @Nullable
    public FilterDefinition findFilter(String name) {
        for (FilterDefinition filter : filters) {
            if (filter.getName().equals(name)) {
                return filter;
            }
        }
        return null;
    }

    @Nullable
    public ViewDefinition findView(String name) {
        for (ViewDefinition view : views) {
            if (view.getName().equals(name)) {
                return view;
            }
        }
        return null;
    }
}
