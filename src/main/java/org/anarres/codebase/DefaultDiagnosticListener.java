/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.codebase;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link DiagnosticListener} which logs every diagnostic and counts
 * them by kind.
 *
 * Unresolved includes are logged at debug level, since system headers are
 * rarely on a configured include path.
 */
public class DefaultDiagnosticListener implements DiagnosticListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultDiagnosticListener.class);

    private final Map<Diagnostic.Kind, AtomicInteger> counts;

    public DefaultDiagnosticListener() {
        counts = new EnumMap<Diagnostic.Kind, AtomicInteger>(Diagnostic.Kind.class);
        for (Diagnostic.Kind kind : Diagnostic.Kind.values())
            counts.put(kind, new AtomicInteger());
    }

    @Override
    public void handleDiagnostic(@Nonnull Diagnostic diagnostic) {
        counts.get(diagnostic.getKind()).incrementAndGet();
        switch (diagnostic.getKind()) {
            case UNRESOLVED_INCLUDE:
            case PARSE_WARNING:
                LOG.debug("{}", diagnostic);
                break;
            default:
                LOG.warn("{}", diagnostic);
                break;
        }
    }

    public int getCount(@Nonnull Diagnostic.Kind kind) {
        return counts.get(kind).get();
    }

    public int getTotal() {
        int total = 0;
        for (AtomicInteger count : counts.values())
            total += count.get();
        return total;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (Map.Entry<Diagnostic.Kind, AtomicInteger> e : counts.entrySet()) {
            if (e.getValue().get() == 0)
                continue;
            if (buf.length() > 0)
                buf.append(", ");
            buf.append(e.getKey().name().toLowerCase()).append('=').append(e.getValue().get());
        }
        return "Diagnostics(" + buf + ")";
    }
}
