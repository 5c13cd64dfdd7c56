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

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import javax.annotation.Nonnull;

/**
 * Renders a {@link SetMap} as a plain-text table.
 */
public class Report {

    private Report() {
    }

    @Nonnull
    private static String describe(@Nonnull List<String> platforms) {
        StringBuilder buf = new StringBuilder("{");
        for (String platform : platforms) {
            if (buf.length() > 1)
                buf.append(", ");
            buf.append(platform);
        }
        return buf.append('}').toString();
    }

    private static double percent(int count, int total) {
        return total == 0 ? 0 : 100.0 * count / total;
    }

    /**
     * Returns the lines of code per platform set, the lines of code per
     * platform, and the divergence of the given platforms.
     */
    @Nonnull
    public static String summary(@Nonnull SetMap setmap, @Nonnull Collection<String> platforms) {
        int total = setmap.getTotal();
        StringBuilder buf = new StringBuilder();
        buf.append(String.format(Locale.ROOT, "%-40s %10s %8s%n", "Platform Set", "LOC", "% LOC"));
        for (List<String> key : setmap.getPlatformSets()) {
            int count = setmap.get(new TreeSet<String>(key));
            buf.append(String.format(Locale.ROOT, "%-40s %10d %8.2f%n", describe(key), count, percent(count, total)));
        }
        buf.append(String.format(Locale.ROOT, "%-40s %10d%n", "Total", total));
        buf.append(String.format(Locale.ROOT, "%n%-40s %10s %8s%n", "Platform", "LOC", "% LOC"));
        for (String platform : new TreeSet<String>(platforms)) {
            int count = setmap.getPlatformCount(platform);
            buf.append(String.format(Locale.ROOT, "%-40s %10d %8.2f%n", platform, count, percent(count, total)));
        }
        buf.append(String.format(Locale.ROOT, "%nDivergence: %.4f%n", setmap.divergence(platforms)));
        return buf.toString();
    }
}
