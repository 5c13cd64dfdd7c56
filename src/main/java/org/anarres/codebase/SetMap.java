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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;

/**
 * Counts lines by the exact set of platforms that compile them.
 */
public class SetMap {

    private final Map<PSet<String>, Integer> counts = new HashMap<PSet<String>, Integer>();

    /* pp */ void increment(@Nonnull PSet<String> platforms) {
        Integer count = counts.get(platforms);
        counts.put(platforms, count == null ? 1 : count + 1);
    }

    /** Returns the number of lines compiled by exactly the given platforms. */
    @Nonnegative
    public int get(@Nonnull Set<String> platforms) {
        Integer count = counts.get(HashTreePSet.from(platforms));
        return count == null ? 0 : count;
    }

    @Nonnull
    public Map<Set<String>, Integer> asMap() {
        return Collections.<Set<String>, Integer>unmodifiableMap(counts);
    }

    @Nonnegative
    public int getTotal() {
        int total = 0;
        for (Integer count : counts.values())
            total += count;
        return total;
    }

    /** Returns the number of lines the given platform compiles. */
    @Nonnegative
    public int getPlatformCount(@Nonnull String platform) {
        int total = 0;
        for (Map.Entry<PSet<String>, Integer> e : counts.entrySet())
            if (e.getKey().contains(platform))
                total += e.getValue();
        return total;
    }

    /** Returns every platform that compiles at least one line, sorted. */
    @Nonnull
    public Set<String> getPlatforms() {
        Set<String> out = new TreeSet<String>();
        for (PSet<String> platforms : counts.keySet())
            out.addAll(platforms);
        return out;
    }

    /**
     * Returns the mean Jaccard distance between the lines of each pair of
     * the given platforms.
     *
     * 0 means every platform compiles the same lines; 1 means no two
     * platforms share a line. A pair that compiles nothing has distance 0.
     */
    public double divergence(@Nonnull Collection<String> platforms) {
        List<String> list = new ArrayList<String>(new TreeSet<String>(platforms));
        if (list.size() < 2)
            return 0;
        double total = 0;
        int pairs = 0;
        for (int i = 0; i < list.size(); i++) {
            for (int j = i + 1; j < list.size(); j++) {
                total += distance(list.get(i), list.get(j));
                pairs++;
            }
        }
        return total / pairs;
    }

    private double distance(@Nonnull String p, @Nonnull String q) {
        int intersection = 0;
        int union = 0;
        for (Map.Entry<PSet<String>, Integer> e : counts.entrySet()) {
            boolean hasP = e.getKey().contains(p);
            boolean hasQ = e.getKey().contains(q);
            if (hasP && hasQ)
                intersection += e.getValue();
            if (hasP || hasQ)
                union += e.getValue();
        }
        if (union == 0)
            return 0;
        return 1.0 - (double) intersection / union;
    }

    /** Returns each platform set with a count, sorted by size and then by name. */
    @Nonnull
    public List<List<String>> getPlatformSets() {
        List<List<String>> keys = new ArrayList<List<String>>();
        for (PSet<String> platforms : counts.keySet())
            keys.add(new ArrayList<String>(new TreeSet<String>(platforms)));
        Collections.sort(keys, new Comparator<List<String>>() {
            @Override
            public int compare(List<String> a, List<String> b) {
                if (a.size() != b.size())
                    return Integer.compare(a.size(), b.size());
                return a.toString().compareTo(b.toString());
            }
        });
        return keys;
    }

    @Nonnull
    public JsonArray toJson() {
        JsonArray out = new JsonArray();
        for (List<String> key : getPlatformSets()) {
            JsonObject entry = new JsonObject();
            JsonArray platforms = new JsonArray();
            for (String platform : key)
                platforms.add(new JsonPrimitive(platform));
            entry.add("platforms", platforms);
            entry.addProperty("lines", get(new TreeSet<String>(key)));
            out.add(entry);
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (List<String> key : getPlatformSets()) {
            if (buf.length() > 0)
                buf.append(", ");
            buf.append(key).append('=').append(get(new TreeSet<String>(key)));
        }
        return "SetMap(" + buf + ")";
    }
}
