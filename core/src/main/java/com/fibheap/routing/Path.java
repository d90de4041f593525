/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.fibheap.routing;

import com.carrotsearch.hppc.IntArrayList;

/**
 * The result of a shortest path search: the visited node sequence from start to end and the accumulated weight.
 */
public class Path {
    private final IntArrayList nodes;
    private final double weight;
    private final boolean found;

    private Path(IntArrayList nodes, double weight, boolean found) {
        this.nodes = nodes;
        this.weight = weight;
        this.found = found;
    }

    static Path notFound() {
        return new Path(new IntArrayList(0), Double.POSITIVE_INFINITY, false);
    }

    static Path extract(SPTEntry endEntry) {
        IntArrayList reversed = new IntArrayList();
        SPTEntry entry = endEntry;
        while (entry != null) {
            reversed.add(entry.adjNode);
            entry = entry.getParent();
        }
        IntArrayList nodes = new IntArrayList(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            nodes.add(reversed.get(i));
        }
        return new Path(nodes, endEntry.weight, true);
    }

    public boolean isFound() {
        return found;
    }

    public IntArrayList getNodes() {
        return nodes;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return found ? "found: true, weight: " + weight + ", nodes: " + nodes : "found: false";
    }
}
