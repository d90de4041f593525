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

/**
 * This class is used to create the shortest-path-tree from linked entities.
 * <p>
 *
 * @author Peter Karich
 */
public class SPTEntry implements Comparable<SPTEntry> {
    public final int adjNode;
    public final double weight;
    public final SPTEntry parent;
    private boolean deleted;

    public SPTEntry(int node, double weight) {
        this(node, weight, null);
    }

    public SPTEntry(int adjNode, double weight, SPTEntry parent) {
        this.adjNode = adjNode;
        this.weight = weight;
        this.parent = parent;
    }

    /**
     * Marks this entry as superseded by a cheaper one. The heap cannot remove it, so it is skipped when polled.
     */
    public void setDeleted() {
        deleted = true;
    }

    public boolean isDeleted() {
        return deleted;
    }

    public SPTEntry getParent() {
        return parent;
    }

    @Override
    public int compareTo(SPTEntry o) {
        // assumption no NaN and no -0
        return Double.compare(weight, o.weight);
    }

    @Override
    public String toString() {
        return adjNode + " weight: " + weight;
    }
}
