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
package com.fibheap.storage;

import com.carrotsearch.hppc.DoubleArrayList;
import com.carrotsearch.hppc.IntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * A minimal in-memory directed graph with non-negative edge weights. Nodes are the ids 0 to getNodes()-1 and are
 * created implicitly when an edge references them.
 */
public class WeightedGraph {
    private final List<IntArrayList> adjNodes = new ArrayList<>();
    private final List<DoubleArrayList> weights = new ArrayList<>();
    private int edges;

    public WeightedGraph() {
    }

    public WeightedGraph(int nodes) {
        ensureNode(nodes - 1);
    }

    /**
     * Adds a directed edge from base to adj.
     */
    public WeightedGraph edge(int base, int adj, double weight) {
        if (base < 0 || adj < 0)
            throw new IllegalArgumentException("Node ids must not be negative: " + base + "->" + adj);
        if (!(weight >= 0) || Double.isInfinite(weight))
            throw new IllegalArgumentException("Edge weight must be finite and not negative but was " + weight + " for " + base + "->" + adj);

        ensureNode(Math.max(base, adj));
        adjNodes.get(base).add(adj);
        weights.get(base).add(weight);
        edges++;
        return this;
    }

    /**
     * Adds an edge in both directions.
     */
    public WeightedGraph biEdge(int node1, int node2, double weight) {
        edge(node1, node2, weight);
        return edge(node2, node1, weight);
    }

    private void ensureNode(int node) {
        while (adjNodes.size() <= node) {
            adjNodes.add(new IntArrayList(4));
            weights.add(new DoubleArrayList(4));
        }
    }

    public int getNodes() {
        return adjNodes.size();
    }

    public int getEdges() {
        return edges;
    }

    public int getDegree(int node) {
        checkNode(node);
        return adjNodes.get(node).size();
    }

    public int getAdjNode(int node, int index) {
        checkNode(node);
        return adjNodes.get(node).get(index);
    }

    public double getWeight(int node, int index) {
        checkNode(node);
        return weights.get(node).get(index);
    }

    private void checkNode(int node) {
        if (node < 0 || node >= adjNodes.size())
            throw new IllegalArgumentException("Illegal node: " + node + ", legal range: [0, " + adjNodes.size() + "[");
    }

    @Override
    public String toString() {
        return "nodes:" + getNodes() + ", edges:" + edges;
    }
}
