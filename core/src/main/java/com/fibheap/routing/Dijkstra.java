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

import com.carrotsearch.hppc.IntObjectHashMap;
import com.carrotsearch.hppc.IntObjectMap;
import com.carrotsearch.hppc.cursors.IntObjectCursor;
import com.fibheap.coll.FibonacciHeap;
import com.fibheap.storage.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Implements a single source shortest path algorithm
 * http://en.wikipedia.org/wiki/Dijkstra's_algorithm
 * <p>
 * The {@link FibonacciHeap} has no decrease-key, so when a cheaper way to a node is found the old entry is only marked
 * as deleted and a new one is pushed. Deleted entries are skipped when they are polled.
 */
public class Dijkstra {
    private static final Logger logger = LoggerFactory.getLogger(Dijkstra.class);
    private final WeightedGraph graph;
    private final FibonacciHeap<SPTEntry> fromHeap = new FibonacciHeap<>();
    private final IntObjectMap<SPTEntry> fromMap;
    private SPTEntry currEntry;
    private int visitedNodes;
    private int to = -1;
    private boolean alreadyRun;

    public Dijkstra(WeightedGraph graph) {
        this.graph = graph;
        int size = Math.min(Math.max(200, graph.getNodes() / 10), 2000);
        fromMap = new IntObjectHashMap<>(size);
    }

    /**
     * Calculates the best path between the specified nodes.
     *
     * @return the path, use {@link Path#isFound()} to check whether the end node was reachable
     */
    public Path calcPath(int from, int to) {
        checkNode(to);
        this.to = to;
        run(from);
        if (currEntry == null || currEntry.isDeleted() || !finished())
            return Path.notFound();
        return Path.extract(currEntry);
    }

    /**
     * Calculates the weights of the shortest paths from the specified node to all other nodes.
     *
     * @return the weight per node id, Double.POSITIVE_INFINITY for nodes that cannot be reached
     */
    public double[] calcWeights(int from) {
        run(from);
        double[] result = new double[graph.getNodes()];
        Arrays.fill(result, Double.POSITIVE_INFINITY);
        for (IntObjectCursor<SPTEntry> cursor : fromMap) {
            result[cursor.key] = cursor.value.weight;
        }
        return result;
    }

    private void run(int from) {
        checkNode(from);
        if (alreadyRun)
            throw new IllegalStateException("Create a new instance per call");
        alreadyRun = true;

        SPTEntry startEntry = new SPTEntry(from, 0);
        fromMap.put(from, startEntry);
        fromHeap.push(startEntry);
        runAlgo();
        logger.debug("visited nodes: {}, remaining heap {}", visitedNodes, fromHeap);
    }

    private void runAlgo() {
        while (!fromHeap.isEmpty()) {
            currEntry = fromHeap.pop();
            if (currEntry.isDeleted())
                continue;
            visitedNodes++;
            if (finished())
                break;

            int currNode = currEntry.adjNode;
            int degree = graph.getDegree(currNode);
            for (int i = 0; i < degree; i++) {
                int adjNode = graph.getAdjNode(currNode, i);
                double tmpWeight = graph.getWeight(currNode, i) + currEntry.weight;
                SPTEntry nEntry = fromMap.get(adjNode);
                if (nEntry == null) {
                    nEntry = new SPTEntry(adjNode, tmpWeight, currEntry);
                    fromMap.put(adjNode, nEntry);
                    fromHeap.push(nEntry);
                } else if (nEntry.weight > tmpWeight) {
                    nEntry.setDeleted();
                    nEntry = new SPTEntry(adjNode, tmpWeight, currEntry);
                    fromMap.put(adjNode, nEntry);
                    fromHeap.push(nEntry);
                }
            }
        }
    }

    private boolean finished() {
        return currEntry.adjNode == to;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= graph.getNodes())
            throw new IllegalArgumentException("Illegal node: " + node + ", legal range: [0, " + graph.getNodes() + "[");
    }

    public int getVisitedNodes() {
        return visitedNodes;
    }
}
