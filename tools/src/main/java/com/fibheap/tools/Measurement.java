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
package com.fibheap.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fibheap.coll.FibonacciHeap;
import com.fibheap.routing.Dijkstra;
import com.fibheap.storage.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.TreeMap;

/**
 * Used to run performance benchmarks of the FibonacciHeap: push/pop compared to java.util.PriorityQueue, merging of
 * many small heaps and a shortest path search on a random graph.
 * <p>
 * Arguments are key=value pairs, e.g. measurement.count=100000 measurement.json=true
 */
public class Measurement {
    private static final Logger logger = LoggerFactory.getLogger(Measurement.class);
    private final Map<String, Object> properties = new TreeMap<>();
    private long seed;

    public static void main(String[] strs) throws IOException {
        PMap args = PMap.read(strs);
        int repeats = args.getInt("measurement.repeats", 1);
        for (int i = 0; i < repeats; ++i)
            new Measurement().start(args);
    }

    /**
     * Runs all measurements and stores the results in the format key=value, either as properties or as json file.
     *
     * @return the location of the stored file
     */
    String start(PMap args) throws IOException {
        final boolean useJson = args.getBool("measurement.json", false);
        final String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
        put("measurement.timestamp", timeStamp);
        String propFolder = args.getString("measurement.folder", "");
        if (!propFolder.isEmpty())
            Files.createDirectories(Paths.get(propFolder));

        String propFilename = args.getString("measurement.filename", "");
        if (propFilename.isBlank())
            propFilename = "measurement_" + timeStamp + (useJson ? ".json" : ".properties");

        final String propLocation = Paths.get(propFolder).resolve(propFilename).toString();
        seed = args.getLong("measurement.seed", 123);
        int count = args.getInt("measurement.count", 100_000, 1);
        int iterations = args.getInt("measurement.iterations", 10, 1);
        int nodes = args.getInt("measurement.nodes", 10_000, 1);
        int edgesPerNode = args.getInt("measurement.edges_per_node", 4, 0);

        put("measurement.name", args.getString("measurement.name", "no_name"));
        put("measurement.seed", seed);
        put("measurement.count", count);

        measurePushPoll(count, iterations);
        measurePriorityQueue(count, iterations);
        measureMerge(count, iterations);

        long start = System.nanoTime();
        WeightedGraph graph = createRandomGraph(nodes, edgesPerNode, new Random(seed));
        put("graph.nodes", graph.getNodes());
        put("graph.edges", graph.getEdges());
        put("graph.create_time", (System.nanoTime() - start) / 1_000_000);
        measureDijkstra(graph, iterations);

        Runtime runtime = Runtime.getRuntime();
        long usedMB = (runtime.totalMemory() - runtime.freeMemory()) >> 20;
        put("measurement.used_mb", usedMB);
        logger.info("Measurement finished, usedMB: {}, totalMB: {}", usedMB, runtime.totalMemory() >> 20);
        if (useJson)
            storeJson(propLocation);
        else
            storeProperties(propLocation);
        return propLocation;
    }

    private void measurePushPoll(int count, int iterations) {
        MiniPerfTest perf = new MiniPerfTest("fibonacci_heap.push_pop", 2 * count) {
            @Override
            public long doCalc(boolean warmup, int run) {
                Random rand = new Random(seed + run);
                FibonacciHeap<Integer> heap = new FibonacciHeap<>();
                for (int i = 0; i < count; i++) {
                    heap.push(rand.nextInt());
                }
                long sum = 0;
                while (!heap.isEmpty()) {
                    sum += heap.pop();
                }
                return sum;
            }
        }.setIterations(iterations).start();
        print(perf);
    }

    private void measurePriorityQueue(int count, int iterations) {
        MiniPerfTest perf = new MiniPerfTest("priority_queue.push_pop", 2 * count) {
            @Override
            public long doCalc(boolean warmup, int run) {
                Random rand = new Random(seed + run);
                PriorityQueue<Integer> queue = new PriorityQueue<>();
                for (int i = 0; i < count; i++) {
                    queue.add(rand.nextInt());
                }
                long sum = 0;
                while (!queue.isEmpty()) {
                    sum += queue.poll();
                }
                return sum;
            }
        }.setIterations(iterations).start();
        print(perf);
    }

    private void measureMerge(int count, int iterations) {
        final int heaps = Math.max(1, count / 100);
        MiniPerfTest perf = new MiniPerfTest("fibonacci_heap.merge", heaps) {
            @Override
            public long doCalc(boolean warmup, int run) {
                Random rand = new Random(seed + run);
                FibonacciHeap<Integer> result = new FibonacciHeap<>();
                for (int h = 0; h < heaps; h++) {
                    FibonacciHeap<Integer> heap = new FibonacciHeap<>();
                    for (int i = 0; i < 100; i++) {
                        heap.push(rand.nextInt());
                    }
                    result = FibonacciHeap.merge(result, heap);
                }
                // one pop to force the consolidation of all merged roots
                return (long) result.pop() + result.size();
            }
        }.setIterations(iterations).start();
        print(perf);
    }

    private void measureDijkstra(WeightedGraph graph, int iterations) {
        final int[] visitedNodesSum = new int[1];
        MiniPerfTest perf = new MiniPerfTest("dijkstra", 1) {
            @Override
            public long doCalc(boolean warmup, int run) {
                Random rand = new Random(seed + run);
                int from = rand.nextInt(graph.getNodes());
                int to = rand.nextInt(graph.getNodes());
                Dijkstra dijkstra = new Dijkstra(graph);
                int nodes = dijkstra.calcPath(from, to).getNodes().size();
                if (!warmup)
                    visitedNodesSum[0] += dijkstra.getVisitedNodes();
                return nodes;
            }
        }.setIterations(iterations).start();
        put("dijkstra.visited_nodes_mean", (float) visitedNodesSum[0] / iterations);
        print(perf);
    }

    /**
     * Creates a connected graph: a ring through all nodes plus edgesPerNode random edges per node
     */
    static WeightedGraph createRandomGraph(int nodes, int edgesPerNode, Random rand) {
        WeightedGraph graph = new WeightedGraph(nodes);
        for (int node = 0; node < nodes; node++) {
            if (nodes > 1)
                graph.biEdge(node, (node + 1) % nodes, 1 + rand.nextInt(100));
            for (int i = 0; i < edgesPerNode; i++) {
                graph.edge(node, rand.nextInt(nodes), 1 + rand.nextInt(100));
            }
        }
        return graph;
    }

    void print(MiniPerfTest perf) {
        logger.info(perf.getReport());
        String prefix = perf.getName();
        put(prefix + ".ops_per_sec", perf.getOperationsPerSecond());
        put(prefix + ".sum", perf.getSum());
        put(prefix + ".min", perf.getMin());
        put(prefix + ".mean", perf.getMean());
        put(prefix + ".max", perf.getMax());
    }

    void put(String key, Object val) {
        properties.put(key, val);
    }

    Map<String, Object> getProperties() {
        return properties;
    }

    private void storeJson(String jsonLocation) throws IOException {
        logger.info("storing measurement json in {}", jsonLocation);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("measurementTime", new SimpleDateFormat("yyy-MM-dd'T'HH:mm:ssZ").format(new Date()));
        result.put("metrics", properties);
        new ObjectMapper()
                .writerWithDefaultPrettyPrinter()
                .writeValue(new File(jsonLocation), result);
    }

    private void storeProperties(String propLocation) throws IOException {
        logger.info("storing measurement properties in {}", propLocation);
        try (FileWriter fileWriter = new FileWriter(propLocation)) {
            fileWriter.append("#measurement finish, " + new Date() + ", heap pushes: " + properties.get("measurement.count") + "\n");
            for (Entry<String, Object> e : properties.entrySet()) {
                fileWriter.append(e.getKey());
                fileWriter.append("=");
                fileWriter.append(e.getValue().toString());
                fileWriter.append("\n");
            }
            fileWriter.flush();
        }
    }
}
