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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fibheap.routing.Dijkstra;
import com.fibheap.storage.WeightedGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class MeasurementTest {

    @TempDir
    Path tmpDir;

    @Test
    public void testStoreJson() throws Exception {
        PMap args = PMap.read(new String[]{"measurement.folder=" + tmpDir.resolve("results"), "measurement.json=true",
                "measurement.count=500", "measurement.iterations=2", "measurement.nodes=200", "measurement.name=unit"});
        Measurement measurement = new Measurement();
        String location = measurement.start(args);
        assertTrue(location.endsWith(".json"), location);

        JsonNode json = new ObjectMapper().readTree(new File(location));
        JsonNode metrics = json.get("metrics");
        assertEquals("unit", metrics.get("measurement.name").asText());
        assertEquals(500, metrics.get("measurement.count").asInt());
        assertEquals(200, metrics.get("graph.nodes").asInt());
        assertTrue(metrics.has("fibonacci_heap.push_pop.mean"));
        assertTrue(metrics.has("fibonacci_heap.merge.mean"));
        assertTrue(metrics.has("priority_queue.push_pop.mean"));
        assertTrue(metrics.has("dijkstra.visited_nodes_mean"));
        assertTrue(json.has("measurementTime"));
    }

    @Test
    public void testStoreProperties() throws Exception {
        PMap args = PMap.read(new String[]{"measurement.folder=" + tmpDir, "measurement.filename=result.properties",
                "measurement.count=100", "measurement.iterations=1", "measurement.nodes=50", "measurement.edges_per_node=2"});
        String location = new Measurement().start(args);
        assertEquals(tmpDir.resolve("result.properties").toString(), location);

        List<String> lines = Files.readAllLines(Path.of(location));
        assertTrue(lines.get(0).startsWith("#measurement finish"));
        assertTrue(lines.contains("measurement.count=100"));
        assertTrue(lines.contains("graph.nodes=50"));
        assertTrue(lines.contains("measurement.name=no_name"));
    }

    @Test
    public void testIllegalArguments() {
        PMap args = PMap.read(new String[]{"measurement.folder=" + tmpDir, "measurement.count=0"});
        assertThrows(IllegalArgumentException.class, () -> new Measurement().start(args));
    }

    @Test
    public void testRandomGraphIsConnected() {
        WeightedGraph graph = Measurement.createRandomGraph(100, 3, new Random(0));
        assertEquals(100, graph.getNodes());
        assertEquals(100 * 2 + 100 * 3, graph.getEdges());
        double[] weights = new Dijkstra(graph).calcWeights(0);
        for (double weight : weights) {
            assertTrue(Double.isFinite(weight));
        }

        WeightedGraph single = Measurement.createRandomGraph(1, 0, new Random(0));
        assertEquals(1, single.getNodes());
        assertEquals(0, single.getEdges());
    }
}
