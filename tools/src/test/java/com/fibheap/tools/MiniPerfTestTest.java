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

import com.fibheap.coll.FibonacciHeap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MiniPerfTestTest {

    @Test
    public void testTimings() {
        int[] calls = new int[2];
        MiniPerfTest perf = new MiniPerfTest("fibonacci_heap.push_pop", 200) {
            @Override
            public long doCalc(boolean warmup, int run) {
                calls[warmup ? 0 : 1]++;
                FibonacciHeap<Integer> heap = new FibonacciHeap<>();
                for (int i = 100; i > 0; i--) {
                    heap.push(i);
                }
                long sum = 0;
                while (!heap.isEmpty()) {
                    sum += heap.pop();
                }
                return sum;
            }
        }.setIterations(6).start();

        assertEquals(2, calls[0]);
        assertEquals(6, calls[1]);
        assertTrue(perf.getMin() <= perf.getMean());
        assertTrue(perf.getMean() <= perf.getMax());
        assertEquals(perf.getSum() / 6, perf.getMean(), 1e-9);
        assertTrue(perf.getOperationsPerSecond() > 0);
        assertTrue(perf.getReport().startsWith("fibonacci_heap.push_pop: sum:"), perf.getReport());
    }

    @Test
    public void testNotStarted() {
        MiniPerfTest perf = new MiniPerfTest("dijkstra", 1) {
            @Override
            public long doCalc(boolean warmup, int run) {
                return run;
            }
        };
        assertEquals(0, perf.getSum());
        assertEquals(0, perf.getMean());
        assertEquals(0, perf.getOperationsPerSecond());
        assertThrows(IllegalArgumentException.class, () -> perf.setIterations(0));
    }
}
