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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    @Test
    public void testRead() {
        PMap args = PMap.read("measurement.count=1000", "--measurement.json=TRUE", "measurement.name=abc",
                "measurement.seed=12345678901", "measurement.edgesPerNode=3", "measurement.folder=/tmp/x=y", "no_value");
        assertEquals(1000, args.getInt("measurement.count", 0));
        assertTrue(args.getBool("measurement.json", false));
        assertEquals("abc", args.getString("measurement.name", ""));
        assertEquals(12345678901L, args.getLong("measurement.seed", 0));
        assertEquals(3, args.getInt("measurement.edges_per_node", 0));
        assertEquals("/tmp/x=y", args.getString("measurement.folder", ""));
        assertFalse(args.has("no_value"));
        assertFalse(args.has("measurement.edgesPerNode"));
    }

    @Test
    public void testDefaults() {
        PMap args = PMap.read("measurement.count=many", "measurement.seed=12345678901", "measurement.name=42");
        assertEquals(7, args.getInt("measurement.count", 7));
        // too big for an int
        assertEquals(5, args.getInt("measurement.seed", 5));
        assertEquals(42L, args.getLong("measurement.name", 0));
        assertEquals("42", args.getString("measurement.name", ""));
        assertFalse(args.getBool("measurement.count", false));
        assertEquals("x", args.getString("missing", "x"));
        assertEquals(10, args.getLong("missing", 10));
    }

    @Test
    public void testMinimum() {
        PMap args = PMap.read("measurement.count=0", "measurement.edges_per_node=0");
        assertEquals(0, args.getInt("measurement.edges_per_node", 4, 0));
        assertEquals(100, args.getInt("measurement.nodes", 100, 1));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> args.getInt("measurement.count", 10, 1));
        assertTrue(ex.getMessage().contains("measurement.count"), ex.getMessage());
    }

    @Test
    public void testDuplicateKey() {
        assertThrows(IllegalArgumentException.class, () -> PMap.read("measurement.count=1", "measurement.count=2"));
        assertThrows(IllegalArgumentException.class, () -> PMap.read("measurement.edgesPerNode=1", "measurement.edges_per_node=2"));
    }
}
