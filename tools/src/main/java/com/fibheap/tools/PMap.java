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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The arguments of a measurement run, read from key=value pairs like measurement.count=100000. Leading dashes are
 * ignored and camelCase keys are stored as under_score, so measurement.edgesPerNode and measurement.edges_per_node
 * are the same key. Values are stored as Boolean, Integer, Long or Double if they can be parsed as such.
 */
public class PMap {
    private final Map<String, Object> map = new LinkedHashMap<>();

    public static PMap read(String... args) {
        PMap pMap = new PMap();
        for (String arg : args) {
            int index = arg.indexOf('=');
            if (index <= 0)
                continue;

            String key = toKey(arg.substring(0, index));
            String value = arg.substring(index + 1);
            if (pMap.map.containsKey(key))
                throw new IllegalArgumentException("Argument '" + key + "' is specified twice: '" + pMap.map.get(key) + "' and '" + value + "'");
            pMap.map.put(key, toValue(value));
        }
        return pMap;
    }

    public boolean has(String key) {
        return map.containsKey(key);
    }

    public boolean getBool(String key, boolean _default) {
        Object value = map.get(key);
        return value instanceof Boolean ? (Boolean) value : _default;
    }

    public int getInt(String key, int _default) {
        Object value = map.get(key);
        return value instanceof Integer ? (Integer) value : _default;
    }

    /**
     * Like {@link #getInt} but fails for values smaller than min, e.g. a heap size of 0 or a negative edge count.
     */
    public int getInt(String key, int _default, int min) {
        int value = getInt(key, _default);
        if (value < min)
            throw new IllegalArgumentException("Argument '" + key + "' must be at least " + min + " but was " + value);
        return value;
    }

    public long getLong(String key, long _default) {
        Object value = map.get(key);
        return value instanceof Integer || value instanceof Long ? ((Number) value).longValue() : _default;
    }

    public String getString(String key, String _default) {
        Object value = map.get(key);
        return value == null ? _default : value.toString();
    }

    private static String toKey(String str) {
        int start = 0;
        while (start < str.length() && str.charAt(start) == '-') {
            start++;
        }
        StringBuilder sb = new StringBuilder(str.length() + 4);
        for (char c : str.substring(start).toCharArray()) {
            if (Character.isUpperCase(c))
                sb.append('_').append(Character.toLowerCase(c));
            else
                sb.append(c);
        }
        return sb.toString();
    }

    private static Object toValue(String str) {
        if ("true".equalsIgnoreCase(str) || "false".equalsIgnoreCase(str))
            return Boolean.parseBoolean(str);
        try {
            long number = Long.parseLong(str);
            return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE ? (Object) (int) number : (Object) number;
        } catch (NumberFormatException ex) {
            try {
                return Double.parseDouble(str);
            } catch (NumberFormatException ex2) {
                return str;
            }
        }
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
