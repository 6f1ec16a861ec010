/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.objectstore.schema;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Value types a record field may hold.
 * <p>
 * Field values are kept in their JSON-friendly Java form:
 * <table border="1">
 *   <tr><th>Type</th><th>Java value</th></tr>
 *   <tr><td>STRING</td><td>{@link String}</td></tr>
 *   <tr><td>LONG</td><td>{@link Long}</td></tr>
 *   <tr><td>DOUBLE</td><td>{@link Double} (finite)</td></tr>
 *   <tr><td>BOOLEAN</td><td>{@link Boolean}</td></tr>
 *   <tr><td>TIMESTAMP</td><td>ISO-8601 instant as {@link String}</td></tr>
 *   <tr><td>JSON</td><td>embedded JSON document as {@link String}</td></tr>
 * </table>
 * JSON documents are not parsed at commit time; malformed documents are
 * reported by the integrity checker.
 */
public enum FieldType {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN,
    TIMESTAMP,
    JSON;

    /**
     * Returns true if {@code value} is a valid (already normalised) value of
     * this type. {@code null} is always accepted; presence is checked separately.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING, JSON -> value instanceof String;
            case LONG -> value instanceof Long;
            case DOUBLE -> value instanceof Double d && Double.isFinite(d);
            case BOOLEAN -> value instanceof Boolean;
            case TIMESTAMP -> value instanceof String s && isInstant(s);
        };
    }

    /**
     * Converts {@code value} into this type where a lossless or conventional
     * conversion exists. Used by inferred migration mappings.
     *
     * @throws IllegalArgumentException if no conversion exists
     */
    public Object convert(Object value) {
        Object v = normalize(value);
        if (v == null || accepts(v)) {
            return v;
        }
        switch (this) {
            case STRING:
                return String.valueOf(v);
            case LONG:
                if (v instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
                    return d.longValue();
                }
                if (v instanceof String s) {
                    try {
                        return Long.parseLong(s.trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Cannot convert '" + s + "' to LONG", e);
                    }
                }
                break;
            case DOUBLE:
                if (v instanceof Long l) {
                    return l.doubleValue();
                }
                if (v instanceof String s) {
                    try {
                        return Double.parseDouble(s.trim());
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Cannot convert '" + s + "' to DOUBLE", e);
                    }
                }
                break;
            case BOOLEAN:
                if (v instanceof String s && ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s))) {
                    return Boolean.parseBoolean(s);
                }
                break;
            case TIMESTAMP:
                if (v instanceof Long epochMillis) {
                    return Instant.ofEpochMilli(epochMillis).toString();
                }
                break;
            case JSON:
                break;
        }
        throw new IllegalArgumentException("Cannot convert " + v.getClass().getSimpleName() + " to " + this);
    }

    /**
     * A safe placeholder value used when repairing an invalid required field
     * that has no declared default.
     */
    public Object zeroValue(Clock clock) {
        return switch (this) {
            case STRING -> "";
            case LONG -> 0L;
            case DOUBLE -> 0.0d;
            case BOOLEAN -> Boolean.FALSE;
            case TIMESTAMP -> Instant.now(clock).toString();
            case JSON -> "{}";
        };
    }

    /**
     * Widens Java numeric types to the stored representation
     * ({@code Integer -> Long}, {@code Float -> Double}) and renders
     * {@link Instant} as an ISO-8601 string.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        return value;
    }

    private static boolean isInstant(String s) {
        try {
            Instant.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
