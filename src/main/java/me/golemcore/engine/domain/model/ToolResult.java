package me.golemcore.engine.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized outcome of a tool invocation: display text, optional structured
 * data, optional error and an optional system-level annotation. Failures carry
 * a {@link ToolFailureKind} so callers never have to parse error text.
 */
@Value
@Builder(toBuilder = true)
public class ToolResult {

    private static final String ERROR_PREFIX = "Error: ";

    String output;
    Map<String, Object> data;
    String error;
    String system;
    ToolFailureKind failureKind;

    /**
     * Creates a successful tool result with output text.
     */
    public static ToolResult success(String output) {
        return ToolResult.builder()
                .output(output)
                .build();
    }

    /**
     * Creates a successful tool result with output text and structured data.
     */
    public static ToolResult success(String output, Map<String, Object> data) {
        return ToolResult.builder()
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .error(error)
                .failureKind(kind)
                .build();
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean hasData() {
        return data != null && !data.isEmpty();
    }

    /**
     * A result is meaningful when at least one of its fields carries something.
     */
    public boolean isPresent() {
        return notEmpty(output) || hasData() || notEmpty(error) || notEmpty(system);
    }

    /**
     * Text shown to the model and to stream consumers. Errors always start with
     * {@code "Error: "}, without doubling a prefix the error already has.
     */
    public String displayText() {
        if (notEmpty(error)) {
            return error.startsWith(ERROR_PREFIX) ? error : ERROR_PREFIX + error;
        }
        return output != null ? output : "";
    }

    /**
     * Combines two results field by field. Output text is concatenated and data
     * maps are merged with {@code other} winning on key clashes. Error and system
     * are single-valued: if both sides carry one, the combination is rejected.
     *
     * @throws ToolResultCombinationException
     *             if both results carry an error or both carry a system annotation
     */
    public ToolResult combine(ToolResult other) {
        if (other == null) {
            return this;
        }
        return ToolResult.builder()
                .output(concat(output, other.output))
                .data(mergeData(data, other.data))
                .error(single("error", error, other.error))
                .system(single("system", system, other.system))
                .failureKind(failureKind != null ? failureKind : other.failureKind)
                .build();
    }

    private static String concat(String left, String right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left + right;
    }

    private static Map<String, Object> mergeData(Map<String, Object> left, Map<String, Object> right) {
        if (left == null || left.isEmpty()) {
            return right;
        }
        if (right == null || right.isEmpty()) {
            return left;
        }
        Map<String, Object> merged = new LinkedHashMap<>(left);
        merged.putAll(right);
        return merged;
    }

    private static String single(String field, String left, String right) {
        if (notEmpty(left) && notEmpty(right)) {
            throw new ToolResultCombinationException("Cannot combine two results that both set '" + field + "'");
        }
        return notEmpty(left) ? left : right;
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
