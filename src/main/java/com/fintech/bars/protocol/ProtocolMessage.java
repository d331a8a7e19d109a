package com.fintech.bars.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Optional;

/**
 * A decoded {@code {"m": method, "p": params}} message.
 *
 * @param method Raw method name, may be null when the payload had none
 * @param params Parameter array, {@link MissingNode} when absent
 */
public record ProtocolMessage(String method, JsonNode params) {

    public ProtocolMessage {
        if (params == null) {
            params = MissingNode.getInstance();
        }
    }

    public Optional<ProtocolMethod> knownMethod() {
        return ProtocolMethod.fromWireName(method);
    }

    /** Returns the i-th parameter or {@link MissingNode} when out of range. */
    public JsonNode param(int index) {
        return params.path(index);
    }

    public int paramCount() {
        return params.isArray() ? params.size() : 0;
    }
}
