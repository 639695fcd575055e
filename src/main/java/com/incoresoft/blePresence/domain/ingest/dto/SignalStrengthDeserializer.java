package com.incoresoft.blePresence.domain.ingest.dto;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/** Reads the rssi field in any of the shapes receivers send. */
public class SignalStrengthDeserializer extends StdDeserializer<SignalStrength> {

    public SignalStrengthDeserializer() {
        super(SignalStrength.class);
    }

    @Override
    public SignalStrength deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.readValueAsTree();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return SignalStrength.absent();
        }
        if (node.isObject()) {
            return SignalStrength.structured(number(node.get("average")), number(node.get("current")));
        }
        return SignalStrength.of(number(node));
    }

    private static Number number(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isNumber()) return node.numberValue();
        if (node.isTextual()) {
            try {
                return Double.valueOf(node.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
