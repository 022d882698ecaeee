package com.medimax.assistant.agent;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Field name to argument declaration, in declaration order.
 * Serialized as a plain JSON object.
 */
@Value
@Builder
public class ArgumentSchema {

    @Singular
    Map<String, ArgumentSpec> fields;

    @JsonValue
    public Map<String, ArgumentSpec> getFields() {
        return fields;
    }

    public static ArgumentSchema empty() {
        return ArgumentSchema.builder().build();
    }
}
