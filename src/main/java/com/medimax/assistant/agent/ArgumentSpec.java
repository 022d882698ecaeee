package com.medimax.assistant.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declaration of one tool argument.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ArgumentSpec {

    ArgumentType type;

    boolean required;

    String description;

    @JsonIgnore
    Double min;

    @JsonIgnore
    Double max;

    @JsonIgnore
    @Singular
    List<String> allowedValues;

    @JsonIgnore
    Integer maxLength;

    @JsonProperty("constraints")
    public Map<String, Object> constraints() {
        Map<String, Object> constraints = new LinkedHashMap<>();
        if (min != null) {
            constraints.put("min", min);
        }
        if (max != null) {
            constraints.put("max", max);
        }
        if (!allowedValues.isEmpty()) {
            constraints.put("allowedValues", allowedValues);
        }
        if (maxLength != null) {
            constraints.put("maxLength", maxLength);
        }
        return constraints;
    }

    public static ArgumentSpec requiredInteger(String description, long min, long max) {
        return ArgumentSpec.builder().type(ArgumentType.INTEGER).required(true)
            .description(description).min((double) min).max((double) max).build();
    }

    public static ArgumentSpec requiredId(String description) {
        return ArgumentSpec.builder().type(ArgumentType.INTEGER).required(true)
            .description(description).min(1.0).build();
    }

    public static ArgumentSpec requiredNumber(String description, double min, double max) {
        return ArgumentSpec.builder().type(ArgumentType.NUMBER).required(true)
            .description(description).min(min).max(max).build();
    }

    public static ArgumentSpec requiredString(String description, int maxLength) {
        return ArgumentSpec.builder().type(ArgumentType.STRING).required(true)
            .description(description).maxLength(maxLength).build();
    }

    public static ArgumentSpec requiredChoice(String description, List<String> allowedValues) {
        return ArgumentSpec.builder().type(ArgumentType.STRING).required(true)
            .description(description).allowedValues(allowedValues).build();
    }
}
