package com.medimax.assistant.model.clinical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One normalized relational row.
 *
 * @param type        fact kind
 * @param naturalKey  stable identity within the patient, may be blank for malformed rows
 * @param properties  scalar column values in column order
 * @param references  keys of related facts: encounter key for symptoms,
 *                    indication / purpose names for medications
 */
public record ClinicalFact(FactType type, String naturalKey, Map<String, Object> properties, List<String> references) {

    public ClinicalFact {
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static ClinicalFact of(FactType type, String naturalKey, Map<String, Object> properties) {
        return new ClinicalFact(type, naturalKey, properties, List.of());
    }

    public Object property(String name) {
        return properties.get(name);
    }
}
