package com.medimax.assistant.knowledge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.medimax.assistant.model.clinical.NaturalKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Curated symptom to condition associations used for {@code MAY_INDICATE} edges.
 *
 * <p>Loaded from YAML:
 * <pre>
 * mappings:
 *   chest pain: [coronary artery disease, hypertension]
 *   polyuria: [diabetes]
 * </pre>
 *
 * A patient's symptom matches a curated key when the symptom name contains the
 * key as whole words, ignoring case ("chest pain radiating" matches "chest pain",
 * "pain" does not). The same rule applies between a patient condition and a
 * mapped condition.
 */
@Slf4j
@Component
public class SymptomConditionMapping {

    private final Map<String, List<String>> mappings;

    @Autowired
    public SymptomConditionMapping(
            @Value("${app.graph.symptom-map:classpath:clinical/symptom-condition-map.yaml}") Resource resource) {
        this(read(resource));
        log.info("Loaded {} symptom-condition mappings from {}", mappings.size(), resource.getDescription());
    }

    public SymptomConditionMapping(Map<String, List<String>> mappings) {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        mappings.forEach((symptom, conditions) -> normalized.put(
            NaturalKeys.normalize(symptom),
            conditions.stream().map(NaturalKeys::normalize).filter(c -> !c.isEmpty()).toList()));
        this.mappings = Map.copyOf(normalized);
    }

    /**
     * True when the curated map associates the symptom with the condition.
     */
    public boolean mayIndicate(String symptomName, String conditionName) {
        String symptom = NaturalKeys.normalize(symptomName);
        String condition = NaturalKeys.normalize(conditionName);
        if (symptom.isEmpty() || condition.isEmpty()) {
            return false;
        }
        return mappings.entrySet().stream()
            .filter(entry -> containsTerm(symptom, entry.getKey()))
            .flatMap(entry -> entry.getValue().stream())
            .anyMatch(mapped -> containsTerm(condition, mapped));
    }

    public int size() {
        return mappings.size();
    }

    /**
     * True when the normalized {@code name} contains the normalized {@code term}
     * as a sequence of whole words. Never matches in the reverse direction.
     */
    public static boolean containsTerm(String name, String term) {
        String haystack = NaturalKeys.normalize(name);
        String needle = NaturalKeys.normalize(term);
        if (haystack.isEmpty() || needle.isEmpty()) {
            return false;
        }
        return (" " + haystack + " ").contains(" " + needle + " ");
    }

    private static Map<String, List<String>> read(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            MappingFile file = new ObjectMapper(new YAMLFactory()).readValue(in, MappingFile.class);
            return file.mappings() == null ? Map.of() : file.mappings();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read symptom-condition mapping " + resource.getDescription(), e);
        }
    }

    record MappingFile(Map<String, List<String>> mappings) {
    }
}
