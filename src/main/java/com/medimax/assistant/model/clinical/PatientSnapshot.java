package com.medimax.assistant.model.clinical;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the relational store knows about one patient at read time.
 */
@Value
@Builder
public class PatientSnapshot {

    long patientId;

    @Singular("demographic")
    Map<String, Object> demographics;

    @Singular
    List<ClinicalFact> conditions;

    @Singular
    List<ClinicalFact> medications;

    @Singular
    List<ClinicalFact> encounters;

    @Singular
    List<ClinicalFact> symptoms;

    @Singular
    List<ClinicalFact> labResults;

    public List<ClinicalFact> facts(FactType type) {
        return switch (type) {
            case CONDITION -> conditions;
            case MEDICATION -> medications;
            case ENCOUNTER -> encounters;
            case SYMPTOM -> symptoms;
            case LAB_RESULT -> labResults;
        };
    }

    public int factCount() {
        return conditions.size() + medications.size() + encounters.size() + symptoms.size() + labResults.size();
    }
}
