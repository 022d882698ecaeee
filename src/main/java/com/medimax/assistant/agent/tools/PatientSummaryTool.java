package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.agent.Tool;
import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.model.clinical.ClinicalFact;
import com.medimax.assistant.model.clinical.PatientSnapshot;
import com.medimax.assistant.repository.PatientRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Demographics, condition names and record counts of one patient.
 */
@Component
@RequiredArgsConstructor
public class PatientSummaryTool implements Tool {

    private final PatientRecordRepository patientRecords;

    @Override
    public String getName() {
        return "get_patient_summary";
    }

    @Override
    public String getDescription() {
        return "Get a patient's demographics, known conditions and how many medications, encounters, "
            + "symptoms and lab results are on record.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        long patientId = (Long) arguments.get("patientId");
        PatientSnapshot snapshot = patientRecords.loadSnapshot(patientId);

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("conditions", snapshot.getConditions().size());
        counts.put("medications", snapshot.getMedications().size());
        counts.put("encounters", snapshot.getEncounters().size());
        counts.put("symptoms", snapshot.getSymptoms().size());
        counts.put("labResults", snapshot.getLabResults().size());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patientId", patientId);
        data.put("demographics", snapshot.getDemographics());
        data.put("conditions", names(snapshot.getConditions()));
        data.put("counts", counts);
        return ToolResult.success(data, "Summary of patient " + patientId);
    }

    private static List<String> names(List<ClinicalFact> facts) {
        return facts.stream()
            .map(fact -> fact.property("name"))
            .filter(Objects::nonNull)
            .map(Object::toString)
            .toList();
    }
}
