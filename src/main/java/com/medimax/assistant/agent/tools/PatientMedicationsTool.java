package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.agent.ArgumentType;
import com.medimax.assistant.agent.Tool;
import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.exception.PatientNotFoundException;
import com.medimax.assistant.repository.PatientRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PatientMedicationsTool implements Tool {

    private final PatientRecordRepository patientRecords;

    @Override
    public String getName() {
        return "list_patient_medications";
    }

    @Override
    public String getDescription() {
        return "List a patient's prescribed medications with dosage, frequency and indication. "
            + "Set activeOnly to true to skip discontinued ones.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("patientId", ArgumentSpec.requiredId("Patient ID"))
            .field("activeOnly", ArgumentSpec.builder().type(ArgumentType.BOOLEAN).required(false)
                .description("Only medications still being taken (default false)").build())
            .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        long patientId = (Long) arguments.get("patientId");
        boolean activeOnly = Boolean.TRUE.equals(arguments.get("activeOnly"));
        if (patientRecords.findPatient(patientId).isEmpty()) {
            throw new PatientNotFoundException(patientId);
        }

        List<Map<String, Object>> medications = patientRecords.findMedications(patientId, activeOnly);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("patientId", patientId);
        data.put("activeOnly", activeOnly);
        data.put("medications", medications);
        return ToolResult.success(data, medications.size() + " medication(s) for patient " + patientId);
    }
}
