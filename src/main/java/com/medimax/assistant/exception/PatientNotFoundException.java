package com.medimax.assistant.exception;

import lombok.Getter;

@Getter
public class PatientNotFoundException extends MediMaxException {

    private final long patientId;

    public PatientNotFoundException(long patientId) {
        super(ErrorCategory.VALIDATION, "Patient not found: " + patientId);
        this.patientId = patientId;
    }
}
