package com.medimax.assistant.repository;

import com.medimax.assistant.exception.PatientNotFoundException;
import com.medimax.assistant.model.clinical.ClinicalFact;
import com.medimax.assistant.model.clinical.FactType;
import com.medimax.assistant.model.clinical.NaturalKeys;
import com.medimax.assistant.model.clinical.PatientSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the clinical tables of the relational store.
 *
 * <p>Column names are mapped explicitly so property names do not depend on
 * the identifier case the database reports. Dates become ISO-8601 strings.
 * Every query is ordered by primary key, which keeps snapshots stable.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PatientRecordRepository {

    private static final String PATIENT_SQL =
        "SELECT patient_id, name, dob, sex FROM patient WHERE patient_id = :pid";

    private static final String CONDITION_SQL =
        "SELECT condition_id, name, severity, status, diagnosis_date, details "
            + "FROM medical_condition WHERE patient_id = :pid ORDER BY condition_id";

    private static final String MEDICATION_SQL =
        "SELECT medication_id, medicine_name, dosage, frequency, indication, prescribed_date, "
            + "discontinued_date, is_continued, prescribed_by "
            + "FROM medication WHERE patient_id = :pid ORDER BY medication_id";

    private static final String ACTIVE_MEDICATION_SQL =
        "SELECT medication_id, medicine_name, dosage, frequency, indication, prescribed_date, "
            + "discontinued_date, is_continued, prescribed_by "
            + "FROM medication WHERE patient_id = :pid AND is_continued = TRUE ORDER BY medication_id";

    private static final String PURPOSE_SQL =
        "SELECT mp.medication_id, mp.condition_name FROM medication_purpose mp "
            + "JOIN medication m ON m.medication_id = mp.medication_id "
            + "WHERE m.patient_id = :pid ORDER BY mp.purpose_id";

    private static final String ENCOUNTER_SQL =
        "SELECT encounter_id, encounter_date, encounter_type, doctor_name, status "
            + "FROM encounter WHERE patient_id = :pid ORDER BY encounter_id";

    private static final String SYMPTOM_SQL =
        "SELECT s.symptom_id, s.name, s.severity, s.description, s.reported_date, "
            + "e.encounter_date, e.encounter_type "
            + "FROM symptom s LEFT JOIN encounter e ON e.encounter_id = s.encounter_id "
            + "WHERE s.patient_id = :pid ORDER BY s.symptom_id";

    private static final String LAB_SQL =
        "SELECT lab_result_id, test_name, test_value, test_unit, flag, test_date "
            + "FROM lab_result WHERE patient_id = :pid ORDER BY lab_result_id";

    private final NamedParameterJdbcTemplate jdbc;

    public Optional<Map<String, Object>> findPatient(long patientId) {
        List<Map<String, Object>> rows = jdbc.query(PATIENT_SQL, params(patientId), (rs, i) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("patientId", rs.getLong("patient_id"));
            row.put("name", rs.getString("name"));
            row.put("dob", isoDate(rs.getDate("dob")));
            row.put("sex", rs.getString("sex"));
            return row;
        });
        return rows.stream().findFirst();
    }

    /**
     * Reads every clinical row of one patient.
     *
     * @throws PatientNotFoundException if there is no such patient row
     */
    public PatientSnapshot loadSnapshot(long patientId) {
        Map<String, Object> patient = findPatient(patientId)
            .orElseThrow(() -> new PatientNotFoundException(patientId));

        PatientSnapshot.PatientSnapshotBuilder snapshot = PatientSnapshot.builder().patientId(patientId);
        patient.forEach((key, value) -> {
            if (!"patientId".equals(key)) {
                snapshot.demographic(key, value);
            }
        });

        snapshot.conditions(jdbc.query(CONDITION_SQL, params(patientId), (rs, i) -> conditionFact(rs)));
        snapshot.medications(medicationFacts(patientId));
        snapshot.encounters(jdbc.query(ENCOUNTER_SQL, params(patientId), (rs, i) -> encounterFact(rs)));
        snapshot.symptoms(jdbc.query(SYMPTOM_SQL, params(patientId), (rs, i) -> symptomFact(rs)));
        snapshot.labResults(jdbc.query(LAB_SQL, params(patientId), (rs, i) -> labFact(rs)));

        PatientSnapshot result = snapshot.build();
        log.debug("Loaded snapshot for patient {}: {} facts", patientId, result.factCount());
        return result;
    }

    public List<Map<String, Object>> findMedications(long patientId, boolean activeOnly) {
        return jdbc.query(activeOnly ? ACTIVE_MEDICATION_SQL : MEDICATION_SQL, params(patientId),
            (rs, i) -> medicationRow(rs));
    }

    public boolean isReachable() {
        try {
            Integer one = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (RuntimeException e) {
            log.warn("Relational store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private List<ClinicalFact> medicationFacts(long patientId) {
        Map<Long, List<String>> purposes = new LinkedHashMap<>();
        jdbc.query(PURPOSE_SQL, params(patientId), rs -> {
            purposes.computeIfAbsent(rs.getLong("medication_id"), id -> new ArrayList<>())
                .add(rs.getString("condition_name"));
        });

        return jdbc.query(MEDICATION_SQL, params(patientId), (rs, i) -> {
            Map<String, Object> properties = medicationRow(rs);
            List<String> indications = new ArrayList<>();
            String indication = rs.getString("indication");
            if (indication != null && !indication.isBlank()) {
                indications.add(indication);
            }
            indications.addAll(purposes.getOrDefault(rs.getLong("medication_id"), List.of()));
            return new ClinicalFact(FactType.MEDICATION,
                NaturalKeys.medication(rs.getString("medicine_name"), properties.get("prescribedDate")),
                properties, indications);
        });
    }

    private static Map<String, Object> medicationRow(ResultSet rs) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("medicationId", rs.getLong("medication_id"));
        row.put("name", rs.getString("medicine_name"));
        row.put("dosage", rs.getString("dosage"));
        row.put("frequency", rs.getString("frequency"));
        row.put("indication", rs.getString("indication"));
        row.put("prescribedDate", isoDate(rs.getDate("prescribed_date")));
        row.put("discontinuedDate", isoDate(rs.getDate("discontinued_date")));
        row.put("active", rs.getBoolean("is_continued"));
        row.put("prescribedBy", rs.getString("prescribed_by"));
        return row;
    }

    private static ClinicalFact conditionFact(ResultSet rs) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", rs.getString("name"));
        row.put("severity", rs.getString("severity"));
        row.put("status", rs.getString("status"));
        row.put("diagnosisDate", isoDate(rs.getDate("diagnosis_date")));
        row.put("details", rs.getString("details"));
        return ClinicalFact.of(FactType.CONDITION, NaturalKeys.condition(rs.getString("name")), row);
    }

    private static ClinicalFact encounterFact(ResultSet rs) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("date", isoDate(rs.getDate("encounter_date")));
        row.put("encounterType", rs.getString("encounter_type"));
        row.put("doctor", rs.getString("doctor_name"));
        row.put("status", rs.getString("status"));
        return ClinicalFact.of(FactType.ENCOUNTER,
            NaturalKeys.encounter(row.get("date"), rs.getString("encounter_type")), row);
    }

    private static ClinicalFact symptomFact(ResultSet rs) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", rs.getString("name"));
        row.put("severity", rs.getString("severity"));
        row.put("description", rs.getString("description"));
        row.put("reportedDate", isoDate(rs.getDate("reported_date")));
        String encounterDate = isoDate(rs.getDate("encounter_date"));
        List<String> references = encounterDate == null
            ? List.of()
            : List.of(NaturalKeys.encounter(encounterDate, rs.getString("encounter_type")));
        return new ClinicalFact(FactType.SYMPTOM, NaturalKeys.symptom(rs.getString("name")), row, references);
    }

    private static ClinicalFact labFact(ResultSet rs) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("testName", rs.getString("test_name"));
        row.put("value", rs.getString("test_value"));
        row.put("unit", rs.getString("test_unit"));
        row.put("flag", rs.getString("flag"));
        row.put("date", isoDate(rs.getDate("test_date")));
        return ClinicalFact.of(FactType.LAB_RESULT,
            NaturalKeys.labResult(rs.getString("test_name"), row.get("date")), row);
    }

    private static MapSqlParameterSource params(long patientId) {
        return new MapSqlParameterSource("pid", patientId);
    }

    private static String isoDate(Date date) {
        return date == null ? null : date.toLocalDate().toString();
    }
}
