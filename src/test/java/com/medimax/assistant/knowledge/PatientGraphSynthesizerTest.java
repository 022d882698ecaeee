package com.medimax.assistant.knowledge;

import com.medimax.assistant.exception.MalformedFactException;
import com.medimax.assistant.model.clinical.ClinicalFact;
import com.medimax.assistant.model.clinical.FactType;
import com.medimax.assistant.model.clinical.NaturalKeys;
import com.medimax.assistant.model.clinical.PatientSnapshot;
import com.medimax.assistant.model.graph.EdgeType;
import com.medimax.assistant.model.graph.GraphEdge;
import com.medimax.assistant.model.graph.GraphNode;
import com.medimax.assistant.model.graph.NodeType;
import com.medimax.assistant.model.graph.Subgraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PatientGraphSynthesizer")
class PatientGraphSynthesizerTest {

    private final PatientGraphSynthesizer synthesizer = new PatientGraphSynthesizer(new SymptomConditionMapping(Map.of(
        "frequent urination", List.of("diabetes"),
        "chest pain", List.of("coronary artery disease"))));

    @Test
    @DisplayName("One condition and one unrelated medication give 3 nodes and 2 edges")
    void minimalPatient() {
        // Given
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(42)
            .demographic("name", "Alex Morgan")
            .condition(condition("Hypertension"))
            .medication(medication("Atorvastatin", "2020-02-15"))
            .build();

        // When
        Subgraph graph = synthesizer.synthesize(snapshot);

        // Then
        assertThat(graph.nodes()).hasSize(3);
        assertThat(graph.edges()).extracting(GraphEdge::type)
            .containsExactlyInAnyOrder(EdgeType.HAS_CONDITION, EdgeType.TAKES_MEDICATION);
        assertThat(graph.nodes()).allSatisfy(node -> assertThat(node.patientId()).isEqualTo(42L));
        assertThat(graph.nodesOfType(NodeType.PATIENT)).singleElement()
            .satisfies(patient -> assertThat(patient.properties()).containsEntry("name", "Alex Morgan"));
    }

    @Test
    @DisplayName("Same snapshot synthesizes to identical IDs and order")
    void synthesis_isDeterministic() {
        PatientSnapshot snapshot = richSnapshot();

        Subgraph first = synthesizer.synthesize(snapshot);
        Subgraph second = synthesizer.synthesize(snapshot);

        assertThat(second).isEqualTo(first);
        assertThat(first.nodes()).extracting(GraphNode::id).isSorted();
        assertThat(first.edges()).extracting(GraphEdge::id).isSorted();
    }

    @Test
    void nodeIds_dependOnPatientTypeAndNormalizedKey() {
        String id = PatientGraphSynthesizer.nodeId(7, NodeType.CONDITION, "Type 2 Diabetes");

        assertThat(id).startsWith("condition-").hasSize("condition-".length() + 32);
        assertThat(PatientGraphSynthesizer.nodeId(7, NodeType.CONDITION, "  type 2   DIABETES ")).isEqualTo(id);
        assertThat(PatientGraphSynthesizer.nodeId(8, NodeType.CONDITION, "Type 2 Diabetes")).isNotEqualTo(id);
        assertThat(PatientGraphSynthesizer.nodeId(7, NodeType.SYMPTOM, "Type 2 Diabetes")).isNotEqualTo(id);
    }

    @Test
    @DisplayName("Facts sharing a natural key collapse into one node, first values win")
    void duplicateFacts_collapse() {
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(7)
            .condition(ClinicalFact.of(FactType.CONDITION, "Hypertension", Map.of("severity", "mild")))
            .condition(ClinicalFact.of(FactType.CONDITION, "hypertension ", Map.of("severity", "severe")))
            .build();

        Subgraph graph = synthesizer.synthesize(snapshot);

        assertThat(graph.nodesOfType(NodeType.CONDITION)).singleElement()
            .satisfies(node -> assertThat(node.properties()).containsEntry("severity", "mild"));
        assertThat(graph.edgesOfType(EdgeType.HAS_CONDITION)).hasSize(1);
    }

    @Test
    void derivedEdges_followIndicationsEncountersAndCuratedMap() {
        Subgraph graph = synthesizer.synthesize(richSnapshot());
        Map<String, GraphNode> byId = graph.nodesById();

        assertThat(graph.edgesOfType(EdgeType.TREATS)).singleElement().satisfies(edge -> {
            assertThat(byId.get(edge.fromId()).properties()).containsEntry("name", "Metformin");
            assertThat(byId.get(edge.toId()).properties()).containsEntry("name", "Type 2 Diabetes");
        });
        assertThat(graph.edgesOfType(EdgeType.MAY_INDICATE)).singleElement().satisfies(edge -> {
            assertThat(byId.get(edge.fromId()).type()).isEqualTo(NodeType.SYMPTOM);
            assertThat(byId.get(edge.toId()).properties()).containsEntry("name", "Type 2 Diabetes");
        });
        assertThat(graph.edgesOfType(EdgeType.REPORTED_SYMPTOM)).hasSize(2);
        assertThat(graph.nodes()).hasSize(8);
        assertThat(graph.edges()).hasSize(7 + 1 + 1 + 2);
    }

    @Test
    void symptomWithUnknownEncounter_getsNoReportedEdge() {
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(7)
            .symptom(new ClinicalFact(FactType.SYMPTOM, "Cough", Map.of("name", "Cough"),
                List.of(NaturalKeys.encounter("2023-01-01", "Emergency"))))
            .build();

        Subgraph graph = synthesizer.synthesize(snapshot);

        assertThat(graph.edgesOfType(EdgeType.REPORTED_SYMPTOM)).isEmpty();
        assertThat(graph.edgesOfType(EdgeType.HAS_SYMPTOM)).hasSize(1);
    }

    @Test
    @DisplayName("A fact without a natural key is rejected with its type and position")
    void blankNaturalKey_isMalformed() {
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(7)
            .medication(medication("Metformin", "2018-03-10"))
            .medication(ClinicalFact.of(FactType.MEDICATION, NaturalKeys.medication("  ", "2019-01-01"), Map.of()))
            .build();

        assertThatThrownBy(() -> synthesizer.synthesize(snapshot))
            .isInstanceOf(MalformedFactException.class)
            .hasMessageContaining("MEDICATION")
            .hasMessageContaining("1");
    }

    @Test
    void emptySnapshot_yieldsPatientNodeOnly() {
        Subgraph graph = synthesizer.synthesize(PatientSnapshot.builder().patientId(99).build());

        assertThat(graph.nodes()).singleElement().satisfies(node -> {
            assertThat(node.type()).isEqualTo(NodeType.PATIENT);
            assertThat(node.id()).isEqualTo(PatientGraphSynthesizer.nodeId(99, NodeType.PATIENT, "99"));
        });
        assertThat(graph.edges()).isEmpty();
    }

    @Test
    @DisplayName("A generic symptom that is only part of a curated key indicates nothing")
    void genericSymptom_doesNotMatchLongerCuratedKeys() {
        // Given
        PatientGraphSynthesizer curated = new PatientGraphSynthesizer(
            new SymptomConditionMapping(new ClassPathResource("clinical/symptom-condition-map.yaml")));
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(11)
            .condition(condition("Arthritis"))
            .condition(condition("Angina"))
            .symptom(ClinicalFact.of(FactType.SYMPTOM, NaturalKeys.symptom("Pain"), Map.of("name", "Pain")))
            .build();

        // When
        Subgraph graph = curated.synthesize(snapshot);

        // Then
        assertThat(graph.edgesOfType(EdgeType.MAY_INDICATE)).isEmpty();
    }

    @Test
    void longerSymptomName_matchesCuratedKeyAsWholeWords() {
        PatientGraphSynthesizer curated = new PatientGraphSynthesizer(
            new SymptomConditionMapping(new ClassPathResource("clinical/symptom-condition-map.yaml")));
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(11)
            .condition(condition("Stable Angina"))
            .condition(condition("Arthritis"))
            .symptom(ClinicalFact.of(FactType.SYMPTOM, NaturalKeys.symptom("Acute chest pain"),
                Map.of("name", "Acute chest pain")))
            .build();

        Subgraph graph = curated.synthesize(snapshot);

        assertThat(graph.edgesOfType(EdgeType.MAY_INDICATE)).singleElement()
            .extracting(GraphEdge::toId)
            .isEqualTo(PatientGraphSynthesizer.nodeId(11, NodeType.CONDITION, "Stable Angina"));
    }

    @Test
    void indicationNamingLessThanTheCondition_doesNotTreatIt() {
        PatientSnapshot snapshot = PatientSnapshot.builder()
            .patientId(12)
            .condition(condition("Type 2 Diabetes"))
            .condition(condition("Pain"))
            .medication(new ClinicalFact(FactType.MEDICATION, NaturalKeys.medication("Ibuprofen", "2023-01-01"),
                Map.of("name", "Ibuprofen"), List.of("Chronic back pain")))
            .medication(new ClinicalFact(FactType.MEDICATION, NaturalKeys.medication("Metformin", "2018-03-10"),
                Map.of("name", "Metformin"), List.of("Diabetes")))
            .build();

        Subgraph graph = synthesizer.synthesize(snapshot);

        assertThat(graph.edgesOfType(EdgeType.TREATS)).singleElement()
            .extracting(GraphEdge::toId)
            .isEqualTo(PatientGraphSynthesizer.nodeId(12, NodeType.CONDITION, "Type 2 Diabetes"));
    }

    private static PatientSnapshot richSnapshot() {
        String checkup = NaturalKeys.encounter("2024-03-01", "Checkup");
        return PatientSnapshot.builder()
            .patientId(7)
            .demographic("name", "Sam Rivera")
            .condition(condition("Type 2 Diabetes"))
            .condition(condition("Hypertension"))
            .medication(new ClinicalFact(FactType.MEDICATION, NaturalKeys.medication("Metformin", "2018-03-10"),
                Map.of("name", "Metformin"), List.of("Type 2 Diabetes")))
            .encounter(ClinicalFact.of(FactType.ENCOUNTER, checkup, Map.of("date", "2024-03-01")))
            .symptom(new ClinicalFact(FactType.SYMPTOM, "Frequent urination", Map.of("name", "Frequent urination"),
                List.of(checkup)))
            .symptom(new ClinicalFact(FactType.SYMPTOM, "Fatigue", Map.of("name", "Fatigue"), List.of(checkup)))
            .labResult(ClinicalFact.of(FactType.LAB_RESULT, NaturalKeys.labResult("HbA1c", "2024-03-01"),
                Map.of("testName", "HbA1c", "value", "7.9")))
            .build();
    }

    private static ClinicalFact condition(String name) {
        return ClinicalFact.of(FactType.CONDITION, NaturalKeys.condition(name), Map.of("name", name));
    }

    private static ClinicalFact medication(String name, String date) {
        return ClinicalFact.of(FactType.MEDICATION, NaturalKeys.medication(name, date),
            Map.of("name", name, "prescribedDate", date));
    }
}
