package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.agent.impl.ToolContextImpl;
import com.medimax.assistant.config.GraphStoreConfig;
import com.medimax.assistant.exception.ArgumentValidationException;
import com.medimax.assistant.exception.QueryTooComplexException;
import com.medimax.assistant.knowledge.GraphStore;
import com.medimax.assistant.resilience.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GraphQueryToolTest {

    private GraphStore graphStore;
    private GraphStoreConfig config;
    private GraphQueryTool tool;

    @BeforeEach
    void setUp() {
        graphStore = mock(GraphStore.class);
        config = new GraphStoreConfig();
        config.setMaxQueryLength(200);
        config.setMaxMatchClauses(2);
        config.setMaxResultRows(3);
        tool = new GraphQueryTool(graphStore, config);
    }

    @Test
    void readQuery_returnsRowsCappedAtLimit() {
        List<Map<String, Object>> rows = new ArrayList<>();
        IntStream.range(0, 5).forEach(i -> rows.add(Map.of("n", i)));
        when(graphStore.query(anyString(), anyMap())).thenReturn(rows);

        ToolResult result = tool.execute(Map.of("cypher", "MATCH (n:Condition {patientId: 42}) RETURN n"),
            ToolContextImpl.create("s", Deadline.none()));

        assertThat(result.isSuccess()).isTrue();
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertThat(data).containsEntry("count", 5).containsEntry("truncated", true);
        assertThat((List<?>) data.get("rows")).hasSize(3);
    }

    @Test
    void tooManyMatchClauses_rejectedBeforeReachingStore() {
        String cypher = "MATCH (a) MATCH (b) MATCH (c) RETURN a, b, c";

        assertThatThrownBy(() -> tool.execute(Map.of("cypher", cypher), ToolContextImpl.create("s", Deadline.none())))
            .isInstanceOf(QueryTooComplexException.class)
            .hasMessageContaining("3 MATCH clauses");
        verify(graphStore, never()).query(any(), any());
    }

    @Test
    void overlongQuery_rejected() {
        String cypher = "MATCH (n) WHERE n.name = '" + "x".repeat(250) + "' RETURN n";

        assertThatThrownBy(() -> tool.execute(Map.of("cypher", cypher), ToolContextImpl.create("s", Deadline.none())))
            .isInstanceOf(QueryTooComplexException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "MATCH (p)-[*]->(c) RETURN c",
        "MATCH (p)-[:TREATS*2..]->(c) RETURN c",
        "MATCH (p)-[r * ]->(c) RETURN c"
    })
    void unboundedVariableLengthPath_rejected(String cypher) {
        assertThatThrownBy(() -> tool.execute(Map.of("cypher", cypher), ToolContextImpl.create("s", Deadline.none())))
            .isInstanceOf(QueryTooComplexException.class)
            .hasMessageContaining("upper bound");
    }

    @Test
    void boundedVariableLengthPath_allowed() {
        when(graphStore.query(anyString(), anyMap())).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("cypher", "MATCH (p)-[*1..3]->(c) RETURN c"),
            ToolContextImpl.create("s", Deadline.none()));

        assertThat(result.isSuccess()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "MATCH (n) DETACH DELETE n",
        "CREATE (n:Condition {name: 'x'})",
        "MATCH (n) SET n.name = 'y' RETURN n",
        "merge (n:Patient {id: 1}) return n"
    })
    void writeQueries_rejectedAsValidationErrors(String cypher) {
        assertThatThrownBy(() -> tool.execute(Map.of("cypher", cypher), ToolContextImpl.create("s", Deadline.none())))
            .isInstanceOf(ArgumentValidationException.class)
            .hasMessageContaining("only read queries");
        verify(graphStore, never()).query(any(), any());
    }
}
