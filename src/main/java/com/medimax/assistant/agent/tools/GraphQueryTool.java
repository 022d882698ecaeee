package com.medimax.assistant.agent.tools;

import com.medimax.assistant.agent.ArgumentSchema;
import com.medimax.assistant.agent.ArgumentSpec;
import com.medimax.assistant.agent.ArgumentType;
import com.medimax.assistant.agent.Tool;
import com.medimax.assistant.agent.ToolContext;
import com.medimax.assistant.agent.ToolResult;
import com.medimax.assistant.config.GraphStoreConfig;
import com.medimax.assistant.exception.ArgumentValidationException;
import com.medimax.assistant.exception.QueryTooComplexException;
import com.medimax.assistant.knowledge.GraphStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs a read-only Cypher query against the patient knowledge graphs.
 *
 * <p>Queries are refused before reaching the store when they are too long,
 * use too many {@code MATCH} clauses, contain an unbounded variable-length
 * pattern such as {@code [*]} or {@code [*2..]}, or contain a write keyword.
 * Results are capped at {@code app.graph.max-result-rows}.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphQueryTool implements Tool {

    static final String NAME = "query_graph";

    private static final Pattern MATCH_CLAUSE = Pattern.compile("\\bMATCH\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNBOUNDED_PATTERN = Pattern.compile("\\*\\s*(?:\\d*\\s*\\.\\.\\s*)?]");
    private static final Pattern WRITE_KEYWORD = Pattern.compile(
        "\\b(CREATE|MERGE|DELETE|DETACH|SET|REMOVE|DROP|FOREACH|LOAD\\s+CSV)\\b", Pattern.CASE_INSENSITIVE);

    private final GraphStore graphStore;
    private final GraphStoreConfig config;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Run a read-only Cypher query over patient knowledge graphs. Nodes carry the ClinicalNode label plus "
            + "one of Patient, Condition, Medication, Symptom, Encounter, LabResult, and a patientId property. "
            + "Relationships: HAS_CONDITION, TAKES_MEDICATION, HAS_ENCOUNTER, HAS_SYMPTOM, HAS_LAB_RESULT, "
            + "REPORTED_SYMPTOM, TREATS, MAY_INDICATE. Build the patient's graph first.";
    }

    @Override
    public ArgumentSchema getArgumentSchema() {
        return ArgumentSchema.builder()
            .field("cypher", ArgumentSpec.builder().type(ArgumentType.STRING).required(true)
                .description("Read-only Cypher query").build())
            .field("parameters", ArgumentSpec.builder().type(ArgumentType.OBJECT).required(false)
                .description("Query parameters").build())
            .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.KNOWLEDGE;
    }

    @Override
    @SuppressWarnings("unchecked")
    public ToolResult execute(Map<String, Object> arguments, ToolContext context) {
        String cypher = (String) arguments.get("cypher");
        checkComplexity(cypher);
        checkReadOnly(cypher);

        Map<String, Object> parameters = (Map<String, Object>) arguments.getOrDefault("parameters", Map.of());
        log.info("Executing Cypher: {}", truncate(cypher, 100));

        List<Map<String, Object>> rows = graphStore.query(cypher, parameters);
        int limit = config.getMaxResultRows();
        boolean truncated = rows.size() > limit;

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", rows.size());
        data.put("truncated", truncated);
        data.put("rows", truncated ? rows.subList(0, limit) : rows);
        return ToolResult.success(data, "Query returned " + rows.size() + " row(s)"
            + (truncated ? ", showing first " + limit : ""));
    }

    private void checkComplexity(String cypher) {
        if (cypher.length() > config.getMaxQueryLength()) {
            throw new QueryTooComplexException("max-query-length",
                "Query is " + cypher.length() + " characters long, limit is " + config.getMaxQueryLength());
        }
        int matchClauses = 0;
        Matcher matcher = MATCH_CLAUSE.matcher(cypher);
        while (matcher.find()) {
            matchClauses++;
        }
        if (matchClauses > config.getMaxMatchClauses()) {
            throw new QueryTooComplexException("max-match-clauses",
                "Query has " + matchClauses + " MATCH clauses, limit is " + config.getMaxMatchClauses());
        }
        if (UNBOUNDED_PATTERN.matcher(cypher).find()) {
            throw new QueryTooComplexException("unbounded-path",
                "Variable-length patterns need an upper bound, e.g. [*1..3]");
        }
    }

    private void checkReadOnly(String cypher) {
        Matcher matcher = WRITE_KEYWORD.matcher(cypher);
        if (matcher.find()) {
            throw new ArgumentValidationException(NAME, "cypher",
                "only read queries are allowed, found " + matcher.group(1).toUpperCase(Locale.ROOT));
        }
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
