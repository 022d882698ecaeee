package com.medimax.assistant.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimax.assistant.agent.impl.ToolContextImpl;
import com.medimax.assistant.client.LLMProvider;
import com.medimax.assistant.config.AgentConfig;
import com.medimax.assistant.config.ResilienceConfig;
import com.medimax.assistant.exception.MediMaxException;
import com.medimax.assistant.exception.RequestDeadlineExceededException;
import com.medimax.assistant.model.conversation.ConversationState;
import com.medimax.assistant.model.conversation.ConversationTurn;
import com.medimax.assistant.model.conversation.ToolTraceEntry;
import com.medimax.assistant.model.conversation.TurnRole;
import com.medimax.assistant.resilience.Deadline;
import com.medimax.assistant.resilience.ResilienceManager;
import com.medimax.assistant.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one question through the plan / execute / fold loop.
 *
 * <pre>
 * AWAITING_PLAN --tool--> EXECUTING_TOOL --> FOLDING_RESULT --> AWAITING_PLAN
 *       |                                          |
 *       +--final answer--> COMPLETED <--iteration cap (forced answer)
 *       +--plan repairs exhausted / model down / deadline--> ABORTED
 * </pre>
 *
 * <p>A run executes at most {@code maxIterations} tools and makes at most
 * {@code maxIterations + maxPlanRepairs + 1} reasoning calls. The request
 * deadline is checked before every transition and caps every outbound attempt.
 * Tool failures of any kind are folded back as data for the model to see.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MedicalAssistantAgent {

    static final String FALLBACK_ANSWER =
        "I could not put together a final answer within the allowed number of steps. "
            + "The tool results gathered so far are listed in the trace.";

    private final LLMProvider llmProvider;
    private final ToolRegistry toolRegistry;
    private final PlanParser planParser;
    private final PromptLibraryService promptLibrary;
    private final ResilienceManager resilience;
    private final ResilienceConfig resilienceConfig;
    private final AgentConfig agentConfig;
    private final ObjectMapper objectMapper;

    public AgentRunResult run(String userMessage, ConversationState state) {
        Run run = new Run(userMessage, state, Deadline.after(agentConfig.getRequestTimeout()));
        state.append(ConversationTurn.user(userMessage));
        log.info("Agent run started for session {}", state.getSessionId());

        AgentState current = AgentState.AWAITING_PLAN;
        while (!current.isTerminal()) {
            if (run.deadline.isExpired()) {
                current = abort(run, "The request took longer than " + agentConfig.getRequestTimeout().toSeconds()
                    + "s and was stopped");
                break;
            }
            log.debug("Session {} entering {}", state.getSessionId(), current);
            current = switch (current) {
                case AWAITING_PLAN -> awaitPlan(run);
                case EXECUTING_TOOL -> executeTool(run);
                case FOLDING_RESULT -> foldResult(run);
                default -> throw new IllegalStateException("Unexpected state " + current);
            };
        }

        log.info("Agent run for session {} ended {} after {} tool(s) and {} reasoning call(s)",
            state.getSessionId(), current, state.getToolTrace().size(), run.reasoningCalls);
        return AgentRunResult.builder()
            .finalState(current)
            .response(current == AgentState.COMPLETED ? run.answer : run.abortReason)
            .trace(List.copyOf(state.getToolTrace()))
            .iterations(state.getToolTrace().size())
            .reasoningCalls(run.reasoningCalls)
            .abortReason(run.abortReason)
            .build();
    }

    private AgentState awaitPlan(Run run) {
        String response;
        try {
            response = callModel(run, promptLibrary.render(PromptLibraryService.AGENT_PLAN, planVariables(run)), "plan");
        } catch (RequestDeadlineExceededException e) {
            return abort(run, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Reasoning model failed for session {}", run.state.getSessionId(), e);
            return abort(run, "The reasoning service is unavailable: " + e.getMessage());
        }

        AgentPlan plan = planParser.parse(response);
        if (plan instanceof AgentPlan.FinalAnswer finalAnswer) {
            return complete(run, finalAnswer.answer());
        }
        if (plan instanceof AgentPlan.ToolInvocation invocation) {
            run.pending = invocation;
            run.planError = null;
            return AgentState.EXECUTING_TOOL;
        }

        AgentPlan.Malformed malformed = (AgentPlan.Malformed) plan;
        int failures = run.state.recordPlanFailure();
        log.warn("Malformed plan {} of session {}: {}", failures, run.state.getSessionId(), malformed.reason());
        if (failures > agentConfig.getMaxPlanRepairs()) {
            return abort(run, "The assistant could not produce a valid plan after " + failures + " attempts");
        }
        run.planError = malformed.reason();
        return AgentState.AWAITING_PLAN;
    }

    private AgentState executeTool(Run run) {
        AgentPlan.ToolInvocation invocation = run.pending;
        AtomicInteger attempt = new AtomicInteger();
        ToolResult result;
        try {
            result = resilience.withRetry("tool." + invocation.toolName(),
                () -> toolRegistry.invoke(
                    new ToolCall(invocation.toolName(), invocation.arguments(), attempt.incrementAndGet()),
                    run.toolContext),
                resilienceConfig.policy(ResilienceConfig.TOOL), run.deadline);
        } catch (RequestDeadlineExceededException e) {
            return abort(run, e.getMessage());
        } catch (MediMaxException e) {
            log.warn("Tool {} failed: {}", invocation.toolName(), e.getMessage());
            result = ToolResult.failure(e.getMessage(), e.getCategory());
        } catch (RuntimeException e) {
            log.error("Tool {} failed", invocation.toolName(), e);
            result = ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
        run.lastResult = result == null ? ToolResult.failure("Tool returned no result") : result;
        return AgentState.FOLDING_RESULT;
    }

    private AgentState foldResult(Run run) {
        AgentPlan.ToolInvocation invocation = run.pending;
        ToolResult result = run.lastResult;
        ConversationState state = run.state;

        state.append(ConversationTurn.tool(invocation.toolName(), describe(result)));
        state.recordTool(result.isSuccess()
            ? ToolTraceEntry.success(invocation.toolName(), invocation.arguments(), result.getData())
            : ToolTraceEntry.failure(invocation.toolName(), invocation.arguments(), result.getMessage()));
        run.pending = null;
        run.lastResult = null;

        if (state.getIterationCount() + 1 >= agentConfig.getMaxIterations()) {
            log.info("Iteration cap {} reached for session {}, forcing final answer",
                agentConfig.getMaxIterations(), state.getSessionId());
            return forceFinalAnswer(run);
        }
        state.nextIteration();
        return AgentState.AWAITING_PLAN;
    }

    private AgentState forceFinalAnswer(Run run) {
        String answer = FALLBACK_ANSWER;
        try {
            String response = callModel(run,
                promptLibrary.render(PromptLibraryService.AGENT_FINAL, finalVariables(run)), "final");
            AgentPlan plan = planParser.parse(response);
            if (plan instanceof AgentPlan.FinalAnswer finalAnswer) {
                answer = finalAnswer.answer();
            } else {
                log.warn("Forced final answer for session {} was not usable, using fallback", run.state.getSessionId());
            }
        } catch (RequestDeadlineExceededException e) {
            return abort(run, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Forced final answer failed for session {}: {}", run.state.getSessionId(), e.getMessage());
        }
        return complete(run, answer);
    }

    private AgentState complete(Run run, String answer) {
        run.answer = answer;
        run.state.append(ConversationTurn.assistant(answer));
        return AgentState.COMPLETED;
    }

    private AgentState abort(Run run, String reason) {
        log.error("Agent run for session {} aborted: {}", run.state.getSessionId(), reason);
        run.abortReason = reason;
        return AgentState.ABORTED;
    }

    private String callModel(Run run, String prompt, String step) {
        run.reasoningCalls++;
        return resilience.withRetry("llm." + step,
            () -> llmProvider.chat(prompt, "MedicalAssistantAgent-" + step, run.state.getSessionId()),
            resilienceConfig.policy(ResilienceConfig.LLM), run.deadline);
    }

    private Map<String, Object> planVariables(Run run) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("message", run.userMessage);
        variables.put("tools", toolVariables());
        variables.put("conversation", turnVariables(priorTurns(run.state)));
        variables.put("observations", turnVariables(observations(run.state)));
        variables.put("iteration", run.state.getIterationCount() + 1);
        variables.put("maxIterations", agentConfig.getMaxIterations());
        if (run.planError != null) {
            variables.put("planError", run.planError);
        }
        return variables;
    }

    private Map<String, Object> finalVariables(Run run) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("message", run.userMessage);
        variables.put("conversation", turnVariables(priorTurns(run.state)));
        variables.put("observations", turnVariables(observations(run.state)));
        return variables;
    }

    private List<Map<String, Object>> toolVariables() {
        List<Map<String, Object>> tools = new ArrayList<>();
        for (ToolDescriptor descriptor : toolRegistry.list()) {
            Map<String, Object> tool = new LinkedHashMap<>();
            tool.put("name", descriptor.name());
            tool.put("description", descriptor.description());
            tool.put("schema", toJson(descriptor.argumentSchema()));
            tools.add(tool);
        }
        return tools;
    }

    private static List<Map<String, Object>> turnVariables(List<ConversationTurn> turns) {
        List<Map<String, Object>> rendered = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("role", turn.role().name().toLowerCase(Locale.ROOT));
            entry.put("content", turn.content());
            if (turn.toolName() != null) {
                entry.put("toolName", turn.toolName());
            }
            rendered.add(entry);
        }
        return rendered;
    }

    private static List<ConversationTurn> priorTurns(ConversationState state) {
        return state.getHistory().subList(0, state.getPriorTurnCount());
    }

    private static List<ConversationTurn> observations(ConversationState state) {
        return state.newTurns().stream().filter(turn -> turn.role() == TurnRole.TOOL).toList();
    }

    private String describe(ToolResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("success", result.isSuccess());
        view.put("message", result.getMessage());
        if (result.getData() != null) {
            view.put("data", result.getData());
        }
        return truncate(toJson(view), agentConfig.getMaxResultChars());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [truncated " + (text.length() - maxLength) + " chars]";
    }

    /**
     * Mutable data of one run. Confined to the request thread.
     */
    private static final class Run {
        private final String userMessage;
        private final ConversationState state;
        private final Deadline deadline;
        private final ToolContext toolContext;
        private AgentPlan.ToolInvocation pending;
        private ToolResult lastResult;
        private String planError;
        private String answer;
        private String abortReason;
        private int reasoningCalls;

        private Run(String userMessage, ConversationState state, Deadline deadline) {
            this.userMessage = userMessage;
            this.state = state;
            this.deadline = deadline;
            this.toolContext = ToolContextImpl.create(state.getSessionId(), deadline);
        }
    }
}
