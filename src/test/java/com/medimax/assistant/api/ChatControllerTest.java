package com.medimax.assistant.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimax.assistant.client.LLMProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration tests for ChatController, with the reasoning model mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ChatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LLMProvider llmProvider;

    @Test
    void question_runsToolsAndReturnsTrace() throws Exception {
        // Given
        when(llmProvider.chat(anyString(), anyString(), anyString()))
            .thenReturn("{\"tool\": \"build_patient_knowledge_graph\", \"arguments\": {\"patientId\": 42}}")
            .thenReturn("{\"final_answer\": \"Patient 42's graph has 3 nodes.\"}");

        // When / Then
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(ChatRequest.builder()
                    .message("Build the knowledge graph for patient 42")
                    .build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.response").value("Patient 42's graph has 3 nodes."))
            .andExpect(jsonPath("$.sessionId").isNotEmpty())
            .andExpect(jsonPath("$.toolTrace", hasSize(1)))
            .andExpect(jsonPath("$.toolTrace[0].tool").value("build_patient_knowledge_graph"))
            .andExpect(jsonPath("$.toolTrace[0].result.nodesWritten").value(3))
            .andExpect(jsonPath("$.toolTrace[0].result.edgesWritten").value(2));
    }

    @Test
    void blankMessage_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"   \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("message is required"));
    }

    @Test
    void abortedRun_isServiceUnavailable() throws Exception {
        when(llmProvider.chat(anyString(), anyString(), anyString())).thenReturn("not a plan");

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"What is wrong with patient 42?\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.detail", containsString("valid plan")));
    }

    @Test
    void session_keepsHistoryUntilCleared() throws Exception {
        when(llmProvider.chat(anyString(), anyString(), anyString()))
            .thenReturn("{\"final_answer\": \"Hello, how can I help?\"}");

        MvcResult first = mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\": \"hi\"}"))
            .andExpect(status().isOk())
            .andReturn();
        String sessionId = objectMapper.readValue(first.getResponse().getContentAsString(), ChatResponse.class)
            .getSessionId();

        mockMvc.perform(post("/api/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(ChatRequest.builder()
                    .message("thanks")
                    .sessionId(sessionId)
                    .build())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sessionId").value(sessionId));

        mockMvc.perform(get("/api/v1/chat/{sessionId}/history", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.turns", hasSize(4)))
            .andExpect(jsonPath("$.turns[0].role").value("USER"))
            .andExpect(jsonPath("$.turns[0].content").value("hi"))
            .andExpect(jsonPath("$.turns[1].role").value("ASSISTANT"));

        mockMvc.perform(delete("/api/v1/chat/{sessionId}", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.turnsRemoved").value(4));

        MvcResult cleared = mockMvc.perform(get("/api/v1/chat/{sessionId}/history", sessionId))
            .andExpect(status().isOk())
            .andReturn();
        assertThat(objectMapper.readValue(cleared.getResponse().getContentAsString(), ConversationHistory.class)
            .getTurns()).isEmpty();
    }
}
