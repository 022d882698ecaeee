package com.medimax.assistant.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: agent-plan
 * version: 1.0
 * systemPrompt: |
 *   You are MediMax...
 * userPrompt: |
 *   {{{message}}}
 * </pre>
 *
 * Triple braces are needed for JSON and free text, double braces HTML-escape.
 *
 * @see com.medimax.assistant.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
