package com.medimax.assistant.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.medimax.assistant.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the agent prompts from YAML and renders them with Mustache.
 *
 * <pre>
 * String prompt = promptLibrary.render("agent-plan", Map.of(
 *     "message", "What does patient 42 take?",
 *     "tools", toolDescriptors
 * ));
 * </pre>
 */
@Slf4j
@Service
public class PromptLibraryService {

    public static final String AGENT_PLAN = "agent-plan";
    public static final String AGENT_FINAL = "agent-final";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources("classpath:prompts/*.yaml");
            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                templates.put(template.getName(), template);
                compiled.put(template.getName(), mustacheFactory.compile(
                    new StringReader(template.getSystemPrompt() + "\n\n" + template.getUserPrompt()),
                    template.getName()));
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Prompt library initialization failed", e);
        }
    }

    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public PromptTemplate getTemplate(String name) {
        return templates.get(name);
    }
}
