package com.brainstorm.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.brainstorm.orchestrator.exception.ConfigException;
import com.brainstorm.orchestrator.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompts from YAML files and renders them with variables.
 *
 * <pre>
 * String prompt = promptLibrary.render("claim-verifier", Map.of(
 *     "userMessage", "We'll launch in March",
 *     "candidate", recorderOutput
 * ));
 * </pre>
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources("classpath:prompts/*.yaml");
        } catch (IOException e) {
            throw new ConfigException("Prompt library initialization failed: " + e.getMessage());
        }

        for (Resource resource : resources) {
            try (InputStream in = resource.getInputStream()) {
                PromptTemplate template = yamlMapper.readValue(in, PromptTemplate.class);
                if (template.getName() == null) {
                    throw new ConfigException("Prompt file " + resource.getFilename() + " has no name");
                }
                templates.put(template.getName(), template);
                log.debug("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            } catch (IOException e) {
                throw new ConfigException("Unreadable prompt file " + resource.getFilename() + ": " + e.getMessage());
            }
        }

        log.info("📚 Loaded {} prompt templates", templates.size());
    }

    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.computeIfAbsent(templateName, this::compile);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public Set<String> templateNames() {
        return Set.copyOf(templates.keySet());
    }

    private Mustache compile(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
        return mustacheFactory.compile(new StringReader(fullPrompt), templateName);
    }
}
