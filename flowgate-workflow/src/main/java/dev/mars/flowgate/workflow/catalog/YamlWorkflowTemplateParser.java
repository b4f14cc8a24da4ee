/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.flowgate.workflow.catalog;

import dev.mars.flowgate.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses workflow template definitions from YAML.
 *
 * <pre>
 * templates:
 *   automated_deployment:
 *     description: Build, test, approve and deploy
 *     steps:
 *       - eventType: build_triggered
 *         description: Build started
 *       - eventType: hitl_required
 *         description: Approval for deployment
 *         approvalGate: true
 * </pre>
 *
 * A template may also be given directly as its list of steps. All problems in a document
 * are collected and reported together in one {@link ValidationException}. Unknown keys are
 * ignored with a warning.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class YamlWorkflowTemplateParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowTemplateParser.class);

    private static final Set<String> TEMPLATE_KEYS = Set.of("description", "steps");
    private static final Set<String> STEP_KEYS = Set.of("eventType", "description", "approvalGate");

    private final Yaml yaml;

    public YamlWorkflowTemplateParser() {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
    }

    public List<WorkflowTemplate> parse(Path yamlFile) throws ValidationException {
        try {
            String content = Files.readString(yamlFile);
            return parseFromString(content);
        } catch (IOException e) {
            throw new ValidationException("Failed to read template file: " + yamlFile, e);
        }
    }

    public List<WorkflowTemplate> parse(InputStream input) throws ValidationException {
        try {
            return parseFromString(new String(input.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ValidationException("Failed to read template definitions", e);
        }
    }

    public List<WorkflowTemplate> parseFromString(String yamlContent) throws ValidationException {
        return parseFromString(yamlContent, new ValidationResult());
    }

    /**
     * Parses {@code yamlContent}, collecting its errors and warnings into {@code result}.
     *
     * @throws ValidationException if the document has any error
     */
    public List<WorkflowTemplate> parseFromString(String yamlContent, ValidationResult result) throws ValidationException {
        Object loaded;
        try {
            loaded = yaml.load(yamlContent);
        } catch (YAMLException e) {
            throw new ValidationException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new ValidationException("Empty or invalid template definitions");
        }

        Map<String, Object> templatesMap = getMapValue(asMap(loaded), "templates");
        if (templatesMap == null) {
            throw new ValidationException("Missing 'templates' section");
        }

        List<WorkflowTemplate> templates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : templatesMap.entrySet()) {
            WorkflowTemplate template = parseTemplate(String.valueOf(entry.getKey()), entry.getValue(), result);
            if (template != null) {
                templates.add(template);
            }
        }

        result.getWarnings().forEach(warning -> logger.warn("Workflow templates: {}", warning));
        if (!result.isValid()) {
            throw new ValidationException("Invalid workflow templates", result.getErrorMessages());
        }
        return templates;
    }

    /**
     * Validates a template built in code with the same rules the parser applies.
     */
    public ValidationResult validate(WorkflowTemplate template) {
        ValidationResult result = new ValidationResult();
        String path = "templates." + template.getName();
        if (template.getName().isBlank()) {
            result.addError(path, "Template name cannot be empty");
        }
        if (template.getSteps().isEmpty()) {
            result.addError(path + ".steps", "Template must have at least one step");
        }
        Map<String, Integer> publishedBy = new HashMap<>();
        for (int i = 0; i < template.getSteps().size(); i++) {
            StepSpec step = template.getSteps().get(i);
            if (step.eventType().isBlank()) {
                result.addError(path + ".steps[" + i + "].eventType", "Event type is required");
                continue;
            }
            if (step.approvalGate()) {
                continue;
            }
            Integer earlier = publishedBy.putIfAbsent(step.eventType(), i);
            if (earlier != null) {
                result.addWarning(path + ".steps[" + i + "].eventType", "Event type '" + step.eventType()
                        + "' is already published by steps[" + earlier + "]");
            }
        }
        return result;
    }

    private WorkflowTemplate parseTemplate(String name, Object value, ValidationResult result) {
        String path = "templates." + name;
        if (name.isBlank()) {
            result.addError(path, "Template name cannot be empty");
            return null;
        }

        String description = "";
        List<Object> stepsList;
        if (value instanceof List) {
            stepsList = asList(value);
        } else if (value instanceof Map) {
            Map<String, Object> templateMap = asMap(value);
            warnUnknownKeys(templateMap, TEMPLATE_KEYS, path, result);
            description = getStringValue(templateMap, "description", "");
            Object steps = templateMap.get("steps");
            stepsList = steps instanceof List ? asList(steps) : null;
        } else {
            stepsList = null;
        }

        if (stepsList == null || stepsList.isEmpty()) {
            result.addError(path + ".steps", "Template must have at least one step");
            return null;
        }

        List<StepSpec> steps = new ArrayList<>();
        for (int i = 0; i < stepsList.size(); i++) {
            String stepPath = path + ".steps[" + i + "]";
            Object stepValue = stepsList.get(i);
            if (!(stepValue instanceof Map)) {
                result.addError(stepPath, "Step must be a mapping");
                continue;
            }
            Map<String, Object> stepMap = asMap(stepValue);
            warnUnknownKeys(stepMap, STEP_KEYS, stepPath, result);
            String eventType = getStringValue(stepMap, "eventType", null);
            if (eventType == null || eventType.isBlank()) {
                result.addError(stepPath + ".eventType", "Event type is required");
                continue;
            }
            steps.add(new StepSpec(eventType.trim(),
                    getStringValue(stepMap, "description", eventType),
                    getBooleanValue(stepMap, "approvalGate", false)));
        }
        return steps.size() == stepsList.size() ? new WorkflowTemplate(name, description, steps) : null;
    }

    private void warnUnknownKeys(Map<String, Object> data, Set<String> known, String path, ValidationResult result) {
        for (Object key : data.keySet()) {
            if (!known.contains(String.valueOf(key))) {
                result.addWarning(path + "." + key, "Unknown key ignored");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private List<Object> asList(Object value) {
        return (List<Object>) value;
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? asMap(value) : null;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }
}
