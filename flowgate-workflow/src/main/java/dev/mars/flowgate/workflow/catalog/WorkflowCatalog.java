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

import dev.mars.flowgate.config.FlowgateConfiguration;
import dev.mars.flowgate.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of workflow templates by name.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkflowCatalog {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCatalog.class);

    public static final String BUILT_IN_RESOURCE = "workflow-templates.yaml";

    private final Map<String, WorkflowTemplate> templates = new LinkedHashMap<>();
    private final YamlWorkflowTemplateParser parser = new YamlWorkflowTemplateParser();

    /**
     * Catalog holding the built-in templates.
     */
    public static WorkflowCatalog defaults() {
        WorkflowCatalog catalog = new WorkflowCatalog();
        try (InputStream input = WorkflowCatalog.class.getClassLoader().getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Built-in template resource missing: " + BUILT_IN_RESOURCE);
            }
            catalog.registerAll(catalog.parser.parse(input));
        } catch (IOException | ValidationException e) {
            throw new IllegalStateException("Built-in workflow templates are invalid", e);
        }
        return catalog;
    }

    /**
     * Built-in templates extended or overridden by {@code flowgate.templates.file} when set.
     */
    public static WorkflowCatalog load(FlowgateConfiguration configuration) throws ValidationException {
        WorkflowCatalog catalog = defaults();
        Path extra = configuration.getTemplatesFile();
        if (extra != null) {
            catalog.loadFile(extra);
        }
        return catalog;
    }

    public void loadFile(Path yamlFile) throws ValidationException {
        List<WorkflowTemplate> loaded = parser.parse(yamlFile);
        registerAll(loaded);
        logger.info("Loaded {} workflow templates from {}", loaded.size(), yamlFile);
    }

    /**
     * Adds or replaces a template.
     *
     * @throws ValidationException if the template is malformed
     */
    public synchronized void register(WorkflowTemplate template) throws ValidationException {
        ValidationResult result = parser.validate(template);
        if (!result.isValid()) {
            throw new ValidationException("Invalid workflow template '" + template.getName() + "'", result.getErrorMessages());
        }
        result.getWarnings().forEach(warning -> logger.warn("Workflow template '{}': {}", template.getName(), warning));
        if (templates.put(template.getName(), template) != null) {
            logger.info("Replaced workflow template '{}'", template.getName());
        }
    }

    public synchronized Optional<WorkflowTemplate> get(String name) {
        return Optional.ofNullable(name == null ? null : templates.get(name));
    }

    /**
     * @throws ValidationException if the name is empty or unknown
     */
    public WorkflowTemplate require(String name) throws ValidationException {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Workflow name cannot be empty");
        }
        return get(name).orElseThrow(() -> new ValidationException("Workflow '" + name + "' not found"));
    }

    public synchronized boolean contains(String name) {
        return templates.containsKey(name);
    }

    public synchronized List<String> names() {
        return new ArrayList<>(templates.keySet());
    }

    public synchronized List<WorkflowTemplate> templates() {
        return new ArrayList<>(templates.values());
    }

    private void registerAll(List<WorkflowTemplate> loaded) throws ValidationException {
        for (WorkflowTemplate template : loaded) {
            register(template);
        }
    }
}
