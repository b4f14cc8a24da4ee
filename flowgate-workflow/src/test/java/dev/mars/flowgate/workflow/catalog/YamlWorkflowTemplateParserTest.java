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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link YamlWorkflowTemplateParser}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class YamlWorkflowTemplateParserTest {

    private YamlWorkflowTemplateParser parser;

    @BeforeEach
    void setUp() {
        parser = new YamlWorkflowTemplateParser();
    }

    @Test
    @DisplayName("Parses templates with descriptions and approval gates")
    void parsesTemplates() throws Exception {
        String yaml = """
                templates:
                  release:
                    description: Release pipeline
                    steps:
                      - eventType: build_triggered
                        description: Build started
                      - eventType: hitl_required
                        description: Approve release
                        approvalGate: true
                """;

        List<WorkflowTemplate> templates = parser.parseFromString(yaml);

        assertEquals(1, templates.size());
        WorkflowTemplate release = templates.get(0);
        assertEquals("release", release.getName());
        assertEquals("Release pipeline", release.getDescription());
        assertEquals(List.of(StepSpec.step("build_triggered", "Build started"),
                StepSpec.gate("hitl_required", "Approve release")), release.getSteps());
        assertEquals(1, release.getGateCount());
    }

    @Test
    @DisplayName("Accepts a bare list of steps and defaults the description to the event type")
    void bareStepList() throws Exception {
        String yaml = """
                templates:
                  quick:
                    - eventType: new_task
                """;

        WorkflowTemplate quick = parser.parseFromString(yaml).get(0);

        assertEquals("new_task", quick.getSteps().get(0).description());
        assertFalse(quick.getSteps().get(0).approvalGate());
    }

    @Test
    @DisplayName("Reports every problem in one exception")
    void collectsAllErrors() {
        String yaml = """
                templates:
                  empty:
                    steps: []
                  broken:
                    steps:
                      - description: no event type
                      - just a string
                """;

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parseFromString(yaml));

        assertThat(e.getErrors()).hasSize(3);
        assertThat(String.join("\n", e.getErrors()))
                .contains("templates.empty.steps")
                .contains("templates.broken.steps[0].eventType")
                .contains("templates.broken.steps[1]");
    }

    @Test
    @DisplayName("Rejects documents without a templates section")
    void missingTemplatesSection() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> parser.parseFromString("workflows: {}"));
        assertEquals("Missing 'templates' section", e.getMessage());
    }

    @Test
    @DisplayName("Wraps YAML syntax errors")
    void syntaxError() {
        assertThrows(ValidationException.class, () -> parser.parseFromString("templates: [unclosed"));
    }

    @Test
    @DisplayName("Validates templates built in code")
    void validatesCodeTemplates() {
        ValidationResult result = parser.validate(new WorkflowTemplate("nothing", "", List.of()));

        assertFalse(result.isValid());
        assertEquals(1, result.getErrors().size());
    }

    @Test
    @DisplayName("Unknown keys are ignored with a warning")
    void unknownKeysWarn() throws Exception {
        String yaml = """
                templates:
                  release:
                    descripton: Release pipeline
                    steps:
                      - eventType: build_triggered
                      - eventType: hitl_required
                        aprovalGate: true
                """;
        ValidationResult result = new ValidationResult();

        List<WorkflowTemplate> templates = parser.parseFromString(yaml, result);

        assertEquals(1, templates.size());
        assertFalse(templates.get(0).getSteps().get(1).approvalGate());
        assertTrue(result.isValid());
        assertTrue(result.hasWarnings());
        assertThat(result.getWarnings())
                .extracting(ValidationResult.ValidationIssue::getFieldPath)
                .containsExactly("templates.release.descripton", "templates.release.steps[1].aprovalGate");
        assertThat(result.getWarnings())
                .allMatch(issue -> issue.getSeverity() == ValidationResult.ValidationIssue.Severity.WARNING);
    }

    @Test
    @DisplayName("A step event type published twice in one template is a warning, repeated gates are not")
    void duplicateEventTypesWarn() {
        WorkflowTemplate template = new WorkflowTemplate("twice", "", List.of(
                StepSpec.step("build_triggered", "Build"),
                StepSpec.gate("hitl_required", "First approval"),
                StepSpec.step("build_triggered", "Rebuild"),
                StepSpec.gate("hitl_required", "Second approval")));

        ValidationResult result = parser.validate(template);

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());
        assertEquals("templates.twice.steps[2].eventType", result.getWarnings().get(0).getFieldPath());
        assertThat(result.getWarnings().get(0).getMessage()).contains("steps[0]");
        assertFalse(parser.validate(new WorkflowTemplate("once", "", List.of(StepSpec.step("a", "A")))).hasWarnings());
    }
}
