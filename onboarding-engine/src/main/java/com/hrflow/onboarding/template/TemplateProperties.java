package com.hrflow.onboarding.template;

import com.hrflow.onboarding.model.Stage;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Onboarding templates bound from {@code onboarding.templates.*} in application.yml.
 *
 * <pre>
 * onboarding:
 *   templates:
 *     standard:
 *       display-name: Standard onboarding
 *       expected-days: 30
 *       steps:
 *         - name: Send Offer Letter
 *           stage: pre-boarding
 *           integration-type: docusign
 *           due-offset-days: 2
 *         - name: Office Tour
 *           stage: day-1
 *           requires: [Send Offer Letter]
 * </pre>
 */
@ConfigurationProperties(prefix = "onboarding")
public record TemplateProperties(Map<String, TemplateDefinition> templates) {

    public TemplateProperties {
        templates = templates == null ? Map.of() : Map.copyOf(templates);
    }

    /**
     * @param expectedDays target duration of the whole onboarding; drives the on-track check
     */
    public record TemplateDefinition(
            String               displayName,
            int                  expectedDays,
            List<StepDefinition> steps) {

        public TemplateDefinition {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }
    }

    /**
     * @param dueOffsetDays days after the workflow start when the step is due; null for no due date
     * @param requires      names of earlier steps in the same template that must be done first
     */
    public record StepDefinition(
            String       name,
            String       description,
            Stage        stage,
            String       integrationType,
            Integer      dueOffsetDays,
            List<String> requires) {

        public StepDefinition {
            requires = requires == null ? List.of() : List.copyOf(requires);
        }
    }
}
