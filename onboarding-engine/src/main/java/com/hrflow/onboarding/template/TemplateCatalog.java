package com.hrflow.onboarding.template;

import com.hrflow.onboarding.engine.TemplateNotFoundException;
import com.hrflow.onboarding.template.TemplateProperties.StepDefinition;
import com.hrflow.onboarding.template.TemplateProperties.TemplateDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of onboarding templates.
 *
 * Templates come from configuration and are checked once at startup, so a
 * broken template stops the application instead of producing broken
 * workflows later:
 * <ul>
 *   <li>at least one step, every step named and staged;</li>
 *   <li>step names unique within the template;</li>
 *   <li>{@code requires} may only name steps declared earlier;</li>
 *   <li>expected days not negative.</li>
 * </ul>
 */
@Component
public class TemplateCatalog {

    private static final Logger log = LoggerFactory.getLogger(TemplateCatalog.class);

    private final Map<String, TemplateDefinition> templates = new ConcurrentHashMap<>();

    public TemplateCatalog(TemplateProperties properties) {
        properties.templates().forEach((id, definition) -> {
            validate(id, definition);
            templates.put(id, definition);
            log.info("Registered onboarding template '{}' ({} steps, {} expected days)",
                    id, definition.steps().size(), definition.expectedDays());
        });
        if (templates.isEmpty()) {
            log.warn("No onboarding templates configured under 'onboarding.templates'");
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public TemplateDefinition get(String templateId) {
        TemplateDefinition definition = templateId == null ? null : templates.get(templateId);
        if (definition == null) {
            throw new TemplateNotFoundException(templateId);
        }
        return definition;
    }

    /** Returns all registered template ids (sorted). */
    public List<String> templateIds() {
        return templates.keySet().stream().sorted().toList();
    }

    // ------------------------------------------------------------------
    // Startup validation
    // ------------------------------------------------------------------

    private static void validate(String id, TemplateDefinition definition) {
        if (definition.steps().isEmpty()) {
            throw new IllegalStateException("Template '" + id + "' has no steps");
        }
        if (definition.expectedDays() < 0) {
            throw new IllegalStateException("Template '" + id + "' has negative expected-days");
        }
        Set<String> seen = new HashSet<>();
        for (StepDefinition step : definition.steps()) {
            if (step.name() == null || step.name().isBlank()) {
                throw new IllegalStateException("Template '" + id + "' has a step without a name");
            }
            if (step.stage() == null) {
                throw new IllegalStateException("Step '" + step.name() + "' in template '" + id + "' has no stage");
            }
            for (String required : step.requires()) {
                if (!seen.contains(required)) {
                    throw new IllegalStateException("Step '" + step.name() + "' in template '" + id
                            + "' requires '" + required + "', which is not declared before it");
                }
            }
            if (!seen.add(step.name())) {
                throw new IllegalStateException("Duplicate step name '" + step.name() + "' in template '" + id + "'");
            }
        }
    }
}
