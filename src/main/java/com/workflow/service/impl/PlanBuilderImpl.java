package com.workflow.service.impl;

import com.workflow.exception.PlanningException;
import com.workflow.model.IntentSpecification;
import com.workflow.model.Plan;
import com.workflow.model.PlanTemplate;
import com.workflow.model.Step;
import com.workflow.model.StepTemplate;
import com.workflow.service.api.PlanBuilder;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * A template-driven {@link PlanBuilder}. Each known category maps to a fixed
 * {@link PlanTemplate}; the intent's parameters are bound into every step of that template.
 * <p>
 * Planning is a pure function of the intent: no clock, no randomness, no I/O.
 */
@Service
@Slf4j
public class PlanBuilderImpl implements PlanBuilder {

    private final Map<String, PlanTemplate> templates = new LinkedHashMap<>();

    public PlanBuilderImpl() {
        this(PlanTemplates.builtIn());
    }

    PlanBuilderImpl(Collection<PlanTemplate> templates) {
        templates.forEach(t -> this.templates.put(normalize(t.category()), t));
    }

    @Override
    public Plan build(IntentSpecification intent) {
        String category = normalize(intent.category());
        PlanTemplate template = templates.get(category);
        if (template == null) {
            log.info("No workflow template for category '{}'; returning an empty plan.", intent.category());
            return Plan.empty(category);
        }

        Map<String, Object> parameters = intent.parameters();
        List<String> missing = template.requiredParameters().stream()
                .filter(name -> isBlank(parameters.get(name)))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("Planning failed for category '{}': missing {}", category, missing);
            throw new PlanningException(category, missing);
        }

        List<Step> steps = new ArrayList<>(template.steps().size());
        for (StepTemplate stepTemplate : template.steps()) {
            steps.add(new Step(stepTemplate.action(), stepTemplate.bind(parameters), steps.size()));
        }
        log.info("Built plan for category '{}' with {} step(s).", category, steps.size());
        return new Plan(category, steps);
    }

    @Override
    public Collection<PlanTemplate> categories() {
        return Collections.unmodifiableCollection(templates.values());
    }

    private static boolean isBlank(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static String normalize(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }
}
