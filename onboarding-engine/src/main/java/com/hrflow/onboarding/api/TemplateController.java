package com.hrflow.onboarding.api;

import com.hrflow.onboarding.api.dto.TemplateResponse;
import com.hrflow.onboarding.template.TemplateCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /templates  lists the templates a workflow can be created from.
 */
@RestController
@RequestMapping("/templates")
public class TemplateController {

    private final TemplateCatalog catalog;

    public TemplateController(TemplateCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<TemplateResponse> list() {
        return catalog.templateIds().stream()
                .map(id -> TemplateResponse.from(id, catalog.get(id)))
                .toList();
    }
}
