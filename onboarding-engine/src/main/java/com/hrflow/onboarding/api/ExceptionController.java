package com.hrflow.onboarding.api;

import com.hrflow.onboarding.api.dto.ExceptionResponse;
import com.hrflow.onboarding.api.dto.ResolveExceptionRequest;
import com.hrflow.onboarding.service.WorkflowEngine;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * POST /exceptions/{id}/resolve  closes an open exception.
 *
 * Exceptions are raised through their workflow (see {@link WorkflowController})
 * but resolved by id alone, since the resolver usually only has the id.
 */
@RestController
@RequestMapping("/exceptions")
public class ExceptionController {

    private final WorkflowEngine engine;

    public ExceptionController(WorkflowEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/{id}/resolve")
    public ExceptionResponse resolve(@PathVariable UUID id, @RequestBody ResolveExceptionRequest req) {
        return ExceptionResponse.from(engine.resolveException(id, req.resolvedBy(), req.note()));
    }
}
