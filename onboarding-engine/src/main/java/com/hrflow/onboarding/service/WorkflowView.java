package com.hrflow.onboarding.service;

import com.hrflow.onboarding.employee.EmployeeSummary;
import com.hrflow.onboarding.engine.ProgressSnapshot;
import com.hrflow.onboarding.model.DocumentRecord;
import com.hrflow.onboarding.model.ExceptionRecord;
import com.hrflow.onboarding.model.Stage;
import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.model.WorkflowInstance;

import java.util.List;
import java.util.Map;

/**
 * Everything the workflow detail view needs, materialised inside the read
 * transaction so callers never touch a lazy collection.
 *
 * @param employee attached after the read transaction; null when the
 *                 employee directory could not be reached
 */
public record WorkflowView(
        WorkflowInstance              workflow,
        List<StepRecord>              steps,
        Map<Stage, List<StepRecord>>  stepsByStage,
        List<ExceptionRecord>         exceptions,
        List<DocumentRecord>          documents,
        ProgressSnapshot              progress,
        EmployeeSummary               employee
) {
    public WorkflowView withEmployee(EmployeeSummary employee) {
        return new WorkflowView(workflow, steps, stepsByStage, exceptions, documents, progress, employee);
    }
}
