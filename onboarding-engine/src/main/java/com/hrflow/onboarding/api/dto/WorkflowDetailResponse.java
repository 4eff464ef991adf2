package com.hrflow.onboarding.api.dto;

import com.hrflow.onboarding.employee.EmployeeSummary;
import com.hrflow.onboarding.model.StepRecord;
import com.hrflow.onboarding.service.WorkflowView;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for GET /workflows/{id}.
 *
 * stepsByStage is keyed by stage code in stage order and lists step ids, so
 * each step is serialised once. employee is null when the employee directory
 * could not be reached; employeeId is always present.
 */
public record WorkflowDetailResponse(
        WorkflowResponse          workflow,
        EmployeeSummary           employee,
        List<StepResponse>        steps,
        Map<String, List<UUID>>   stepsByStage,
        List<ExceptionResponse>   exceptions,
        List<DocumentResponse>    documents,
        ProgressResponse          progress
) {
    public static WorkflowDetailResponse from(WorkflowView view) {
        Map<String, List<UUID>> byStage = new LinkedHashMap<>();
        view.stepsByStage().forEach((stage, steps) ->
                byStage.put(stage.code(), steps.stream().map(StepRecord::getId).toList()));
        return new WorkflowDetailResponse(
                WorkflowResponse.from(view.workflow()),
                view.employee(),
                view.steps().stream().map(StepResponse::from).toList(),
                byStage,
                view.exceptions().stream().map(ExceptionResponse::from).toList(),
                view.documents().stream().map(DocumentResponse::from).toList(),
                ProgressResponse.from(view.progress())
        );
    }
}
