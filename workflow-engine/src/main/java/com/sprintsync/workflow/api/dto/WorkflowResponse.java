package com.sprintsync.workflow.api.dto;

import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.service.WorkflowView;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Response body for GET and PUT /organizations/{orgId}/workflow: every
 * status (inactive ones included) and every edge of the organization.
 */
public record WorkflowResponse(List<StatusResponse> statuses, List<EdgeResponse> transitions) {

    public static WorkflowResponse from(WorkflowView view) {
        Map<Long, String> displayNames = view.statuses().stream()
                .collect(Collectors.toMap(TaskStatus::getId, TaskStatus::getDisplayName));
        return new WorkflowResponse(
                view.statuses().stream().map(StatusResponse::from).toList(),
                view.transitions().stream().map(e -> EdgeResponse.from(e, displayNames)).toList()
        );
    }
}
