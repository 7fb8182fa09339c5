package com.sprintsync.workflow.service;

import com.sprintsync.workflow.model.TaskStatus;
import com.sprintsync.workflow.model.TransitionEdge;

import java.util.List;

/** An organization's statuses (active and inactive) and all its edges. */
public record WorkflowView(List<TaskStatus> statuses, List<TransitionEdge> transitions) {}
