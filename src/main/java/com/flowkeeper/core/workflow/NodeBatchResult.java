package com.flowkeeper.core.workflow;

import java.util.List;

public record NodeBatchResult(boolean success, List<String> completedNodes, List<String> failedNodes, String error) {

    public NodeBatchResult {
        completedNodes = completedNodes != null ? List.copyOf(completedNodes) : List.of();
        failedNodes = failedNodes != null ? List.copyOf(failedNodes) : List.of();
    }
}
