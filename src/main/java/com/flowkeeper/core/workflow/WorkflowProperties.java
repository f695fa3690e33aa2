package com.flowkeeper.core.workflow;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where stored workflow definitions are loaded from.
 */
@Component
@ConfigurationProperties(prefix = "flowkeeper.workflows")
public class WorkflowProperties {

    /** Directory of {@code <workflowId>.json} definition files. Missing directories are ignored. */
    private String directory = "workflows";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }
}
