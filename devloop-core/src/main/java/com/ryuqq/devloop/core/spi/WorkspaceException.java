package com.ryuqq.devloop.core.spi;

/**
 * Failure of the workspace backend (git process, filesystem).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class WorkspaceException extends RuntimeException {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
