package com.flowkeeper.core.substrate;

/**
 * Thrown by an orchestration to end the current run and start a new one under
 * the same execution id, with {@link #nextInput()} as its input.
 * <p>
 * The host catches it, releases the finished run's history and re-invokes the
 * orchestration. Observers see one execution.
 */
public class ContinueAsNewException extends RuntimeException {

    private final transient Object nextInput;

    public ContinueAsNewException(Object nextInput) {
        super("continue-as-new", null, false, false);
        this.nextInput = nextInput;
    }

    public Object nextInput() {
        return nextInput;
    }
}
