package com.taskgraph.actions;

import com.taskgraph.core.exception.TaskFailureException;

/**
 * Domain failure raised by action handlers. Stored on the result as-is and
 * cascaded to dependents like any other task failure.
 */
public class ActionException extends TaskFailureException {

    public static final String ERROR_CODE = "ACTION_FAILED";
    public static final String MISSING_OUTPUT_CODE = "MISSING_OUTPUT";

    private final String actionKey;

    public ActionException(String actionKey, String errorCode, String message) {
        super(errorCode, message);
        this.actionKey = actionKey;
    }

    public ActionException(String actionKey, String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.actionKey = actionKey;
    }

    public String getActionKey() {
        return actionKey;
    }

    public static ActionException failed(String actionKey, String message) {
        return new ActionException(actionKey, ERROR_CODE, String.format("Action %s failed: %s", actionKey, message));
    }

    public static ActionException failed(String actionKey, String message, Throwable cause) {
        return new ActionException(actionKey, ERROR_CODE,
            String.format("Action %s failed: %s", actionKey, message), cause);
    }

    /**
     * A dependency result or one of its outputs the handler relies on is absent.
     */
    public static ActionException missingOutput(String actionKey, String dependencyKey, String outputName) {
        return new ActionException(actionKey, MISSING_OUTPUT_CODE, String.format(
            "Action %s needs output '%s' of %s, which is not available",
            actionKey, outputName, dependencyKey
        ));
    }
}
