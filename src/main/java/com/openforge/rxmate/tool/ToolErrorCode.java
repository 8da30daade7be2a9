package com.openforge.rxmate.tool;

/**
 * Error codes produced by the registry itself. Domain handlers use their own
 * codes, which the registry passes through untouched.
 */
public enum ToolErrorCode {

    /** No tool is registered under the requested name. */
    UNKNOWN_TOOL,

    /** A declared required argument is absent or null. */
    MISSING_REQUIRED_ARGUMENT,

    /** The handler did not return within agent.tools.timeout. */
    TOOL_TIMEOUT,

    /** The handler broke its contract and threw. */
    TOOL_FAILED
}
