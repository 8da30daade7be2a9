package com.openforge.rxmate.tool;

import java.util.Map;

/**
 * Uniform calling convention for domain tools.
 *
 * Implementations return a structured result and report domain failures as
 * an {@code "error"} entry in it (e.g. {@code NOT_FOUND}, {@code EXPIRED});
 * they must not throw past their own boundary.
 */
@FunctionalInterface
public interface ToolHandler {

    Map<String, Object> handle(ToolArguments arguments);
}
