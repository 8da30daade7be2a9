package com.openforge.rxmate.llm;

/**
 * Receives incremental output while a completion is being streamed.
 * Callbacks run synchronously on the thread reading the provider stream,
 * in the order the fragments arrive.
 */
public interface CompletionListener {

    /** A non-empty piece of assistant text. */
    void onText(String text);

    /**
     * A fragment of the JSON arguments of the tool call at {@code index}.
     * {@code callId} may still be empty if the provider has not sent it yet.
     */
    default void onToolArguments(int index, String callId, String fragment) {
    }
}
