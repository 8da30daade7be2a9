package com.openforge.rxmate.llm.model;

import java.util.List;

/**
 * A completed model reply. The streaming client folds every chunk of a
 * response into one of these; only the first choice is meaningful.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices
) {

    public static ChatResponse of(Message assistantMessage) {
        return assembled(null, null, assistantMessage, null);
    }

    public static ChatResponse assembled(String id, String model, Message assistantMessage, String finishReason) {
        return new ChatResponse(id, model, List.of(new Choice(0, assistantMessage, finishReason)));
    }

    /**
     * @throws IllegalStateException when the provider answered without any choice
     */
    public Message firstMessage() {
        Message message = choices == null || choices.isEmpty() ? null : choices.get(0).message();
        if (message == null) {
            throw new IllegalStateException("Completion " + id + " carried no assistant message");
        }
        return message;
    }

    public record Choice(int index, Message message, String finishReason) {
    }
}
