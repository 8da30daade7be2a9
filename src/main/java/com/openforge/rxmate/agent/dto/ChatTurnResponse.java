package com.openforge.rxmate.agent.dto;

import com.openforge.rxmate.agent.TurnResult;
import com.openforge.rxmate.agent.TurnState;
import com.openforge.rxmate.agent.event.AgentEvent;
import com.openforge.rxmate.llm.model.Message;

import java.util.List;

/**
 * Non-streaming rendition of one turn.
 *
 * @param message   the assistant text of the whole turn
 * @param messages  the extended history, to be sent back with the next turn
 * @param events    every event the turn produced, in order
 */
public record ChatTurnResponse(
        Message message,
        List<Message> messages,
        List<AgentEvent> events,
        TurnState state,
        int rounds
) {

    public static ChatTurnResponse of(TurnResult result, List<AgentEvent> events) {
        return new ChatTurnResponse(result.finalAssistantMessage(), result.history(),
                events, result.state(), result.rounds());
    }
}
