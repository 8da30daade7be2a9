package com.openforge.rxmate.agent;

import com.openforge.rxmate.llm.model.Message;

import java.util.List;

/**
 * Outcome of one turn.
 *
 * @param state                  final state
 * @param finalAssistantMessage  every text delta of the turn, concatenated
 * @param history                the caller's history plus everything the turn appended
 * @param rounds                 number of tool rounds executed
 */
public record TurnResult(
        TurnState state,
        Message finalAssistantMessage,
        List<Message> history,
        int rounds
) {}
