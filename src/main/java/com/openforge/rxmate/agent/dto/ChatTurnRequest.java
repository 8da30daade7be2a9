package com.openforge.rxmate.agent.dto;

import com.openforge.rxmate.llm.model.Message;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/chat and /api/chat/stream.
 *
 * @param messages  the whole conversation so far, newest user message last;
 *                  the server keeps no history between turns
 */
public record ChatTurnRequest(

        @NotEmpty(message = "messages must not be empty")
        @Size(max = 500, message = "messages must not exceed 500 entries")
        List<@Valid Message> messages
) {}
