package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.AgentContext;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolNodeOutput;
import me.golemcore.orchestrator.domain.model.TurnOutcome;
import me.golemcore.orchestrator.domain.system.toolloop.RoutingDecision;
import me.golemcore.orchestrator.domain.system.toolloop.ToolRoutingEngine;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Runs one conversational turn of an agent.
 *
 * <p>
 * Incoming messages are merged into the log, the model is called on the pruned
 * window, and its reply is merged. Tool calls in the reply are dispatched once
 * through the routing engine and their results merged as well. A hand-off
 * merges the command's messages and is returned to the host graph, which
 * decides which agent runs next.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentTurnService {

    private final MessageStateReducer reducer;
    private final ModelInvocationService modelInvocationService;

    public TurnOutcome runTurn(AgentContext context, List<Message> history, List<?> incoming, LlmPort llmPort,
            ToolRoutingEngine engine) {
        List<Message> state = reducer.merge(history, incoming);

        LlmResponse response = modelInvocationService.invoke(context, state, llmPort);
        Message reply = response.getMessage();
        if (!reply.isAi()) {
            throw new IllegalStateException("Provider reply must be an AI message, got " + reply.getType());
        }
        state = reducer.merge(state, List.of(reply));
        Message aiMessage = state.get(state.size() - 1);

        if (engine == null || ToolRoutingEngine.toolsCondition(state, Set.of()) == RoutingDecision.END) {
            return new TurnOutcome(state, aiMessage, null);
        }

        ToolNodeOutput output = engine.invoke(state);
        if (!output.getMessages().isEmpty()) {
            state = reducer.merge(state, output.getMessages());
        }
        if (output.hasRouting()) {
            ToolNodeOutput.ParentCommand command = output.getParentCommand();
            state = reducer.merge(state, command.messages());
            log.info("[Turn] Agent {} hands off to {}", context.getAgentId(), command.targetAgents());
            return new TurnOutcome(state, aiMessage, command);
        }
        log.debug("[Turn] Agent {}: {} tool results merged", context.getAgentId(), output.getMessages().size());
        return new TurnOutcome(state, aiMessage, null);
    }
}
