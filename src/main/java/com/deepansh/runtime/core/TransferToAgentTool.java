package com.deepansh.runtime.core;

import com.deepansh.runtime.tool.AgentTool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Injected into every agent of an {@link AgentCoordinator}. Executing it only records the
 * requested target; the coordinator switches agents after the current turn ends.
 */
class TransferToAgentTool implements AgentTool<TransferToAgentTool.Args> {

    static final String NAME = "transfer_to_agent";

    record Args(String targetAgent, String reason) {}

    private final AgentCoordinator coordinator;

    TransferToAgentTool(AgentCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Transfer the conversation to another specialized agent. Only do this if the user request "
                + "requires the specific expertise of the other agent.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        Map<String, Object> targetAgent = new LinkedHashMap<>();
        targetAgent.put("type", "string");
        targetAgent.put("description", "The exact name of the agent to transfer to.");
        targetAgent.put("enum", coordinator.agentNames());

        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "target_agent", targetAgent,
                        "reason", Map.of(
                                "type", "string",
                                "description", "Reason for transfer so the next agent understands context.")),
                "required", List.of("target_agent", "reason"));
    }

    @Override
    public Args parseArguments(Map<String, Object> raw) {
        Object target = raw.get("target_agent");
        if (target == null || target.toString().isBlank()) {
            throw new IllegalArgumentException("'target_agent' is required");
        }
        Object reason = raw.get("reason");
        return new Args(target.toString(), reason != null ? reason.toString() : "");
    }

    @Override
    public String execute(Args args) {
        if (!coordinator.hasAgent(args.targetAgent())) {
            return "Error: Agent \"" + args.targetAgent() + "\" not found. Available agents: "
                    + String.join(", ", coordinator.agentNames());
        }
        coordinator.requestTransfer(args.targetAgent());
        return "SUCCESS. You have transferred control to " + args.targetAgent()
                + ". Stop responding and let the new agent take over for the next request. Reason provided: "
                + args.reason();
    }
}
