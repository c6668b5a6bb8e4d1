package com.deepansh.runtime.core;

import com.deepansh.runtime.model.AgentCheckpoint;
import com.deepansh.runtime.model.AgentResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Routes user turns to one of several agents that share a memory.
 *
 * The first agent is active at start. Every agent gets a {@code transfer_to_agent} tool;
 * calling it only records a pending target, and the switch happens once the current
 * turn has finished. Because memory is shared, the new agent sees the whole history.
 */
@Slf4j
public class AgentCoordinator {

    private final Map<String, AgentLoop> agents = new LinkedHashMap<>();
    private final AtomicReference<String> pendingTransfer = new AtomicReference<>();
    private volatile AgentLoop active;

    public AgentCoordinator(List<AgentLoop> agentList) {
        if (agentList == null || agentList.isEmpty()) {
            throw new IllegalArgumentException("AgentCoordinator requires at least one agent");
        }
        for (AgentLoop agent : agentList) {
            if (agents.put(agent.getName(), agent) != null) {
                log.warn("Agent [{}] defined twice, keeping the latest", agent.getName());
            }
        }
        active = agentList.get(0);

        TransferToAgentTool transferTool = new TransferToAgentTool(this);
        agents.values().forEach(agent -> agent.addTool(transferTool));
        log.info("Coordinator ready [agents={}, active={}]", agents.keySet(), active.getName());
    }

    public AgentLoop getActiveAgent() {
        return active;
    }

    public List<String> agentNames() {
        return List.copyOf(agents.keySet());
    }

    public boolean hasAgent(String name) {
        return agents.containsKey(name);
    }

    /** Records a handoff to take effect after the current turn. Unknown names are ignored. */
    void requestTransfer(String targetAgent) {
        if (agents.containsKey(targetAgent)) {
            pendingTransfer.set(targetAgent);
            log.info("Transfer requested [from={}, to={}]", active.getName(), targetAgent);
        }
    }

    public AgentResponse run(String prompt, CancellationToken token) {
        try {
            return active.run(prompt, token);
        } finally {
            applyPendingTransfer();
        }
    }

    public AgentResponse resume(AgentCheckpoint checkpoint, CancellationToken token) {
        try {
            return active.resume(checkpoint, token);
        } finally {
            applyPendingTransfer();
        }
    }

    /** The transfer is applied once the stream is exhausted or closed. */
    public Stream<AgentResponse> runStreaming(String prompt, CancellationToken token) {
        return watch(active.runStreaming(prompt, token, null));
    }

    public Stream<AgentResponse> resumeStreaming(AgentCheckpoint checkpoint, CancellationToken token) {
        return watch(active.runStreaming(null, token, checkpoint));
    }

    private Stream<AgentResponse> watch(Stream<AgentResponse> inner) {
        Iterator<AgentResponse> it = inner.iterator();
        Iterator<AgentResponse> watching = new Iterator<>() {
            @Override
            public boolean hasNext() {
                boolean more = it.hasNext();
                if (!more) {
                    applyPendingTransfer();
                }
                return more;
            }

            @Override
            public AgentResponse next() {
                return it.next();
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(watching, Spliterator.ORDERED), false)
                .onClose(() -> {
                    inner.close();
                    applyPendingTransfer();
                });
    }

    private void applyPendingTransfer() {
        String target = pendingTransfer.getAndSet(null);
        if (target != null) {
            AgentLoop previous = active;
            active = agents.get(target);
            log.info("Active agent switched [from={}, to={}]", previous.getName(), target);
        }
    }
}
