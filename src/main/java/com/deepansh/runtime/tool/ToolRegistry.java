package com.deepansh.runtime.tool;

import com.deepansh.runtime.model.ToolCall;
import com.deepansh.runtime.observability.LogRedactor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Tool set of one agent, indexed by name for dispatch.
 *
 * Dispatch never throws: unknown tools, unconfirmed sensitive calls, timeouts and
 * tool exceptions all come back as observation strings so the agent loop always
 * continues and the model decides what to do next.
 */
@Slf4j
public class ToolRegistry {

    public static final String CONFIRMATION_FLAG = "confirmed";

    private final Map<String, AgentTool<?>> tools = new LinkedHashMap<>();
    private final ToolArgumentParser argumentParser;
    private final AsyncTaskExecutor executor;
    private final LogRedactor redactor;

    public ToolRegistry(Collection<? extends AgentTool<?>> initialTools,
                        ToolArgumentParser argumentParser,
                        AsyncTaskExecutor executor,
                        LogRedactor redactor) {
        this.argumentParser = argumentParser;
        this.executor = executor;
        this.redactor = redactor;
        initialTools.forEach(this::register);
    }

    public synchronized void register(AgentTool<?> tool) {
        if (tools.put(tool.getName(), tool) != null) {
            log.warn("Tool [{}] registered twice, keeping the latest", tool.getName());
        }
        log.info("Registered tool: [{}]", tool.getName());
    }

    public synchronized List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(ToolDefinition::from)
                .toList();
    }

    public synchronized boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public synchronized Set<String> toolNames() {
        return Set.copyOf(tools.keySet());
    }

    public synchronized int toolCount() {
        return tools.size();
    }

    /**
     * Decodes the raw arguments, resolves the tool, applies its confirmation policy
     * and runs it on the tool executor bounded by the tool's timeout.
     */
    public ToolExecution dispatch(ToolCall toolCall) {
        long start = System.currentTimeMillis();
        String name = toolCall.getToolName();
        AgentTool<?> tool;
        synchronized (this) {
            tool = tools.get(name);
        }

        if (tool == null) {
            String msg = String.format(
                    "Error: Tool '%s' is not registered. Available tools: %s", name, toolNames());
            log.warn(msg);
            return new ToolExecution(name, msg, null, System.currentTimeMillis() - start);
        }

        Map<String, Object> raw = argumentParser.parse(toolCall.getArguments());
        log.info("Executing tool: [{}] with args: {}", name, redactor.redact(raw));

        try {
            String output = invoke(tool, raw);
            log.debug("Tool [{}] returned: {}", name, output);
            return new ToolExecution(name, output, null, System.currentTimeMillis() - start);
        } catch (TimeoutException e) {
            String msg = "Error executing tool: " + name + " timed out after "
                    + tool.getTimeout().toMillis() + "ms";
            log.warn(msg);
            return new ToolExecution(name, msg, e, System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ToolExecution(name, "Error executing tool: interrupted", e,
                    System.currentTimeMillis() - start);
        } catch (Exception e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Tool [{}] failed: {}", name, cause.getMessage(), cause);
            return new ToolExecution(name, "Error executing tool: " + describe(cause), cause,
                    System.currentTimeMillis() - start);
        }
    }

    private <A> String invoke(AgentTool<A> tool, Map<String, Object> raw) throws Exception {
        A arguments = tool.parseArguments(raw);

        if (tool.requiresConfirmation(arguments) && !isConfirmed(raw)) {
            log.info("Tool [{}] requires confirmation, not executing", tool.getName());
            return confirmationRequired(tool);
        }

        Future<String> future = executor.submit(() -> tool.execute(arguments));
        try {
            return future.get(tool.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    static boolean isConfirmed(Map<String, Object> raw) {
        Object flag = raw.get(CONFIRMATION_FLAG);
        return Boolean.TRUE.equals(flag) || "true".equalsIgnoreCase(String.valueOf(flag));
    }

    private static String confirmationRequired(AgentTool<?> tool) {
        return "CONFIRMATION_REQUIRED: This operation (" + tool.getDescription().strip()
                + ") is sensitive. Ask the user to confirm, then call " + tool.getName()
                + " again with \"" + CONFIRMATION_FLAG + "\": true.";
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
