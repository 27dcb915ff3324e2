package com.taskledger.core.state;

import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Graph state for one planning or execution step.
 * <p>
 * Only identifiers and the outcome of the step travel through the graph; the durable
 * progress itself lives in the repositories and the key-value store.
 */
public class LedgerState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry("planId",         Channels.base(() -> "")),
        Map.entry("threadId",       Channels.base(() -> "")),
        Map.entry("batchIndex",     Channels.base(() -> 0)),
        Map.entry("taskIndex",      Channels.base(() -> 0)),
        Map.entry("plannedTaskIds", Channels.base((Supplier<List<String>>) List::of)),
        Map.entry("lastTaskId",     Channels.base(() -> "")),
        Map.entry("lastOutcome",    Channels.base(() -> "")),
        Map.entry("planFinished",   Channels.base(() -> false))
    );

    public LedgerState(Map<String, Object> initData) {
        super(initData);
    }

    public String planId() {
        return this.<String>value("planId").orElse("");
    }

    /** Worker thread id; falls back to the plan id. */
    public String threadId() {
        String threadId = this.<String>value("threadId").orElse("");
        return threadId.isBlank() ? planId() : threadId;
    }

    public int batchIndex() {
        return this.<Integer>value("batchIndex").orElse(0);
    }

    public int taskIndex() {
        return this.<Integer>value("taskIndex").orElse(0);
    }

    public List<String> plannedTaskIds() {
        return this.<List<String>>value("plannedTaskIds").orElse(List.of());
    }

    public String lastTaskId() {
        return this.<String>value("lastTaskId").orElse("");
    }

    public StepOutcome lastOutcome() {
        String raw = this.<String>value("lastOutcome").orElse("");
        return raw.isEmpty() ? null : StepOutcome.valueOf(raw);
    }

    public boolean planFinished() {
        return this.<Boolean>value("planFinished").orElse(false);
    }
}
