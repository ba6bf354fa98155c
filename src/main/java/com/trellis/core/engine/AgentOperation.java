package com.trellis.core.engine;

/**
 * A unit of agent work run by {@link ExecutionSession#execute}. Any exception counts
 * as a failed attempt.
 */
@FunctionalInterface
public interface AgentOperation<T> {

    T execute() throws Exception;
}
