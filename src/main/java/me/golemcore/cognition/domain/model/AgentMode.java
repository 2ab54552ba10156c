package me.golemcore.cognition.domain.model;

/**
 * Coarse activity mode of the agent. Only {@link #SLEEPING} changes cycle
 * behavior indirectly, through the decisions the model makes while resting.
 */
public enum AgentMode {
    AWAKE, THINKING, REFLECTING, SLEEPING, EXPLORING
}
