package dev.agentsdk.claude.types.messages;

/**
 * Base interface for all message types.
 */
public interface Message {

    /**
     * Get the type of this message.
     */
    String getType();
}
