package dev.agentsdk.claude.types.content;

/**
 * Base interface for message content blocks.
 */
public interface ContentBlock {

    String getType();
}
