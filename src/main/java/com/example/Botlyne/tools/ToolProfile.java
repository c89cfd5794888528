package com.example.Botlyne.tools;

/**
 * Tool sets a generation call may be given.
 */
public enum ToolProfile {
    /** No tools; used by the review agent. */
    NONE,
    /** Tools available to the primary drafting agent. */
    ASSISTANT
}
