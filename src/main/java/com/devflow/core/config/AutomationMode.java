package com.devflow.core.config;

/**
 * How far the assistant may act on its own.
 */
public enum AutomationMode {
    /** No automation. */
    OFF,
    /** Observe and learn patterns only. */
    LEARNING,
    /** Suggest actions but require approval. */
    ASSISTED,
    /** Execute actions automatically, subject to the safety gate. */
    AUTONOMOUS
}
