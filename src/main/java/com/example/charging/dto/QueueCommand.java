package com.example.charging.dto;

/**
 * A front-end action, decoded once from its button identifier.
 *
 * @param extra action-specific argument (TTL minutes for RESERVE, leave reason for LEAVE), may be null
 */
public record QueueCommand(Action action, Long resourceId, String userId, String extra) {

    public enum Action {
        JOIN, LEAVE, RESERVE, EXTEND, START_SESSION, STOP_SESSION, STATUS
    }
}
