package com.example.charging.service;

import com.example.charging.dto.QueueCommand;
import com.example.charging.model.LeaveReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decodes button identifiers of the form {@code ACTION:resourceId:userId[:extra]}.
 */
@Slf4j
@Component
public class QueueCommandParser {

    private static final Pattern USER_ID = Pattern.compile("[\\p{Alnum}_+\\-.]{1,32}");

    public Optional<QueueCommand> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String[] parts = raw.trim().split(":", -1);
        if (parts.length < 3 || parts.length > 4) {
            log.debug("Command '{}' has {} parts", raw, parts.length);
            return Optional.empty();
        }

        QueueCommand.Action action = parseAction(parts[0]);
        Long resourceId = parseResourceId(parts[1]);
        String userId = parts[2].trim();
        String extra = parts.length == 4 ? blankToNull(parts[3]) : null;

        if (action == null || resourceId == null || !isValidUserId(userId)) {
            log.debug("Command '{}' rejected: action={}, resource={}, user={}", raw, action, resourceId, userId);
            return Optional.empty();
        }
        if (extra != null && !extraValid(action, extra)) {
            log.debug("Command '{}' rejected: bad argument '{}' for {}", raw, extra, action);
            return Optional.empty();
        }

        return Optional.of(new QueueCommand(action, resourceId, userId, extra));
    }

    /** Ids fit the 32-character user column and carry no separators. */
    public boolean isValidUserId(String userId) {
        return userId != null && USER_ID.matcher(userId).matches();
    }

    private QueueCommand.Action parseAction(String token) {
        String normalized = token.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (QueueCommand.Action action : QueueCommand.Action.values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        return null;
    }

    private Long parseResourceId(String token) {
        try {
            long id = Long.parseLong(token.trim());
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private boolean extraValid(QueueCommand.Action action, String extra) {
        return switch (action) {
            case LEAVE -> leaveReason(extra) != null;
            case RESERVE -> isPositiveInt(extra);
            case START_SESSION, STOP_SESSION -> isDecimal(extra);
            // these take no argument
            case JOIN, EXTEND, STATUS -> false;
        };
    }

    static LeaveReason leaveReason(String token) {
        try {
            return LeaveReason.valueOf(token.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private boolean isPositiveInt(String token) {
        try {
            return Integer.parseInt(token) > 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private boolean isDecimal(String token) {
        try {
            return new BigDecimal(token).signum() >= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private String blankToNull(String value) {
        String trimmed = value.trim();
        return trimmed.isBlank() ? null : trimmed;
    }
}
