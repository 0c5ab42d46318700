package com.example.factcheck.permissions.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * User-triggered mutations that are gated by reputation and daily quotas.
 *
 * <p>The wire key is the snake_case name used by API clients (e.g. {@code flag_comment}).
 */
public enum ActionKind {
    ADD_COMMENT("add_comment"),
    ADD_VIDEO("add_video"),

    // Votes
    VOTE_UP("vote_up"),
    VOTE_DOWN("vote_down"),

    // Flag / approve
    APPROVE_HISTORY_ACTION("approve_history_action"),
    FLAG_HISTORY_ACTION("flag_history_action"),
    FLAG_COMMENT("flag_comment"),

    // Statements
    ADD_STATEMENT("add_statement"),
    EDIT_OTHER_STATEMENT("edit_other_statement"),
    REMOVE_STATEMENT("remove_statement"),
    RESTORE_STATEMENT("restore_statement"),

    // Speakers
    ADD_SPEAKER("add_speaker"),
    REMOVE_SPEAKER("remove_speaker"),
    EDIT_SPEAKER("edit_speaker"),
    RESTORE_SPEAKER("restore_speaker");

    private static final Map<String, ActionKind> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ActionKind::key, Function.identity()));

    private final String key;

    ActionKind(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolve an action from its wire key.
     *
     * @param key snake_case key, may be null
     * @return the matching action, or empty if the key names no known action
     */
    public static Optional<ActionKind> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
