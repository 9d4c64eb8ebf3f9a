package com.github.tubetune.model;

import com.github.tubetune.exception.InvalidSelectionException;
import lombok.Value;

/**
 * Payload of a result or navigation button: {@code song:<generation>:<index>}
 * or {@code page:<generation>:<page>}.
 */
@Value
public class CallbackData {

    public enum Action {
        SONG("song"),
        PAGE("page");

        private final String prefix;

        Action(String prefix) {
            this.prefix = prefix;
        }
    }

    private static final String SEPARATOR = ":";

    Action action;
    long generation;
    int index;

    public static CallbackData song(long generation, int index) {
        return new CallbackData(Action.SONG, generation, index);
    }

    public static CallbackData page(long generation, int page) {
        return new CallbackData(Action.PAGE, generation, page);
    }

    /**
     * Decode a button payload.
     *
     * @param data Raw payload
     * @return Decoded callback
     * @throws InvalidSelectionException if the payload is malformed
     */
    public static CallbackData parse(String data) {
        if (data == null) {
            throw new InvalidSelectionException("Missing callback data");
        }
        String[] parts = data.strip().split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new InvalidSelectionException("Malformed callback data: " + data);
        }

        Action action = null;
        for (Action candidate : Action.values()) {
            if (candidate.prefix.equals(parts[0])) {
                action = candidate;
            }
        }
        if (action == null) {
            throw new InvalidSelectionException("Unknown callback action: " + parts[0]);
        }

        try {
            long generation = Long.parseLong(parts[1]);
            int index = Integer.parseInt(parts[2]);
            if (generation < 0 || index < 0) {
                throw new InvalidSelectionException("Negative callback value: " + data);
            }
            return new CallbackData(action, generation, index);
        } catch (NumberFormatException e) {
            throw new InvalidSelectionException("Non-numeric callback data: " + data);
        }
    }

    public String encode() {
        return action.prefix + SEPARATOR + generation + SEPARATOR + index;
    }
}
