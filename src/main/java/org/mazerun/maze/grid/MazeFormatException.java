package org.mazerun.maze.grid;

import lombok.Getter;

import java.util.Objects;

/**
 * Text maze parsing failure with a deterministic reason code.
 */
@Getter
public final class MazeFormatException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded parse failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public MazeFormatException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }
}
