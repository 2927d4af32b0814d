package com.vidnyan.astdump.application.port.out;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The front end could not produce a syntax tree for a file.
 */
@Getter
public class ParseFailureException extends Exception {

    public enum Reason {
        /** File missing or not readable. */
        UNREADABLE,
        /** File read but not parsable. */
        UNPARSABLE
    }

    private final Path file;
    private final Reason reason;

    public ParseFailureException(Path file, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
        this.reason = reason;
    }

    public static ParseFailureException unreadable(Path file, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ParseFailureException(file, Reason.UNREADABLE, "cannot read file: " + detail, cause);
    }

    public static ParseFailureException unparsable(Path file, String problems) {
        return new ParseFailureException(file, Reason.UNPARSABLE, problems, null);
    }
}
