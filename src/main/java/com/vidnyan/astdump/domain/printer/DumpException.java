package com.vidnyan.astdump.domain.printer;

import lombok.Getter;

/**
 * Raised when a dump cannot be produced at all. Nothing has been written
 * to the sink when this is thrown.
 */
@Getter
public class DumpException extends Exception {

    public enum Reason {
        /** The printer was handed no root node. */
        NO_TREE
    }

    private final Reason reason;

    public DumpException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static DumpException noTree() {
        return new DumpException(Reason.NO_TREE, "no syntax tree");
    }
}
