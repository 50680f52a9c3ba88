package com.symcalc.calc;

/**
 * Base class of every error the engine raises. Errors are never recovered
 * from inside the engine; they propagate to whoever called the facade.
 */
public class CalcError extends RuntimeException {
    final int position;

    CalcError(String message, int position) {
        super(message);
        this.position = position;
    }

    // -1 when the error isn't tied to a source offset (evaluation errors)
    public int getPosition() {
        return position;
    }
}
