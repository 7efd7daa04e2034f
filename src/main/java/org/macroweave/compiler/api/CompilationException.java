package org.macroweave.compiler.api;

/**
 * An exception that is thrown when one or more compilation units failed to compile.
 * <p>
 * It is part of the public API and hides the internal exception types of the expansion engine.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }
}
