package org.macroweave.compiler.macro.template;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.macro.MacroException;

/**
 * Thrown when the source text of a template cannot be parsed into a single skeleton.
 */
public class TemplateSyntaxException extends MacroException {

    /**
     * @param message What is wrong with the template, including the parser diagnostics.
     */
    public TemplateSyntaxException(String message) {
        super(MacroErrorCode.TEMPLATE_SYNTAX, message, null, null, null);
    }
}
