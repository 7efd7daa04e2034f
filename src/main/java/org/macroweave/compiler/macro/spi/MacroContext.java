package org.macroweave.compiler.macro.spi;

import org.macroweave.compiler.api.SourceSpan;
import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.macro.template.Bindings;
import org.macroweave.compiler.macro.template.Template;
import org.macroweave.compiler.macro.template.TemplateEngine;

/**
 * The read-only context of one macro invocation. Created when a call site matched and
 * discarded as soon as the implementation returns.
 *
 * @param macroName The name of the macro being invoked.
 * @param callSite The span of the call site.
 * @param enclosingScope The syntactic scope around the call site (lookup only).
 * @param config The compile-time configuration values.
 * @param templates The template engine shared by the pass.
 */
public record MacroContext(
        String macroName,
        SourceSpan callSite,
        ScopeView enclosingScope,
        CompileTimeConfig config,
        TemplateEngine templates
) {

    /**
     * @return The call-site location as {@code file:line:column}.
     */
    public String locationString() {
        return callSite.toString();
    }

    /**
     * Parses template source, using the engine's cache.
     * @param source The quasiquoted code.
     * @return The template.
     */
    public Template template(String source) {
        return templates.parse(source);
    }

    /**
     * Parses and materializes a template in one step.
     * @param source The quasiquoted code.
     * @param bindings The hole values.
     * @return The materialized tree.
     */
    public AstNode quote(String source, Bindings bindings) {
        return templates.materialize(templates.parse(source), bindings);
    }
}
