package org.macroweave.compiler.macro.match;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.macro.registry.MacroDefinition;
import org.macroweave.compiler.macro.registry.MacroSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Decides which macro, if any, a call site invokes, by the structure of its arguments.
 * <p>
 * A candidate matches when its name equals the callee, its arity equals the argument count
 * exactly, and every argument's node kind satisfies the parameter shape at the same position.
 * Among several matching candidates the earliest registered wins. Stateless and thread-safe.
 */
public class CallSiteMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CallSiteMatcher.class);

    /**
     * @param callSite The call to match.
     * @param candidates Definitions in registration order, typically {@code registry.lookup(callee)}.
     * @return The earliest-registered matching definition, or {@link MatchResult#noMatch()}.
     */
    public MatchResult match(CallNode callSite, List<MacroDefinition> candidates) {
        MacroDefinition chosen = null;
        for (MacroDefinition candidate : candidates) {
            if (!accepts(candidate.signature(), callSite)) {
                continue;
            }
            if (chosen == null) {
                chosen = candidate;
                if (!LOG.isDebugEnabled()) {
                    break;
                }
            } else {
                LOG.debug("{} at {} also matches {}, shadowed by earlier {}",
                        callSite.callee(), callSite.span(), candidate.signature(), chosen.signature());
            }
        }
        return chosen == null ? MatchResult.noMatch() : MatchResult.matched(chosen);
    }

    /**
     * Tests one signature against one call site.
     *
     * @param signature The signature.
     * @param callSite The call site.
     * @return {@code true} if name, arity and every argument shape agree.
     */
    public static boolean accepts(MacroSignature signature, CallNode callSite) {
        if (!signature.name().equals(callSite.callee())) {
            return false;
        }
        List<AstNode> arguments = callSite.arguments();
        if (arguments.size() != signature.arity()) {
            return false;
        }
        for (int i = 0; i < arguments.size(); i++) {
            if (!signature.shapes().get(i).matches(arguments.get(i))) {
                return false;
            }
        }
        return true;
    }
}
