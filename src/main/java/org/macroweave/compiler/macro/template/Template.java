package org.macroweave.compiler.macro.template;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.HoleNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed quasiquote: a skeleton AST containing named {@link HoleNode}s.
 * Immutable, so one template can be materialized any number of times, from any thread.
 * All skeleton nodes carry {@link org.macroweave.compiler.api.SourceSpan#UNASSIGNED}.
 */
public final class Template {

    private final String source;
    private final AstNode skeleton;
    private final Map<String, HoleNode.HoleKind> holes;

    Template(String source, AstNode skeleton, Map<String, HoleNode.HoleKind> holes) {
        this.source = source;
        this.skeleton = skeleton;
        this.holes = Collections.unmodifiableMap(new LinkedHashMap<>(holes));
    }

    /**
     * @return The template source text this template was parsed from.
     */
    public String source() {
        return source;
    }

    /**
     * @return The skeleton, holes included.
     */
    public AstNode skeleton() {
        return skeleton;
    }

    /**
     * @return Every hole name with its kind, in order of first appearance.
     */
    public Map<String, HoleNode.HoleKind> holes() {
        return holes;
    }

    public Set<String> expressionHoles() {
        return holesOf(HoleNode.HoleKind.EXPRESSION_SPLICE);
    }

    public Set<String> valueHoles() {
        return holesOf(HoleNode.HoleKind.VALUE_SPLICE);
    }

    private Set<String> holesOf(HoleNode.HoleKind kind) {
        return holes.entrySet().stream()
                .filter(e -> e.getValue() == kind)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String toString() {
        return "Template[" + source + "]";
    }
}
