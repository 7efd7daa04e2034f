package org.macroweave.compiler.macro.registry;

import org.macroweave.compiler.macro.declare.MacroDeclarations;
import org.macroweave.compiler.macro.spi.MacroImplementation;
import org.macroweave.compiler.macro.spi.MacroLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the macro definitions of one compilation run.
 * <p>
 * The registry is populated once at startup and then {@link #freeze() frozen}. A frozen registry
 * is immutable and can be shared by units expanding on different threads without locking.
 * Definitions with the same name are kept in registration order; choosing among them is left
 * to the {@link org.macroweave.compiler.macro.match.CallSiteMatcher}.
 */
public class MacroRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(MacroRegistry.class);

    private Map<String, List<MacroDefinition>> definitions = new LinkedHashMap<>();
    private volatile boolean frozen = false;

    /**
     * Registers a macro.
     *
     * @param signature The signature.
     * @param implementation The implementation.
     * @return The new definition.
     * @throws DuplicateSignatureException if an identical signature is already registered.
     * @throws IllegalStateException if the registry is frozen.
     */
    public MacroDefinition register(MacroSignature signature, MacroImplementation implementation) {
        return register(new MacroDefinition(signature, implementation, "<programmatic>"));
    }

    /**
     * Registers a ready-made definition.
     *
     * @param definition The definition.
     * @return The same definition.
     * @throws DuplicateSignatureException if an identical signature is already registered.
     * @throws IllegalStateException if the registry is frozen.
     */
    public synchronized MacroDefinition register(MacroDefinition definition) {
        if (frozen) {
            throw new IllegalStateException("Macro registry is frozen; cannot register " + definition.signature() + ".");
        }
        List<MacroDefinition> sameName = definitions.computeIfAbsent(definition.name(), k -> new ArrayList<>());
        for (MacroDefinition existing : sameName) {
            if (existing.signature().equals(definition.signature())) {
                throw new DuplicateSignatureException(definition.signature(), existing.origin(), definition.origin());
            }
        }
        sameName.add(definition);
        LOG.debug("Registered macro {}", definition);
        return definition;
    }

    /**
     * Registers every macro of a library.
     * @param library The library.
     */
    public void registerLibrary(MacroLibrary library) {
        library.contributeTo(this);
    }

    /**
     * Registers every {@link org.macroweave.compiler.macro.spi.MacroMethod} of an object, or the
     * static ones of a {@link Class}.
     * @param library The object or class declaring the macro methods.
     */
    public void registerAnnotated(Object library) {
        for (MacroDefinition definition : MacroDeclarations.scan(library)) {
            register(definition);
        }
    }

    /**
     * Ends population. Later registrations fail.
     * @return this
     */
    public synchronized MacroRegistry freeze() {
        if (!frozen) {
            Map<String, List<MacroDefinition>> copy = new LinkedHashMap<>();
            definitions.forEach((name, list) -> copy.put(name, List.copyOf(list)));
            definitions = Collections.unmodifiableMap(copy);
            frozen = true;
            LOG.debug("Macro registry frozen with {} definition(s)", size());
        }
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * @param name A callee name.
     * @return The definitions with that name, in registration order; empty if there are none.
     */
    public List<MacroDefinition> lookup(String name) {
        List<MacroDefinition> found = definitions().get(name);
        return found == null ? List.of() : List.copyOf(found);
    }

    /**
     * @param name A callee name.
     * @return The signatures registered under that name, in registration order.
     */
    public List<MacroSignature> signatures(String name) {
        return lookup(name).stream().map(MacroDefinition::signature).toList();
    }

    /**
     * @return The number of registered definitions.
     */
    public int size() {
        return definitions().values().stream().mapToInt(List::size).sum();
    }

    private Map<String, List<MacroDefinition>> definitions() {
        if (frozen) {
            return definitions;
        }
        synchronized (this) {
            return definitions;
        }
    }
}
