package org.macroweave.compiler.macro.spi;

import org.macroweave.compiler.macro.registry.MacroRegistry;

/**
 * A unit of macros shipped together, typically by one library author.
 */
public interface MacroLibrary {

    /**
     * Registers this library's macros. Called once, before the registry is frozen.
     * @param registry The registry being populated.
     */
    void contributeTo(MacroRegistry registry);
}
