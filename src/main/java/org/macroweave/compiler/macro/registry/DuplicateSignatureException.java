package org.macroweave.compiler.macro.registry;

import org.macroweave.compiler.api.MacroErrorCode;
import org.macroweave.compiler.macro.MacroException;

/**
 * Thrown when a (name, shape sequence) pair is registered twice. Fatal for the whole run:
 * it happens before any compilation unit is processed.
 */
public class DuplicateSignatureException extends MacroException {

    private final MacroSignature signature;

    /**
     * @param signature The signature registered twice.
     * @param existingOrigin The library that registered it first.
     * @param newOrigin The library that tried to register it again.
     */
    public DuplicateSignatureException(MacroSignature signature, String existingOrigin, String newOrigin) {
        super(MacroErrorCode.DUPLICATE_SIGNATURE,
                "Macro signature " + signature + " from " + newOrigin + " is already registered by " + existingOrigin + ".",
                signature.name(), null, null);
        this.signature = signature;
    }

    public MacroSignature getSignature() {
        return signature;
    }
}
