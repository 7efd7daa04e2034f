package org.macroweave.compiler.macro.spi;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tags a method of a macro library as a macro.
 * <p>
 * If the first parameter is a {@link MacroContext}, it is the context slot and is never matched
 * against call-site arguments. Each remaining parameter's declared type gives the shape its
 * argument must have:
 * <pre>
 * AstNode         any expression
 * LiteralNode     literal
 * IdentifierNode  identifier
 * LambdaNode      lambda
 * CallNode        call
 * BinaryOpNode    binary operator expression
 * UnaryOpNode     unary operator expression
 * </pre>
 * The method returns an {@code AstNode} (or subtype) or a {@link ReplacementResult}.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface MacroMethod {

    /**
     * @return The macro name; defaults to the Java method name.
     */
    String name() default "";

    /**
     * Fixes the registration order among the macros of one library, lowest first. Reflection does
     * not report methods in declaration order, so overloads that shadow each other set this.
     * @return The position of the macro within its library.
     */
    int order() default 0;
}
