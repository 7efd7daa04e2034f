package org.macroweave.compiler.macro.declare;

import org.macroweave.compiler.frontend.parser.ast.AstNode;
import org.macroweave.compiler.frontend.parser.ast.BinaryOpNode;
import org.macroweave.compiler.frontend.parser.ast.CallNode;
import org.macroweave.compiler.frontend.parser.ast.IdentifierNode;
import org.macroweave.compiler.frontend.parser.ast.LambdaNode;
import org.macroweave.compiler.frontend.parser.ast.LiteralNode;
import org.macroweave.compiler.frontend.parser.ast.UnaryOpNode;
import org.macroweave.compiler.macro.registry.MacroDefinition;
import org.macroweave.compiler.macro.registry.MacroSignature;
import org.macroweave.compiler.macro.registry.ParameterShape;
import org.macroweave.compiler.macro.spi.MacroContext;
import org.macroweave.compiler.macro.spi.MacroMethod;
import org.macroweave.compiler.macro.spi.ReplacementResult;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads {@link MacroMethod}-tagged methods of a macro library and turns them into
 * {@link MacroDefinition}s. Parameter types are mapped to {@link ParameterShape}s by a fixed table.
 */
public final class MacroDeclarations {

    private static final Map<Class<?>, ParameterShape> SHAPES_BY_TYPE = new LinkedHashMap<>();

    static {
        SHAPES_BY_TYPE.put(AstNode.class, ParameterShape.ANY);
        SHAPES_BY_TYPE.put(LiteralNode.class, ParameterShape.LITERAL);
        SHAPES_BY_TYPE.put(IdentifierNode.class, ParameterShape.IDENTIFIER);
        SHAPES_BY_TYPE.put(LambdaNode.class, ParameterShape.LAMBDA);
        SHAPES_BY_TYPE.put(CallNode.class, ParameterShape.CALL);
        SHAPES_BY_TYPE.put(BinaryOpNode.class, ParameterShape.BINARY_OP);
        SHAPES_BY_TYPE.put(UnaryOpNode.class, ParameterShape.UNARY_OP);
    }

    private MacroDeclarations() {}

    /**
     * Scans a library for macro methods. For an instance, both its static and instance macro
     * methods are read; for a {@link Class}, only the static ones.
     * <p>
     * Definitions come back sorted by {@link MacroMethod#order()}, then by name, then by
     * parameter types, so registration order does not depend on reflection order.
     *
     * @param library The library object or class.
     * @return The definitions, ready to register.
     * @throws InvalidDeclarationException if a tagged method has an unsupported parameter or return type.
     */
    public static List<MacroDefinition> scan(Object library) {
        boolean staticOnly = library instanceof Class<?>;
        Class<?> type = staticOnly ? (Class<?>) library : library.getClass();
        Object target = staticOnly ? null : library;

        List<Method> methods = Arrays.stream(type.getMethods())
                .filter(m -> m.isAnnotationPresent(MacroMethod.class))
                .filter(m -> !staticOnly || Modifier.isStatic(m.getModifiers()))
                .sorted(Comparator.<Method>comparingInt(m -> m.getAnnotation(MacroMethod.class).order())
                        .thenComparing(MacroDeclarations::macroName)
                        .thenComparing(m -> Arrays.stream(m.getParameterTypes()).map(Class::getSimpleName).collect(Collectors.joining(","))))
                .toList();

        List<MacroDefinition> definitions = new ArrayList<>();
        for (Method method : methods) {
            definitions.add(toDefinition(method, Modifier.isStatic(method.getModifiers()) ? null : target, type));
        }
        return definitions;
    }

    /**
     * @param parameterType A declared parameter type.
     * @return The shape the type maps to.
     * @throws InvalidDeclarationException if the type is not in the mapping table.
     */
    public static ParameterShape shapeOf(Class<?> parameterType) {
        ParameterShape shape = SHAPES_BY_TYPE.get(parameterType);
        if (shape == null) {
            throw new InvalidDeclarationException("Unsupported macro parameter type " + parameterType.getName()
                    + "; expected one of " + SHAPES_BY_TYPE.keySet().stream().map(Class::getSimpleName).toList() + ".", null);
        }
        return shape;
    }

    private static MacroDefinition toDefinition(Method method, Object target, Class<?> owner) {
        String where = owner.getName() + "#" + method.getName();
        String name = macroName(method);
        Class<?>[] parameterTypes = method.getParameterTypes();
        boolean takesContext = parameterTypes.length > 0 && parameterTypes[0] == MacroContext.class;

        List<ParameterShape> shapes = new ArrayList<>();
        for (int i = takesContext ? 1 : 0; i < parameterTypes.length; i++) {
            try {
                shapes.add(shapeOf(parameterTypes[i]));
            } catch (InvalidDeclarationException e) {
                throw new InvalidDeclarationException(where + ": parameter " + i + ": " + e.getMessage(), name);
            }
        }

        Class<?> returnType = method.getReturnType();
        if (!AstNode.class.isAssignableFrom(returnType) && returnType != ReplacementResult.class) {
            throw new InvalidDeclarationException(where + ": macro methods must return AstNode or ReplacementResult, not "
                    + returnType.getName() + ".", name);
        }

        MacroSignature signature = new MacroSignature(name, shapes);
        // Libraries are often nested or package-private classes.
        method.trySetAccessible();
        return new MacroDefinition(signature, (context, arguments) -> {
            Object[] actuals = new Object[parameterTypes.length];
            int offset = 0;
            if (takesContext) {
                actuals[0] = context;
                offset = 1;
            }
            for (int i = 0; i < arguments.size(); i++) {
                actuals[i + offset] = arguments.get(i);
            }
            Object returned = call(method, target, actuals);
            if (returned == null) {
                throw new IllegalStateException("Macro method " + where
                        + " returned null; return ReplacementResult.empty() to delete the call.");
            }
            return returned instanceof ReplacementResult result ? result : ReplacementResult.of((AstNode) returned);
        }, where);
    }

    private static Object call(Method method, Object target, Object[] actuals) {
        try {
            return method.invoke(target, actuals);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new UndeclaredThrowableException(cause);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Macro method " + method + " is not accessible.", e);
        }
    }

    private static String macroName(Method method) {
        String declared = method.getAnnotation(MacroMethod.class).name();
        return declared.isEmpty() ? method.getName() : declared;
    }
}
