package bytebeat.sema;

import bytebeat.types.PrimitiveType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifier types of one program. A name's type is fixed by its first binding;
 * built-in variables are never stored.
 */
public final class TypeContext {

    public record Binding(PrimitiveType type, boolean explicitlyDeclared) {}

    private static final Map<String, PrimitiveType> BUILTINS = builtins();

    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private PrimitiveType defaultType = PrimitiveType.INT;
    private boolean explicitlyTyped = false;

    private static Map<String, PrimitiveType> builtins() {
        Map<String, PrimitiveType> m = new LinkedHashMap<>();
        for (String name : new String[] {"t", "sx", "sy", "mx", "my", "kx", "ky"}) {
            m.put(name, PrimitiveType.INT);
            m.put(name + "_f", PrimitiveType.FLOAT);
        }
        return Collections.unmodifiableMap(m);
    }

    public static boolean isBuiltin(String name) {
        return BUILTINS.containsKey(name);
    }

    public static Map<String, PrimitiveType> builtinVariables() {
        return BUILTINS;
    }

    /** Type of {@code name}, or null when it is neither built in nor bound. */
    public PrimitiveType lookup(String name) {
        PrimitiveType builtin = BUILTINS.get(name);
        if (builtin != null) return builtin;
        Binding b = bindings.get(name);
        return b == null ? null : b.type();
    }

    /**
     * Binds {@code name} to {@code type} unless it already has a type.
     *
     * @return null if the binding was added, otherwise the existing type (left unchanged)
     */
    public PrimitiveType declare(String name, PrimitiveType type) {
        PrimitiveType existing = lookup(name);
        if (existing != null) return existing;
        bindings.put(name, new Binding(type, explicitlyTyped));
        return null;
    }

    /** Bindings in declaration order. */
    public Map<String, Binding> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public PrimitiveType defaultType() {
        return defaultType;
    }

    public void setDefaultType(PrimitiveType defaultType) {
        this.defaultType = defaultType;
    }

    /** True while checking a statement that starts with a type keyword. */
    public boolean isExplicitlyTyped() {
        return explicitlyTyped;
    }

    public void setExplicitlyTyped(boolean explicitlyTyped) {
        this.explicitlyTyped = explicitlyTyped;
    }

    public TypeContext copy() {
        TypeContext c = new TypeContext();
        c.bindings.putAll(bindings);
        c.defaultType = defaultType;
        c.explicitlyTyped = explicitlyTyped;
        return c;
    }
}
