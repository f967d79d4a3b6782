package com.spanql.service.core.ast;

/**
 * Reference to span data: either an intrinsic or a custom attribute by name. {@code parent} marks references
 * that read the parent span instead of the span under evaluation.
 */
public record Attribute(Scope scope, boolean parent, String name, Intrinsic intrinsic) implements FieldExpression {

    public static Attribute custom(Scope scope, String name) {
        return new Attribute(scope, false, name, Intrinsic.NONE);
    }

    public static Attribute ofParent(Scope scope, String name) {
        return new Attribute(scope, true, name, Intrinsic.NONE);
    }

    /** Scoped spelling, e.g. {@code span:duration}. */
    public static Attribute scopedIntrinsic(Intrinsic intrinsic) {
        return new Attribute(intrinsic.scope(), false, null, intrinsic);
    }

    /** Unscoped spelling, e.g. {@code duration}. */
    public static Attribute legacyIntrinsic(Intrinsic intrinsic) {
        return new Attribute(Scope.NONE, false, null, intrinsic);
    }

    public boolean isIntrinsic() {
        return intrinsic != Intrinsic.NONE;
    }

    /** Scope whose data the reference reads, taking the intrinsic's own scope into account. */
    public Scope effectiveScope() {
        if (isIntrinsic() && intrinsic.scope() != null) {
            return intrinsic.scope();
        }
        return scope;
    }

    @Override
    public StaticType impliedType() {
        return intrinsic.type();
    }

    @Override
    public boolean referencesSpan() {
        return true;
    }

    @Override
    public String toString() {
        if (isIntrinsic()) {
            return scope == Scope.NONE ? intrinsic.legacyName() : scope.keyword() + ":" + intrinsic.scopedName();
        }
        String prefix;
        if (parent) {
            prefix = scope == Scope.NONE ? "parent." : "parent." + scope.keyword() + ".";
        } else {
            prefix = scope == Scope.NONE ? "." : scope.keyword() + ".";
        }
        return prefix + renderName(name);
    }

    private static String renderName(String name) {
        if (isPlainPath(name)) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 2).append('"');
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '"' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private static boolean isPlainPath(String name) {
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) return false;
        if (name.startsWith(".") || name.endsWith(".") || name.contains("..")) return false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c != '.' && !isPathChar(c)) return false;
        }
        return true;
    }

    /** Characters allowed in an unquoted attribute path segment. */
    public static boolean isPathChar(char c) {
        if (Character.isWhitespace(c)) return false;
        return switch (c) {
            case '{', '}', '(', ')', '=', '~', '!', '<', '>', '&', '|', '^', ',', '"', '.', '`' -> false;
            default -> true;
        };
    }
}
