package de.upb.sse.jrefactor.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolved semantic type attached to syntax tree nodes.
 *
 * The set of variants is closed: the constructor is private and every variant is nested here.
 * Two notions of equality exist. {@link #equals(Object)} is the cheap one, identity for
 * {@link Class} (classes are canonicalized by {@link TypePool}) and value equality for the
 * other variants. {@link #deepEquals(Type)} compares full structure and is what the pool uses
 * to decide whether a new class variant is needed.
 */
public abstract class Type {

    private Type() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public abstract boolean deepEquals(Type other);

    public static boolean deepEquals(Type t1, Type t2) {
        if (t1 == null) return t2 == null;
        return t1.deepEquals(t2);
    }

    /**
     * One method per variant. Adding a variant breaks every implementation until it is handled.
     */
    public interface Visitor<R> {
        R visitPrimitive(Primitive primitive);

        R visitClass(Class clazz);

        R visitArray(Array array);

        R visitGenericTypeVariable(GenericTypeVariable generic);

        R visitMethod(Method method);

        R visitVar(Var var);

        R visitCyclic(Cyclic cyclic);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Primitive extends Type {
        private static final Map<String, Primitive> BY_KEYWORD = new LinkedHashMap<>();

        public static final Primitive BOOLEAN = register("boolean");
        public static final Primitive BYTE = register("byte");
        public static final Primitive CHAR = register("char");
        public static final Primitive DOUBLE = register("double");
        public static final Primitive FLOAT = register("float");
        public static final Primitive INT = register("int");
        public static final Primitive LONG = register("long");
        public static final Primitive SHORT = register("short");
        public static final Primitive VOID = register("void");
        public static final Primitive STRING = register("String");
        /** Absence of a type. */
        public static final Primitive NONE = register("");
        /** Unbound generic wildcard. */
        public static final Primitive WILDCARD = register("*");
        /** Type of the {@code null} literal. */
        public static final Primitive NULL = register("null");

        private final String keyword;

        private Primitive(String keyword) {
            this.keyword = keyword;
        }

        private static Primitive register(String keyword) {
            Primitive primitive = new Primitive(keyword);
            BY_KEYWORD.put(keyword, primitive);
            return primitive;
        }

        /**
         * @throws IllegalArgumentException if the keyword is not one of the known primitives
         */
        public static Primitive build(String keyword) {
            Primitive primitive = BY_KEYWORD.get(keyword);
            if (primitive == null) {
                throw new IllegalArgumentException("Invalid primitive keyword: '" + keyword + "'");
            }
            return primitive;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrimitive(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            return other instanceof Primitive && keyword.equals(((Primitive) other).keyword);
        }

        @Override
        public String toString() {
            return keyword;
        }
    }

    /**
     * Declaring type of a class, interface or enum. Instances are only created through a
     * {@link TypePool}, so two references to the same canonical variant are identical.
     */
    @Getter
    public static final class Class extends Type {
        private final String fullyQualifiedName;
        /** Declared fields in source order. Order does not take part in {@link #deepEquals(Type)}. */
        private final List<Var> members;
        private final Class supertype;

        Class(String fullyQualifiedName, List<Var> members, Class supertype) {
            this.fullyQualifiedName = fullyQualifiedName;
            this.members = members == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(members));
            this.supertype = supertype;
        }

        public static Class build(String fullyQualifiedName) {
            return build(fullyQualifiedName, Collections.emptyList(), null);
        }

        /**
         * Canonical class for this exact content, interned in {@link TypePool#DEFAULT}.
         */
        public static Class build(String fullyQualifiedName, List<Var> members, Class supertype) {
            return TypePool.DEFAULT.build(fullyQualifiedName, members, supertype);
        }

        /**
         * Simple name including enclosing types, e.g. {@code Map.Entry} for {@code java.util.Map.Entry}.
         * Leading segments that start with a lowercase letter are treated as the package.
         */
        public String className() {
            String[] parts = fullyQualifiedName.split("\\.");
            int i = 0;
            while (i < parts.length && !parts[i].isEmpty() && Character.isLowerCase(parts[i].charAt(0))) {
                i++;
            }
            return String.join(".", Arrays.asList(parts).subList(i, parts.length));
        }

        public String packageName() {
            return packageName(fullyQualifiedName);
        }

        public static String packageName(String fullyQualifiedName) {
            int lastDot = fullyQualifiedName.lastIndexOf('.');
            if (lastDot < 0) return "";

            String subName = fullyQualifiedName.substring(0, lastDot);
            String lastSegment = subName.substring(subName.lastIndexOf('.') + 1);
            if (!lastSegment.isEmpty() && Character.isUpperCase(lastSegment.charAt(0))) {
                return packageName(subName);
            }
            return subName;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClass(this);
        }

        /**
         * Same name, same supertype chain, and a one-to-one pairing of members by name where
         * every pair is deep-equal.
         */
        @Override
        public boolean deepEquals(Type other) {
            if (this == other) return true;
            if (!(other instanceof Class)) return false;

            Class c = (Class) other;
            if (!fullyQualifiedName.equals(c.fullyQualifiedName) || members.size() != c.members.size()) {
                return false;
            }

            boolean[] paired = new boolean[c.members.size()];
            for (Var member : members) {
                boolean found = false;
                for (int i = 0; i < c.members.size(); i++) {
                    Var candidate = c.members.get(i);
                    if (!paired[i] && candidate.getName().equals(member.getName()) && member.deepEquals(candidate)) {
                        paired[i] = true;
                        found = true;
                        break;
                    }
                }
                if (!found) return false;
            }

            return deepEquals(supertype, c.supertype);
        }

        @Override
        public String toString() {
            return fullyQualifiedName;
        }
    }

    /**
     * Stands in for a type whose structure is already being built further up, e.g. the type
     * of a field {@code Node next} inside {@code Node}. Comparison never looks past the name.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Cyclic extends Type {
        private final String fullyQualifiedName;

        public Cyclic(String fullyQualifiedName) {
            this.fullyQualifiedName = fullyQualifiedName;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCyclic(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            return other instanceof Cyclic && fullyQualifiedName.equals(((Cyclic) other).fullyQualifiedName);
        }

        @Override
        public String toString() {
            return "cyclic " + fullyQualifiedName;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Method extends Type {
        private final Signature genericSignature;
        private final Signature resolvedSignature;
        /** Null when the declaration does not expose parameter names. */
        private final List<String> paramNames;
        private final Set<Flag> flags;
        private final Class declaringType;

        public Method(Signature genericSignature, Signature resolvedSignature, List<String> paramNames,
                      Collection<Flag> flags, Class declaringType) {
            this.genericSignature = genericSignature;
            this.resolvedSignature = resolvedSignature;
            this.paramNames = paramNames == null ? null : Collections.unmodifiableList(new ArrayList<>(paramNames));
            this.flags = toFlagSet(flags);
            this.declaringType = declaringType;
        }

        public boolean hasFlags(Flag... test) {
            return flags.containsAll(Arrays.asList(test));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMethod(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            if (!(other instanceof Method)) return false;
            Method method = (Method) other;
            return deepEquals(declaringType, method.declaringType) &&
                    genericSignature.deepEquals(method.genericSignature) &&
                    resolvedSignature.deepEquals(method.resolvedSignature) &&
                    flags.equals(method.flags) &&
                    Objects.equals(paramNames, method.paramNames);
        }

        @Override
        public String toString() {
            return (declaringType == null ? "?" : declaringType.getFullyQualifiedName()) + resolvedSignature;
        }

        @Getter
        @EqualsAndHashCode
        public static final class Signature {
            private final Type returnType;
            private final List<Type> paramTypes;

            public Signature(Type returnType, List<Type> paramTypes) {
                this.returnType = returnType;
                this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
            }

            public boolean deepEquals(Signature signature) {
                if (signature == null || paramTypes.size() != signature.paramTypes.size()) return false;
                if (!Type.deepEquals(returnType, signature.returnType)) return false;
                for (int i = 0; i < paramTypes.size(); i++) {
                    if (!Type.deepEquals(paramTypes.get(i), signature.paramTypes.get(i))) return false;
                }
                return true;
            }

            @Override
            public String toString() {
                return "(" + paramTypes.stream().map(String::valueOf).collect(Collectors.joining(",")) + ")" +
                        (returnType == null ? "" : returnType.toString());
            }
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class GenericTypeVariable extends Type {
        private final String fullyQualifiedName;
        private final Class bound;

        public GenericTypeVariable(String fullyQualifiedName, Class bound) {
            this.fullyQualifiedName = fullyQualifiedName;
            this.bound = bound;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGenericTypeVariable(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            return other instanceof GenericTypeVariable &&
                    fullyQualifiedName.equals(((GenericTypeVariable) other).fullyQualifiedName) &&
                    deepEquals(bound, ((GenericTypeVariable) other).bound);
        }

        @Override
        public String toString() {
            return fullyQualifiedName;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Array extends Type {
        private final Type elemType;

        public Array(Type elemType) {
            this.elemType = elemType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArray(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            return other instanceof Array && deepEquals(elemType, ((Array) other).elemType);
        }

        @Override
        public String toString() {
            return elemType + "[]";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Var extends Type {
        private final String name;
        private final Type type;
        private final Set<Flag> flags;

        public Var(String name, Type type, Collection<Flag> flags) {
            this.name = name;
            this.type = type;
            this.flags = toFlagSet(flags);
        }

        public boolean hasFlags(Flag... test) {
            return flags.containsAll(Arrays.asList(test));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public boolean deepEquals(Type other) {
            if (!(other instanceof Var)) return false;
            Var v = (Var) other;
            return name.equals(v.name) && deepEquals(type, v.type) && flags.equals(v.flags);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static Set<Flag> toFlagSet(Collection<Flag> flags) {
        if (flags == null || flags.isEmpty()) return Collections.unmodifiableSet(EnumSet.noneOf(Flag.class));
        return Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public static Class asClass(Type type) {
        return type instanceof Class ? (Class) type : null;
    }

    public static Array asArray(Type type) {
        return type instanceof Array ? (Array) type : null;
    }

    public static GenericTypeVariable asGeneric(Type type) {
        return type instanceof GenericTypeVariable ? (GenericTypeVariable) type : null;
    }

    public static Method asMethod(Type type) {
        return type instanceof Method ? (Method) type : null;
    }

    public static Primitive asPrimitive(Type type) {
        return type instanceof Primitive ? (Primitive) type : null;
    }

    /**
     * Unwraps arrays and tests the leaf element's name. A {@link Cyclic} leaf never matches.
     */
    public static boolean hasElementType(Type type, String fullyQualifiedName) {
        if (type instanceof Array) {
            return hasElementType(((Array) type).getElemType(), fullyQualifiedName);
        } else if (type instanceof Class) {
            return ((Class) type).getFullyQualifiedName().equals(fullyQualifiedName);
        } else if (type instanceof GenericTypeVariable) {
            return ((GenericTypeVariable) type).getFullyQualifiedName().equals(fullyQualifiedName);
        }
        return false;
    }
}
