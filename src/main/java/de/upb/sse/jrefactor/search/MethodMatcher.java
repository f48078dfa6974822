package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.ast.Tr;
import de.upb.sse.jrefactor.ast.Type;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Matches method invocations against a pointcut style signature such as
 * {@code java.util.List add(..)} or {@code com.foo..*Service find*(String, ..)}.
 *
 * <ul>
 *     <li>{@code *} matches any run of characters except the package separator.</li>
 *     <li>{@code ..} in a type name matches any number of intermediate packages.</li>
 *     <li>{@code ..} in the parameter list matches zero or more parameters.</li>
 *     <li>A trailing {@code ...} on a parameter type matches the equivalent array type.</li>
 * </ul>
 *
 * Simple type names that exist in {@code java.lang} are qualified with it. Patterns are compiled
 * once in the constructor; a matcher is immutable and may be shared between threads.
 */
@Getter
public class MethodMatcher {
    private static final String DOT_DOT_PARAMS = "([^,]+,)*([^,]+)";

    private final MethodPattern methodPattern;
    private final Pattern targetTypePattern;
    private final Pattern methodNamePattern;
    private final Pattern argumentPattern;

    public MethodMatcher(String signature) {
        this.methodPattern = MethodPatternParser.parse(signature);
        this.targetTypePattern = Pattern.compile(typeRegex(methodPattern.getTargetTypePattern()));
        this.methodNamePattern = Pattern.compile(nameRegex(methodPattern.getMethodNamePattern()));
        this.argumentPattern = Pattern.compile(paramsRegex(methodPattern.getParams()));
    }

    /**
     * False when the invocation carries no resolved declaring type or parameter types, or when a
     * parameter type has no textual rendering (type variables, unresolved types).
     */
    public boolean matches(Tr.MethodInvocation meth) {
        Type.Method type = meth.getType();
        if (type == null || type.getDeclaringType() == null || type.getResolvedSignature() == null) return false;

        List<String> paramTypes = new ArrayList<>();
        for (Type paramType : type.getResolvedSignature().getParamTypes()) {
            String rendered = paramType == null ? null : paramType.accept(TypeRenderer.INSTANCE);
            if (rendered == null) return false;
            paramTypes.add(rendered);
        }

        return targetTypePattern.matcher(type.getDeclaringType().getFullyQualifiedName()).matches()
                && methodNamePattern.matcher(meth.getSimpleName()).matches()
                && argumentPattern.matcher(String.join(",", paramTypes)).matches();
    }

    static String nameRegex(String name) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (name.startsWith("..", i)) {
                regex.append("\\.(.+\\.)?");
                i++;
            } else if (c == '*') {
                regex.append("[^.]*");
            } else if (c == '.' || c == '[' || c == ']' || c == '$') {
                regex.append('\\').append(c);
            } else {
                regex.append(c);
            }
        }
        return regex.toString();
    }

    static String typeRegex(String typeName) {
        if (typeName.indexOf('.') < 0 && typeName.indexOf('*') < 0) {
            String baseName = typeName.replace("[]", "");
            try {
                Class.forName("java.lang." + baseName, false, MethodMatcher.class.getClassLoader());
                return nameRegex("java.lang." + typeName);
            } catch (ClassNotFoundException ignored) {
                // not a java.lang type, keep the name as written
            }
        }
        return nameRegex(typeName);
    }

    static String paramsRegex(List<MethodPattern.Param> params) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < params.size(); i++) {
            MethodPattern.Param param = params.get(i);
            if (param instanceof MethodPattern.DotDot) {
                if (params.size() == 1) {
                    regex.append('(').append(DOT_DOT_PARAMS).append(")?");
                } else if (i == 0) {
                    regex.append('(').append(DOT_DOT_PARAMS).append(",)?");
                } else {
                    regex.append("(,").append(DOT_DOT_PARAMS).append(")?");
                }
            } else {
                MethodPattern.FormalType formalType = (MethodPattern.FormalType) param;
                // a leading '..' carries the comma that follows it
                boolean afterLeadingDotDot = i == 1 && params.get(0) instanceof MethodPattern.DotDot;
                if (i > 0 && !afterLeadingDotDot) {
                    regex.append(',');
                }
                regex.append(typeRegex(formalType.getTypePattern()));
                if (formalType.isVarargs()) {
                    regex.append("\\[\\]");
                }
            }
        }
        return regex.toString();
    }

    /**
     * Renders resolved parameter types the way they appear in a pattern, or null when the type
     * has no such rendering.
     */
    private static class TypeRenderer implements Type.Visitor<String> {
        static final TypeRenderer INSTANCE = new TypeRenderer();

        @Override
        public String visitPrimitive(Type.Primitive primitive) {
            return primitive == Type.Primitive.STRING ? "java.lang.String" : primitive.getKeyword();
        }

        @Override
        public String visitClass(Type.Class clazz) {
            return clazz.getFullyQualifiedName();
        }

        @Override
        public String visitArray(Type.Array array) {
            String elem = array.getElemType() == null ? null : array.getElemType().accept(this);
            return elem == null ? null : elem + "[]";
        }

        @Override
        public String visitGenericTypeVariable(Type.GenericTypeVariable generic) {
            return null;
        }

        @Override
        public String visitMethod(Type.Method method) {
            return null;
        }

        @Override
        public String visitVar(Type.Var var) {
            return null;
        }

        @Override
        public String visitCyclic(Type.Cyclic cyclic) {
            return null;
        }
    }
}
