package de.upb.sse.jrefactor.parse;

import com.github.javaparser.ast.AccessSpecifier;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.resolution.declarations.ResolvedFieldDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedMethodLikeDeclaration;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFacade;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import de.upb.sse.jrefactor.ast.Flag;
import de.upb.sse.jrefactor.ast.Type;
import de.upb.sse.jrefactor.ast.TypePool;
import de.upb.sse.jrefactor.stats.ParseStats;

import java.util.*;
import java.util.logging.Logger;

/**
 * Converts JavaParser's resolved types into {@link Type} values interned in a session pool.
 *
 * Class members are expanded {@code memberDepth} levels deep. A class that is already being
 * built further up the current conversion becomes a {@link Type.Cyclic}. Any resolution failure
 * yields a null type.
 */
class TypeMapper {
    private static final Logger logger = Logger.getLogger(TypeMapper.class.getName());

    private final CombinedTypeSolver typeSolver;
    private final TypePool typePool;
    private final ParseStats stats;
    private final int memberDepth;

    private final Map<String, Type> classCache = new HashMap<>();
    private final Set<String> building = new LinkedHashSet<>();

    TypeMapper(CombinedTypeSolver typeSolver, TypePool typePool, ParseStats stats, int memberDepth) {
        this.typeSolver = typeSolver;
        this.typePool = typePool;
        this.stats = stats;
        this.memberDepth = memberDepth;
    }

    void clear() {
        classCache.clear();
        building.clear();
    }

    Type expressionType(Expression expression) {
        try {
            return type(expression.calculateResolvedType(), memberDepth);
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(expression, e);
            return null;
        }
    }

    Type typeOf(com.github.javaparser.ast.type.Type type) {
        try {
            return type(type.resolve(), memberDepth);
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(type, e);
            return null;
        }
    }

    Type.Class classDeclType(TypeDeclaration<?> typeDeclaration) {
        try {
            return asClass(classType(typeDeclaration.resolve(), memberDepth));
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(typeDeclaration.getName(), e);
            return null;
        }
    }

    Type.Class classType(String fullyQualifiedName) {
        var ref = typeSolver.tryToSolveType(fullyQualifiedName);
        return ref.isSolved() ? asClass(classType(ref.getCorrespondingDeclaration(), memberDepth)) : null;
    }

    Type.Method methodInvocationType(MethodCallExpr call) {
        try {
            var usage = JavaParserFacade.get(typeSolver).solveMethodAsUsage(call);
            var declaration = usage.getDeclaration();

            List<Type> resolvedParams = new ArrayList<>();
            for (ResolvedType paramType : usage.getParamTypes()) {
                resolvedParams.add(type(paramType, 0));
            }
            Type.Method.Signature resolved = new Type.Method.Signature(type(usage.returnType(), 0), resolvedParams);
            Type.Method.Signature generic = new Type.Method.Signature(type(declaration.getReturnType(), 0), paramTypes(declaration));

            Set<Flag> flags = EnumSet.noneOf(Flag.class);
            addAccessFlag(flags, declaration.accessSpecifier());
            if (declaration.isStatic()) flags.add(Flag.Static);
            if (declaration.isAbstract()) flags.add(Flag.Abstract);
            if (declaration.isDefaultMethod()) flags.add(Flag.Default);

            return new Type.Method(generic, resolved, paramNames(declaration), flags,
                    asClass(classType(usage.declaringType(), memberDepth)));
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(call, e);
            return null;
        }
    }

    Type.Method methodDeclType(MethodDeclaration method) {
        try {
            var declaration = method.resolve();
            Type.Method.Signature signature = new Type.Method.Signature(type(declaration.getReturnType(), 0), paramTypes(declaration));
            return new Type.Method(signature, signature, paramNames(declaration), flags(method.getModifiers()),
                    asClass(classType(declaration.declaringType(), memberDepth)));
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(method.getName(), e);
            return null;
        }
    }

    Type.Method constructorDeclType(ConstructorDeclaration constructor) {
        try {
            var declaration = constructor.resolve();
            Type.Class declaringType = asClass(classType(declaration.declaringType(), memberDepth));
            Type.Method.Signature signature = new Type.Method.Signature(declaringType, paramTypes(declaration));
            return new Type.Method(signature, signature, paramNames(declaration), flags(constructor.getModifiers()),
                    declaringType);
        } catch (RuntimeException | StackOverflowError e) {
            unresolved(constructor.getName(), e);
            return null;
        }
    }

    static Set<Flag> flags(Collection<Modifier> modifiers) {
        Set<Flag> flags = EnumSet.noneOf(Flag.class);
        for (Modifier modifier : modifiers) {
            Flag flag = Flag.fromKeyword(modifier.getKeyword().asString());
            if (flag != null) flags.add(flag);
        }
        return flags;
    }

    private Type type(ResolvedType type, int depth) {
        if (type == null) return null;
        if (type.isVoid()) return Type.Primitive.VOID;
        if (type.isPrimitive()) return Type.Primitive.build(type.asPrimitive().describe());
        if (type.isNull()) return Type.Primitive.NULL;
        if (type.isWildcard()) return Type.Primitive.WILDCARD;

        if (type.isArray()) {
            Type elemType = type(type.asArrayType().getComponentType(), depth);
            return elemType == null ? null : new Type.Array(elemType);
        }

        if (type.isTypeVariable()) {
            var typeParameter = type.asTypeParameter();
            Type.Class bound = null;
            for (var b : typeParameter.getBounds()) {
                if (b.isExtends()) {
                    bound = asClass(type(b.getType(), 0));
                    if (bound != null) break;
                }
            }
            return new Type.GenericTypeVariable(typeParameter.getName(), bound);
        }

        if (type.isReferenceType()) {
            ResolvedReferenceType referenceType = type.asReferenceType();
            var declaration = referenceType.getTypeDeclaration();
            if (declaration.isPresent()) return classType(declaration.get(), depth);
            return classType(referenceType.getQualifiedName());
        }

        // lambda constraints, unions, intersections
        return null;
    }

    private Type classType(ResolvedReferenceTypeDeclaration declaration, int depth) {
        String fqn = declaration.getQualifiedName();
        if (building.contains(fqn)) return new Type.Cyclic(fqn);

        String key = fqn + "#" + depth;
        Type cached = classCache.get(key);
        if (cached != null) return cached;

        building.add(fqn);
        try {
            List<Type.Var> members = depth > 0 ? members(declaration, depth - 1) : Collections.emptyList();
            Type.Class supertype = declaration.isInterface() ? null : supertype(declaration, depth);
            Type.Class clazz = typePool.build(fqn, members, supertype);
            classCache.put(key, clazz);
            return clazz;
        } finally {
            building.remove(fqn);
        }
    }

    private List<Type.Var> members(ResolvedReferenceTypeDeclaration declaration, int depth) {
        List<Type.Var> members = new ArrayList<>();
        List<ResolvedFieldDeclaration> fields;
        try {
            fields = declaration.getDeclaredFields();
        } catch (RuntimeException e) {
            logger.fine(() -> "Could not list fields of " + declaration.getQualifiedName() + ": " + e.getMessage());
            return members;
        }

        for (ResolvedFieldDeclaration field : fields) {
            Type fieldType;
            try {
                fieldType = type(field.getType(), depth);
            } catch (RuntimeException e) {
                fieldType = null;
            }

            Set<Flag> flags = EnumSet.noneOf(Flag.class);
            addAccessFlag(flags, field.accessSpecifier());
            if (field.isStatic()) flags.add(Flag.Static);
            members.add(new Type.Var(field.getName(), fieldType, flags));
        }
        return members;
    }

    private Type.Class supertype(ResolvedReferenceTypeDeclaration declaration, int depth) {
        for (ResolvedReferenceType ancestor : declaration.getAncestors(true)) {
            var ancestorDeclaration = ancestor.getTypeDeclaration();
            if (ancestorDeclaration.isPresent() && ancestorDeclaration.get().isClass()) {
                return asClass(classType(ancestorDeclaration.get(), depth));
            }
        }
        return null;
    }

    private List<Type> paramTypes(ResolvedMethodLikeDeclaration declaration) {
        List<Type> paramTypes = new ArrayList<>();
        for (int i = 0; i < declaration.getNumberOfParams(); i++) {
            paramTypes.add(type(declaration.getParam(i).getType(), 0));
        }
        return paramTypes;
    }

    private static List<String> paramNames(ResolvedMethodLikeDeclaration declaration) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < declaration.getNumberOfParams(); i++) {
            var param = declaration.getParam(i);
            if (!param.hasName()) return null;
            names.add(param.getName());
        }
        return names;
    }

    private static void addAccessFlag(Set<Flag> flags, AccessSpecifier accessSpecifier) {
        if (accessSpecifier == AccessSpecifier.PUBLIC) {
            flags.add(Flag.Public);
        } else if (accessSpecifier == AccessSpecifier.PROTECTED) {
            flags.add(Flag.Protected);
        } else if (accessSpecifier == AccessSpecifier.PRIVATE) {
            flags.add(Flag.Private);
        }
    }

    private static Type.Class asClass(Type type) {
        return Type.asClass(type);
    }

    private void unresolved(Node node, Throwable e) {
        stats.incrementUnresolvedSymbols();
        logger.fine(() -> "Could not resolve '" + node + "' at " + node.getRange().map(Object::toString).orElse("?")
                + ": " + e.getMessage());
    }
}
