package de.upb.sse.jrefactor.parse;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.VarType;
import com.github.javaparser.ast.type.VoidType;
import de.upb.sse.jrefactor.ast.Formatting;
import de.upb.sse.jrefactor.ast.Tr;
import de.upb.sse.jrefactor.ast.Type;
import de.upb.sse.jrefactor.stats.ParseStats;

import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

import static de.upb.sse.jrefactor.ast.Formatting.format;

/**
 * Converts one JavaParser compilation unit into a {@link Tr.CompilationUnit} over the exact text
 * it was parsed from.
 *
 * A single cursor walks the source front to back. Every character between two tokens the tree
 * models ends up in some prefix, suffix or verbatim fragment, which is what makes printing a
 * byte-exact round trip. Whenever a dedicated conversion cannot account for every character of
 * a node it is discarded and the node is kept as {@link Tr.Unknown} instead.
 */
class TreeBuilder {
    private static final Logger logger = Logger.getLogger(TreeBuilder.class.getName());

    private final Path sourcePath;
    private final String source;
    private final int[] lineStarts;
    private final TypeMapper typeMapper;
    private final ParseStats stats;

    private int cursor;

    TreeBuilder(Path sourcePath, String source, TypeMapper typeMapper, ParseStats stats) {
        this.sourcePath = sourcePath;
        this.source = source;
        this.lineStarts = lineStarts(source);
        this.typeMapper = typeMapper;
        this.stats = stats;
    }

    Tr.CompilationUnit build(CompilationUnit cu) {
        logger.finer(() -> "Building tree for " + sourcePath);
        cursor = 0;

        Tr packageDecl = cu.getPackageDeclaration().map(this::packageDecl).orElse(null);

        List<Tr.Import> imports = new ArrayList<>();
        for (ImportDeclaration importDeclaration : cu.getImports()) {
            imports.add(importDecl(importDeclaration));
        }

        List<Node> declarations = new ArrayList<>(cu.getTypes());
        cu.getModule().ifPresent(declarations::add);
        List<Tr> classes = new ArrayList<>();
        for (Node declaration : sorted(declarations)) {
            classes.add(member(declaration));
        }

        return new Tr.CompilationUnit(format("", source.substring(cursor)), sourcePath, packageDecl, imports, classes);
    }

    private Tr packageDecl(PackageDeclaration pkg) {
        int saved = cursor;
        if (pkg.getAnnotations().isEmpty()) {
            try {
                String prefix = prefix(pkg);
                cursor += "package".length();
                Tr.Expression name = suffixed(nameTree(pkg.getName()), sourceBefore(";"));
                if (cursor == end(pkg)) return new Tr.Package(format(prefix), name);
            } catch (RuntimeException e) {
                conversionFailed(pkg, e);
            }
        }
        cursor = saved;
        return unknown(pkg, null);
    }

    private Tr.Import importDecl(ImportDeclaration impoort) {
        String prefix = prefix(impoort);
        cursor += "import".length();

        Tr.Keyword staticKeyword = null;
        if (impoort.isStatic()) {
            String staticPrefix = whitespace();
            cursor += "static".length();
            staticKeyword = new Tr.Keyword(format(staticPrefix), "static");
        }

        Tr.Expression qualid = nameTree(impoort.getName());
        if (impoort.isAsterisk()) {
            Tr.Expression target = suffixed(qualid, sourceBefore("."));
            String starPrefix = whitespace();
            cursor++;
            qualid = new Tr.FieldAccess(format(""), target, new Tr.Ident(format(starPrefix), "*", null), null);
        }
        qualid = suffixed(qualid, sourceBefore(";"));

        return new Tr.Import(format(prefix), staticKeyword, qualid);
    }

    /**
     * Type declarations and their members. Falls back to {@link Tr.Unknown}.
     */
    private Tr member(Node member) {
        int saved = cursor;
        try {
            Tr tree = null;
            if (member instanceof TypeDeclaration) {
                tree = classDecl((TypeDeclaration<?>) member);
            } else if (member instanceof MethodDeclaration || member instanceof ConstructorDeclaration) {
                tree = methodDecl((CallableDeclaration<?>) member);
            } else if (member instanceof FieldDeclaration) {
                FieldDeclaration field = (FieldDeclaration) member;
                tree = variableDecls(field, field.getModifiers(), field.getAnnotations(), field.getVariables())
                        .withSuffix(sourceBefore(";"));
            } else if (member instanceof InitializerDeclaration) {
                tree = initializer((InitializerDeclaration) member);
            }
            if (tree != null && cursor == end(member)) return tree;
        } catch (RuntimeException e) {
            conversionFailed(member, e);
        }
        cursor = saved;
        return unknown(member, null);
    }

    private Tr.ClassDecl classDecl(TypeDeclaration<?> typeDeclaration) {
        String prefix = prefix(typeDeclaration);
        List<Tr> modifiers = modifiers(typeDeclaration.getModifiers(), typeDeclaration.getAnnotations());

        String kindPrefix = whitespace();
        String kind;
        if (source.startsWith("@", cursor)) {
            kind = source.substring(cursor, source.indexOf("interface", cursor) + "interface".length());
        } else {
            int i = cursor;
            while (i < source.length() && Character.isJavaIdentifierPart(source.charAt(i))) i++;
            kind = source.substring(cursor, i);
        }
        cursor += kind.length();
        Tr.Keyword kindKeyword = new Tr.Keyword(format(kindPrefix), kind);

        Tr.Ident name = ident(typeDeclaration.getName(), null);

        int bodyStart = indexOfDelimiter('{', cursor);
        Tr.Unknown header = null;
        int beforeHeader = cursor;
        String headerPrefix = whitespace();
        if (cursor < bodyStart) {
            int headerEnd = trimTrailingWhitespace(cursor, bodyStart);
            header = Tr.Unknown.verbatim(format(headerPrefix), source.substring(cursor, headerEnd), null);
            cursor = headerEnd;
        } else {
            cursor = beforeHeader;
        }

        String bodyPrefix = source.substring(cursor, bodyStart);
        cursor = bodyStart + 1;

        List<Tr> statements = new ArrayList<>();
        if (typeDeclaration instanceof EnumDeclaration) {
            Tr constants = enumConstants((EnumDeclaration) typeDeclaration);
            if (constants != null) statements.add(constants);
        }
        for (Node member : sorted(typeDeclaration.getMembers())) {
            statements.add(member(member));
        }

        int close = end(typeDeclaration) - 1;
        Formatting end = format(source.substring(cursor, close));
        cursor = close + 1;

        Tr.Block body = new Tr.Block(format(bodyPrefix), null, statements, end);
        return new Tr.ClassDecl(format(prefix), modifiers, kindKeyword, name, header, body,
                typeMapper.classDeclType(typeDeclaration));
    }

    /**
     * Enum constants up to and including the semicolon that separates them from the members.
     */
    private Tr enumConstants(EnumDeclaration enumDeclaration) {
        NodeList<EnumConstantDeclaration> entries = enumDeclaration.getEntries();
        int contentEnd;
        if (!enumDeclaration.getMembers().isEmpty()) {
            int from = entries.isEmpty() ? cursor : end(entries.get(entries.size() - 1));
            int semicolon = indexOfDelimiter(';', from);
            contentEnd = semicolon + 1;
        } else {
            contentEnd = trimTrailingWhitespace(cursor, end(enumDeclaration) - 1);
        }

        int saved = cursor;
        String prefix = whitespace();
        if (cursor >= contentEnd) {
            cursor = saved;
            return null;
        }
        stats.incrementUnknownNodes();
        return unknownSpan(prefix, contentEnd, new ArrayList<>(entries), null);
    }

    private Tr.MethodDecl methodDecl(CallableDeclaration<?> method) {
        if (method.getReceiverParameter().isPresent()) {
            throw new IllegalStateException("receiver parameters are kept verbatim");
        }

        String prefix = prefix(method);
        List<Tr> modifiers = modifiers(method.getModifiers(), method.getAnnotations());

        Tr.Unknown typeParameters = null;
        if (method.getTypeParameters().isNonEmpty()) {
            String typeParametersPrefix = whitespace();
            int start = cursor;
            cursor = end(method.getTypeParameters().get(method.getTypeParameters().size() - 1));
            sourceBefore(">");
            typeParameters = Tr.Unknown.verbatim(format(typeParametersPrefix), source.substring(start, cursor), null);
        }

        Tr returnTypeExpr = method instanceof MethodDeclaration ? typeTree(((MethodDeclaration) method).getType()) : null;
        Tr.Ident name = suffixed(ident(method.getName(), null), sourceBefore("("));

        List<Tr> params = new ArrayList<>();
        NodeList<Parameter> parameters = method.getParameters();
        if (parameters.isEmpty()) {
            params.add(new Tr.Empty(format(sourceBefore(")"))));
        } else {
            for (int i = 0; i < parameters.size(); i++) {
                params.add(suffixed(parameter(parameters.get(i)), sourceBefore(i == parameters.size() - 1 ? ")" : ",")));
            }
        }

        Tr.Unknown throwsClause = null;
        if (method.getThrownExceptions().isNonEmpty()) {
            String throwsPrefix = whitespace();
            int start = cursor;
            cursor = end(method.getThrownExceptions().get(method.getThrownExceptions().size() - 1));
            throwsClause = Tr.Unknown.verbatim(format(throwsPrefix), source.substring(start, cursor), null);
        }

        Tr body;
        Type.Method type;
        if (method instanceof MethodDeclaration) {
            MethodDeclaration methodDeclaration = (MethodDeclaration) method;
            body = methodDeclaration.getBody().isPresent() ? block(methodDeclaration.getBody().get())
                    : new Tr.Empty(format(sourceBefore(";")));
            type = typeMapper.methodDeclType(methodDeclaration);
        } else {
            ConstructorDeclaration constructor = (ConstructorDeclaration) method;
            body = block(constructor.getBody());
            type = typeMapper.constructorDeclType(constructor);
        }

        return new Tr.MethodDecl(format(prefix), modifiers, typeParameters, returnTypeExpr, name, params,
                throwsClause, body, type);
    }

    private Tr.Block initializer(InitializerDeclaration initializer) {
        String prefix = prefix(initializer);
        Tr.Keyword staticKeyword = null;
        if (initializer.isStatic()) {
            cursor += "static".length();
            staticKeyword = new Tr.Keyword(format("", source.substring(cursor, begin(initializer.getBody()))), "static");
            cursor = begin(initializer.getBody());
        }
        return blockBody(format(prefix), staticKeyword, initializer.getBody());
    }

    private Tr.Block block(BlockStmt block) {
        return blockBody(format(prefix(block)), null, block);
    }

    private Tr.Block blockBody(Formatting formatting, Tr.Keyword staticKeyword, BlockStmt block) {
        cursor = begin(block) + 1;

        List<Tr> statements = new ArrayList<>();
        for (Statement statement : block.getStatements()) {
            statements.add(statement(statement));
        }

        int close = end(block) - 1;
        Formatting end = format(source.substring(cursor, close));
        cursor = close + 1;
        return new Tr.Block(formatting, staticKeyword, statements, end);
    }

    /**
     * Block statements. Terminated statements consume their semicolon; the whitespace before it
     * becomes their suffix.
     */
    private Tr statement(Statement statement) {
        int saved = cursor;
        try {
            Tr tree = null;
            if (statement instanceof ExpressionStmt) {
                Expression expression = ((ExpressionStmt) statement).getExpression();
                if (expression instanceof VariableDeclarationExpr) {
                    VariableDeclarationExpr variables = (VariableDeclarationExpr) expression;
                    tree = variableDecls(variables, variables.getModifiers(), variables.getAnnotations(), variables.getVariables());
                } else if (expression instanceof MethodCallExpr) {
                    tree = methodInvocation((MethodCallExpr) expression);
                } else if (expression instanceof AssignExpr) {
                    tree = assign((AssignExpr) expression);
                }
                if (tree != null) tree = tree.withSuffix(sourceBefore(";"));
            } else if (statement instanceof ReturnStmt) {
                ReturnStmt returnStmt = (ReturnStmt) statement;
                String prefix = prefix(returnStmt);
                cursor += "return".length();
                Tr.Expression expr = returnStmt.getExpression().isPresent() ? expression(returnStmt.getExpression().get()) : null;
                tree = new Tr.Return(format(prefix), expr).withSuffix(sourceBefore(";"));
            } else if (statement instanceof BlockStmt) {
                tree = block((BlockStmt) statement);
            }
            if (tree != null && cursor == end(statement)) return tree;
        } catch (RuntimeException e) {
            conversionFailed(statement, e);
        }
        cursor = saved;
        return unknown(statement, null);
    }

    private Tr.VariableDecls variableDecls(Node declaration, NodeList<Modifier> modifierNodes,
                                           NodeList<AnnotationExpr> annotations, NodeList<VariableDeclarator> variables) {
        for (VariableDeclarator variable : variables) {
            if (hasArrayBrackets(variable.getName()) || !variable.getType().equals(variables.get(0).getType())) {
                throw new IllegalStateException("C style array declarators are kept verbatim");
            }
        }

        String prefix = prefix(declaration);
        List<Tr> modifiers = modifiers(modifierNodes, annotations);
        Tr typeExpr = typeTree(variables.get(0).getType());

        List<Tr.NamedVar> vars = new ArrayList<>();
        for (int i = 0; i < variables.size(); i++) {
            Tr.NamedVar var = namedVar(variables.get(i));
            if (i < variables.size() - 1) {
                var = suffixed(var, sourceBefore(","));
            }
            vars.add(var);
        }

        return new Tr.VariableDecls(format(prefix), modifiers, typeExpr, null, vars);
    }

    private Tr.NamedVar namedVar(VariableDeclarator variable) {
        String prefix = prefix(variable.getName());
        Tr.Ident name = ident(variable.getName(), null);

        Tr.Expression initializer = null;
        if (variable.getInitializer().isPresent()) {
            name = suffixed(name, sourceBefore("="));
            initializer = expression(variable.getInitializer().get());
        }

        return new Tr.NamedVar(format(prefix), name, initializer, typeMapper.typeOf(variable.getType()));
    }

    private Tr.VariableDecls parameter(Parameter parameter) {
        if (!parameter.getVarArgsAnnotations().isEmpty() || hasArrayBrackets(parameter.getName())) {
            throw new IllegalStateException("parameter is kept verbatim");
        }

        String prefix = prefix(parameter);
        List<Tr> modifiers = modifiers(parameter.getModifiers(), parameter.getAnnotations());
        Tr typeExpr = typeTree(parameter.getType());

        Formatting varargs = null;
        if (parameter.isVarArgs()) {
            varargs = format(sourceBefore("..."));
        }

        String namePrefix = prefix(parameter.getName());
        Tr.Ident name = ident(parameter.getName(), null);

        Type type = typeMapper.typeOf(parameter.getType());
        if (type != null && parameter.isVarArgs()) {
            type = new Type.Array(type);
        }

        Tr.NamedVar var = new Tr.NamedVar(format(namePrefix), name, null, type);
        return new Tr.VariableDecls(format(prefix), modifiers, typeExpr, varargs, Collections.singletonList(var));
    }

    private List<Tr> modifiers(NodeList<Modifier> modifiers, NodeList<AnnotationExpr> annotations) {
        List<Node> nodes = new ArrayList<>(modifiers);
        nodes.addAll(annotations);

        List<Tr> trees = new ArrayList<>();
        for (Node node : sorted(nodes)) {
            if (node instanceof Modifier) {
                String prefix = prefix(node);
                String keyword = source.substring(begin(node), end(node));
                cursor = end(node);
                trees.add(new Tr.Keyword(format(prefix), keyword));
            } else {
                trees.add(expression((Expression) node));
            }
        }
        return trees;
    }

    /**
     * Primitive types and plain, possibly qualified, class names become {@link Tr.Ident} and
     * {@link Tr.FieldAccess}; generic, array and annotated types stay verbatim.
     */
    private Tr typeTree(com.github.javaparser.ast.type.Type typeNode) {
        int saved = cursor;
        Type type = typeMapper.typeOf(typeNode);
        try {
            if ((typeNode instanceof PrimitiveType || typeNode instanceof VoidType || typeNode instanceof VarType)
                    && typeNode.getAnnotations().isEmpty()) {
                String prefix = prefix(typeNode);
                String name = source.substring(begin(typeNode), end(typeNode));
                cursor = end(typeNode);
                return new Tr.Ident(format(prefix), name, type);
            }

            if (typeNode instanceof ClassOrInterfaceType && isPlainClassName((ClassOrInterfaceType) typeNode)) {
                Tr.Expression name = classTypeName((ClassOrInterfaceType) typeNode);
                if (cursor == end(typeNode)) {
                    return name instanceof Tr.Ident ? ((Tr.Ident) name).withType(type) : ((Tr.FieldAccess) name).withType(type);
                }
            }
        } catch (RuntimeException e) {
            conversionFailed(typeNode, e);
        }
        cursor = saved;
        return unknown(typeNode, type);
    }

    private static boolean isPlainClassName(ClassOrInterfaceType type) {
        if (type.getTypeArguments().isPresent() || !type.getAnnotations().isEmpty()) return false;
        return type.getScope().map(TreeBuilder::isPlainClassName).orElse(true);
    }

    private Tr.Expression classTypeName(ClassOrInterfaceType type) {
        String prefix = prefix(type);
        if (type.getScope().isPresent()) {
            Tr.Expression target = suffixed(classTypeName(type.getScope().get()), sourceBefore("."));
            Tr.Ident name = ident(type.getName(), null);
            return new Tr.FieldAccess(format(prefix), target, name, null);
        }
        cursor = end(type);
        return new Tr.Ident(format(prefix), type.getNameAsString(), null);
    }

    private Tr.Expression nameTree(Name name) {
        String prefix = prefix(name);
        if (name.getQualifier().isPresent()) {
            Tr.Expression target = suffixed(nameTree(name.getQualifier().get()), sourceBefore("."));
            int identifierBegin = end(name) - name.getIdentifier().length();
            String identifierPrefix = source.substring(cursor, identifierBegin);
            cursor = end(name);
            return new Tr.FieldAccess(format(prefix), target, new Tr.Ident(format(identifierPrefix), name.getIdentifier(), null), null);
        }
        cursor = end(name);
        return new Tr.Ident(format(prefix), name.getIdentifier(), null);
    }

    private Tr.Expression expression(Expression expression) {
        int saved = cursor;
        try {
            Tr.Expression tree = null;
            if (expression instanceof MethodCallExpr) {
                tree = methodInvocation((MethodCallExpr) expression);
            } else if (expression instanceof FieldAccessExpr) {
                tree = fieldAccess((FieldAccessExpr) expression);
            } else if (expression instanceof NameExpr) {
                String prefix = prefix(expression);
                cursor = end(expression);
                tree = new Tr.Ident(format(prefix), ((NameExpr) expression).getNameAsString(), typeMapper.expressionType(expression));
            } else if (expression instanceof LiteralExpr) {
                tree = literal((LiteralExpr) expression);
            } else if (expression instanceof EnclosedExpr) {
                tree = parentheses((EnclosedExpr) expression);
            } else if (expression instanceof BinaryExpr) {
                tree = binary((BinaryExpr) expression);
            } else if (expression instanceof AssignExpr) {
                tree = assign((AssignExpr) expression);
            }
            if (tree != null && cursor == end(expression)) return tree;
        } catch (RuntimeException e) {
            conversionFailed(expression, e);
        }
        cursor = saved;
        return unknown(expression, null);
    }

    private Tr.MethodInvocation methodInvocation(MethodCallExpr call) {
        String prefix = prefix(call);

        Tr.Expression select = null;
        if (call.getScope().isPresent()) {
            select = suffixed(expression(call.getScope().get()), sourceBefore("."));
        }

        Tr.Unknown typeParameters = null;
        if (call.getTypeArguments().isPresent()) {
            NodeList<com.github.javaparser.ast.type.Type> typeArguments = call.getTypeArguments().get();
            String typeParametersPrefix = whitespace();
            int start = cursor;
            if (!typeArguments.isEmpty()) {
                cursor = end(typeArguments.get(typeArguments.size() - 1));
            }
            sourceBefore(">");
            typeParameters = Tr.Unknown.verbatim(format(typeParametersPrefix), source.substring(start, cursor), null);
        }

        Tr.Ident name = suffixed(ident(call.getName(), null), sourceBefore("("));

        List<Tr> args = new ArrayList<>();
        NodeList<Expression> arguments = call.getArguments();
        if (arguments.isEmpty()) {
            args.add(new Tr.Empty(format(sourceBefore(")"))));
        } else {
            for (int i = 0; i < arguments.size(); i++) {
                args.add(suffixed(expression(arguments.get(i)), sourceBefore(i == arguments.size() - 1 ? ")" : ",")));
            }
        }

        return new Tr.MethodInvocation(format(prefix), select, typeParameters, name, args,
                typeMapper.methodInvocationType(call));
    }

    private Tr.FieldAccess fieldAccess(FieldAccessExpr fieldAccess) {
        if (fieldAccess.getTypeArguments().isPresent()) {
            throw new IllegalStateException("field access with type arguments is kept verbatim");
        }
        String prefix = prefix(fieldAccess);
        Tr.Expression target = suffixed(expression(fieldAccess.getScope()), sourceBefore("."));
        Tr.Ident name = ident(fieldAccess.getName(), null);
        return new Tr.FieldAccess(format(prefix), target, name, typeMapper.expressionType(fieldAccess));
    }

    private Tr.Literal literal(LiteralExpr literal) {
        String prefix = prefix(literal);
        String valueSource = source.substring(begin(literal), end(literal));
        cursor = end(literal);

        Object value = null;
        Type type = null;
        try {
            if (literal instanceof BooleanLiteralExpr) {
                value = ((BooleanLiteralExpr) literal).getValue();
                type = Type.Primitive.BOOLEAN;
            } else if (literal instanceof CharLiteralExpr) {
                type = Type.Primitive.CHAR;
                value = ((CharLiteralExpr) literal).asChar();
            } else if (literal instanceof IntegerLiteralExpr) {
                type = Type.Primitive.INT;
                value = ((IntegerLiteralExpr) literal).asNumber();
            } else if (literal instanceof LongLiteralExpr) {
                type = Type.Primitive.LONG;
                value = ((LongLiteralExpr) literal).asNumber();
            } else if (literal instanceof DoubleLiteralExpr) {
                double d = ((DoubleLiteralExpr) literal).asDouble();
                boolean isFloat = valueSource.endsWith("f") || valueSource.endsWith("F");
                type = isFloat ? Type.Primitive.FLOAT : Type.Primitive.DOUBLE;
                value = isFloat ? (Object) (float) d : (Object) d;
            } else if (literal instanceof StringLiteralExpr) {
                type = Type.Primitive.STRING;
                value = ((StringLiteralExpr) literal).asString();
            } else if (literal instanceof TextBlockLiteralExpr) {
                type = Type.Primitive.STRING;
                value = ((TextBlockLiteralExpr) literal).asString();
            } else if (literal instanceof NullLiteralExpr) {
                type = Type.Primitive.NULL;
            }
        } catch (RuntimeException e) {
            logger.fine(() -> "Could not decode literal " + valueSource + " in " + sourcePath + ": " + e.getMessage());
        }

        return new Tr.Literal(format(prefix), value, valueSource, type);
    }

    private Tr.Parentheses parentheses(EnclosedExpr enclosed) {
        String prefix = prefix(enclosed);
        cursor++;
        Tr.Expression inner = suffixed(expression(enclosed.getInner()), sourceBefore(")"));
        return new Tr.Parentheses(format(prefix), inner);
    }

    private Tr.Binary binary(BinaryExpr binary) {
        String prefix = prefix(binary);
        String operator = binary.getOperator().asString();
        Tr.Expression left = suffixed(expression(binary.getLeft()), sourceBefore(operator));
        Tr.Expression right = expression(binary.getRight());
        return new Tr.Binary(format(prefix), left, operator, right, typeMapper.expressionType(binary));
    }

    private Tr.Assign assign(AssignExpr assign) {
        String prefix = prefix(assign);
        String operator = assign.getOperator().asString();
        Tr.Expression variable = suffixed(expression(assign.getTarget()), sourceBefore(operator));
        Tr.Expression value = expression(assign.getValue());
        return new Tr.Assign(format(prefix), variable, operator, value, typeMapper.expressionType(assign));
    }

    private Tr.Ident ident(SimpleName name, Type type) {
        String prefix = prefix(name);
        cursor = end(name);
        return new Tr.Ident(format(prefix), name.getIdentifier(), type);
    }

    private Tr.Unknown unknown(Node node, Type type) {
        String prefix = prefix(node);
        stats.incrementUnknownNodes();
        return unknownSpan(prefix, end(node), childNodes(node), type);
    }

    /**
     * Verbatim text from the cursor to {@code end}, with the children that contain modeled
     * constructs converted in place.
     */
    private Tr.Unknown unknownSpan(String prefix, int end, List<? extends Node> children, Type type) {
        List<String> fragments = new ArrayList<>();
        List<Tr> trees = new ArrayList<>();
        int fragmentStart = cursor;

        for (Node child : sorted(children)) {
            if (begin(child) < cursor || end(child) > end || !containsModeledNodes(child)) continue;

            int childPrefixStart = trimTrailingWhitespace(cursor, begin(child));
            int saved = cursor;
            cursor = childPrefixStart;
            Tr tree = nested(child);
            if (tree == null) {
                cursor = saved;
                continue;
            }
            fragments.add(source.substring(fragmentStart, childPrefixStart));
            trees.add(tree);
            fragmentStart = cursor;
        }

        fragments.add(source.substring(fragmentStart, end));
        cursor = end;
        return new Tr.Unknown(format(prefix), fragments, trees, type);
    }

    private Tr nested(Node child) {
        try {
            Tr tree;
            if (child instanceof Expression) {
                tree = expression((Expression) child);
            } else if (child instanceof BlockStmt) {
                tree = block((BlockStmt) child);
            } else {
                tree = unknown(child, null);
            }
            if (cursor == end(child)) return tree;
        } catch (RuntimeException e) {
            conversionFailed(child, e);
        }
        return null;
    }

    private static boolean containsModeledNodes(Node node) {
        return node instanceof Expression || node instanceof BlockStmt
                || node.findFirst(Expression.class).isPresent() || node.findFirst(BlockStmt.class).isPresent();
    }

    private List<Node> childNodes(Node node) {
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment) && child.getRange().isPresent()) {
                children.add(child);
            }
        }
        return children;
    }

    private List<Node> sorted(Collection<? extends Node> nodes) {
        List<Node> sorted = new ArrayList<>(nodes);
        sorted.sort(Comparator.comparingInt(this::begin));
        return sorted;
    }

    private String prefix(Node node) {
        int begin = begin(node);
        if (begin < cursor) {
            throw new IllegalStateException("Node starts at " + begin + " before the cursor at " + cursor);
        }
        String prefix = source.substring(cursor, begin);
        cursor = begin;
        return prefix;
    }

    private String whitespace() {
        int start = cursor;
        cursor = skipWhitespaceAndComments(cursor);
        return source.substring(start, cursor);
    }

    /**
     * Everything from the cursor up to {@code delimiter}, which is consumed.
     */
    private String sourceBefore(String delimiter) {
        int start = cursor;
        int pos = skipWhitespaceAndComments(cursor);
        if (!source.startsWith(delimiter, pos)) {
            pos = source.indexOf(delimiter, cursor);
            if (pos < 0) {
                throw new IllegalStateException("Expected '" + delimiter + "' after offset " + cursor + " in " + sourcePath);
            }
        }
        cursor = pos + delimiter.length();
        return source.substring(start, pos);
    }

    /**
     * Whether brackets follow a declared name, measured from the identifier rather than the name's range.
     */
    private boolean hasArrayBrackets(SimpleName name) {
        return followedBy(begin(name) + name.getIdentifier().length(), '[');
    }

    private boolean followedBy(int from, char c) {
        int pos = skipWhitespaceAndComments(from);
        return pos < source.length() && source.charAt(pos) == c;
    }

    private int skipWhitespaceAndComments(int from) {
        int i = from;
        while (i < source.length()) {
            if (Character.isWhitespace(source.charAt(i))) {
                i++;
            } else if (source.startsWith("//", i)) {
                while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') i++;
            } else if (source.startsWith("/*", i)) {
                int close = source.indexOf("*/", i + 2);
                i = close < 0 ? source.length() : close + 2;
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * First occurrence of {@code c} outside comments and string or character literals.
     */
    private int indexOfDelimiter(char c, int from) {
        int i = from;
        while (i < source.length()) {
            if (source.startsWith("//", i) || source.startsWith("/*", i)) {
                i = skipWhitespaceAndComments(i);
                continue;
            }

            char ch = source.charAt(i);
            if (ch == c) return i;

            if (source.startsWith("\"\"\"", i)) {
                int close = source.indexOf("\"\"\"", i + 3);
                i = close < 0 ? source.length() : close + 3;
            } else if (ch == '"' || ch == '\'') {
                i++;
                while (i < source.length() && source.charAt(i) != ch) {
                    if (source.charAt(i) == '\\') i++;
                    i++;
                }
                i++;
            } else {
                i++;
            }
        }
        throw new IllegalStateException("Expected '" + c + "' after offset " + from + " in " + sourcePath);
    }

    private int trimTrailingWhitespace(int from, int to) {
        int i = to;
        while (i > from && Character.isWhitespace(source.charAt(i - 1))) i--;
        return i;
    }

    private int begin(Node node) {
        return offset(node.getRange().orElseThrow(() -> new IllegalStateException("Node without range: " + node)).begin);
    }

    private int end(Node node) {
        return offset(node.getRange().orElseThrow(() -> new IllegalStateException("Node without range: " + node)).end) + 1;
    }

    private int offset(Position position) {
        return lineStarts[position.line - 1] + position.column - 1;
    }

    private void conversionFailed(Node node, RuntimeException e) {
        logger.finer(() -> "Keeping " + node.getClass().getSimpleName() + " verbatim in " + sourcePath + ": " + e.getMessage());
    }

    @SuppressWarnings("unchecked")
    private static <T extends Tr> T suffixed(T tree, String suffix) {
        return (T) tree.withSuffix(suffix);
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r') {
                if (i + 1 < source.length() && source.charAt(i + 1) == '\n') i++;
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
