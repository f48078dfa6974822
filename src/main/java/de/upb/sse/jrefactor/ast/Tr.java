package de.upb.sse.jrefactor.ast;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.With;

import java.nio.file.Path;
import java.util.*;

/**
 * A syntax tree node.
 *
 * The set of node kinds is closed: the constructor is private and every kind is nested here with
 * its own {@code visitX} operation on {@link AstVisitor}. Nodes are immutable. The Lombok generated
 * {@code withX} methods return the same instance when nothing changes, so an edit rebuilds only the
 * path from the changed node up to the root and shares every other subtree.
 */
public abstract class Tr {

    private Tr() {
    }

    public abstract Formatting getFormatting();

    public abstract Tr withFormatting(Formatting formatting);

    public abstract <R> R accept(AstVisitor<R> visitor, Cursor cursor);

    /**
     * Direct children in source order.
     */
    public abstract List<Tr> children();

    public Tr withPrefix(String prefix) {
        return withFormatting(getFormatting().withPrefix(prefix));
    }

    public Tr withSuffix(String suffix) {
        return withFormatting(getFormatting().withSuffix(suffix));
    }

    public String print() {
        return new TreePrinter().print(this);
    }

    public String printTrimmed() {
        return print().trim();
    }

    @Override
    public String toString() {
        return print();
    }

    /**
     * An unmodifiable copy, so a node never shares a mutable list with its caller.
     */
    private static <T> List<T> frozen(List<T> list) {
        return list == null ? null : Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static List<Tr> nodes(Object... parts) {
        List<Tr> nodes = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Tr) {
                nodes.add((Tr) part);
            } else if (part instanceof List) {
                for (Object element : (List<?>) part) {
                    if (element != null) nodes.add((Tr) element);
                }
            }
        }
        return nodes;
    }

    /**
     * Nodes that can carry a resolved type.
     */
    public abstract static class Expression extends Tr {
        private Expression() {
        }

        public abstract Type getType();
    }

    @Getter
    @With
    public static final class CompilationUnit extends Tr {
        /** The suffix holds everything after the last declaration. */
        private final Formatting formatting;
        private final Path sourcePath;
        /** A {@link Package}, an {@link Unknown} for annotated package declarations, or null. */
        private final Tr packageDecl;
        private final List<Import> imports;
        /** {@link ClassDecl} or {@link Unknown} (module declarations). */
        private final List<Tr> classes;

        public CompilationUnit(Formatting formatting, Path sourcePath, Tr packageDecl, List<Import> imports, List<Tr> classes) {
            this.formatting = formatting;
            this.sourcePath = sourcePath;
            this.packageDecl = packageDecl;
            this.imports = frozen(imports);
            this.classes = frozen(classes);
        }

        public List<ClassDecl> getClassDecls() {
            List<ClassDecl> decls = new ArrayList<>();
            for (Tr clazz : classes) {
                if (clazz instanceof ClassDecl) decls.add((ClassDecl) clazz);
            }
            return decls;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitCompilationUnit(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(packageDecl, imports, classes);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Package extends Tr {
        private final Formatting formatting;
        private final Expression name;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitPackage(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(name);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Import extends Tr {
        private final Formatting formatting;
        /** Null unless this is a static import. */
        private final Keyword staticKeyword;
        /** {@link FieldAccess} chain ending in the imported name or {@code *}. */
        private final Expression qualid;

        public boolean isStatic() {
            return staticKeyword != null;
        }

        public boolean isStar() {
            return qualid instanceof FieldAccess && "*".equals(((FieldAccess) qualid).getSimpleName());
        }

        /**
         * The imported name without formatting, e.g. {@code java.util.*}.
         */
        public String getTypeName() {
            return qualifiedName(qualid);
        }

        /**
         * Whether this import brings {@code fullyQualifiedName} into scope: an exact type import, a
         * star import of its package or enclosing type, or a static import of one of its members.
         */
        public boolean matches(String fullyQualifiedName) {
            String typeName = getTypeName();
            if (isStatic()) {
                String owner = typeName.substring(0, Math.max(typeName.lastIndexOf('.'), 0));
                return owner.equals(fullyQualifiedName);
            }
            if (isStar()) {
                String owner = typeName.substring(0, typeName.length() - 2);
                int lastDot = fullyQualifiedName.lastIndexOf('.');
                return owner.equals(Type.Class.packageName(fullyQualifiedName))
                        || (lastDot > 0 && owner.equals(fullyQualifiedName.substring(0, lastDot)));
            }
            return typeName.equals(fullyQualifiedName);
        }

        private static String qualifiedName(Tr tree) {
            if (tree instanceof Ident) {
                return ((Ident) tree).getName();
            } else if (tree instanceof FieldAccess) {
                FieldAccess fieldAccess = (FieldAccess) tree;
                return qualifiedName(fieldAccess.getTarget()) + "." + fieldAccess.getSimpleName();
            }
            return tree.printTrimmed();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitImport(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(staticKeyword, qualid);
        }
    }

    @Getter
    @With
    public static final class ClassDecl extends Tr {
        private final Formatting formatting;
        /** {@link Keyword} modifiers and annotations (as {@link Unknown}) in source order. */
        private final List<Tr> modifiers;
        /** {@code class}, {@code interface}, {@code enum}, {@code record} or {@code @interface}. */
        private final Keyword kind;
        private final Ident name;
        /** Type parameters, extends, implements, permits and record components, verbatim. */
        private final Unknown header;
        private final Block body;
        private final Type.Class type;

        public ClassDecl(Formatting formatting, List<Tr> modifiers, Keyword kind, Ident name, Unknown header,
                         Block body, Type.Class type) {
            this.formatting = formatting;
            this.modifiers = frozen(modifiers);
            this.kind = kind;
            this.name = name;
            this.header = header;
            this.body = body;
            this.type = type;
        }

        public String getSimpleName() {
            return name.getName();
        }

        public List<MethodDecl> getMethods() {
            List<MethodDecl> methods = new ArrayList<>();
            for (Tr member : body.getStatements()) {
                if (member instanceof MethodDecl) methods.add((MethodDecl) member);
            }
            return methods;
        }

        public List<VariableDecls> getFields() {
            List<VariableDecls> fields = new ArrayList<>();
            for (Tr member : body.getStatements()) {
                if (member instanceof VariableDecls) fields.add((VariableDecls) member);
            }
            return fields;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitClassDecl(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(modifiers, kind, name, header, body);
        }
    }

    @Getter
    @With
    public static final class MethodDecl extends Tr {
        private final Formatting formatting;
        private final List<Tr> modifiers;
        private final Unknown typeParameters;
        /** Null for constructors. */
        private final Tr returnTypeExpr;
        /** The suffix holds the whitespace before the opening parenthesis. */
        private final Ident name;
        /** {@link VariableDecls} per parameter, or a single {@link Empty} for an empty list. */
        private final List<Tr> params;
        private final Unknown throwsClause;
        /** A {@link Block}, or an {@link Empty} whose prefix precedes the terminating semicolon. */
        private final Tr body;
        private final Type.Method type;

        public MethodDecl(Formatting formatting, List<Tr> modifiers, Unknown typeParameters, Tr returnTypeExpr,
                          Ident name, List<Tr> params, Unknown throwsClause, Tr body, Type.Method type) {
            this.formatting = formatting;
            this.modifiers = frozen(modifiers);
            this.typeParameters = typeParameters;
            this.returnTypeExpr = returnTypeExpr;
            this.name = name;
            this.params = frozen(params);
            this.throwsClause = throwsClause;
            this.body = body;
            this.type = type;
        }

        public String getSimpleName() {
            return name.getName();
        }

        public boolean isConstructor() {
            return returnTypeExpr == null;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitMethodDecl(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(modifiers, typeParameters, returnTypeExpr, name, params, throwsClause, body);
        }
    }

    @Getter
    @With
    public static final class Block extends Tr {
        private final Formatting formatting;
        /** Set for static initializers; its suffix precedes the opening brace. */
        private final Keyword staticKeyword;
        private final List<Tr> statements;
        /** The prefix holds the whitespace before the closing brace. */
        private final Formatting end;

        public Block(Formatting formatting, Keyword staticKeyword, List<Tr> statements, Formatting end) {
            this.formatting = formatting;
            this.staticKeyword = staticKeyword;
            this.statements = frozen(statements);
            this.end = end;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitBlock(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(staticKeyword, statements);
        }
    }

    @Getter
    @With
    public static final class VariableDecls extends Tr {
        private final Formatting formatting;
        private final List<Tr> modifiers;
        /** Null for lambda parameters without a declared type. */
        private final Tr typeExpr;
        /** Non-null for a variable arity parameter; the prefix precedes the ellipsis. */
        private final Formatting varargs;
        private final List<NamedVar> vars;

        public VariableDecls(Formatting formatting, List<Tr> modifiers, Tr typeExpr, Formatting varargs,
                             List<NamedVar> vars) {
            this.formatting = formatting;
            this.modifiers = frozen(modifiers);
            this.typeExpr = typeExpr;
            this.varargs = varargs;
            this.vars = frozen(vars);
        }

        public boolean isVarargs() {
            return varargs != null;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitVariableDecls(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(modifiers, typeExpr, vars);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class NamedVar extends Tr {
        private final Formatting formatting;
        /** The suffix holds the whitespace before {@code =}. */
        private final Ident name;
        private final Expression initializer;
        private final Type type;

        public String getSimpleName() {
            return name.getName();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitNamedVar(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(name, initializer);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Keyword extends Tr {
        private final Formatting formatting;
        private final String keyword;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitKeyword(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return Collections.emptyList();
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Return extends Tr {
        private final Formatting formatting;
        private final Expression expr;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitReturn(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(expr);
        }
    }

    @Getter
    @With
    public static final class MethodInvocation extends Expression {
        private final Formatting formatting;
        /** The suffix holds the whitespace before the dot. Null for unqualified calls. */
        private final Expression select;
        private final Unknown typeParameters;
        /** The suffix holds the whitespace before the opening parenthesis. */
        private final Ident name;
        /** One expression per argument, or a single {@link Empty} for an empty list. */
        private final List<Tr> args;
        private final Type.Method type;

        public MethodInvocation(Formatting formatting, Expression select, Unknown typeParameters, Ident name,
                                List<Tr> args, Type.Method type) {
            this.formatting = formatting;
            this.select = select;
            this.typeParameters = typeParameters;
            this.name = name;
            this.args = frozen(args);
            this.type = type;
        }

        public String getSimpleName() {
            return name.getName();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitMethodInvocation(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(select, typeParameters, name, args);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class FieldAccess extends Expression {
        private final Formatting formatting;
        /** The suffix holds the whitespace before the dot. */
        private final Expression target;
        private final Ident name;
        private final Type type;

        public String getSimpleName() {
            return name.getName();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitFieldAccess(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(target, name);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Ident extends Expression {
        private final Formatting formatting;
        private final String name;
        private final Type type;

        public static Ident build(String name) {
            return new Ident(Formatting.EMPTY, name, null);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitIdent(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return Collections.emptyList();
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Literal extends Expression {
        private final Formatting formatting;
        /** Decoded value where the literal kind has one, otherwise null. */
        private final Object value;
        private final String valueSource;
        private final Type type;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitLiteral(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return Collections.emptyList();
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Parentheses extends Expression {
        private final Formatting formatting;
        /** The suffix holds the whitespace before the closing parenthesis. */
        private final Expression tree;

        /**
         * Synthesizes a parenthesis pair around {@code expression}. The expression's formatting
         * moves to the parentheses and the expression itself is left with {@link Formatting#EMPTY},
         * which the printer pads with one space on each side.
         */
        public static Parentheses wrap(Expression expression) {
            return new Parentheses(expression.getFormatting(), (Expression) expression.withFormatting(Formatting.EMPTY));
        }

        @Override
        public Type getType() {
            return tree.getType();
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitParentheses(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(tree);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Binary extends Expression {
        private final Formatting formatting;
        /** The suffix holds the whitespace before the operator. */
        private final Expression left;
        private final String operator;
        private final Expression right;
        private final Type type;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitBinary(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(left, right);
        }
    }

    @Getter
    @With
    @AllArgsConstructor
    public static final class Assign extends Expression {
        private final Formatting formatting;
        /** The suffix holds the whitespace before the operator. */
        private final Expression variable;
        /** {@code =} or a compound operator such as {@code +=}. */
        private final String operator;
        private final Expression assignment;
        private final Type type;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitAssign(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(variable, assignment);
        }
    }

    /**
     * Placeholder carrying only formatting, e.g. the inside of {@code ( )}.
     */
    @Getter
    @With
    @AllArgsConstructor
    public static final class Empty extends Tr {
        private final Formatting formatting;

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitEmpty(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return Collections.emptyList();
        }
    }

    /**
     * A construct without a dedicated kind, kept as verbatim text interleaved with the nodes
     * found inside it: {@code fragments[0] trees[0] fragments[1] ... trees[n-1] fragments[n]}.
     */
    @Getter
    @With
    public static final class Unknown extends Expression {
        private final Formatting formatting;
        private final List<String> fragments;
        private final List<Tr> trees;
        private final Type type;

        public Unknown(Formatting formatting, List<String> fragments, List<Tr> trees, Type type) {
            this.formatting = formatting;
            this.fragments = frozen(fragments);
            this.trees = frozen(trees);
            this.type = type;
        }

        public static Unknown verbatim(Formatting formatting, String text, Type type) {
            return new Unknown(formatting, Collections.singletonList(text), Collections.emptyList(), type);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor, Cursor cursor) {
            return visitor.visitUnknown(this, cursor);
        }

        @Override
        public List<Tr> children() {
            return nodes(trees);
        }
    }
}
