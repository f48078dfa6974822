package de.upb.sse.jrefactor.ast;

import java.util.List;
import java.util.Objects;

/**
 * Depth-first, pre-order traversal over a syntax tree producing a result of type {@code R}.
 *
 * Every node kind has a {@code visitX} operation whose default recurses into the node's children
 * in source order and folds their results with {@link #reduce(Object, Object)}. An override that
 * returns without calling {@code super} prunes the subtree. The cursor handed to {@code visitX}
 * already ends with the node being visited.
 *
 * @param <R> the result type
 */
public abstract class AstVisitor<R> {
    private final R defaultValue;

    protected AstVisitor(R defaultValue) {
        this.defaultValue = defaultValue;
    }

    public R defaultValue() {
        return defaultValue;
    }

    /**
     * Combines the result accumulated so far with the next child's result. The first result that
     * differs from the default wins.
     */
    public R reduce(R r1, R r2) {
        return Objects.equals(r1, defaultValue) ? r2 : r1;
    }

    public R visit(Tr tree) {
        return visit(tree, Cursor.ROOT);
    }

    public R visit(Tr tree, Cursor parent) {
        if (tree == null) return defaultValue;
        return tree.accept(this, parent.push(tree));
    }

    public R visit(List<? extends Tr> trees, Cursor parent) {
        R acc = defaultValue;
        if (trees == null) return acc;
        for (Tr tree : trees) {
            acc = reduce(acc, visit(tree, parent));
        }
        return acc;
    }

    public R visitChildren(Tr tree, Cursor cursor) {
        return visit(tree.children(), cursor);
    }

    public R visitCompilationUnit(Tr.CompilationUnit cu, Cursor cursor) {
        return visitChildren(cu, cursor);
    }

    public R visitPackage(Tr.Package pkg, Cursor cursor) {
        return visitChildren(pkg, cursor);
    }

    public R visitImport(Tr.Import impoort, Cursor cursor) {
        return visitChildren(impoort, cursor);
    }

    public R visitClassDecl(Tr.ClassDecl classDecl, Cursor cursor) {
        return visitChildren(classDecl, cursor);
    }

    public R visitMethodDecl(Tr.MethodDecl method, Cursor cursor) {
        return visitChildren(method, cursor);
    }

    public R visitBlock(Tr.Block block, Cursor cursor) {
        return visitChildren(block, cursor);
    }

    public R visitVariableDecls(Tr.VariableDecls variableDecls, Cursor cursor) {
        return visitChildren(variableDecls, cursor);
    }

    public R visitNamedVar(Tr.NamedVar namedVar, Cursor cursor) {
        return visitChildren(namedVar, cursor);
    }

    public R visitKeyword(Tr.Keyword keyword, Cursor cursor) {
        return visitChildren(keyword, cursor);
    }

    public R visitReturn(Tr.Return retrn, Cursor cursor) {
        return visitChildren(retrn, cursor);
    }

    public R visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
        return visitChildren(meth, cursor);
    }

    public R visitFieldAccess(Tr.FieldAccess fieldAccess, Cursor cursor) {
        return visitChildren(fieldAccess, cursor);
    }

    public R visitIdent(Tr.Ident ident, Cursor cursor) {
        return visitChildren(ident, cursor);
    }

    public R visitLiteral(Tr.Literal literal, Cursor cursor) {
        return visitChildren(literal, cursor);
    }

    public R visitParentheses(Tr.Parentheses parens, Cursor cursor) {
        return visitChildren(parens, cursor);
    }

    public R visitBinary(Tr.Binary binary, Cursor cursor) {
        return visitChildren(binary, cursor);
    }

    public R visitAssign(Tr.Assign assign, Cursor cursor) {
        return visitChildren(assign, cursor);
    }

    public R visitEmpty(Tr.Empty empty, Cursor cursor) {
        return visitChildren(empty, cursor);
    }

    public R visitUnknown(Tr.Unknown unknown, Cursor cursor) {
        return visitChildren(unknown, cursor);
    }
}
