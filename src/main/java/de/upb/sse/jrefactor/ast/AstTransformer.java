package de.upb.sse.jrefactor.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Visitor that produces a new tree.
 *
 * Each {@code visitX} rebuilds its node from the transformed children through the node's
 * {@code withX} methods, which hand back the same instance when a child did not change. A
 * transformer that changes nothing therefore returns the very tree it was given, and an edit deep
 * in the tree only copies the nodes on the path to the root. Returning null from a visit removes
 * the node from the enclosing list.
 */
public abstract class AstTransformer extends AstVisitor<Tr> {

    protected AstTransformer() {
        super(null);
    }

    @SuppressWarnings("unchecked")
    protected <T extends Tr> T transform(T tree, Cursor parent) {
        return tree == null ? null : (T) visit(tree, parent);
    }

    protected <T extends Tr> List<T> transformAll(List<T> trees, Cursor parent) {
        if (trees == null) return null;

        List<T> result = null;
        for (int i = 0; i < trees.size(); i++) {
            T tree = trees.get(i);
            T transformed = transform(tree, parent);
            if (result == null && transformed != tree) {
                result = new ArrayList<>(trees.subList(0, i));
            }
            if (result != null && transformed != null) {
                result.add(transformed);
            }
        }
        return result == null ? trees : result;
    }

    @Override
    public Tr visitCompilationUnit(Tr.CompilationUnit cu, Cursor cursor) {
        return cu.withPackageDecl(transform(cu.getPackageDecl(), cursor))
                .withImports(transformAll(cu.getImports(), cursor))
                .withClasses(transformAll(cu.getClasses(), cursor));
    }

    @Override
    public Tr visitPackage(Tr.Package pkg, Cursor cursor) {
        return pkg.withName(transform(pkg.getName(), cursor));
    }

    @Override
    public Tr visitImport(Tr.Import impoort, Cursor cursor) {
        return impoort.withStaticKeyword(transform(impoort.getStaticKeyword(), cursor))
                .withQualid(transform(impoort.getQualid(), cursor));
    }

    @Override
    public Tr visitClassDecl(Tr.ClassDecl classDecl, Cursor cursor) {
        return classDecl.withModifiers(transformAll(classDecl.getModifiers(), cursor))
                .withKind(transform(classDecl.getKind(), cursor))
                .withName(transform(classDecl.getName(), cursor))
                .withHeader(transform(classDecl.getHeader(), cursor))
                .withBody(transform(classDecl.getBody(), cursor));
    }

    @Override
    public Tr visitMethodDecl(Tr.MethodDecl method, Cursor cursor) {
        return method.withModifiers(transformAll(method.getModifiers(), cursor))
                .withTypeParameters(transform(method.getTypeParameters(), cursor))
                .withReturnTypeExpr(transform(method.getReturnTypeExpr(), cursor))
                .withName(transform(method.getName(), cursor))
                .withParams(transformAll(method.getParams(), cursor))
                .withThrowsClause(transform(method.getThrowsClause(), cursor))
                .withBody(transform(method.getBody(), cursor));
    }

    @Override
    public Tr visitBlock(Tr.Block block, Cursor cursor) {
        return block.withStaticKeyword(transform(block.getStaticKeyword(), cursor))
                .withStatements(transformAll(block.getStatements(), cursor));
    }

    @Override
    public Tr visitVariableDecls(Tr.VariableDecls variableDecls, Cursor cursor) {
        return variableDecls.withModifiers(transformAll(variableDecls.getModifiers(), cursor))
                .withTypeExpr(transform(variableDecls.getTypeExpr(), cursor))
                .withVars(transformAll(variableDecls.getVars(), cursor));
    }

    @Override
    public Tr visitNamedVar(Tr.NamedVar namedVar, Cursor cursor) {
        return namedVar.withName(transform(namedVar.getName(), cursor))
                .withInitializer(transform(namedVar.getInitializer(), cursor));
    }

    @Override
    public Tr visitKeyword(Tr.Keyword keyword, Cursor cursor) {
        return keyword;
    }

    @Override
    public Tr visitReturn(Tr.Return retrn, Cursor cursor) {
        return retrn.withExpr(transform(retrn.getExpr(), cursor));
    }

    @Override
    public Tr visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
        return meth.withSelect(transform(meth.getSelect(), cursor))
                .withTypeParameters(transform(meth.getTypeParameters(), cursor))
                .withName(transform(meth.getName(), cursor))
                .withArgs(transformAll(meth.getArgs(), cursor));
    }

    @Override
    public Tr visitFieldAccess(Tr.FieldAccess fieldAccess, Cursor cursor) {
        return fieldAccess.withTarget(transform(fieldAccess.getTarget(), cursor))
                .withName(transform(fieldAccess.getName(), cursor));
    }

    @Override
    public Tr visitIdent(Tr.Ident ident, Cursor cursor) {
        return ident;
    }

    @Override
    public Tr visitLiteral(Tr.Literal literal, Cursor cursor) {
        return literal;
    }

    @Override
    public Tr visitParentheses(Tr.Parentheses parens, Cursor cursor) {
        return parens.withTree(transform(parens.getTree(), cursor));
    }

    @Override
    public Tr visitBinary(Tr.Binary binary, Cursor cursor) {
        return binary.withLeft(transform(binary.getLeft(), cursor))
                .withRight(transform(binary.getRight(), cursor));
    }

    @Override
    public Tr visitAssign(Tr.Assign assign, Cursor cursor) {
        return assign.withVariable(transform(assign.getVariable(), cursor))
                .withAssignment(transform(assign.getAssignment(), cursor));
    }

    @Override
    public Tr visitEmpty(Tr.Empty empty, Cursor cursor) {
        return empty;
    }

    @Override
    public Tr visitUnknown(Tr.Unknown unknown, Cursor cursor) {
        return unknown.withTrees(transformAll(unknown.getTrees(), cursor));
    }
}
