package de.upb.sse.jrefactor.ast;

import java.util.List;

/**
 * Renders a tree back to source text.
 *
 * A node prints as its prefix, its own tokens interleaved with its children, then its suffix.
 * Parsed nodes carry every character of the input in some prefix, suffix, token or verbatim
 * fragment, so an unedited tree prints back byte for byte. Synthesized parenthesized content
 * ({@link Formatting#EMPTY}) is padded with a single space on each side.
 */
public class TreePrinter extends AstVisitor<String> {

    public TreePrinter() {
        super("");
    }

    public String print(Tr tree) {
        return visit(tree);
    }

    @Override
    public String reduce(String r1, String r2) {
        return r1 + r2;
    }

    private static String fmt(Tr tree, String code) {
        Formatting formatting = tree.getFormatting();
        return formatting.getPrefix() + code + formatting.getSuffix();
    }

    private String print(Tr tree, Cursor cursor) {
        return tree == null ? "" : visit(tree, cursor);
    }

    private String printAll(List<? extends Tr> trees, Cursor cursor) {
        return visit(trees, cursor);
    }

    private String join(List<? extends Tr> trees, String delimiter, Cursor cursor) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < trees.size(); i++) {
            if (i > 0) sb.append(delimiter);
            sb.append(visit(trees.get(i), cursor));
        }
        return sb.toString();
    }

    private static boolean isTerminatedStatement(Tr statement) {
        return statement instanceof Tr.VariableDecls || statement instanceof Tr.MethodInvocation
                || statement instanceof Tr.Assign || statement instanceof Tr.Return;
    }

    @Override
    public String visitCompilationUnit(Tr.CompilationUnit cu, Cursor cursor) {
        return fmt(cu, print(cu.getPackageDecl(), cursor) + printAll(cu.getImports(), cursor)
                + printAll(cu.getClasses(), cursor));
    }

    @Override
    public String visitPackage(Tr.Package pkg, Cursor cursor) {
        return fmt(pkg, "package" + print(pkg.getName(), cursor) + ";");
    }

    @Override
    public String visitImport(Tr.Import impoort, Cursor cursor) {
        return fmt(impoort, "import" + print(impoort.getStaticKeyword(), cursor) + print(impoort.getQualid(), cursor) + ";");
    }

    @Override
    public String visitClassDecl(Tr.ClassDecl classDecl, Cursor cursor) {
        return fmt(classDecl, printAll(classDecl.getModifiers(), cursor) + print(classDecl.getKind(), cursor)
                + print(classDecl.getName(), cursor) + print(classDecl.getHeader(), cursor)
                + print(classDecl.getBody(), cursor));
    }

    @Override
    public String visitMethodDecl(Tr.MethodDecl method, Cursor cursor) {
        String body = method.getBody() instanceof Tr.Block ? print(method.getBody(), cursor)
                : print(method.getBody(), cursor) + ";";
        return fmt(method, printAll(method.getModifiers(), cursor) + print(method.getTypeParameters(), cursor)
                + print(method.getReturnTypeExpr(), cursor) + print(method.getName(), cursor)
                + "(" + join(method.getParams(), ",", cursor) + ")"
                + print(method.getThrowsClause(), cursor) + body);
    }

    @Override
    public String visitBlock(Tr.Block block, Cursor cursor) {
        StringBuilder statements = new StringBuilder();
        for (Tr statement : block.getStatements()) {
            statements.append(visit(statement, cursor));
            if (isTerminatedStatement(statement)) {
                statements.append(';');
            }
        }
        return fmt(block, print(block.getStaticKeyword(), cursor) + "{" + statements
                + block.getEnd().getPrefix() + "}");
    }

    @Override
    public String visitVariableDecls(Tr.VariableDecls variableDecls, Cursor cursor) {
        String varargs = variableDecls.getVarargs() == null ? "" : variableDecls.getVarargs().getPrefix() + "...";
        return fmt(variableDecls, printAll(variableDecls.getModifiers(), cursor)
                + print(variableDecls.getTypeExpr(), cursor) + varargs
                + join(variableDecls.getVars(), ",", cursor));
    }

    @Override
    public String visitNamedVar(Tr.NamedVar namedVar, Cursor cursor) {
        String initializer = namedVar.getInitializer() == null ? "" : "=" + print(namedVar.getInitializer(), cursor);
        return fmt(namedVar, print(namedVar.getName(), cursor) + initializer);
    }

    @Override
    public String visitKeyword(Tr.Keyword keyword, Cursor cursor) {
        return fmt(keyword, keyword.getKeyword());
    }

    @Override
    public String visitReturn(Tr.Return retrn, Cursor cursor) {
        return fmt(retrn, "return" + print(retrn.getExpr(), cursor));
    }

    @Override
    public String visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
        String select = meth.getSelect() == null ? "" : print(meth.getSelect(), cursor) + ".";
        return fmt(meth, select + print(meth.getTypeParameters(), cursor) + print(meth.getName(), cursor)
                + "(" + join(meth.getArgs(), ",", cursor) + ")");
    }

    @Override
    public String visitFieldAccess(Tr.FieldAccess fieldAccess, Cursor cursor) {
        return fmt(fieldAccess, print(fieldAccess.getTarget(), cursor) + "." + print(fieldAccess.getName(), cursor));
    }

    @Override
    public String visitIdent(Tr.Ident ident, Cursor cursor) {
        return fmt(ident, ident.getName());
    }

    @Override
    public String visitLiteral(Tr.Literal literal, Cursor cursor) {
        return fmt(literal, literal.getValueSource());
    }

    @Override
    public String visitParentheses(Tr.Parentheses parens, Cursor cursor) {
        String inner = print(parens.getTree(), cursor);
        if (parens.getTree().getFormatting().isEmpty()) {
            inner = " " + inner + " ";
        }
        return fmt(parens, "(" + inner + ")");
    }

    @Override
    public String visitBinary(Tr.Binary binary, Cursor cursor) {
        return fmt(binary, print(binary.getLeft(), cursor) + binary.getOperator() + print(binary.getRight(), cursor));
    }

    @Override
    public String visitAssign(Tr.Assign assign, Cursor cursor) {
        return fmt(assign, print(assign.getVariable(), cursor) + assign.getOperator()
                + print(assign.getAssignment(), cursor));
    }

    @Override
    public String visitEmpty(Tr.Empty empty, Cursor cursor) {
        return fmt(empty, "");
    }

    @Override
    public String visitUnknown(Tr.Unknown unknown, Cursor cursor) {
        StringBuilder sb = new StringBuilder(unknown.getFragments().get(0));
        List<Tr> trees = unknown.getTrees();
        for (int i = 0; i < trees.size(); i++) {
            sb.append(visit(trees.get(i), cursor));
            sb.append(unknown.getFragments().get(i + 1));
        }
        return fmt(unknown, sb.toString());
    }
}
