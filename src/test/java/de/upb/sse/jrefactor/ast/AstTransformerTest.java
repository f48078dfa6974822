package de.upb.sse.jrefactor.ast;

import de.upb.sse.jrefactor.AstTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstTransformerTest extends AstTest {
    private static final String SOURCE = lines(
            "public class A {",
            "    int first = 1;",
            "",
            "    void test() {",
            "        int n = first + 2;",
            "        foo(n);",
            "    }",
            "",
            "    void foo(int n) {",
            "    }",
            "}");

    @Test
    @DisplayName("A transformer that changes nothing returns the same tree")
    public void identity_transform() {
        Tr.CompilationUnit cu = parse(SOURCE);

        Tr transformed = new AstTransformer() {
        }.visit(cu);

        assertSame(cu, transformed);
    }

    @Test
    @DisplayName("Unchanged subtrees are shared between the old and the new tree")
    public void structural_sharing() {
        Tr.CompilationUnit cu = parse(SOURCE);

        Tr.CompilationUnit transformed = (Tr.CompilationUnit) new AstTransformer() {
            @Override
            public Tr visitLiteral(Tr.Literal literal, Cursor cursor) {
                if ("2".equals(literal.getValueSource())) {
                    return literal.withValue(3).withValueSource("3");
                }
                return literal;
            }
        }.visit(cu);

        assertNotSame(cu, transformed);
        assertEquals(SOURCE.replace("first + 2", "first + 3"), transformed.print());

        Tr.ClassDecl before = cu.getClassDecls().get(0);
        Tr.ClassDecl after = transformed.getClassDecls().get(0);
        assertSame(before.getFields().get(0), after.getFields().get(0));
        assertSame(before.getMethods().get(1), after.getMethods().get(1));
        assertNotSame(before.getMethods().get(0), after.getMethods().get(0));

        Tr.Block body = (Tr.Block) after.getMethods().get(0).getBody();
        Tr.Block oldBody = (Tr.Block) before.getMethods().get(0).getBody();
        assertSame(oldBody.getStatements().get(1), body.getStatements().get(1));
    }

    @Test
    @DisplayName("Returning null removes a statement from its block")
    public void remove_statement() {
        Tr.CompilationUnit cu = parse(SOURCE);

        Tr transformed = new AstTransformer() {
            @Override
            public Tr visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
                return cursor.getParentTree() instanceof Tr.Block ? null : super.visitMethodInvocation(meth, cursor);
            }
        }.visit(cu);

        assertEquals(SOURCE.replace("\n        foo(n);", ""), transformed.print());
        assertTrue(cu.print().contains("foo(n);"));
    }

    @Test
    @DisplayName("Node lists cannot be changed after construction")
    public void lists_are_unmodifiable() {
        Tr.CompilationUnit cu = parse(lines(
                "import java.util.List;",
                "",
                SOURCE));
        Tr.Block body = cu.getClassDecls().get(0).getBody();

        assertThrows(UnsupportedOperationException.class, () -> cu.getImports().clear());
        assertThrows(UnsupportedOperationException.class, () -> cu.getClasses().clear());
        assertThrows(UnsupportedOperationException.class, () -> body.getStatements().remove(0));

        List<Tr> statements = new ArrayList<>(body.getStatements());
        Tr.Block copy = body.withStatements(statements);
        statements.clear();

        assertNotSame(body, copy);
        assertEquals(body.getStatements().size(), copy.getStatements().size());
        assertEquals(body.print(), copy.print());
    }
}
