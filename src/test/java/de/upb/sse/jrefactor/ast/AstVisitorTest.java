package de.upb.sse.jrefactor.ast;

import de.upb.sse.jrefactor.AstTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstVisitorTest extends AstTest {
    private static final String SOURCE = lines(
            "package com.foo;",
            "",
            "public class A {",
            "    int count = 1;",
            "",
            "    void test() {",
            "        foo(count);",
            "    }",
            "",
            "    void foo(int n) {",
            "        int m = n + 1;",
            "    }",
            "}");

    private static class MethodCounter extends AstVisitor<Integer> {
        MethodCounter() {
            super(0);
        }

        @Override
        public Integer reduce(Integer r1, Integer r2) {
            return r1 + r2;
        }

        @Override
        public Integer visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
            return 1 + super.visitMethodInvocation(meth, cursor);
        }
    }

    private static class NodeCounter extends AstVisitor<Integer> {
        final List<Cursor> visited = new ArrayList<>();

        NodeCounter() {
            super(0);
        }

        @Override
        public Integer reduce(Integer r1, Integer r2) {
            return r1 + r2;
        }

        @Override
        public Integer visitChildren(Tr tree, Cursor cursor) {
            visited.add(cursor);
            return 1 + super.visitChildren(tree, cursor);
        }
    }

    private static int size(Tr tree) {
        int size = 1;
        for (Tr child : tree.children()) {
            size += size(child);
        }
        return size;
    }

    @Test
    @DisplayName("Children are visited and results reduced")
    public void visits_whole_tree() {
        Tr.CompilationUnit cu = parse(SOURCE);

        assertEquals(1, new MethodCounter().visit(cu));
    }

    @Test
    @DisplayName("Overriding without calling super prunes the subtree")
    public void pruning() {
        Tr.CompilationUnit cu = parse(SOURCE);

        NodeCounter all = new NodeCounter();
        assertEquals(size(cu), all.visit(cu));

        NodeCounter pruned = new NodeCounter() {
            @Override
            public Integer visitMethodDecl(Tr.MethodDecl method, Cursor cursor) {
                return 0;
            }
        };

        int methodNodes = 0;
        for (Tr.MethodDecl method : cu.getClassDecls().get(0).getMethods()) {
            methodNodes += size(method);
        }
        assertEquals(2, cu.getClassDecls().get(0).getMethods().size());
        assertEquals(size(cu) - methodNodes, pruned.visit(cu));
        assertEquals(size(cu) - methodNodes, pruned.visited.size());
        for (Cursor cursor : pruned.visited) {
            assertNull(cursor.enclosingMethod(), cursor.toString());
        }
    }

    @Test
    @DisplayName("Default reduce keeps the first result that is not the default")
    public void first_non_default_wins() {
        Tr.CompilationUnit cu = parse(SOURCE);

        AstVisitor<String> firstIdent = new AstVisitor<String>(null) {
            @Override
            public String visitIdent(Tr.Ident ident, Cursor cursor) {
                return cursor.enclosingMethod() == null ? null : ident.getName();
            }
        };

        // 'void' is the return type of test(), the first method
        assertEquals("void", firstIdent.visit(cu));
    }

    @Test
    @DisplayName("Cursor holds the path from the compilation unit down to the visited node")
    public void cursor_path() {
        Tr.CompilationUnit cu = parse(SOURCE);
        List<Cursor> cursors = new ArrayList<>();

        new AstVisitor<Void>(null) {
            @Override
            public Void visitMethodInvocation(Tr.MethodInvocation meth, Cursor cursor) {
                cursors.add(cursor);
                return super.visitMethodInvocation(meth, cursor);
            }
        }.visit(cu);

        assertEquals(1, cursors.size());
        Cursor cursor = cursors.get(0);
        List<Tr> path = cursor.getPath();

        assertSame(cu, path.get(0));
        assertTrue(path.get(path.size() - 1) instanceof Tr.MethodInvocation);
        assertTrue(cursor.getParentTree() instanceof Tr.Block);
        assertSame(cu, cursor.enclosingCompilationUnit());
        assertEquals("A", cursor.enclosingClass().getSimpleName());
        assertEquals("test", cursor.enclosingMethod().getSimpleName());
        assertSame(cursor.getTree(), cursor.firstEnclosing(Tr.MethodInvocation.class));
    }

    @Test
    @DisplayName("Root cursor has no tree and no path")
    public void root_cursor() {
        assertTrue(Cursor.ROOT.isRoot());
        assertNull(Cursor.ROOT.getTree());
        assertTrue(Cursor.ROOT.getPath().isEmpty());
        assertSame(Cursor.ROOT, Cursor.ROOT.getParent());
        assertNull(Cursor.ROOT.enclosingMethod());

        Tr.Ident ident = Tr.Ident.build("x");
        Cursor cursor = Cursor.ROOT.push(ident);
        assertFalse(cursor.isRoot());
        assertSame(Cursor.ROOT, cursor.getParent());
        assertEquals("Cursor{/Ident}", cursor.toString());
    }

    @Test
    @DisplayName("Visiting null returns the default value")
    public void visit_null() {
        assertEquals(0, new MethodCounter().visit((Tr) null));
    }
}
