package de.upb.sse.jrefactor.parse;

import de.upb.sse.jrefactor.AstTest;
import de.upb.sse.jrefactor.ast.Flag;
import de.upb.sse.jrefactor.ast.Tr;
import de.upb.sse.jrefactor.ast.Type;
import de.upb.sse.jrefactor.configuration.JRefactorConfiguration;
import de.upb.sse.jrefactor.exceptions.SourceParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JavaSourceParserTest extends AstTest {

    @Test
    @DisplayName("Method invocations carry declaring type, signatures and flags")
    public void method_invocation_attribution() {
        Tr.CompilationUnit cu = parse(lines(
                "import java.util.ArrayList;",
                "import java.util.List;",
                "",
                "public class A {",
                "    public void test() {",
                "        List<String> list = new ArrayList<>();",
                "        list.add(\"a\");",
                "    }",
                "}"));

        Tr.Block body = (Tr.Block) firstMethod(cu).getBody();
        Tr.MethodInvocation add = (Tr.MethodInvocation) body.getStatements().get(1);
        Type.Method type = add.getType();

        assertNotNull(type);
        assertEquals("java.util.List", type.getDeclaringType().getFullyQualifiedName());
        assertEquals(Type.Primitive.BOOLEAN, type.getResolvedSignature().getReturnType());
        assertTrue(Type.hasElementType(type.getResolvedSignature().getParamTypes().get(0), "java.lang.String"));
        assertTrue(type.getGenericSignature().getParamTypes().get(0) instanceof Type.GenericTypeVariable);
        assertTrue(type.hasFlags(Flag.Public, Flag.Abstract));
    }

    @Test
    @DisplayName("Declarations carry their class and method types")
    public void declaration_attribution() {
        Tr.CompilationUnit cu = parse(lines(
                "package com.foo;",
                "",
                "public class Node extends Base {",
                "    private Node next;",
                "    int value;",
                "",
                "    public static int twice(int n) {",
                "        return n * 2;",
                "    }",
                "}"), lines(
                "package com.foo;",
                "",
                "public class Base {",
                "}"));

        Tr.ClassDecl node = cu.getClassDecls().get(0);
        Type.Class type = node.getType();

        assertEquals("com.foo.Node", type.getFullyQualifiedName());
        assertEquals("com.foo.Base", type.getSupertype().getFullyQualifiedName());
        assertEquals(2, type.getMembers().size());

        Type.Var next = type.getMembers().stream().filter(m -> m.getName().equals("next")).findFirst().orElseThrow();
        assertTrue(next.getType() instanceof Type.Cyclic);
        assertTrue(next.hasFlags(Flag.Private));

        Tr.MethodDecl twice = node.getMethods().get(0);
        assertEquals(Arrays.asList("n"), twice.getType().getParamNames());
        assertTrue(twice.getType().hasFlags(Flag.Public, Flag.Static));
        assertEquals(Type.Primitive.INT, twice.getType().getResolvedSignature().getReturnType());

        Tr.Return ret = (Tr.Return) ((Tr.Block) twice.getBody()).getStatements().get(0);
        assertTrue(ret.getExpr() instanceof Tr.Binary);
        assertEquals(Type.Primitive.INT, ret.getExpr().getType());
        assertTrue(parser.getParseStats().fullyAttributed());
    }

    @Test
    @DisplayName("Identical classes resolved twice are the same instance")
    public void class_types_are_interned() {
        Tr.CompilationUnit cu = parse(lines(
                "public class A {",
                "    String a = \"a\";",
                "    String b = \"b\";",
                "}"));

        List<Tr.VariableDecls> fields = cu.getClassDecls().get(0).getFields();
        Type first = fields.get(0).getVars().get(0).getType();
        Type second = fields.get(1).getVars().get(0).getType();

        assertTrue(first instanceof Type.Class);
        assertSame(first, second);
        assertFalse(parser.getTypePool().variants("java.lang.String").isEmpty());
    }

    @Test
    @DisplayName("Unresolved symbols leave types null and are counted")
    public void unresolved_symbols() {
        Tr.CompilationUnit cu = parse(lines(
                "public class A {",
                "    Missing field;",
                "    void test() {",
                "        field.call();",
                "    }",
                "}"));

        assertNull(cu.getClassDecls().get(0).getFields().get(0).getVars().get(0).getType());
        Tr.MethodInvocation call = (Tr.MethodInvocation) firstMethodStatement(cu);
        assertNull(call.getType());
        assertTrue(parser.getParseStats().getUnresolvedSymbols() > 0);
        assertEquals(1, parser.getParseStats().getParsedFiles());
    }

    @Test
    @DisplayName("Files with syntax errors are skipped by default")
    public void skips_broken_files() {
        Path broken = sourceFile("class Broken { void test( }\n");
        Path fine = sourceFile("class Fine {}\n");

        List<Tr.CompilationUnit> cus = parser.parse(broken, fine);

        assertEquals(1, cus.size());
        assertEquals("Fine", cus.get(0).getClassDecls().get(0).getSimpleName());
        assertEquals(1, parser.getParseStats().getSkippedFiles());
        assertEquals(1, parser.getParseStats().getParsedFiles());
    }

    @Test
    @DisplayName("Files with syntax errors fail the parse when configured")
    public void fails_on_broken_files() {
        JRefactorConfiguration config = new JRefactorConfiguration();
        config.setFailOnParseError(true);
        JavaSourceParser strict = new JavaSourceParser(config);
        Path broken = sourceFile("class Broken { void test( }\n");

        SourceParseException e = assertThrows(SourceParseException.class, () -> strict.parse(broken));
        assertEquals(broken, e.getSourcePath());
    }

    @Test
    @DisplayName("Non-Java paths are ignored")
    public void filters_source_files() throws IOException {
        Path text = temp.resolve("notes.txt");
        Files.writeString(text, "not java");

        assertTrue(parser.parse(Collections.singletonList(text)).isEmpty());
        assertEquals(0, parser.getParseStats().getSkippedFiles());
    }

    @Test
    @DisplayName("Source roots are derived from package declarations")
    public void source_roots() {
        parse(lines(
                "package com.foo;",
                "",
                "public class A {}"));

        assertTrue(parser.getSourceRoots().contains(temp.toAbsolutePath().normalize()));
    }

    @Test
    @DisplayName("Reset drops interned types and source roots")
    public void reset() {
        parse(lines(
                "public class A {",
                "    String a;",
                "}"));
        assertTrue(parser.getTypePool().size() > 0);

        parser.reset();

        assertEquals(0, parser.getTypePool().size());
        assertTrue(parser.getSourceRoots().isEmpty());

        Tr.CompilationUnit cu = parse(lines(
                "public class B {",
                "    String b;",
                "}"));
        assertNotNull(cu.getClassDecls().get(0).getType());
    }

    @Test
    @DisplayName("Constructors are method declarations returning their class")
    public void constructor_declaration() {
        Tr.CompilationUnit cu = parse(lines(
                "public class A {",
                "    private final int x;",
                "",
                "    public A(int x) {",
                "        this.x = x;",
                "    }",
                "}"));

        Tr.MethodDecl constructor = cu.getClassDecls().get(0).getMethods().get(0);

        assertTrue(constructor.isConstructor());
        assertNull(constructor.getReturnTypeExpr());
        assertEquals("A", constructor.getType().getDeclaringType().getFullyQualifiedName());
        assertTrue(((Tr.Block) constructor.getBody()).getStatements().get(0) instanceof Tr.Assign);
    }
}
