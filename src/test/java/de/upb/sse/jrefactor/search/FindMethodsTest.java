package de.upb.sse.jrefactor.search;

import de.upb.sse.jrefactor.AstTest;
import de.upb.sse.jrefactor.ast.Tr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FindMethodsTest extends AstTest {

    @Test
    @DisplayName("Finds JDK calls resolved through the symbol solver")
    public void find_jdk_calls() {
        Tr.CompilationUnit cu = parse(lines(
                "import java.util.ArrayList;",
                "import java.util.List;",
                "",
                "public class A {",
                "    public void test() {",
                "        List<String> list = new ArrayList<>();",
                "        list.add(\"a\");",
                "        list.add(0, \"b\");",
                "        list.remove(\"a\");",
                "    }",
                "}"));

        List<Tr.MethodInvocation> adds = new FindMethods("java.util.List add(..)").visit(cu);
        assertEquals(2, adds.size());
        assertEquals("list.add(\"a\")", adds.get(0).printTrimmed());

        assertEquals(1, new FindMethods("java.util.List add(int, ..)").visit(cu).size());
        assertEquals(1, new FindMethods("java.util.List add(String)").visit(cu).size());
        assertEquals(1, new FindMethods("java.util.List remove(Object)").visit(cu).size());
        assertTrue(new FindMethods("java.util.List clear()").visit(cu).isEmpty());
    }

    @Test
    @DisplayName("Finds calls to types declared in the same batch")
    public void find_source_calls() {
        String b = lines(
                "package com.foo;",
                "",
                "public class B {",
                "    public void foo(int i) {",
                "    }",
                "}");
        String a = lines(
                "package com.foo;",
                "",
                "public class A {",
                "    public void test() {",
                "        new B().foo(1);",
                "        B other = new B();",
                "        other.foo(2);",
                "    }",
                "}");

        Tr.CompilationUnit cu = parse(a, b);

        List<Tr.MethodInvocation> calls = new FindMethods("com.foo.B foo(int)").visit(cu);
        assertEquals(2, calls.size());
        assertEquals("other.foo(2)", calls.get(1).printTrimmed());
        assertEquals(2, new FindMethods("com..B *(..)").visit(cu).size());
    }

    @Test
    @DisplayName("Nested matching calls are found in source order")
    public void nested_calls() {
        Tr.CompilationUnit cu = parse(lines(
                "public class A {",
                "    String test(String s) {",
                "        return s.concat(s.concat(\"x\"));",
                "    }",
                "}"));

        List<Tr.MethodInvocation> calls = new FindMethods("java.lang.String concat(String)").visit(cu);

        assertEquals(2, calls.size());
        assertEquals("s.concat(s.concat(\"x\"))", calls.get(0).printTrimmed());
        assertEquals("s.concat(\"x\")", calls.get(1).printTrimmed());
    }

    @Test
    @DisplayName("Unresolvable calls are not matched")
    public void unresolved_calls() {
        Tr.CompilationUnit cu = parse(lines(
                "public class A {",
                "    void test() {",
                "        missing.Type.call();",
                "    }",
                "}"));

        assertTrue(new FindMethods("missing.Type call()").visit(cu).isEmpty());
        assertFalse(parser.getParseStats().fullyAttributed());
    }
}
