package de.upb.sse.jrefactor.refactor;

import de.upb.sse.jrefactor.AstTest;
import de.upb.sse.jrefactor.ast.Tr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RemoveImportTest extends AstTest {

    @Test
    @DisplayName("Removes a named import in the middle")
    public void remove_middle_import() {
        Tr.CompilationUnit cu = parse(lines(
                "package com.foo;",
                "",
                "import java.util.List;",
                "import java.util.Set;",
                "import java.util.Map;",
                "",
                "class A {}"));

        Tr fixed = new RemoveImport("java.util.Set").visit(cu);

        assertRefactored(fixed, lines(
                "package com.foo;",
                "",
                "import java.util.List;",
                "import java.util.Map;",
                "",
                "class A {}"));
    }

    @Test
    @DisplayName("The next import takes over the blank line when the first one goes")
    public void remove_first_import() {
        Tr.CompilationUnit cu = parse(lines(
                "package com.foo;",
                "",
                "import java.util.List;",
                "import java.util.Map;",
                "",
                "class A {}"));

        Tr fixed = new RemoveImport("java.util.List").visit(cu);

        assertRefactored(fixed, lines(
                "package com.foo;",
                "",
                "import java.util.Map;",
                "",
                "class A {}"));
    }

    @Test
    @DisplayName("The class moves to the top when the only import of a default package file goes")
    public void remove_only_import_without_package() {
        Tr.CompilationUnit cu = parse(lines(
                "import java.util.List;",
                "",
                "class A {}"));

        Tr fixed = new RemoveImport("java.util.List").visit(cu);

        assertRefactored(fixed, "class A {}\n");
    }

    @Test
    @DisplayName("Star and static imports are not removed")
    public void keeps_star_and_static_imports() {
        Tr.CompilationUnit cu = parse(lines(
                "import java.util.*;",
                "import static java.util.List.of;",
                "",
                "class A {}"));

        assertSame(cu, new RemoveImport("java.util.List").visit(cu));
        assertSame(cu, new RemoveImport("java.util.List.of").visit(cu));
    }
}
