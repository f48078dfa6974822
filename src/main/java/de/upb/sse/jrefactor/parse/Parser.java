package de.upb.sse.jrefactor.parse;

import de.upb.sse.jrefactor.ast.Tr;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns source files into attributed syntax trees.
 *
 * Attribution is best effort: a file with unresolved symbols still yields a tree, with the types
 * it could not resolve left null. Implementations keep caches between calls and are not safe for
 * use by more than one thread; {@link #reset()} drops them.
 */
public interface Parser {

    List<Tr.CompilationUnit> parse(List<Path> sourceFiles);

    default List<Tr.CompilationUnit> parse(Path... sourceFiles) {
        return parse(Arrays.asList(sourceFiles));
    }

    void reset();

    static List<Path> filterSourceFiles(List<Path> paths) {
        return paths.stream()
                .filter(path -> path.getFileName() != null && path.getFileName().toString().endsWith(".java"))
                .collect(Collectors.toList());
    }
}
