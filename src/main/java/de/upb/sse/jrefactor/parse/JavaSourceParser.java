package de.upb.sse.jrefactor.parse;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFacade;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import de.upb.sse.jrefactor.ast.Tr;
import de.upb.sse.jrefactor.ast.TypePool;
import de.upb.sse.jrefactor.configuration.JRefactorConfiguration;
import de.upb.sse.jrefactor.exceptions.SourceParseException;
import de.upb.sse.jrefactor.stats.ParseStats;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Parser} backed by JavaParser and its symbol solver.
 *
 * Source roots are derived from the package declarations of the files being parsed, so that
 * files in one batch resolve against each other. Jars on the configured classpath and the
 * running JDK are consulted as well.
 */
public class JavaSourceParser implements Parser {
    private static final Logger logger = Logger.getLogger(JavaSourceParser.class.getName());

    @Getter private final JRefactorConfiguration config;
    @Getter private final ParseStats parseStats = new ParseStats();
    @Getter private final TypePool typePool = new TypePool();

    private CombinedTypeSolver combinedTypeSolver;
    private TypeMapper typeMapper;
    private final Set<Path> sourceRoots = new LinkedHashSet<>();

    public JavaSourceParser() {
        this(new JRefactorConfiguration());
    }

    public JavaSourceParser(JRefactorConfiguration config) {
        this.config = config;
    }

    @Override
    public List<Tr.CompilationUnit> parse(List<Path> sourceFiles) {
        Charset charset = Charset.forName(config.getCharset());

        Map<Path, String> sources = new LinkedHashMap<>();
        for (Path sourceFile : Parser.filterSourceFiles(sourceFiles)) {
            try {
                sources.put(sourceFile, Files.readString(sourceFile, charset));
            } catch (IOException e) {
                skip(sourceFile, "could not be read", e);
            }
        }

        for (Map.Entry<Path, String> source : sources.entrySet()) {
            Path root = SourceRootFinder.findSourceRoot(source.getKey(), SourceRootFinder.findPackage(source.getValue()));
            if (root != null) addSourceRoot(root);
        }

        JavaParser javaParser = new JavaParser(parserConfiguration());
        List<Tr.CompilationUnit> compilationUnits = new ArrayList<>();
        for (Map.Entry<Path, String> source : sources.entrySet()) {
            Tr.CompilationUnit cu = parse(javaParser, source.getKey(), source.getValue());
            if (cu != null) compilationUnits.add(cu);
        }
        return compilationUnits;
    }

    private Tr.CompilationUnit parse(JavaParser javaParser, Path sourceFile, String source) {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            skip(sourceFile, "has syntax errors: " + result.getProblems(), null);
            return null;
        }

        try {
            Tr.CompilationUnit cu = new TreeBuilder(sourceFile, source, typeMapper(), parseStats).build(result.getResult().get());
            parseStats.incrementParsedFiles();
            return cu;
        } catch (RuntimeException e) {
            skip(sourceFile, "could not be converted", e);
            return null;
        }
    }

    private void skip(Path sourceFile, String reason, Exception cause) {
        if (config.isFailOnParseError()) {
            throw new SourceParseException(sourceFile, reason, cause);
        }
        parseStats.incrementSkippedFiles();
        logger.log(Level.WARNING, "Skipping " + sourceFile + ", it " + reason, cause);
    }

    private ParserConfiguration parserConfiguration() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.valueOf(config.getLanguageLevel()));
        parserConfig.setCharacterEncoding(Charset.forName(config.getCharset()));
        parserConfig.setTabSize(1);
        parserConfig.setSymbolResolver(new JavaSymbolSolver(typeSolver()));
        return parserConfig;
    }

    private CombinedTypeSolver typeSolver() {
        if (combinedTypeSolver != null) return combinedTypeSolver;

        combinedTypeSolver = new CombinedTypeSolver();
        combinedTypeSolver.add(new ReflectionTypeSolver());

        for (Path jar : config.getClasspath()) {
            try {
                combinedTypeSolver.add(new JarTypeSolver(jar));
            } catch (IOException | RuntimeException e) {
                logger.log(Level.WARNING, "Could not load JarTypeSolver for " + jar, e);
            }
        }
        return combinedTypeSolver;
    }

    private void addSourceRoot(Path root) {
        if (!sourceRoots.add(root)) return;
        try {
            typeSolver().add(new JavaParserTypeSolver(root));
        } catch (IllegalStateException e) {
            // JavaParserTypeSolver rejects paths that are not directories
            logger.log(Level.WARNING, "Skipping invalid source root " + root, e);
        }
    }

    private TypeMapper typeMapper() {
        if (typeMapper == null) {
            typeMapper = new TypeMapper(typeSolver(), typePool, parseStats, config.getMemberDepth());
        }
        return typeMapper;
    }

    public Set<Path> getSourceRoots() {
        return Collections.unmodifiableSet(sourceRoots);
    }

    /**
     * Drops the type solver, JavaParser's cached facades, the type mapper and every type interned
     * so far. Statistics are kept.
     */
    @Override
    public void reset() {
        if (typeMapper != null) typeMapper.clear();
        combinedTypeSolver = null;
        typeMapper = null;
        sourceRoots.clear();
        typePool.clear();
        JavaParserFacade.clearInstances();
    }
}
