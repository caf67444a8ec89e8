package com.dbc.contracts.processor;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locates and parses the source file a class was compiled from, looking under a list of
 * source roots. Parsed files are cached, including misses.
 */
public class SourceIndex {

    private static final Logger logger = LoggerFactory.getLogger(SourceIndex.class);

    private final JavaParser javaParser;
    private final List<Path> sourceRoots;
    private final Map<Path, Optional<ParsedSource>> cache = new ConcurrentHashMap<>();

    public SourceIndex(List<Path> sourceRoots) {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public List<Path> getSourceRoots() {
        return sourceRoots;
    }

    /**
     * Finds the parsed source declaring a class.
     *
     * @param type the class, used for its package
     * @param fileName source file name recorded in the class file, or null to guess from the top-level class
     */
    public Optional<ParsedSource> find(Class<?> type, String fileName) {
        Class<?> topLevel = type;
        while (topLevel.getEnclosingClass() != null) {
            topLevel = topLevel.getEnclosingClass();
        }
        String name = fileName != null ? fileName : topLevel.getSimpleName() + ".java";
        String packagePath = topLevel.getPackageName().replace('.', '/');

        for (Path root : sourceRoots) {
            Path candidate = packagePath.isEmpty() ? root.resolve(name) : root.resolve(packagePath).resolve(name);
            if (Files.isRegularFile(candidate)) {
                return cache.computeIfAbsent(candidate.toAbsolutePath().normalize(), this::parse);
            }
        }
        logger.debug("No source for {} under {}", type.getName(), sourceRoots);
        return Optional.empty();
    }

    private synchronized Optional<ParsedSource> parse(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            ParseResult<CompilationUnit> result = javaParser.parse(text);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                logger.debug("Failed to parse file: {} {}", file, result.getProblems());
                return Optional.empty();
            }
            return Optional.of(new ParsedSource(file, result.getResult().get(), text));
        } catch (IOException e) {
            logger.debug("Error reading file: {}", file, e);
            return Optional.empty();
        }
    }

    /**
     * A parsed compilation unit together with its raw lines, so that spans can be cut
     * from the text exactly as written.
     */
    public static final class ParsedSource {

        private final Path path;
        private final CompilationUnit unit;
        private final List<String> lines;

        ParsedSource(Path path, CompilationUnit unit, String text) {
            this.path = path;
            this.unit = unit;
            this.lines = Arrays.asList(text.split("\r?\n", -1));
        }

        public Path getPath() {
            return path;
        }

        public CompilationUnit getUnit() {
            return unit;
        }

        /**
         * Raw text between two positions, both inclusive.
         */
        public String slice(Position begin, Position end) {
            StringBuilder text = new StringBuilder();
            for (int line = begin.line; line <= end.line && line <= lines.size(); line++) {
                String content = lines.get(line - 1);
                int from = line == begin.line ? begin.column - 1 : 0;
                int to = line == end.line ? Math.min(end.column, content.length()) : content.length();
                if (from < to) {
                    text.append(content, from, to);
                }
                if (line != end.line) {
                    text.append('\n');
                }
            }
            return text.toString();
        }
    }
}
