package com.raditha.structdiff.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.profile.DirectiveDetector;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * {@link SourceParser} for Java sources, built on JavaParser.
 * <p>
 * Conditional compilation directives are evaluated first by {@link ConditionalPreprocessor}.
 * A fresh {@link JavaParser} is created per call, so one instance can serve several
 * profile tasks concurrently.
 */
public class JavaSourceParser implements SourceParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSourceParser.class);

    public static final ParserConfiguration.LanguageLevel DEFAULT_LANGUAGE_LEVEL =
            ParserConfiguration.LanguageLevel.JAVA_17;

    private final ParserConfiguration.LanguageLevel languageLevel;
    private final @Nullable String fileName;
    private final ConditionalPreprocessor preprocessor = new ConditionalPreprocessor();
    private final SyntaxTreeBuilder treeBuilder = new SyntaxTreeBuilder();

    public JavaSourceParser() {
        this(DEFAULT_LANGUAGE_LEVEL, null);
    }

    public JavaSourceParser(ParserConfiguration.LanguageLevel languageLevel, @Nullable String fileName) {
        this.languageLevel = Objects.requireNonNull(languageLevel, "languageLevel");
        this.fileName = fileName;
    }

    /**
     * Create a parser for a language level given by name, such as "JAVA_17".
     *
     * @throws IllegalArgumentException if the name is not a JavaParser language level
     */
    public static JavaSourceParser forLanguageLevel(String languageLevel) {
        return new JavaSourceParser(parseLanguageLevel(languageLevel), null);
    }

    public static ParserConfiguration.LanguageLevel parseLanguageLevel(String languageLevel) {
        try {
            return ParserConfiguration.LanguageLevel.valueOf(languageLevel.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown language level: " + languageLevel, e);
        }
    }

    /**
     * Same parser, naming the root node after {@code name}.
     */
    public JavaSourceParser withFileName(@Nullable String name) {
        return new JavaSourceParser(languageLevel, name);
    }

    @Override
    public SyntaxNode parse(String text, Set<String> activeSymbols) throws SourceParseException {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(activeSymbols, "activeSymbols");

        String effective = text;
        BitSet blankedLines = new BitSet();
        if (DirectiveDetector.hasConditionalDirectives(text)) {
            ConditionalPreprocessor.Result preprocessed = preprocessor.preprocess(text, activeSymbols);
            effective = preprocessed.text();
            blankedLines = preprocessed.blankedLines();
        }

        JavaParser parser = new JavaParser(new ParserConfiguration().setLanguageLevel(languageLevel));
        ParseResult<CompilationUnit> result = parser.parse(effective);

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = result.getProblems().stream().map(Problem::getMessage).toList();
            logger.debug("Parse failed with {} problem(s) under symbols {}", problems.size(), activeSymbols);
            String first = problems.isEmpty() ? "unknown error" : problems.get(0);
            throw new SourceParseException("Failed to parse " + (fileName != null ? fileName : "source")
                    + ": " + first, problems.isEmpty() ? List.of(first) : problems);
        }

        return treeBuilder.build(result.getResult().get(), text, blankedLines, fileName);
    }

    public ParserConfiguration.LanguageLevel getLanguageLevel() {
        return languageLevel;
    }
}
