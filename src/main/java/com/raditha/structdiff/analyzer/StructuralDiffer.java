package com.raditha.structdiff.analyzer;

import com.raditha.structdiff.comparison.CancellationToken;
import com.raditha.structdiff.comparison.DiffOptions;
import com.raditha.structdiff.comparison.RecursiveTreeComparator;
import com.raditha.structdiff.config.StructuralDiffConfig;
import com.raditha.structdiff.matching.ClassMatch;
import com.raditha.structdiff.matching.ClassMatchOptions;
import com.raditha.structdiff.matching.ClassMatchStrategy;
import com.raditha.structdiff.matching.ClassMatcher;
import com.raditha.structdiff.matching.NodeMatcher;
import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.DiffStats;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.parser.JavaSourceParser;
import com.raditha.structdiff.parser.SourceParseException;
import com.raditha.structdiff.parser.SourceParser;
import com.raditha.structdiff.profile.ProfileParser;
import com.raditha.structdiff.profile.ProfileResolver;
import com.raditha.structdiff.similarity.SignatureHasher;
import com.raditha.structdiff.variant.MultiVariantComparator;
import com.raditha.structdiff.variant.MultiVariantResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for structural comparison.
 * Wires the parser, comparator, class matcher and multi-variant merger from one configuration.
 */
public class StructuralDiffer {

    private static final Logger logger = LoggerFactory.getLogger(StructuralDiffer.class);

    private final StructuralDiffConfig config;
    private final SourceParser parser;
    private final ProfileResolver resolver;
    private final RecursiveTreeComparator comparator;
    private final ClassMatcher classMatcher;
    private final MultiVariantComparator multiVariantComparator;

    /**
     * Create a differ with default configuration.
     */
    public StructuralDiffer() {
        this(StructuralDiffConfig.defaults());
    }

    /**
     * Create a differ for Java sources with custom configuration.
     */
    public StructuralDiffer(StructuralDiffConfig config) {
        this(config, JavaSourceParser.forLanguageLevel(config.languageLevel()));
    }

    /**
     * Create a differ with a custom parser.
     */
    public StructuralDiffer(StructuralDiffConfig config, SourceParser parser) {
        this.config = config;
        this.parser = parser;
        SignatureHasher hasher = new SignatureHasher();
        this.resolver = new ProfileResolver(config.customProfiles());
        this.comparator = new RecursiveTreeComparator(new NodeMatcher(hasher));
        this.classMatcher = new ClassMatcher(hasher);
        this.multiVariantComparator = new MultiVariantComparator(parser, comparator, resolver, config.parallelism());
    }

    /**
     * Compare two parsed trees.
     */
    public List<Change> compare(SyntaxNode oldTree, SyntaxNode newTree) {
        return compare(oldTree, newTree, CancellationToken.NONE);
    }

    public List<Change> compare(SyntaxNode oldTree, SyntaxNode newTree, CancellationToken token) {
        return comparator.compare(oldTree, newTree, config.toDiffOptions(), token);
    }

    /**
     * Parse and compare two source texts using the default symbols.
     *
     * @throws SourceParseException if either version fails to parse
     */
    public List<Change> compareText(String oldText, String newText) throws SourceParseException {
        return compareText(oldText, newText, null, null);
    }

    /**
     * Parse and compare two source texts, attaching file paths to the reported locations.
     *
     * @throws SourceParseException if either version fails to parse
     */
    public List<Change> compareText(String oldText, String newText, String oldPath, String newPath)
            throws SourceParseException {
        SyntaxNode oldTree = parser.parse(oldText, resolver.defaultSymbols());
        SyntaxNode newTree = parser.parse(newText, resolver.defaultSymbols());
        DiffOptions options = config.toDiffOptions().withPaths(oldPath, newPath);
        List<Change> changes = comparator.compare(oldTree, newTree, options, CancellationToken.NONE);
        logger.debug("Compared {} -> {}: {}", oldPath, newPath, DiffStats.of(changes));
        return changes;
    }

    /**
     * Compare two source texts under each of the given profiles.
     *
     * @param profiles profile names such as "java11" or "jdk17"; empty for a single run
     * @throws com.raditha.structdiff.profile.ProfileResolutionException if a profile name is invalid
     * @throws SourceParseException if parsing fails for a single run or for every profile
     */
    public MultiVariantResult compareMultiVariant(String oldText, String newText, List<String> profiles)
            throws SourceParseException {
        return compareMultiVariant(oldText, newText, profiles, CancellationToken.NONE);
    }

    public MultiVariantResult compareMultiVariant(String oldText, String newText, List<String> profiles,
            CancellationToken token) throws SourceParseException {
        return multiVariantComparator.compare(oldText, newText, profiles, config.toDiffOptions(), token);
    }

    /**
     * Same as {@link #compareMultiVariant(String, String, List)} with profiles given as a
     * list such as "java11;java17".
     */
    public MultiVariantResult compareMultiVariant(String oldText, String newText, String profiles)
            throws SourceParseException {
        List<String> parsed = ProfileParser.parseMultiple(profiles, resolver.getCustomProfiles());
        return compareMultiVariant(oldText, newText, parsed, CancellationToken.NONE);
    }

    /**
     * Find the counterpart of a type in another tree.
     */
    public Optional<ClassMatch> findClassMatch(SyntaxNode sourceType, SyntaxNode targetTree,
            ClassMatchStrategy strategy, ClassMatchOptions options) {
        Optional<ClassMatch> match = classMatcher.findMatch(sourceType, targetTree, strategy, options);
        if (match.isEmpty()) {
            logger.debug("No {} match for {}", strategy, sourceType.displayName());
        }
        return match;
    }

    /**
     * Find the counterpart of a type with the configured threshold and compare the two.
     */
    public Optional<ClassComparison> compareClass(SyntaxNode sourceType, SyntaxNode targetTree,
            ClassMatchStrategy strategy, String interfaceName) {
        ClassMatchOptions options = config.toClassMatchOptions(interfaceName);
        return findClassMatch(sourceType, targetTree, strategy, options)
                .map(match -> new ClassComparison(match, compare(sourceType, match.node())));
    }

    public StructuralDiffConfig getConfig() {
        return config;
    }
}
