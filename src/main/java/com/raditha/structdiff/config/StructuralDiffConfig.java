package com.raditha.structdiff.config;

import com.raditha.structdiff.comparison.DiffOptions;
import com.raditha.structdiff.comparison.TextEquivalence;
import com.raditha.structdiff.matching.ClassMatchOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for structural comparison.
 *
 * @param similarityThreshold Minimum similarity for class matching by content (0.0-1.0)
 * @param renameThreshold     Minimum similarity for a rename (0.0-1.0)
 * @param moveThreshold       Minimum similarity for a move (0.0-1.0)
 * @param detectRenames       Run rename detection
 * @param detectMoves         Run move detection
 * @param includeContent      Copy source text into changes
 * @param includeNestedTypes  Let class matching consider nested types
 * @param parallelism         Worker threads for multi-profile runs
 * @param languageLevel       JavaParser language level name, e.g. "JAVA_17"
 * @param customProfiles      Extra compilation profiles: name to active symbols
 */
public record StructuralDiffConfig(
        double similarityThreshold,
        double renameThreshold,
        double moveThreshold,
        boolean detectRenames,
        boolean detectMoves,
        boolean includeContent,
        boolean includeNestedTypes,
        int parallelism,
        String languageLevel,
        Map<String, List<String>> customProfiles) {

    public static final String DEFAULT_LANGUAGE_LEVEL = "JAVA_17";

    /**
     * Validate configuration.
     */
    public StructuralDiffConfig {
        checkRange("similarityThreshold", similarityThreshold);
        checkRange("renameThreshold", renameThreshold);
        checkRange("moveThreshold", moveThreshold);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        if (languageLevel == null || languageLevel.isBlank()) {
            languageLevel = DEFAULT_LANGUAGE_LEVEL;
        }
        if (customProfiles == null) {
            customProfiles = Map.of();
        } else {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            customProfiles.forEach((name, symbols) -> copy.put(name, List.copyOf(symbols)));
            customProfiles = Collections.unmodifiableMap(copy);
        }
    }

    /**
     * Default preset: 0.8 thresholds for matching and renames, 0.95 for moves.
     */
    public static StructuralDiffConfig defaults() {
        return new StructuralDiffConfig(
                0.8, // similarityThreshold
                DiffOptions.DEFAULT_RENAME_THRESHOLD,
                DiffOptions.DEFAULT_MOVE_THRESHOLD,
                true,
                true,
                true, // includeContent
                false, // includeNestedTypes
                defaultParallelism(),
                DEFAULT_LANGUAGE_LEVEL,
                Map.of());
    }

    /**
     * Strict preset: only near-identical elements are paired as matches, renames or moves.
     */
    public static StructuralDiffConfig strict() {
        return new StructuralDiffConfig(0.9, 0.9, 1.0, true, true, true, false,
                defaultParallelism(), DEFAULT_LANGUAGE_LEVEL, Map.of());
    }

    /**
     * Lenient preset: pairs elements that changed more along the way.
     */
    public static StructuralDiffConfig lenient() {
        return new StructuralDiffConfig(0.7, 0.7, 0.85, true, true, true, false,
                defaultParallelism(), DEFAULT_LANGUAGE_LEVEL, Map.of());
    }

    /**
     * Options for one comparison derived from this configuration.
     */
    public DiffOptions toDiffOptions() {
        return new DiffOptions(null, null, includeContent, TextEquivalence.exact(),
                detectRenames, detectMoves, renameThreshold, moveThreshold);
    }

    public ClassMatchOptions toClassMatchOptions(String interfaceName) {
        return new ClassMatchOptions(interfaceName, similarityThreshold, includeNestedTypes);
    }

    public StructuralDiffConfig withParallelism(int threads) {
        return new StructuralDiffConfig(similarityThreshold, renameThreshold, moveThreshold, detectRenames,
                detectMoves, includeContent, includeNestedTypes, threads, languageLevel, customProfiles);
    }

    static int defaultParallelism() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static void checkRange(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
