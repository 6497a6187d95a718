package com.raditha.structdiff.variant;

import com.raditha.structdiff.comparison.CancellationToken;
import com.raditha.structdiff.comparison.ComparisonCancelledException;
import com.raditha.structdiff.comparison.DiffOptions;
import com.raditha.structdiff.comparison.TreeComparator;
import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.parser.SourceParseException;
import com.raditha.structdiff.parser.SourceParser;
import com.raditha.structdiff.profile.DirectiveDetector;
import com.raditha.structdiff.profile.ProfileResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Compares two versions of a source under several compilation profiles and merges the results.
 * <p>
 * Profiles are validated before anything is parsed. Each profile runs as its own task on a
 * fixed pool and returns its own change list; the fold into one annotated list happens
 * afterwards on the calling thread. When neither version contains a conditional directive
 * the profiles cannot differ, so a single comparison is run instead.
 * <p>
 * Cancellation is cooperative: tasks check the token before each parse and between sibling
 * groups. Once one task stops on cancellation, tasks not yet started are dropped and running
 * ones stop at their next check.
 */
public class MultiVariantComparator {

    private static final Logger logger = LoggerFactory.getLogger(MultiVariantComparator.class);

    private final SourceParser parser;
    private final TreeComparator comparator;
    private final ProfileResolver resolver;
    private final ProfileResultMerger merger = new ProfileResultMerger();
    private final int parallelism;

    public MultiVariantComparator(SourceParser parser, TreeComparator comparator, ProfileResolver resolver,
            int parallelism) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        this.parallelism = parallelism;
    }

    /**
     * Result of one profile task: its changes, or the parse failure that made it skip.
     */
    private record ProfileOutcome(String profile, List<Change> changes, SourceParseException failure) {
    }

    /**
     * Compare {@code oldText} and {@code newText} under each profile.
     *
     * @param profiles profile names in the order their annotations should follow; empty for a
     *                 single run with the default symbols
     * @throws com.raditha.structdiff.profile.ProfileResolutionException if a profile name is invalid
     * @throws SourceParseException         if a single run fails to parse, or every profile fails
     * @throws ComparisonCancelledException if {@code token} is cancelled
     */
    public MultiVariantResult compare(String oldText, String newText, List<String> profiles, DiffOptions options,
            CancellationToken token) throws SourceParseException {
        Objects.requireNonNull(oldText, "oldText");
        Objects.requireNonNull(newText, "newText");
        Objects.requireNonNull(profiles, "profiles");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(token, "token");

        List<String> normalized = resolver.normalize(profiles);
        Map<String, Set<String>> symbols = new LinkedHashMap<>();
        for (String profile : normalized) {
            symbols.put(profile, resolver.resolve(profile));
        }

        boolean directives = DirectiveDetector.hasConditionalDirectives(oldText)
                || DirectiveDetector.hasConditionalDirectives(newText);
        if (!directives || normalized.isEmpty()) {
            Set<String> active = normalized.isEmpty() ? resolver.defaultSymbols() : symbols.get(normalized.get(0));
            logger.debug("Single-variant comparison (directives present: {}, profiles: {})", directives,
                    normalized);
            token.throwIfCancellationRequested();
            List<Change> changes = compareOnce(oldText, newText, active, options, token);
            return MultiVariantResult.singleVariant(changes);
        }

        List<ProfileOutcome> outcomes = runProfiles(oldText, newText, symbols, options, token);
        token.throwIfCancellationRequested();

        Map<String, List<Change>> changesByProfile = new LinkedHashMap<>();
        Map<String, String> failed = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();
        for (ProfileOutcome outcome : outcomes) {
            if (outcome.failure() != null) {
                logger.warn("Skipping profile {}: {}", outcome.profile(), outcome.failure().getMessage());
                failed.put(outcome.profile(), outcome.failure().getMessage());
                problems.addAll(outcome.failure().getProblems());
            } else {
                changesByProfile.put(outcome.profile(), outcome.changes());
            }
        }

        if (changesByProfile.isEmpty()) {
            throw new SourceParseException("Source could not be parsed under any of the profiles " + normalized,
                    problems);
        }

        List<Change> merged = merger.merge(changesByProfile);
        MultiVariantResult result = new MultiVariantResult(merged, List.copyOf(changesByProfile.keySet()), failed,
                true);
        logger.info("Multi-variant comparison: {}", result.summary());
        return result;
    }

    private List<ProfileOutcome> runProfiles(String oldText, String newText, Map<String, Set<String>> symbols,
            DiffOptions options, CancellationToken token) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, symbols.size()));
        CancellationToken runToken = token.newLinkedToken();
        List<CompletableFuture<ProfileOutcome>> futures = new ArrayList<>();
        try {
            for (Map.Entry<String, Set<String>> entry : symbols.entrySet()) {
                String profile = entry.getKey();
                Set<String> active = entry.getValue();
                futures.add(CompletableFuture.supplyAsync(
                        () -> runProfile(profile, oldText, newText, active, options, runToken), executor));
            }

            List<ProfileOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<ProfileOutcome> future : futures) {
                outcomes.add(join(future));
            }
            return outcomes;
        } catch (RuntimeException | Error e) {
            runToken.cancel();
            futures.forEach(future -> future.cancel(false));
            throw e;
        } finally {
            executor.shutdownNow();
        }
    }

    private ProfileOutcome runProfile(String profile, String oldText, String newText, Set<String> active,
            DiffOptions options, CancellationToken runToken) {
        try {
            runToken.throwIfCancellationRequested();
            logger.debug("Comparing under profile {} with {} symbol(s)", profile, active.size());
            List<Change> changes = compareOnce(oldText, newText, active, options, runToken);
            return new ProfileOutcome(profile, changes, null);
        } catch (SourceParseException e) {
            return new ProfileOutcome(profile, List.of(), e);
        } catch (ComparisonCancelledException e) {
            // stop the sibling tasks at their next check
            runToken.cancel();
            throw e;
        }
    }

    private List<Change> compareOnce(String oldText, String newText, Set<String> active, DiffOptions options,
            CancellationToken token) throws SourceParseException {
        SyntaxNode oldTree = parser.parse(oldText, active);
        token.throwIfCancellationRequested();
        SyntaxNode newTree = parser.parse(newText, active);
        return comparator.compare(oldTree, newTree, options, token);
    }

    private static ProfileOutcome join(CompletableFuture<ProfileOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
