package com.raditha.structdiff.matching;

import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.similarity.SignatureHasher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds the type in a target tree that corresponds to a given source type.
 */
public class ClassMatcher {

    private final SignatureHasher hasher;

    public ClassMatcher() {
        this(new SignatureHasher());
    }

    public ClassMatcher(SignatureHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * A candidate type and its dotted path through enclosing types.
     */
    public record TypeEntry(SyntaxNode node, String path) {
    }

    /**
     * Find the counterpart of {@code sourceType} in {@code targetTree}.
     *
     * @return the match, or empty when the strategy finds none
     */
    public Optional<ClassMatch> findMatch(SyntaxNode sourceType, SyntaxNode targetTree,
            ClassMatchStrategy strategy, ClassMatchOptions options) {
        Objects.requireNonNull(sourceType, "sourceType");
        Objects.requireNonNull(targetTree, "targetTree");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(options, "options");

        List<TypeEntry> candidates = collectTypes(targetTree, options.includeNestedTypes());

        return switch (strategy) {
            case EXACT_NAME -> findByExactName(sourceType, candidates);
            case INTERFACE -> findByInterface(sourceType, candidates, options.interfaceName());
            case SIMILARITY -> findBySimilarity(sourceType, candidates, options.similarityThreshold());
            case AUTO -> findByAuto(sourceType, candidates, options);
        };
    }

    /**
     * Collect type declarations in document order. Namespaces are always searched;
     * nested types only when requested.
     */
    public List<TypeEntry> collectTypes(SyntaxNode tree, boolean includeNested) {
        List<TypeEntry> result = new ArrayList<>();
        if (tree.kind() == NodeKind.TYPE) {
            result.add(new TypeEntry(tree, tree.displayName()));
            if (includeNested) {
                collectTypes(tree, tree.displayName(), result, true);
            }
        } else {
            collectTypes(tree, null, result, includeNested);
        }
        return result;
    }

    private void collectTypes(SyntaxNode node, String enclosingPath, List<TypeEntry> result, boolean includeNested) {
        for (SyntaxNode child : node.children()) {
            if (child.kind() == NodeKind.TYPE) {
                String path = enclosingPath == null ? child.displayName() : enclosingPath + "." + child.displayName();
                result.add(new TypeEntry(child, path));
                if (includeNested) {
                    collectTypes(child, path, result, true);
                }
            } else if (child.kind() == NodeKind.NAMESPACE || child.kind() == NodeKind.FILE) {
                collectTypes(child, enclosingPath, result, includeNested);
            }
        }
    }

    private Optional<ClassMatch> findByExactName(SyntaxNode sourceType, List<TypeEntry> candidates) {
        String name = sourceType.name();
        if (name == null) {
            return Optional.empty();
        }

        // A top-level type of that name wins over a nested one
        for (TypeEntry entry : candidates) {
            if (entry.path().equals(name)) {
                return Optional.of(new ClassMatch(entry.node(), entry.path(), 1.0, ClassMatchStrategy.EXACT_NAME));
            }
        }
        for (TypeEntry entry : candidates) {
            if (name.equals(entry.node().name())) {
                return Optional.of(new ClassMatch(entry.node(), entry.path(), 1.0, ClassMatchStrategy.EXACT_NAME));
            }
        }
        return Optional.empty();
    }

    private Optional<ClassMatch> findByInterface(SyntaxNode sourceType, List<TypeEntry> candidates,
            String interfaceName) {
        if (interfaceName == null || interfaceName.isBlank()) {
            return Optional.empty();
        }

        for (TypeEntry entry : candidates) {
            if (declaresCapability(entry.node(), interfaceName)) {
                double similarity = hasher.similarity(sourceType, entry.node());
                return Optional.of(new ClassMatch(entry.node(), entry.path(), similarity, ClassMatchStrategy.INTERFACE));
            }
        }
        return Optional.empty();
    }

    private Optional<ClassMatch> findBySimilarity(SyntaxNode sourceType, List<TypeEntry> candidates,
            double threshold) {
        TypeEntry best = null;
        double bestSimilarity = -1.0;

        for (TypeEntry entry : candidates) {
            double similarity = hasher.similarity(sourceType, entry.node());
            if (similarity >= threshold && similarity > bestSimilarity) {
                best = entry;
                bestSimilarity = similarity;
            }
        }

        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new ClassMatch(best.node(), best.path(), bestSimilarity, ClassMatchStrategy.SIMILARITY));
    }

    private Optional<ClassMatch> findByAuto(SyntaxNode sourceType, List<TypeEntry> candidates,
            ClassMatchOptions options) {
        Optional<ClassMatch> exact = findByExactName(sourceType, candidates);
        if (exact.isPresent()) {
            return exact;
        }

        if (options.interfaceName() != null && !options.interfaceName().isBlank()) {
            Optional<ClassMatch> byInterface = findByInterface(sourceType, candidates, options.interfaceName());
            if (byInterface.isPresent()) {
                return byInterface;
            }
        }

        return findBySimilarity(sourceType, candidates, options.similarityThreshold());
    }

    /**
     * True when the type lists {@code name} among its supertypes, written plainly, with
     * type arguments or qualified.
     */
    static boolean declaresCapability(SyntaxNode type, String name) {
        for (String capability : type.capabilities()) {
            if (capability.equals(name)
                    || capability.startsWith(name + "<")
                    || capability.endsWith("." + name)
                    || capability.contains("." + name + "<")) {
                return true;
            }
        }
        return false;
    }
}
