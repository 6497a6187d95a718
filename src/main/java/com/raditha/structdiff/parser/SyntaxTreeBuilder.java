package com.raditha.structdiff.parser;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.raditha.structdiff.model.NodeKind;
import com.raditha.structdiff.model.Range;
import com.raditha.structdiff.model.SyntaxNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts a JavaParser {@link CompilationUnit} into a {@link SyntaxNode} tree.
 * <p>
 * Declarations down to members are emitted; method bodies stay leaves. Each node carries two
 * texts cut from the caller's text: the source text is the exact slice, the same whatever
 * symbols were active; the raw text is that slice without the lines the preprocessor blanked,
 * so it only changes when code compiled under the active symbols changes.
 */
public class SyntaxTreeBuilder {

    /**
     * Build the tree for a unit parsed from text without directives.
     */
    public SyntaxNode build(CompilationUnit cu, String originalText, @Nullable String fileName) {
        return build(cu, originalText, new BitSet(), fileName);
    }

    /**
     * Build the tree for one compilation unit.
     *
     * @param cu           parsed unit; its positions must match {@code originalText} line by line
     * @param originalText the text as the caller supplied it
     * @param blankedLines 1-based lines the preprocessor blanked; left out of raw text
     * @param fileName     name for the root node, or null to use the first type's name
     */
    public SyntaxNode build(CompilationUnit cu, String originalText, BitSet blankedLines,
            @Nullable String fileName) {
        SourceText source = new SourceText(originalText, blankedLines);
        List<SyntaxNode> children = new ArrayList<>();

        for (ImportDeclaration imp : cu.getImports()) {
            rangeOf(imp).ifPresent(range -> children.add(
                    source.node(NodeKind.OTHER, importName(imp), null, range, List.of(), List.of())));
        }

        List<SyntaxNode> types = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            buildType(type, source).ifPresent(types::add);
        }

        if (cu.getPackageDeclaration().isPresent()) {
            var pkg = cu.getPackageDeclaration().get();
            Range range = types.isEmpty()
                    ? rangeOf(pkg).orElse(source.fullRange())
                    : types.get(0).range().through(types.get(types.size() - 1).range());
            children.add(source.node(NodeKind.NAMESPACE, pkg.getNameAsString(), null, range, types, List.of()));
        } else {
            children.addAll(types);
        }

        String rootName = fileName != null ? fileName
                : cu.getTypes().isEmpty() ? null : cu.getType(0).getNameAsString();
        Range full = source.fullRange();
        return new SyntaxNode(NodeKind.FILE, rootName, null, full, source.active(full), children, List.of(),
                originalText);
    }

    private Optional<SyntaxNode> buildType(TypeDeclaration<?> type, SourceText source) {
        Optional<Range> range = rangeOf(type);
        if (range.isEmpty()) {
            return Optional.empty();
        }

        List<SyntaxNode> children = new ArrayList<>();
        if (type instanceof RecordDeclaration recordDecl) {
            for (Parameter component : recordDecl.getParameters()) {
                rangeOf(component).ifPresent(r -> children.add(source.node(NodeKind.PROPERTY,
                        component.getNameAsString(), component.getTypeAsString(), r, List.of(), List.of())));
            }
        }
        if (type instanceof EnumDeclaration enumDecl) {
            for (EnumConstantDeclaration constant : enumDecl.getEntries()) {
                rangeOf(constant).ifPresent(r -> children.add(
                        source.node(NodeKind.FIELD, constant.getNameAsString(), null, r, List.of(), List.of())));
            }
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            buildMember(member, source).ifPresent(children::add);
        }

        return Optional.of(source.node(NodeKind.TYPE, type.getNameAsString(), typeSignature(type),
                range.get(), children, capabilities(type)));
    }

    private Optional<SyntaxNode> buildMember(BodyDeclaration<?> member, SourceText source) {
        if (member instanceof TypeDeclaration<?> nested) {
            return buildType(nested, source);
        }

        Optional<Range> maybeRange = rangeOf(member);
        if (maybeRange.isEmpty()) {
            return Optional.empty();
        }
        Range range = maybeRange.get();

        if (member instanceof MethodDeclaration method) {
            return Optional.of(source.leaf(NodeKind.METHOD, method.getNameAsString(),
                    method.getDeclarationAsString(true, false, false), range));
        }
        if (member instanceof ConstructorDeclaration ctor) {
            return Optional.of(source.leaf(NodeKind.METHOD, ctor.getNameAsString(),
                    ctor.getDeclarationAsString(true, false, false), range));
        }
        if (member instanceof CompactConstructorDeclaration compact) {
            return Optional.of(source.leaf(NodeKind.METHOD, compact.getNameAsString(),
                    modifiers(compact.getModifiers()) + compact.getNameAsString(), range));
        }
        if (member instanceof AnnotationMemberDeclaration annotationMember) {
            return Optional.of(source.leaf(NodeKind.METHOD, annotationMember.getNameAsString(),
                    annotationMember.getTypeAsString() + " " + annotationMember.getNameAsString() + "()", range));
        }
        if (member instanceof FieldDeclaration field) {
            String name = field.getVariables().isEmpty() ? null : field.getVariable(0).getNameAsString();
            String type = field.getVariables().isEmpty() ? "" : field.getElementType().asString();
            return Optional.of(source.leaf(NodeKind.FIELD, name, modifiers(field.getModifiers()) + type, range));
        }
        if (member instanceof InitializerDeclaration initializer) {
            return Optional.of(source.leaf(NodeKind.OTHER,
                    initializer.isStatic() ? "<clinit>" : "<init>", null, range));
        }
        return Optional.of(source.leaf(NodeKind.OTHER, null, null, range));
    }

    private static String typeSignature(TypeDeclaration<?> type) {
        String keyword;
        if (type instanceof ClassOrInterfaceDeclaration coid) {
            keyword = coid.isInterface() ? "interface" : "class";
        } else if (type instanceof EnumDeclaration) {
            keyword = "enum";
        } else if (type instanceof RecordDeclaration) {
            keyword = "record";
        } else if (type instanceof AnnotationDeclaration) {
            keyword = "@interface";
        } else {
            keyword = "type";
        }
        return modifiers(type.getModifiers()) + keyword + " " + type.getNameAsString();
    }

    /**
     * Written and simple names of the declared supertypes.
     */
    static List<String> capabilities(TypeDeclaration<?> type) {
        List<ClassOrInterfaceType> supertypes = new ArrayList<>();
        if (type instanceof ClassOrInterfaceDeclaration coid) {
            supertypes.addAll(coid.getExtendedTypes());
            supertypes.addAll(coid.getImplementedTypes());
        } else if (type instanceof EnumDeclaration enumDecl) {
            supertypes.addAll(enumDecl.getImplementedTypes());
        } else if (type instanceof RecordDeclaration recordDecl) {
            supertypes.addAll(recordDecl.getImplementedTypes());
        }

        Set<String> names = new LinkedHashSet<>();
        for (ClassOrInterfaceType supertype : supertypes) {
            names.add(supertype.asString());
            names.add(supertype.getNameAsString());
        }
        return List.copyOf(names);
    }

    private static String modifiers(NodeList<Modifier> modifiers) {
        if (modifiers.isEmpty()) {
            return "";
        }
        return modifiers.stream()
                .map(m -> m.getKeyword().asString())
                .collect(Collectors.joining(" ")) + " ";
    }

    private static String importName(ImportDeclaration imp) {
        StringBuilder sb = new StringBuilder("import ");
        if (imp.isStatic()) {
            sb.append("static ");
        }
        sb.append(imp.getNameAsString());
        if (imp.isAsterisk()) {
            sb.append(".*");
        }
        return sb.toString();
    }

    private static Optional<Range> rangeOf(Node node) {
        return node.getRange().map(Range::from);
    }

    /**
     * Line-indexed view of the original text for slicing by line and column.
     */
    static final class SourceText {
        private final String text;
        private final BitSet blankedLines;
        private final List<Integer> lineStarts = new ArrayList<>();

        SourceText(String text, BitSet blankedLines) {
            this.text = text;
            this.blankedLines = blankedLines;
            lineStarts.add(0);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                    lineStarts.add(i + 1);
                } else if (c == '\n' || c == '\r') {
                    lineStarts.add(i + 1);
                }
            }
        }

        SyntaxNode node(NodeKind kind, @Nullable String name, @Nullable String signature, Range range,
                List<SyntaxNode> children, List<String> capabilities) {
            return new SyntaxNode(kind, name, signature, range, active(range), children, capabilities, slice(range));
        }

        SyntaxNode leaf(NodeKind kind, @Nullable String name, @Nullable String signature, Range range) {
            return node(kind, name, signature, range, List.of(), List.of());
        }

        /**
         * The slice of {@code range} without blanked lines.
         */
        String active(Range range) {
            String slice = slice(range);
            if (blankedLines.isEmpty()) {
                return slice;
            }
            StringBuilder sb = new StringBuilder(slice.length());
            int line = range.startLine();
            for (String[] part : ConditionalPreprocessor.splitLines(slice)) {
                if (!blankedLines.get(line)) {
                    sb.append(part[0]).append(part[1]);
                }
                line++;
            }
            return sb.toString();
        }

        /**
         * Text between the start of {@code range} and its (inclusive) end.
         */
        String slice(Range range) {
            int begin = offset(range.startLine(), range.startColumn());
            int end = Math.min(text.length(), offset(range.endLine(), range.endColumn()) + 1);
            return begin >= end ? "" : text.substring(begin, end);
        }

        Range fullRange() {
            int lastLine = lineStarts.size();
            int lastColumn = Math.max(1, text.length() - lineStarts.get(lastLine - 1));
            return new Range(1, lastLine, 1, lastColumn);
        }

        private int offset(int line, int column) {
            if (line < 1) {
                return 0;
            }
            if (line > lineStarts.size()) {
                return text.length();
            }
            return Math.min(text.length(), lineStarts.get(line - 1) + Math.max(0, column - 1));
        }
    }
}
