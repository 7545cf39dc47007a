package com.codescore.core.parser.ast;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.parser.SourceParser;
import com.codescore.core.parser.base.SourceLines;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * AST-tier parser: walks a concrete syntax tree using a {@link LanguageGrammarConfig}.
 *
 * <p><b>Extraction rules:</b></p>
 * <ul>
 *   <li>Functions and classes are collected depth-first. The walk does not descend into a
 *       matched function or class node when collecting that same role. Nested functions are
 *       neither extracted nor counted toward the enclosing function's metrics.</li>
 *   <li>Complexity is 1 plus every complexity-kind node in the body. Operator nodes count only
 *       for logical AND/OR. Nested function bodies are skipped.</li>
 *   <li>Nesting depth is the deepest chain of nesting-kind nodes in the body, again skipping
 *       nested function bodies.</li>
 *   <li>A line is blank if its trimmed text is empty, comment if any comment node covers it,
 *       code otherwise.</li>
 * </ul>
 *
 * <p><b>Errors:</b></p>
 * <p>Any failure while building or walking the tree is rethrown as {@link AstParseException}.
 * Syntax errors that the tree builder tolerates are reported in {@link ParseResult#errors()}.</p>
 *
 * @see GrammarRegistry
 * @since 1.0.0
 */
public class AstParser implements SourceParser {

    private static final int MAX_REPORTED_SYNTAX_ERRORS = 10;
    private static final String ERROR_KIND = "ERROR";
    private static final List<String> IMPORT_TARGET_KINDS = List.of(
        "interpreted_string_literal", "string", "string_literal", "dotted_name",
        "scoped_identifier", "qualified_name", "identifier");
    private static final List<String> DOC_COMMENT_PREFIXES = List.of("/**", "///", "\"\"\"", "'''", "--[");
    private static final Set<String> DECLARATOR_WRAPPERS = Set.of(
        "function_declarator", "pointer_declarator", "reference_declarator", "parenthesized_declarator");

    private final Language language;
    private final LanguageGrammarConfig config;
    private final SyntaxTreeBuilder treeBuilder;

    public AstParser(Language language, LanguageGrammarConfig config, SyntaxTreeBuilder treeBuilder) {
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder must not be null");
    }

    @Override
    public ParserTier tier() {
        return ParserTier.AST;
    }

    public LanguageGrammarConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String filePath, String content) {
        String text = content == null ? "" : content;
        SyntaxNode root;
        try {
            root = treeBuilder.build(text);
        } catch (RuntimeException e) {
            throw new AstParseException("Failed to build syntax tree for " + filePath, e);
        }
        if (root == null) {
            throw new AstParseException("Syntax tree builder returned no root for " + filePath, null);
        }

        try {
            List<String> lines = SourceLines.split(text);
            LineCounts counts = countLines(root, lines);
            return new ParseResult(
                filePath,
                language,
                lines.size(),
                counts.code(),
                counts.comment(),
                counts.blank(),
                extractFunctions(root),
                extractClasses(root),
                extractImports(root),
                collectSyntaxErrors(root),
                null,
                ParserTier.AST
            );
        } catch (RuntimeException e) {
            throw new AstParseException("Failed to traverse syntax tree for " + filePath, e);
        }
    }

    // ==================== Line accounting ====================

    private record LineCounts(int code, int comment, int blank) {}

    private LineCounts countLines(SyntaxNode root, List<String> lines) {
        Set<Integer> commentRows = new HashSet<>();
        collect(root, config.commentKinds(), true, node -> {
            for (int row = node.startRow(); row <= node.endRow(); row++) {
                commentRows.add(row);
            }
        });

        int blank = 0;
        int comment = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).trim().isEmpty()) {
                blank++;
            } else if (commentRows.contains(i)) {
                comment++;
            }
        }
        return new LineCounts(lines.size() - blank - comment, comment, blank);
    }

    private List<String> collectSyntaxErrors(SyntaxNode root) {
        List<String> errors = new ArrayList<>();
        collect(root, Set.of(ERROR_KIND), false, node -> {
            if (errors.size() < MAX_REPORTED_SYNTAX_ERRORS) {
                errors.add("Syntax error at line " + (node.startRow() + 1));
            }
        });
        return errors;
    }

    // ==================== Imports ====================

    private List<String> extractImports(SyntaxNode root) {
        List<String> imports = new ArrayList<>();
        collect(root, config.importKinds(), true, node -> {
            if (!config.importCallNames().isEmpty() && !isImportCall(node)) {
                return;
            }
            importTarget(node)
                .map(target -> stripQuotes(target.text()))
                .filter(target -> !target.isEmpty())
                .ifPresent(imports::add);
        });
        return imports;
    }

    private boolean isImportCall(SyntaxNode node) {
        return node.childByField("method")
            .map(method -> config.importCallNames().contains(method.text()))
            .orElse(false);
    }

    private Optional<SyntaxNode> importTarget(SyntaxNode node) {
        for (String kind : IMPORT_TARGET_KINDS) {
            Optional<SyntaxNode> match = node.firstDescendant(kind);
            if (match.isPresent()) {
                return match;
            }
        }
        return node.childByField("path")
            .or(() -> node.childByField("source"))
            .or(() -> node.childByField("name"));
    }

    private static String stripQuotes(String text) {
        String result = text.trim();
        if (!result.isEmpty() && "\"'`".indexOf(result.charAt(0)) >= 0) {
            result = result.substring(1);
        }
        if (!result.isEmpty() && "\"'`".indexOf(result.charAt(result.length() - 1)) >= 0) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    // ==================== Functions ====================

    private List<FunctionInfo> extractFunctions(SyntaxNode root) {
        List<FunctionInfo> functions = new ArrayList<>();
        collect(root, config.functionKinds(), false, node -> {
            String name = functionName(node);
            if (name == null || name.isBlank()) {
                return;
            }
            Optional<SyntaxNode> body = node.childByField(config.bodyField());
            int complexity = 1 + body.map(this::countDecisionPoints).orElse(0);
            int nesting = body.map(b -> maxNesting(b, 0)).orElse(0);
            functions.add(FunctionInfo.of(
                name,
                node.startRow() + 1,
                node.endRow() + 1,
                complexity,
                countParameters(node),
                nesting,
                hasDocstring(node)
            ));
        });
        return functions;
    }

    private String functionName(SyntaxNode node) {
        Optional<SyntaxNode> nameNode = node.childByField(config.nameField());
        if (nameNode.isPresent()) {
            return config.declaratorNames()
                ? declaratorName(nameNode.get())
                : nameNode.get().text();
        }
        // Anonymous function bound to a variable: const handler = () => {...}
        return node.parent()
            .filter(parent -> "variable_declarator".equals(parent.kind()))
            .flatMap(parent -> parent.childByField("name"))
            .map(SyntaxNode::text)
            .orElse(null);
    }

    private static String declaratorName(SyntaxNode declarator) {
        SyntaxNode current = declarator;
        while (DECLARATOR_WRAPPERS.contains(current.kind())) {
            SyntaxNode wrapper = current;
            Optional<SyntaxNode> inner = wrapper.childByField("declarator")
                .or(() -> wrapper.namedChildren().stream().findFirst());
            if (inner.isEmpty()) {
                break;
            }
            current = inner.get();
        }
        if ("qualified_identifier".equals(current.kind())) {
            SyntaxNode qualified = current;
            return qualified.childByField("name").map(SyntaxNode::text).orElse(qualified.text());
        }
        return current.text();
    }

    private int countParameters(SyntaxNode function) {
        Optional<SyntaxNode> parameters;
        if (config.declaratorNames()) {
            parameters = function.childByField(config.parametersField())
                .flatMap(declarator -> declarator.childByField("parameters")
                    .or(() -> declarator.firstDescendant("parameter_list")));
        } else {
            parameters = function.childByField(config.parametersField());
        }
        if (parameters.isEmpty()) {
            return 0;
        }

        int count = 0;
        for (SyntaxNode child : parameters.get().namedChildren()) {
            if (config.groupedParameters()) {
                if ("parameter_declaration".equals(child.kind())
                    || "variadic_parameter_declaration".equals(child.kind())) {
                    long names = child.namedChildren().stream()
                        .filter(inner -> "identifier".equals(inner.kind()))
                        .count();
                    // An unnamed parameter such as func(int) still declares one parameter
                    count += (int) Math.max(1, names);
                }
            } else if (GrammarRegistry.PARAMETER_KINDS.contains(child.kind())) {
                count++;
            }
        }
        return count;
    }

    private boolean hasDocstring(SyntaxNode function) {
        Optional<SyntaxNode> previous = function.previousNamedSibling()
            .filter(sibling -> config.commentKinds().contains(sibling.kind()));
        if (previous.isPresent()) {
            String text = previous.get().text().stripLeading();
            if (DOC_COMMENT_PREFIXES.stream().anyMatch(text::startsWith)) {
                return true;
            }
            if (previous.get().endRow() == function.startRow() - 1) {
                return true;
            }
        }

        if (config.bodyDocstring()) {
            return function.childByField(config.bodyField())
                .flatMap(body -> body.namedChildren().stream().findFirst())
                .filter(first -> "expression_statement".equals(first.kind()))
                .flatMap(first -> first.namedChildren().stream().findFirst())
                .map(expression -> "string".equals(expression.kind()))
                .orElse(false);
        }
        return false;
    }

    int countDecisionPoints(SyntaxNode node) {
        int count = 0;
        if (config.complexityKinds().contains(node.kind())) {
            if (GrammarRegistry.LOGICAL_OPERATOR_KINDS.contains(node.kind())) {
                if (isLogicalOperator(node)) {
                    count++;
                }
            } else {
                count++;
            }
        }
        for (SyntaxNode child : node.namedChildren()) {
            if (!config.functionKinds().contains(child.kind())) {
                count += countDecisionPoints(child);
            }
        }
        return count;
    }

    private static boolean isLogicalOperator(SyntaxNode node) {
        return node.childByField("operator")
            .map(operator -> GrammarRegistry.LOGICAL_OPERATORS.contains(operator.text().trim()))
            .orElse(false);
    }

    int maxNesting(SyntaxNode node, int depth) {
        int max = depth;
        for (SyntaxNode child : node.namedChildren()) {
            if (config.functionKinds().contains(child.kind())) {
                continue;
            }
            int childDepth = config.nestingKinds().contains(child.kind()) ? depth + 1 : depth;
            max = Math.max(max, maxNesting(child, childDepth));
        }
        return max;
    }

    // ==================== Classes ====================

    private List<ClassInfo> extractClasses(SyntaxNode root) {
        List<ClassInfo> classes = new ArrayList<>();
        collect(root, config.classKinds(), false, node -> {
            SyntaxNode declaration = node;
            if (config.classWrapperKind() != null) {
                Optional<SyntaxNode> wrapped = node.namedChildren().stream()
                    .filter(child -> config.classWrapperKind().equals(child.kind()))
                    .findFirst();
                if (wrapped.isEmpty()) {
                    return;
                }
                declaration = wrapped.get();
            }

            SyntaxNode decl = declaration;
            String name = decl.childByField(config.classNameField())
                .or(() -> decl.childByField("type"))
                .map(SyntaxNode::text)
                .orElse(null);
            if (name == null || name.isBlank()) {
                return;
            }

            int[] members = new int[2];
            decl.childByField(config.classBodyField())
                .ifPresent(body -> countMembers(body, members));
            classes.add(new ClassInfo(name, node.startRow() + 1, node.endRow() + 1, members[0], members[1]));
        });
        return classes;
    }

    private void countMembers(SyntaxNode container, int[] members) {
        for (SyntaxNode child : container.namedChildren()) {
            String kind = child.kind();
            if (config.methodKinds().contains(kind)) {
                members[0]++;
            } else if (config.fieldKinds().contains(kind)) {
                members[1]++;
            } else if (kind.contains("_list") || kind.contains("_body") || "declaration_list".equals(kind)) {
                countMembers(child, members);
            }
        }
    }

    // ==================== Traversal ====================

    /**
     * Visits every node whose kind is in {@code kinds}. When {@code descendIntoMatches} is false
     * the walk stops at a matched node.
     */
    private static void collect(SyntaxNode root, Set<String> kinds, boolean descendIntoMatches,
                                Consumer<SyntaxNode> visitor) {
        if (kinds.isEmpty()) {
            return;
        }
        walk(root, kinds, descendIntoMatches, visitor);
    }

    private static void walk(SyntaxNode node, Set<String> kinds, boolean descendIntoMatches,
                             Consumer<SyntaxNode> visitor) {
        if (kinds.contains(node.kind())) {
            visitor.accept(node);
            if (!descendIntoMatches) {
                return;
            }
        }
        for (SyntaxNode child : node.namedChildren()) {
            walk(child, kinds, descendIntoMatches, visitor);
        }
    }

    /**
     * Failure while building or traversing a syntax tree.
     */
    public static class AstParseException extends RuntimeException {
        public AstParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
