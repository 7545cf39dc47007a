package com.codescore.core.parser.ast;

import com.codescore.core.model.Language;

import java.util.Objects;
import java.util.Set;

/**
 * Per-language extraction rules for the AST tier: which syntax-node kinds play which
 * semantic role, and which named fields hold a declaration's name, parameters and body.
 *
 * <p>Pure data. Instances are built once by {@link GrammarRegistry} and shared read-only.
 *
 * @param language language the rules apply to
 * @param grammarName grammar identifier, e.g. {@code "c_sharp"}
 * @param functionKinds function-like declarations
 * @param classKinds class-like declarations
 * @param importKinds import statements
 * @param commentKinds comments
 * @param complexityKinds nodes that add one to cyclomatic complexity
 * @param nestingKinds nodes that open a nesting level
 * @param methodKinds class members counted as methods
 * @param fieldKinds class members counted as fields
 * @param nameField field holding a function's name
 * @param parametersField field holding a function's parameter list
 * @param bodyField field holding a function's body
 * @param classNameField field holding a class's name
 * @param classBodyField field holding a class's body
 * @param classWrapperKind child kind that carries name and body for wrapped declarations
 *                         (Go {@code type_spec}), or {@code null}
 * @param declaratorNames names and parameters live inside a nested declarator chain (C, C++)
 * @param groupedParameters one parameter declaration may declare several names ({@code a, b int})
 * @param bodyDocstring a leading string literal in the body is a docstring
 * @param importCallNames for grammars where imports are plain calls, the callee names that count
 *
 * @since 1.0.0
 */
public record LanguageGrammarConfig(
    Language language,
    String grammarName,
    Set<String> functionKinds,
    Set<String> classKinds,
    Set<String> importKinds,
    Set<String> commentKinds,
    Set<String> complexityKinds,
    Set<String> nestingKinds,
    Set<String> methodKinds,
    Set<String> fieldKinds,
    String nameField,
    String parametersField,
    String bodyField,
    String classNameField,
    String classBodyField,
    String classWrapperKind,
    boolean declaratorNames,
    boolean groupedParameters,
    boolean bodyDocstring,
    Set<String> importCallNames
) {
    public LanguageGrammarConfig {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(grammarName, "grammarName must not be null");
        functionKinds = copy(functionKinds);
        classKinds = copy(classKinds);
        importKinds = copy(importKinds);
        commentKinds = copy(commentKinds);
        complexityKinds = copy(complexityKinds);
        nestingKinds = copy(nestingKinds);
        methodKinds = copy(methodKinds);
        fieldKinds = copy(fieldKinds);
        importCallNames = copy(importCallNames);
        nameField = nameField == null ? "name" : nameField;
        parametersField = parametersField == null ? "parameters" : parametersField;
        bodyField = bodyField == null ? "body" : bodyField;
        classNameField = classNameField == null ? "name" : classNameField;
        classBodyField = classBodyField == null ? "body" : classBodyField;
    }

    private static Set<String> copy(Set<String> kinds) {
        return kinds == null ? Set.of() : Set.copyOf(kinds);
    }

    /**
     * Starts a builder for the given language and grammar.
     */
    public static Builder builder(Language language, String grammarName) {
        return new Builder(language, grammarName);
    }

    /**
     * Fluent builder used by the registry tables.
     */
    public static final class Builder {
        private final Language language;
        private final String grammarName;
        private Set<String> functionKinds = Set.of();
        private Set<String> classKinds = Set.of();
        private Set<String> importKinds = Set.of();
        private Set<String> commentKinds = Set.of("comment");
        private Set<String> complexityKinds = Set.of();
        private Set<String> nestingKinds = Set.of();
        private Set<String> methodKinds = Set.of();
        private Set<String> fieldKinds = Set.of();
        private String nameField;
        private String parametersField;
        private String bodyField;
        private String classNameField;
        private String classBodyField;
        private String classWrapperKind;
        private boolean declaratorNames;
        private boolean groupedParameters;
        private boolean bodyDocstring;
        private Set<String> importCallNames = Set.of();

        private Builder(Language language, String grammarName) {
            this.language = language;
            this.grammarName = grammarName;
        }

        public Builder functions(String... kinds) {
            this.functionKinds = Set.of(kinds);
            return this;
        }

        public Builder classes(String... kinds) {
            this.classKinds = Set.of(kinds);
            return this;
        }

        public Builder imports(String... kinds) {
            this.importKinds = Set.of(kinds);
            return this;
        }

        public Builder comments(String... kinds) {
            this.commentKinds = Set.of(kinds);
            return this;
        }

        public Builder complexity(String... kinds) {
            this.complexityKinds = Set.of(kinds);
            return this;
        }

        public Builder nesting(String... kinds) {
            this.nestingKinds = Set.of(kinds);
            return this;
        }

        public Builder methods(String... kinds) {
            this.methodKinds = Set.of(kinds);
            return this;
        }

        public Builder fields(String... kinds) {
            this.fieldKinds = Set.of(kinds);
            return this;
        }

        public Builder functionFields(String name, String parameters, String body) {
            this.nameField = name;
            this.parametersField = parameters;
            this.bodyField = body;
            return this;
        }

        public Builder classFields(String name, String body) {
            this.classNameField = name;
            this.classBodyField = body;
            return this;
        }

        public Builder classWrapper(String kind) {
            this.classWrapperKind = kind;
            return this;
        }

        public Builder declaratorNames() {
            this.declaratorNames = true;
            return this;
        }

        public Builder groupedParameters() {
            this.groupedParameters = true;
            return this;
        }

        public Builder bodyDocstring() {
            this.bodyDocstring = true;
            return this;
        }

        public Builder importCalls(String... calleeNames) {
            this.importCallNames = Set.of(calleeNames);
            return this;
        }

        public LanguageGrammarConfig build() {
            return new LanguageGrammarConfig(language, grammarName, functionKinds, classKinds,
                importKinds, commentKinds, complexityKinds, nestingKinds, methodKinds, fieldKinds,
                nameField, parametersField, bodyField, classNameField, classBodyField,
                classWrapperKind, declaratorNames, groupedParameters, bodyDocstring, importCallNames);
        }
    }
}
