package com.codescore.core.parser.ast;

import com.codescore.core.model.Language;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static table of {@link LanguageGrammarConfig} entries, one per language with a grammar.
 *
 * <p>Node-kind names follow the tree-sitter grammars of each language. Binary and boolean
 * operator kinds appear in the complexity sets; the AST parser only counts them when the
 * operator is a logical AND or OR (see {@link #LOGICAL_OPERATOR_KINDS}).
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * GrammarRegistry.find(Language.GO).ifPresent(config -> {
 *     boolean grouped = config.groupedParameters();   // true: "a, b int" counts twice
 * });
 * }</pre>
 *
 * @since 1.0.0
 */
public final class GrammarRegistry {

    /** Operator node kinds whose contribution depends on the operator token. */
    public static final Set<String> LOGICAL_OPERATOR_KINDS = Set.of("binary_expression", "boolean_operator", "binary");

    /** Operator tokens that count as a decision point. */
    public static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "and", "or");

    /** Node kinds that count as one parameter inside a parameter list. */
    public static final Set<String> PARAMETER_KINDS = Set.of(
        "parameter_declaration",
        "parameter",
        "formal_parameter",
        "spread_parameter",
        "required_parameter",
        "optional_parameter",
        "rest_parameter",
        "typed_parameter",
        "typed_default_parameter",
        "default_parameter",
        "identifier",
        "variadic_parameter_declaration",
        "variadic_parameter",
        "simple_parameter",
        "property_promotion_parameter",
        "splat_parameter",
        "hash_splat_parameter",
        "keyword_parameter",
        "block_parameter",
        "list_splat_pattern",
        "dictionary_splat_pattern",
        "self_parameter"
    );

    private static final Map<Language, LanguageGrammarConfig> CONFIGS = buildConfigs();

    private GrammarRegistry() {
        // Utility class - no instantiation
    }

    /**
     * Looks up the grammar configuration for a language.
     *
     * @param language language to look up
     * @return configuration, or empty if the language has no grammar (e.g. {@link Language#UNKNOWN})
     */
    public static Optional<LanguageGrammarConfig> find(Language language) {
        return Optional.ofNullable(CONFIGS.get(language));
    }

    /**
     * Returns every registered configuration keyed by language.
     */
    public static Map<Language, LanguageGrammarConfig> all() {
        return CONFIGS;
    }

    private static Map<Language, LanguageGrammarConfig> buildConfigs() {
        Map<Language, LanguageGrammarConfig> configs = new EnumMap<>(Language.class);

        configs.put(Language.GO, LanguageGrammarConfig.builder(Language.GO, "go")
            .functions("function_declaration", "method_declaration")
            .classes("type_declaration")
            .imports("import_declaration")
            .complexity("if_statement", "for_statement", "expression_switch_statement",
                "type_switch_statement", "select_statement", "expression_case", "type_case",
                "default_case", "communication_case", "binary_expression")
            .nesting("if_statement", "for_statement", "expression_switch_statement",
                "type_switch_statement", "select_statement", "func_literal")
            .methods("method_declaration", "method_elem", "method_spec")
            .fields("field_declaration")
            .classFields("name", "type")
            .classWrapper("type_spec")
            .groupedParameters()
            .build());

        String[] jsFunctions = {"function_declaration", "function_expression", "method_definition",
            "arrow_function", "generator_function_declaration"};
        String[] jsComplexity = {"if_statement", "for_statement", "for_in_statement", "while_statement",
            "do_statement", "switch_case", "catch_clause", "ternary_expression", "binary_expression"};
        String[] jsNesting = {"if_statement", "for_statement", "for_in_statement", "while_statement",
            "do_statement", "switch_statement", "try_statement"};

        configs.put(Language.JAVASCRIPT, LanguageGrammarConfig.builder(Language.JAVASCRIPT, "javascript")
            .functions(jsFunctions)
            .classes("class_declaration")
            .imports("import_statement")
            .complexity(jsComplexity)
            .nesting(jsNesting)
            .methods("method_definition")
            .fields("field_definition", "public_field_definition")
            .build());

        configs.put(Language.TYPESCRIPT, LanguageGrammarConfig.builder(Language.TYPESCRIPT, "typescript")
            .functions(jsFunctions)
            .classes("class_declaration", "abstract_class_declaration", "interface_declaration")
            .imports("import_statement")
            .complexity(jsComplexity)
            .nesting(jsNesting)
            .methods("method_definition", "method_signature", "abstract_method_signature")
            .fields("public_field_definition", "property_signature")
            .build());

        configs.put(Language.PYTHON, LanguageGrammarConfig.builder(Language.PYTHON, "python")
            .functions("function_definition")
            .classes("class_definition")
            .imports("import_statement", "import_from_statement")
            .complexity("if_statement", "elif_clause", "for_statement", "while_statement",
                "except_clause", "with_statement", "conditional_expression", "boolean_operator",
                "case_clause")
            .nesting("if_statement", "for_statement", "while_statement", "with_statement",
                "try_statement", "match_statement", "class_definition")
            .methods("function_definition", "decorated_definition")
            .fields("expression_statement")
            .bodyDocstring()
            .build());

        configs.put(Language.JAVA, LanguageGrammarConfig.builder(Language.JAVA, "java")
            .functions("method_declaration", "constructor_declaration")
            .classes("class_declaration", "interface_declaration", "enum_declaration", "record_declaration")
            .imports("import_declaration")
            .comments("line_comment", "block_comment")
            .complexity("if_statement", "for_statement", "enhanced_for_statement", "while_statement",
                "do_statement", "switch_expression", "switch_label", "catch_clause",
                "ternary_expression", "binary_expression")
            .nesting("if_statement", "for_statement", "enhanced_for_statement", "while_statement",
                "do_statement", "switch_expression", "try_statement", "lambda_expression")
            .methods("method_declaration", "constructor_declaration")
            .fields("field_declaration", "constant_declaration")
            .build());

        configs.put(Language.C, LanguageGrammarConfig.builder(Language.C, "c")
            .functions("function_definition")
            .classes("struct_specifier", "enum_specifier", "union_specifier")
            .imports("preproc_include")
            .complexity("if_statement", "for_statement", "while_statement", "do_statement",
                "case_statement", "conditional_expression", "binary_expression")
            .nesting("if_statement", "for_statement", "while_statement", "do_statement", "switch_statement")
            .fields("field_declaration")
            .functionFields("declarator", "declarator", "body")
            .declaratorNames()
            .build());

        configs.put(Language.CPP, LanguageGrammarConfig.builder(Language.CPP, "cpp")
            .functions("function_definition")
            .classes("class_specifier", "struct_specifier", "enum_specifier")
            .imports("preproc_include")
            .complexity("if_statement", "for_statement", "for_range_loop", "while_statement",
                "do_statement", "case_statement", "catch_clause", "conditional_expression",
                "binary_expression")
            .nesting("if_statement", "for_statement", "for_range_loop", "while_statement",
                "do_statement", "switch_statement", "try_statement", "lambda_expression")
            .methods("function_definition", "declaration")
            .fields("field_declaration")
            .functionFields("declarator", "declarator", "body")
            .declaratorNames()
            .build());

        configs.put(Language.RUST, LanguageGrammarConfig.builder(Language.RUST, "rust")
            .functions("function_item")
            .classes("struct_item", "enum_item", "impl_item", "trait_item")
            .imports("use_declaration")
            .comments("line_comment", "block_comment")
            .complexity("if_expression", "for_expression", "while_expression", "loop_expression",
                "match_arm", "closure_expression", "binary_expression")
            .nesting("if_expression", "for_expression", "while_expression", "loop_expression",
                "match_expression", "closure_expression")
            .methods("function_item", "function_signature_item")
            .fields("field_declaration")
            .build());

        configs.put(Language.CSHARP, LanguageGrammarConfig.builder(Language.CSHARP, "c_sharp")
            .functions("method_declaration", "constructor_declaration", "local_function_statement")
            .classes("class_declaration", "interface_declaration", "struct_declaration",
                "enum_declaration", "record_declaration")
            .imports("using_directive")
            .complexity("if_statement", "for_statement", "for_each_statement", "foreach_statement",
                "while_statement", "do_statement", "switch_section", "catch_clause",
                "conditional_expression", "binary_expression")
            .nesting("if_statement", "for_statement", "for_each_statement", "foreach_statement",
                "while_statement", "do_statement", "switch_statement", "try_statement",
                "lambda_expression")
            .methods("method_declaration", "constructor_declaration")
            .fields("field_declaration", "property_declaration")
            .build());

        configs.put(Language.PHP, LanguageGrammarConfig.builder(Language.PHP, "php")
            .functions("function_definition", "method_declaration")
            .classes("class_declaration", "interface_declaration", "trait_declaration")
            .imports("namespace_use_declaration")
            .complexity("if_statement", "else_if_clause", "for_statement", "foreach_statement",
                "while_statement", "do_statement", "case_statement", "catch_clause",
                "conditional_expression", "binary_expression")
            .nesting("if_statement", "for_statement", "foreach_statement", "while_statement",
                "do_statement", "switch_statement", "try_statement", "anonymous_function")
            .methods("method_declaration")
            .fields("property_declaration")
            .build());

        configs.put(Language.RUBY, LanguageGrammarConfig.builder(Language.RUBY, "ruby")
            .functions("method", "singleton_method")
            .classes("class", "module")
            .imports("call")
            .importCalls("require", "require_relative", "load")
            .complexity("if", "elsif", "unless", "when", "for", "while", "until", "rescue",
                "conditional", "if_modifier", "unless_modifier", "binary")
            .nesting("if", "unless", "case", "for", "while", "until", "begin", "block", "do_block")
            .methods("method", "singleton_method")
            .fields("assignment")
            .build());

        configs.put(Language.SWIFT, LanguageGrammarConfig.builder(Language.SWIFT, "swift")
            .functions("function_declaration", "init_declaration")
            .classes("class_declaration", "protocol_declaration")
            .imports("import_declaration")
            .comments("comment", "multiline_comment")
            .complexity("if_statement", "guard_statement", "switch_entry", "for_statement",
                "while_statement", "repeat_while_statement", "catch_block", "ternary_expression",
                "conjunction_expression", "disjunction_expression")
            .nesting("if_statement", "guard_statement", "switch_statement", "for_statement",
                "while_statement", "repeat_while_statement", "do_statement", "lambda_literal")
            .methods("function_declaration", "init_declaration")
            .fields("property_declaration")
            .build());

        configs.put(Language.SHELL, LanguageGrammarConfig.builder(Language.SHELL, "bash")
            .functions("function_definition")
            .complexity("if_statement", "elif_clause", "case_item", "for_statement",
                "c_style_for_statement", "while_statement")
            .nesting("if_statement", "case_statement", "for_statement", "c_style_for_statement",
                "while_statement", "subshell")
            .build());

        return Collections.unmodifiableMap(configs);
    }
}
