package com.codescore.core.parser.ast;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.codescore.core.parser.ast.FakeSyntaxNode.leaf;
import static com.codescore.core.parser.ast.FakeSyntaxNode.node;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstParser} against hand-built syntax trees.
 */
class AstParserTest {

    private static final String SOURCE = String.join("\n",
        "import x from \"lib\";",
        "/** adds */",
        "function add(a, b) {",
        "  if (a && b) {",
        "    for (;;) {}",
        "  }",
        "",
        "class Box { size = 1; open() {} }");

    private static final LanguageGrammarConfig CONFIG = LanguageGrammarConfig.builder(Language.JAVASCRIPT, "fake")
        .functions("function_declaration", "method_definition", "arrow_function")
        .classes("class_declaration")
        .imports("import_statement")
        .comments("comment")
        .complexity("if_statement", "for_statement", "binary_expression")
        .nesting("if_statement", "for_statement")
        .methods("method_definition")
        .fields("field_definition")
        .build();

    private FakeSyntaxNode root;

    @BeforeEach
    void buildTree() {
        FakeSyntaxNode importStatement = node("import_statement", 0, 0)
            .child(leaf("string", "\"lib\"", 0));

        FakeSyntaxNode condition = node("binary_expression", 3, 3)
            .child(leaf("identifier", "a", 3));
        condition.field("operator", leaf("operator", "&&", 3));
        FakeSyntaxNode forLoop = node("for_statement", 4, 4);
        FakeSyntaxNode ifBody = node("statement_block", 3, 5).child(forLoop);
        FakeSyntaxNode ifStatement = node("if_statement", 3, 5).child(condition).child(ifBody);

        FakeSyntaxNode parameters = node("formal_parameters", 2, 2)
            .child(leaf("required_parameter", "a", 2))
            .child(leaf("required_parameter", "b", 2));
        FakeSyntaxNode function = node("function_declaration", 2, 5);
        function.field("name", leaf("identifier", "add", 2));
        function.field("parameters", parameters);
        function.field("body", node("statement_block", 2, 5).child(ifStatement));

        FakeSyntaxNode method = node("method_definition", 7, 7);
        method.field("name", leaf("property_identifier", "open", 7));
        FakeSyntaxNode classBody = node("class_body", 7, 7)
            .child(node("field_definition", 7, 7))
            .child(method);
        FakeSyntaxNode classDeclaration = node("class_declaration", 7, 7);
        classDeclaration.field("name", leaf("identifier", "Box", 7));
        classDeclaration.field("body", classBody);

        root = node("program", 0, 7)
            .child(importStatement)
            .child(leaf("comment", "/** adds */", 1))
            .child(function)
            .child(classDeclaration);
    }

    @Test
    void parse_countsLinesFromCommentNodes() {
        ParseResult result = parser().parse("a.js", SOURCE);

        assertThat(result.totalLines()).isEqualTo(8);
        assertThat(result.blankLines()).isEqualTo(1);
        assertThat(result.commentLines()).isEqualTo(1);
        assertThat(result.codeLines()).isEqualTo(6);
        assertThat(result.tier()).isEqualTo(ParserTier.AST);
    }

    @Test
    void parse_extractsFunctionFacts() {
        ParseResult result = parser().parse("a.js", SOURCE);

        FunctionInfo add = result.functions().get(0);
        assertThat(add.name()).isEqualTo("add");
        assertThat(add.startLine()).isEqualTo(3);
        assertThat(add.endLine()).isEqualTo(6);
        // 1 + if + for + &&
        assertThat(add.complexity()).isEqualTo(4);
        assertThat(add.nestingDepth()).isEqualTo(2);
        assertThat(add.parameterCount()).isEqualTo(2);
        assertThat(add.hasDocstring()).isTrue();
    }

    @Test
    void parse_extractsImportsWithoutQuotes() {
        ParseResult result = parser().parse("a.js", SOURCE);

        assertThat(result.imports()).containsExactly("lib");
    }

    @Test
    void parse_extractsClassesWithMembers() {
        ParseResult result = parser().parse("a.js", SOURCE);

        assertThat(result.classes()).hasSize(1);
        ClassInfo box = result.classes().get(0);
        assertThat(box.name()).isEqualTo("Box");
        assertThat(box.methodCount()).isEqualTo(1);
        assertThat(box.fieldCount()).isEqualTo(1);
        assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("add", "open");
    }

    @Test
    void parse_arithmeticOperator_doesNotCountAsDecision() {
        FakeSyntaxNode sum = node("binary_expression", 0, 0);
        sum.field("operator", leaf("operator", "+", 0));
        FakeSyntaxNode function = node("function_declaration", 0, 0);
        function.field("name", leaf("identifier", "sum", 0));
        function.field("body", node("statement_block", 0, 0).child(sum));
        FakeSyntaxNode program = node("program", 0, 0).child(function);

        ParseResult result = new AstParser(Language.JAVASCRIPT, CONFIG, content -> program)
            .parse("s.js", "function sum(a, b) { return a + b; }");

        assertThat(result.functions().get(0).complexity()).isEqualTo(1);
    }

    @Test
    void parse_nestedFunctionBody_isExcludedFromNestingAndComplexity() {
        FakeSyntaxNode innerIf = node("if_statement", 2, 4)
            .child(node("statement_block", 2, 4).child(node("if_statement", 3, 3)));
        FakeSyntaxNode inner = node("arrow_function", 1, 5);
        inner.field("body", node("statement_block", 1, 5).child(innerIf));
        FakeSyntaxNode outer = node("function_declaration", 0, 6);
        outer.field("name", leaf("identifier", "outer", 0));
        outer.field("body", node("statement_block", 0, 6).child(node("lexical_declaration", 1, 5).child(inner)));
        FakeSyntaxNode program = node("program", 0, 6).child(outer);

        ParseResult result = new AstParser(Language.JAVASCRIPT, CONFIG, content -> program)
            .parse("n.js", "1\n2\n3\n4\n5\n6\n7");

        FunctionInfo function = result.functions().get(0);
        assertThat(function.name()).isEqualTo("outer");
        assertThat(function.nestingDepth()).isZero();
        assertThat(function.complexity()).isEqualTo(1);
    }

    @Test
    void parse_anonymousFunction_takesVariableName() {
        FakeSyntaxNode arrow = node("arrow_function", 0, 0);
        arrow.field("body", node("statement_block", 0, 0));
        FakeSyntaxNode declarator = node("variable_declarator", 0, 0);
        declarator.field("name", leaf("identifier", "handler", 0));
        declarator.field("value", arrow);
        FakeSyntaxNode program = node("program", 0, 0).child(node("lexical_declaration", 0, 0).child(declarator));

        ParseResult result = new AstParser(Language.JAVASCRIPT, CONFIG, content -> program)
            .parse("h.js", "const handler = () => {};");

        assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("handler");
    }

    @Test
    void parse_declaratorChain_unwrapsToFunctionNameAndParameters() {
        LanguageGrammarConfig c = LanguageGrammarConfig.builder(Language.C, "fake")
            .functions("function_definition")
            .functionFields("declarator", "declarator", "body")
            .declaratorNames()
            .build();
        FakeSyntaxNode parameterList = node("parameter_list", 0, 0)
            .child(node("parameter_declaration", 0, 0))
            .child(node("parameter_declaration", 0, 0));
        FakeSyntaxNode functionDeclarator = node("function_declarator", 0, 0);
        functionDeclarator.field("declarator", leaf("identifier", "scale", 0));
        functionDeclarator.field("parameters", parameterList);
        // pointer_declarator without a declarator field: the first named child is followed
        FakeSyntaxNode pointer = node("pointer_declarator", 0, 0).child(functionDeclarator);
        FakeSyntaxNode function = node("function_definition", 0, 2);
        function.field("type", leaf("primitive_type", "int", 0));
        function.field("declarator", pointer);
        function.field("body", node("compound_statement", 0, 2));
        FakeSyntaxNode unit = node("translation_unit", 0, 2).child(function);

        ParseResult result = new AstParser(Language.C, c, content -> unit)
            .parse("scale.c", "int *scale(int *v, int n) {\n  return v;\n}");

        assertThat(result.functions()).hasSize(1);
        FunctionInfo scale = result.functions().get(0);
        assertThat(scale.name()).isEqualTo("scale");
        assertThat(scale.parameterCount()).isEqualTo(2);
        assertThat(scale.complexity()).isEqualTo(1);
    }

    @Test
    void parse_classWrapperWithoutNameField_fallsBackToTypeField() {
        LanguageGrammarConfig wrapped = LanguageGrammarConfig.builder(Language.GO, "fake")
            .functions("function_declaration")
            .classes("type_declaration")
            .fields("field_declaration")
            .classFields("name", "body")
            .classWrapper("type_spec")
            .build();
        FakeSyntaxNode spec = node("type_spec", 0, 3);
        spec.field("type", leaf("type_identifier", "Point", 0));
        spec.field("body", node("field_declaration_list", 0, 3)
            .child(node("field_declaration", 1, 1))
            .child(node("field_declaration", 2, 2)));
        FakeSyntaxNode declaration = node("type_declaration", 0, 3).child(spec);
        FakeSyntaxNode alias = node("type_declaration", 4, 4).child(node("type_alias", 4, 4));
        FakeSyntaxNode file = node("source_file", 0, 4).child(declaration).child(alias);

        ParseResult result = new AstParser(Language.GO, wrapped, content -> file)
            .parse("point.go", "type Point struct {\n  X int\n  Y int\n}\ntype ID = int");

        assertThat(result.classes()).hasSize(1);
        ClassInfo point = result.classes().get(0);
        assertThat(point.name()).isEqualTo("Point");
        assertThat(point.startLine()).isEqualTo(1);
        assertThat(point.endLine()).isEqualTo(4);
        assertThat(point.methodCount()).isZero();
        assertThat(point.fieldCount()).isEqualTo(2);
    }

    @Test
    void parse_errorNodes_reportedAsSyntaxErrors() {
        FakeSyntaxNode program = node("program", 0, 1).child(node("ERROR", 1, 1));

        ParseResult result = new AstParser(Language.JAVASCRIPT, CONFIG, content -> program)
            .parse("e.js", "ok\nbroken(");

        assertThat(result.errors()).containsExactly("Syntax error at line 2");
    }

    @Test
    void parse_builderFailure_wrappedInAstParseException() {
        AstParser parser = new AstParser(Language.JAVASCRIPT, CONFIG, content -> {
            throw new IllegalStateException("native crash");
        });

        assertThatThrownBy(() -> parser.parse("x.js", "x"))
            .isInstanceOf(AstParser.AstParseException.class)
            .hasMessageContaining("x.js")
            .hasRootCauseMessage("native crash");
    }

    private AstParser parser() {
        return new AstParser(Language.JAVASCRIPT, CONFIG, content -> root);
    }
}
