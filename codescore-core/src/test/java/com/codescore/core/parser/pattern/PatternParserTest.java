package com.codescore.core.parser.pattern;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PatternParser}.
 */
class PatternParserTest {

    @Nested
    class BraceLanguages {

        private static final String JS_SOURCE = String.join("\n",
            "import { a } from \"./a\";",
            "/** Adds numbers. */",
            "function add(x, y) {",
            "  if (x > 0 && y > 0) {",
            "    for (let i = 0; i < x; i++) {",
            "      y += i;",
            "    }",
            "  }",
            "  return x + y;",
            "}",
            "",
            "const helper = (v) => v * 2;",
            "",
            "class Box {",
            "  size = 1;",
            "  open() {",
            "    return this.size;",
            "  }",
            "}");

        private final ParseResult result = PatternParser.forLanguage(Language.JAVASCRIPT).parse("box.js", JS_SOURCE);

        @Test
        void parse_countsLineKinds() {
            assertThat(result.tier()).isEqualTo(ParserTier.PATTERN);
            assertThat(result.totalLines()).isEqualTo(19);
            assertThat(result.blankLines()).isEqualTo(2);
            assertThat(result.commentLines()).isEqualTo(1);
            assertThat(result.codeLines()).isEqualTo(16);
        }

        @Test
        void parse_braceFunction_tracksComplexityAndNesting() {
            FunctionInfo add = result.functions().get(0);

            assertThat(add.name()).isEqualTo("add");
            assertThat(add.startLine()).isEqualTo(3);
            assertThat(add.endLine()).isEqualTo(10);
            // 1 + if + && + for
            assertThat(add.complexity()).isEqualTo(4);
            assertThat(add.nestingDepth()).isEqualTo(2);
            assertThat(add.parameterCount()).isEqualTo(2);
            assertThat(add.hasDocstring()).isTrue();
        }

        @Test
        void parse_oneLineArrowFunction_endsAtSemicolon() {
            FunctionInfo helper = result.functions().get(1);

            assertThat(helper.name()).isEqualTo("helper");
            assertThat(helper.startLine()).isEqualTo(12);
            assertThat(helper.endLine()).isEqualTo(12);
            assertThat(helper.parameterCount()).isEqualTo(1);
            assertThat(helper.hasDocstring()).isFalse();
        }

        @Test
        void parse_classMembers_countedAtDirectDepth() {
            assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("add", "helper", "open");
            ClassInfo box = result.classes().get(0);
            assertThat(box.name()).isEqualTo("Box");
            assertThat(box.startLine()).isEqualTo(14);
            assertThat(box.endLine()).isEqualTo(19);
            assertThat(box.methodCount()).isEqualTo(1);
            assertThat(box.fieldCount()).isEqualTo(1);
        }

        @Test
        void parse_imports_extractedFromCodeLines() {
            assertThat(result.imports()).containsExactly("./a");
        }

        @Test
        void parse_nestedFunction_excludedFromOuterMetrics() {
            String source = String.join("\n",
                "function outer() {",
                "  const inner = function () {",
                "    if (a) {",
                "      return 1;",
                "    }",
                "  };",
                "  return inner();",
                "}");

            ParseResult nested = PatternParser.forLanguage(Language.JAVASCRIPT).parse("n.js", source);

            assertThat(nested.functions()).hasSize(1);
            FunctionInfo outer = nested.functions().get(0);
            assertThat(outer.name()).isEqualTo("outer");
            assertThat(outer.endLine()).isEqualTo(8);
            assertThat(outer.complexity()).isEqualTo(1);
            assertThat(outer.nestingDepth()).isZero();
        }

        @Test
        void lineComplexity_ternaryAndNullishCount_optionalChainingDoesNot() {
            PatternParser parser = PatternParser.forLanguage(Language.JAVASCRIPT);

            assertThat(parser.lineComplexity("const v = a ? b : c ?? d;")).isEqualTo(2);
            assertThat(parser.lineComplexity("const n = user?.name;")).isZero();
            assertThat(parser.lineComplexity("const ok = a || b;")).isEqualTo(1);
        }

        @Test
        void matchName_skipsControlKeywords() {
            PatternLanguageConfig js = PatternTables.find(Language.JAVASCRIPT).orElseThrow();

            assertThat(PatternParser.matchName(js.functionPatterns(), "if (ready) {")).isNull();
            assertThat(PatternParser.matchName(js.functionPatterns(), "render(props) {")).isEqualTo("render");
        }

        @Test
        void parse_javaRecordHeader_notTakenForMethod() {
            String source = String.join("\n",
                "public record Point(int x, int y) {",
                "    public int sum() {",
                "        return x + y;",
                "    }",
                "}");

            ParseResult result = PatternParser.forLanguage(Language.JAVA).parse("Point.java", source);

            assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("sum");
            assertThat(result.classes()).extracting(ClassInfo::name).containsExactly("Point");
        }

        @Test
        void matchName_javaTypeDeclarations_notFunctions() {
            PatternLanguageConfig java = PatternTables.find(Language.JAVA).orElseThrow();

            assertThat(PatternParser.matchName(java.functionPatterns(), "record Pair(String a, String b) {")).isNull();
            assertThat(PatternParser.matchName(java.methodPatterns(), "    static record Entry(int key) {")).isNull();
            assertThat(PatternParser.matchName(java.functionPatterns(), "public Point scale(int factor) {"))
                .isEqualTo("scale");
        }
    }

    @Nested
    class IndentLanguages {

        private static final String PY_SOURCE = String.join("\n",
            "import os",
            "",
            "# Entry point.",
            "def process(items):",
            "    \"\"\"Process items.\"\"\"",
            "    total = 0",
            "    for item in items:",
            "        if item > 0:",
            "            total += item",
            "    return total",
            "",
            "class Worker:",
            "    def __init__(self):",
            "        self.count = 0",
            "",
            "    def run(self):",
            "        return os.getcwd()");

        private final ParseResult result = PatternParser.forLanguage(Language.PYTHON).parse("worker.py", PY_SOURCE);

        @Test
        void parse_countsDocstringAndHashComments() {
            assertThat(result.totalLines()).isEqualTo(17);
            assertThat(result.blankLines()).isEqualTo(3);
            assertThat(result.commentLines()).isEqualTo(2);
            assertThat(result.codeLines()).isEqualTo(12);
        }

        @Test
        void parse_indentFunction_endsAtDedent() {
            FunctionInfo process = result.functions().get(0);

            assertThat(process.name()).isEqualTo("process");
            assertThat(process.startLine()).isEqualTo(4);
            assertThat(process.endLine()).isEqualTo(10);
            assertThat(process.complexity()).isEqualTo(3);
            assertThat(process.nestingDepth()).isEqualTo(2);
            assertThat(process.parameterCount()).isEqualTo(1);
            assertThat(process.hasDocstring()).isTrue();
        }

        @Test
        void parse_methodsReportedAsFunctionsAndClassMembers() {
            assertThat(result.functions()).extracting(FunctionInfo::name)
                .containsExactly("process", "__init__", "run");

            ClassInfo worker = result.classes().get(0);
            assertThat(worker.name()).isEqualTo("Worker");
            assertThat(worker.startLine()).isEqualTo(12);
            assertThat(worker.endLine()).isEqualTo(17);
            assertThat(worker.methodCount()).isEqualTo(2);
            assertThat(worker.fieldCount()).isEqualTo(1);
        }

        @Test
        void parse_imports_moduleName() {
            assertThat(result.imports()).containsExactly("os");
        }

        @Test
        void parse_ruby_endTerminatorClosesBlock() {
            String source = String.join("\n",
                "def greet(name)",
                "  if name",
                "    puts name",
                "  end",
                "end");

            FunctionInfo greet = PatternParser.forLanguage(Language.RUBY).parse("g.rb", source).functions().get(0);

            assertThat(greet.name()).isEqualTo("greet");
            assertThat(greet.endLine()).isEqualTo(5);
            assertThat(greet.complexity()).isEqualTo(2);
            assertThat(greet.nestingDepth()).isEqualTo(1);
        }
    }

    @Test
    void forLanguage_withoutTable_throws() {
        assertThatThrownBy(() -> PatternParser.forLanguage(Language.UNKNOWN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown");
    }

    @Test
    void parse_emptyContent_yieldsSingleBlankLine() {
        ParseResult empty = PatternParser.forLanguage(Language.GO).parse("e.go", "");

        assertThat(empty.totalLines()).isEqualTo(1);
        assertThat(empty.blankLines()).isEqualTo(1);
        assertThat(empty.functions()).isEmpty();
    }
}
