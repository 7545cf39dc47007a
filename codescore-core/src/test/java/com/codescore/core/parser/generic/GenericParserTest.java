package com.codescore.core.parser.generic;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GenericParser}.
 */
class GenericParserTest {

    private final GenericParser parser = new GenericParser(Language.UNKNOWN);

    @Test
    void parse_braceFunctionsAndStructs_reportStructureOnly() {
        String source = String.join("\n",
            "// helpers",
            "fn scale(a, b) {",
            "    if a > b { a } else { b }",
            "}",
            "",
            "struct Point {",
            "    x: i32,",
            "}");

        ParseResult result = parser.parse("lib.x", source);

        assertThat(result.tier()).isEqualTo(ParserTier.GENERIC);
        assertThat(result.language()).isEqualTo(Language.UNKNOWN);
        assertThat(result.commentLines()).isEqualTo(1);
        assertThat(result.blankLines()).isEqualTo(1);

        FunctionInfo scale = result.functions().get(0);
        assertThat(scale.name()).isEqualTo("scale");
        assertThat(scale.startLine()).isEqualTo(2);
        assertThat(scale.endLine()).isEqualTo(4);
        assertThat(scale.complexity()).isEqualTo(1);
        assertThat(scale.nestingDepth()).isZero();
        assertThat(scale.parameterCount()).isEqualTo(2);

        assertThat(result.classes()).extracting(ClassInfo::name).containsExactly("Point");
    }

    @Test
    void parse_blockComment_spansLines() {
        ParseResult result = parser.parse("c.x", "/* one\n two\n three */\ncode();");

        assertThat(result.commentLines()).isEqualTo(3);
        assertThat(result.codeLines()).isEqualTo(1);
    }

    @Test
    void findBlockEnd_withoutBraces_usesIndentation() {
        List<String> lines = List.of("def run(x):", "    x += 1", "    return x", "print(run(1))");

        assertThat(GenericParser.findBlockEnd(lines, 0)).isEqualTo(3);
    }

    @Test
    void parse_nullLanguage_reportsUnknown() {
        assertThat(new GenericParser(null).parse("f", "x").language()).isEqualTo(Language.UNKNOWN);
    }
}
