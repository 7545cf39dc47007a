package com.codescore.core.metrics.naming;

import com.codescore.core.model.ClassInfo;
import com.codescore.core.model.FunctionInfo;
import com.codescore.core.model.Language;
import com.codescore.core.model.MetricLocation;
import com.codescore.core.model.MetricResult;
import com.codescore.core.model.ParseResult;
import com.codescore.core.model.ParserTier;
import com.codescore.core.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NamingConventionMetric}.
 */
class NamingConventionMetricTest {

    @Test
    void calculate_pythonSnakeCaseAndDunder_areCompliant() {
        NamingConventionMetric metric = new NamingConventionMetric(0.05, Language.PYTHON);

        MetricResult result = metric.calculate(result(Language.PYTHON,
            List.of("load_items", "__init__", "_private_helper"), List.of("OrderService")));

        assertThat(result.value()).isEqualTo(100.0);
        assertThat(result.severity()).isEqualTo(Severity.INFO);
        assertThat(result.locations()).isEmpty();
    }

    @Test
    void calculate_pythonCamelCase_isViolation() {
        NamingConventionMetric metric = new NamingConventionMetric(0.05, Language.PYTHON);

        MetricResult result = metric.calculate(result(Language.PYTHON,
            List.of("loadItems", "save"), List.of("order_service")));

        // 1 of 3 compliant
        assertThat(result.normalizedScore()).isEqualTo(33.3);
        assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.locations()).extracting(MetricLocation::message)
            .containsExactly("\"loadItems\" - snake_case", "\"order_service\" - PascalCase");
    }

    @Test
    void calculate_locationsAreCappedAtTen() {
        NamingConventionMetric metric = new NamingConventionMetric(0.05, Language.CSHARP);
        List<String> names = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            names.add("bad_name_" + i);
        }

        MetricResult result = metric.calculate(result(Language.CSHARP, names, List.of()));

        assertThat(result.normalizedScore()).isZero();
        assertThat(result.locations()).hasSize(10);
    }

    @Test
    void calculate_noIdentifiers_returnsInsufficientData() {
        NamingConventionMetric metric = new NamingConventionMetric(0.05, Language.GO);

        MetricResult result = metric.calculate(result(Language.GO, List.of(), List.of()));

        assertThat(result.normalizedScore()).isEqualTo(100.0);
        assertThat(result.value()).isEqualTo(100.0);
    }

    @Test
    void normalize_stripsQualifiersAndDecorations() {
        assertThat(NamingConventionMetric.normalize("Widget::~Widget")).isEqualTo("Widget");
        assertThat(NamingConventionMetric.normalize("self.valid?")).isEqualTo("valid");
        assertThat(NamingConventionMetric.normalize("__repr__")).isEqualTo("repr");
    }

    @Test
    void convention_matches() {
        assertThat(NamingConventionMetric.Convention.CAMEL_CASE.matches("loadItems")).isTrue();
        assertThat(NamingConventionMetric.Convention.PASCAL_CASE.matches("loadItems")).isFalse();
        assertThat(NamingConventionMetric.Convention.UPPER_SNAKE_CASE.matches("MAX_SIZE")).isTrue();
        assertThat(NamingConventionMetric.Convention.SNAKE_CASE.matches("max_size")).isTrue();
    }

    private static ParseResult result(Language language, List<String> functionNames, List<String> classNames) {
        List<FunctionInfo> functions = new ArrayList<>();
        int line = 1;
        for (String name : functionNames) {
            functions.add(FunctionInfo.of(name, line, line + 1, 1, 0, 0, false));
            line += 2;
        }
        List<ClassInfo> classes = new ArrayList<>();
        for (String name : classNames) {
            classes.add(new ClassInfo(name, line, line + 1, 0, 0));
            line += 2;
        }
        return new ParseResult("sample", language, 100, 100, 0, 0,
            functions, classes, List.of(), List.of(), null, ParserTier.PATTERN);
    }
}
