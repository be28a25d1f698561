package eu.virtualparadox.ctxstore.catalog.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StringListConverterTest {

    private final StringListConverter converter = new StringListConverter();

    @Test
    void testNullListIsStoredAsEmptyArray() {
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
    }

    @Test
    void testMissingColumnReadsAsMutableEmptyList() {
        List<String> fromNull = converter.convertToEntityAttribute(null);
        List<String> fromBlank = converter.convertToEntityAttribute("  ");

        assertThat(fromNull).isEmpty();
        assertThat(fromBlank).isEmpty();
        fromNull.add("still mutable");
        assertThat(fromNull).containsExactly("still mutable");
    }

    @Test
    void testValuesWithQuotesAndCommasSurvive() {
        List<String> values = List.of("a, b", "say \"hi\"", "");
        String column = converter.convertToDatabaseColumn(values);

        assertThat(converter.convertToEntityAttribute(column)).containsExactlyElementsOf(values);
    }
}
