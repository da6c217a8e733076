package com.marketpulse.backend.service.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClassificationParserTest {

    private final ClassificationParser parser = new ClassificationParser(new ObjectMapper());

    @Test
    void parsesStrictJson() {
        ClassificationParser.ParseResult result = parser.parse(
                "{\"relevant\": true, \"confidence\": 0.82, \"labels\": [\"Price\", \"ETF\"], \"reason\": \"ETF flows\"}");

        assertThat(result.success()).isTrue();
        assertThat(result.relevance().relevant()).isTrue();
        assertThat(result.relevance().confidence()).isEqualTo(0.82);
        assertThat(result.relevance().labels()).containsExactly("price", "etf");
        assertThat(result.relevance().reason()).isEqualTo("ETF flows");
    }

    @Test
    void extractsObjectFromChattyOutput() {
        ClassificationParser.ParseResult result = parser.parse(
                "Here is my answer:\n```json\n{\"relevant\": \"no\", \"confidence\": \"0.4\", \"labels\": \"meme, spam\"}\n```");

        assertThat(result.success()).isTrue();
        assertThat(result.relevance().relevant()).isFalse();
        assertThat(result.relevance().confidence()).isEqualTo(0.4);
        assertThat(result.relevance().labels()).containsExactly("meme", "spam");
    }

    @Test
    void clampsConfidenceAndDefaultsWhenMissing() {
        assertThat(parser.parse("{\"relevant\": 1, \"confidence\": 7}").relevance().confidence()).isEqualTo(1.0);
        assertThat(parser.parse("{\"relevant\": true}").relevance().confidence()).isEqualTo(1.0);
        assertThat(parser.parse("{\"relevant\": false}").relevance().confidence()).isEqualTo(0.0);
    }

    @Test
    void reportsFailureInsteadOfThrowing() {
        assertThat(parser.parse(null).success()).isFalse();
        assertThat(parser.parse("I cannot help with that").success()).isFalse();
        assertThat(parser.parse("{\"relevant\": \"maybe\"}").error()).contains("relevant");
        assertThat(parser.parse("{broken json}").success()).isFalse();
    }
}
