package com.ollama.gateway.translator.structured;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionStrategiesTest {

    @Test
    void shouldParseWholeTextAsObject() {
        Optional<Object> value = ExtractionStrategies.DIRECT_OBJECT.extract(input("  {\"answer\":\"42\"}\n"));

        assertThat(value).contains(JSONObject.of("answer", "42"));
    }

    @Test
    void shouldSkipDirectObjectWhenTextIsProse() {
        assertThat(ExtractionStrategies.DIRECT_OBJECT.extract(input("result {\"answer\":\"42\"}"))).isEmpty();
        assertThat(ExtractionStrategies.DIRECT_OBJECT.extract(input(""))).isEmpty();
    }

    @Test
    void shouldMatchFirstFlatObjectInProse() {
        Optional<Object> value = ExtractionStrategies.FLAT_OBJECT_MATCH.extract(
                input("first {\"answer\":\"a\"} then {\"answer\":\"b\"}"));

        assertThat(value).contains(JSONObject.of("answer", "a"));
    }

    @Test
    void shouldNotMatchFlatObjectWithoutQuotedKey() {
        assertThat(ExtractionStrategies.FLAT_OBJECT_MATCH.extract(input("see {answer: 1} here"))).isEmpty();
    }

    @Test
    void shouldTakeSpanFromFirstToLastBrace() {
        Optional<Object> value = ExtractionStrategies.BRACE_SPAN.extract(
                input("Result: {\"answer\":\"ok\",\"meta\":{\"n\":1}} done"));

        assertThat(value).containsInstanceOf(JSONObject.class);
        JSONObject object = (JSONObject) value.get();
        assertThat(object.getString("answer")).isEqualTo("ok");
        assertThat(object.getJSONObject("meta").getIntValue("n")).isEqualTo(1);
    }

    @Test
    void shouldSkipBraceSpanWhenBracesAreReversed() {
        assertThat(ExtractionStrategies.BRACE_SPAN.extract(input("} nothing {"))).isEmpty();
    }

    @Test
    void shouldFindNextSpeakerObjectInsideThinkBlock() {
        String raw = "<think>{\"next_speaker\": \"model\", \"reasoning\": \"r\"}</think> I am done";
        ExtractionInput input = input(raw);

        assertThat(input.workingText()).isEqualTo("I am done");
        assertThat(ExtractionStrategies.DIRECT_OBJECT.extract(input)).isEmpty();
        assertThat(ExtractionStrategies.FLAT_OBJECT_MATCH.extract(input)).isEmpty();
        assertThat(ExtractionStrategies.BRACE_SPAN.extract(input)).isEmpty();
        assertThat(ExtractionStrategies.NEXT_SPEAKER_IN_RAW.extract(input))
                .contains(JSONObject.of("next_speaker", "model", "reasoning", "r"));
    }

    @Test
    void shouldRejectSingleQuotedObjectInEveryStrategy() {
        ExtractionInput input = input("{'answer': 'hi', 'next_speaker': 'user'}");

        for (ExtractionStrategy strategy : ExtractionStrategies.DEFAULT_CHAIN) {
            assertThat(strategy.extract(input)).isEmpty();
        }
    }

    @Test
    void shouldAcceptOnlyStrictJsonObjects() {
        assertThat(ExtractionStrategies.tryParse("{\"answer\":\"hi\"}")).contains(JSONObject.of("answer", "hi"));
        assertThat(ExtractionStrategies.tryParse("{'answer':'hi'}")).isEmpty();
        assertThat(ExtractionStrategies.tryParse("{answer:\"hi\"}")).isEmpty();
        assertThat(ExtractionStrategies.tryParse("{\"answer\":\"hi\",}")).isEmpty();
        assertThat(ExtractionStrategies.tryParse("{\"answer\":\"hi\"} trailing")).isEmpty();
        assertThat(ExtractionStrategies.tryParse("[1,2]")).isEmpty();
    }

    @Test
    void shouldRunStrategiesInDeclaredOrder() {
        assertThat(ExtractionStrategies.DEFAULT_CHAIN).containsExactly(
                ExtractionStrategies.DIRECT_OBJECT,
                ExtractionStrategies.FLAT_OBJECT_MATCH,
                ExtractionStrategies.BRACE_SPAN,
                ExtractionStrategies.NEXT_SPEAKER_IN_RAW);
    }

    private static ExtractionInput input(String raw) {
        return new ExtractionInput(raw, ThinkTagCleaner.prepare(raw));
    }
}
