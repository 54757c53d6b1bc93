package com.ollama.gateway.translator.structured;

import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaFallbackTest {

    @Test
    void shouldWrapRawTextWhenSchemaHasNoProperties() {
        assertThat(SchemaFallback.build(new JSONObject(), "hello")).isEqualTo(JSONObject.of("response", "hello"));
        assertThat(SchemaFallback.build(JSONObject.of("properties", "bogus"), "hello"))
                .isEqualTo(JSONObject.of("response", "hello"));
        assertThat(SchemaFallback.build(null, "hello")).isEqualTo(JSONObject.of("response", "hello"));
    }

    @Test
    void shouldReturnEmptyObjectWhenPropertiesAreEmpty() {
        JSONObject result = SchemaFallback.build(JSONObject.of("type", "object", "properties", new JSONObject()), "hello");

        assertThat(result).isEmpty();
    }

    @Test
    void shouldSynthesizeValuesPerPropertyType() {
        JSONObject schema = JSONObject.parseObject("""
                {"type":"object","properties":{
                  "mood":{"type":"string","enum":["happy","sad"]},
                  "summary":{"type":"string"},
                  "confirmed":{"type":"boolean"},
                  "count":{"type":"integer"}
                }}
                """);
        String raw = "Yes, " + "x".repeat(150);

        JSONObject result = SchemaFallback.build(schema, raw);

        assertThat(result.getString("mood")).isEqualTo("happy");
        assertThat(result.getString("summary")).hasSize(100).isEqualTo(raw.substring(0, 100));
        assertThat(result.getBoolean("confirmed")).isTrue();
        assertThat(result).containsKey("count");
        assertThat(result.get("count")).isNull();
    }

    @Test
    void shouldReportFalseWhenNoAffirmativeWordPresent() {
        JSONObject schema = JSONObject.parseObject("""
                {"properties":{"confirmed":{"type":"boolean"}}}
                """);

        assertThat(SchemaFallback.build(schema, "nope").getBoolean("confirmed")).isFalse();
    }

    @Test
    void shouldInferModelAsNextSpeaker() {
        JSONObject schema = nextSpeakerSchema();

        JSONObject result = SchemaFallback.build(schema, "I think the model should speak next.");

        assertThat(result.getString("next_speaker")).isEqualTo("model");
        assertThat(result.getString("reasoning")).isEqualTo("Model indicated it should continue");
    }

    @Test
    void shouldDefaultNextSpeakerToUser() {
        JSONObject schema = nextSpeakerSchema();

        assertThat(SchemaFallback.build(schema, "I have a question to user").getString("next_speaker")).isEqualTo("user");
        assertThat(SchemaFallback.build(schema, "unclear").getString("reasoning"))
                .isEqualTo("Unable to parse response, defaulting to user turn");
    }

    private static JSONObject nextSpeakerSchema() {
        return JSONObject.parseObject("""
                {"type":"object","properties":{
                  "reasoning":{"type":"string"},
                  "next_speaker":{"type":"string","enum":["user","model"]}
                },"required":["reasoning","next_speaker"]}
                """);
    }
}
