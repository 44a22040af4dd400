package com.eainde.patientqa.redflag;

import com.eainde.patientqa.TestFixtures;
import com.eainde.patientqa.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedFlagRuleLoaderTest {

    private final RedFlagRuleLoader loader = new RedFlagRuleLoader(TestFixtures.objectMapper());

    private static InputStream json(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("loads rules in declaration order")
    void loadsRules() {
        RedFlagRuleSet set = loader.load(json("""
                {"version": "t1", "rules": [
                  {"id": "a", "label": "A", "severity": "HIGH", "allOf": ["fever"], "escalation": "call"},
                  {"id": "b", "label": "B", "severity": "LOW", "allOf": ["itch", "night"], "escalation": "wait"}
                ]}
                """), "inline");

        assertThat(set.getVersion()).isEqualTo("t1");
        assertThat(set.getRules()).extracting(RedFlagRule::id).containsExactly("a", "b");
        assertThat(set.getRules().get(1).allOf()).hasSize(2);
    }

    @Test
    @DisplayName("the shipped rule file loads")
    void shippedFileLoads() {
        assertThat(TestFixtures.shippedDetector().getRuleSet().size()).isGreaterThanOrEqualTo(5);
    }

    @Test
    @DisplayName("invalid regex is a configuration error")
    void invalidRegex() {
        assertThatThrownBy(() -> loader.load(json("""
                {"rules": [{"id": "a", "severity": "HIGH", "allOf": ["(unclosed"], "escalation": "x"}]}
                """), "inline"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    @DisplayName("rule without escalation is a configuration error")
    void missingEscalation() {
        assertThatThrownBy(() -> loader.load(json("""
                {"rules": [{"id": "a", "severity": "HIGH", "allOf": ["x"]}]}
                """), "inline"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("malformed JSON and empty rule lists are configuration errors")
    void malformed() {
        assertThatThrownBy(() -> loader.load(json("{not json"), "inline"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> loader.load(json("{\"rules\": []}"), "inline"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("rule scopes and advisory patterns load")
    void loadsScopesAndAdvisoryPatterns() {
        RedFlagRuleSet set = loader.load(json("""
                {"version": "t2", "advisoryPatterns": ["\\\\bif\\\\b"], "rules": [
                  {"id": "a", "severity": "HIGH", "appliesTo": "USER", "allOf": ["fever"], "escalation": "call"},
                  {"id": "b", "severity": "LOW", "allOf": ["itch"], "escalation": "wait"}
                ]}
                """), "inline");

        assertThat(set.getRules()).extracting(RedFlagRule::scope).containsExactly(RuleScope.USER, RuleScope.BOTH);
        assertThat(set.getAdvisoryPatterns()).hasSize(1);
        assertThat(set.isAdvisory("Call us if it itches.")).isTrue();
        assertThat(set.isAdvisory("Iffy wording.")).isFalse();
    }

    @Test
    @DisplayName("invalid advisory pattern is a configuration error")
    void invalidAdvisoryPattern() {
        assertThatThrownBy(() -> loader.load(json("""
                {"advisoryPatterns": ["(unclosed"], "rules": [
                  {"id": "a", "severity": "HIGH", "allOf": ["x"], "escalation": "x"}]}
                """), "inline"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("advisory");
    }
}
