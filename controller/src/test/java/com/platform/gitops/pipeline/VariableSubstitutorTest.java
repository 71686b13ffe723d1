package com.platform.gitops.pipeline;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableSubstitutorTest {

    private final VariableSubstitutor substitutor = new VariableSubstitutor();

    @Test
    void replacesKnownVariables() {
        String out = substitutor.substitute("replicas: ${REPLICAS}\nenv: ${ENV}",
            Map.of("REPLICAS", "3", "ENV", "prod"), false);

        assertEquals("replicas: 3\nenv: prod", out);
    }

    @Test
    @DisplayName("Default form applies when the variable is unset or empty")
    void defaultForm() {
        assertEquals("replicas: 1", substitutor.substitute("replicas: ${REPLICAS:=1}", Map.of(), false));
        assertEquals("replicas: 1", substitutor.substitute("replicas: ${REPLICAS:=1}", Map.of("REPLICAS", ""), false));
        assertEquals("replicas: 5", substitutor.substitute("replicas: ${REPLICAS:=1}", Map.of("REPLICAS", "5"), false));
    }

    @Test
    void substringAndReplaceForms() {
        Map<String, String> vars = Map.of("IMAGE", "registry.local/app:1.2.3");

        assertEquals("registry", substitutor.substitute("${IMAGE:0:8}", vars, false));
        assertEquals("1.2.3", substitutor.substitute("${IMAGE: -5}", vars, false));
        assertEquals("mirror.local/app:1.2.3", substitutor.substitute("${IMAGE/registry/mirror}", vars, false));
    }

    @Test
    @DisplayName("Colon-dash is not a substring form and passes through")
    void colonDashPassesThrough() {
        assertEquals("port: ${PORT:-1}", substitutor.substitute("port: ${PORT:-1}", Map.of("PORT", "8080"), false));
        assertEquals("${PORT:-80}", substitutor.substitute("${PORT:-80}", Map.of(), false));
    }

    @Test
    void oversizedSubstringBoundsAreClamped() {
        Map<String, String> vars = Map.of("V", "abcdef");

        assertEquals("bcdef", substitutor.substitute("${V:1:2147483647}", vars, false));
        assertEquals("bcdef", substitutor.substitute("${V:1:99999999999999999999}", vars, false));
        assertEquals("", substitutor.substitute("${V:99999999999999999999}", vars, false));
        assertEquals("abcdef", substitutor.substitute("${V: -99999999999999999999}", vars, false));
    }

    @Test
    @DisplayName("Unset variables stay verbatim unless strict")
    void unsetVariables() {
        assertEquals("value: ${MISSING}", substitutor.substitute("value: ${MISSING}", Map.of(), false));

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> substitutor.substitute("value: ${MISSING}", Map.of(), true));
        assertEquals(ErrorCode.SUBSTITUTION_FAILED, e.getErrorCode());
        assertTrue(e.getMessage().contains("MISSING"));
    }

    @Test
    void replacementValuesAreLiteral() {
        assertEquals("pw: a$1\\b", substitutor.substitute("pw: ${PW}", Map.of("PW", "a$1\\b"), false));
    }

    @Test
    void nonVariableExpressionsAreLeftAlone() {
        assertEquals("${1abc} ${}", substitutor.substitute("${1abc} ${}", Map.of(), true));
    }

    @Test
    void rejectsInvalidNames() {
        assertDoesNotThrow(() -> substitutor.validateNames(Map.of("_ok", "1", "Also_OK2", "2")));

        ReconciliationException e = assertThrows(ReconciliationException.class,
            () -> substitutor.validateNames(Map.of("bad-name", "1")));
        assertTrue(e.getMessage().contains("'bad-name' var name is invalid"));
    }
}
