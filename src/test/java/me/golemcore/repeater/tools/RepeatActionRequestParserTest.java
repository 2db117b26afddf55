package me.golemcore.repeater.tools;

import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionType;
import me.golemcore.repeater.domain.model.AssertionType;
import me.golemcore.repeater.domain.model.LoopType;
import me.golemcore.repeater.domain.model.RepeatActionRequest;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepeatActionRequestParserTest {

    private final RepeatActionRequestParser parser = new RepeatActionRequestParser();

    private String rejectedField(Map<String, Object> parameters) {
        return assertThrows(LoopSpecException.class, () -> parser.parse(parameters)).getField();
    }

    @Test
    void shouldParseForRequest() {
        RepeatActionRequest request = parser.parse(Map.of(
                "loop", Map.of("type", "for", "iterations", 3),
                "action", Map.of("ref", "#q", "element", "Search", "type", "fill", "value", "golem")));

        assertEquals(LoopType.FOR, request.getLoop().getType());
        assertEquals(3, request.getLoop().getIterations());
        assertNull(request.getLoop().getUntil());
        assertEquals(ActionType.FILL, request.getAction().getType());
        assertEquals("#q", request.getAction().getRef());
        assertEquals("Search", request.getAction().getElement());
        assertEquals("golem", request.getAction().getValue());
        assertNull(request.getLimits());
    }

    @Test
    void shouldParseDoWhileRequestWithCondition() {
        RepeatActionRequest request = parser.parse(Map.of(
                "loop", Map.of("type", "do-while", "until", Map.of(
                        "ref", ".spinner",
                        "assertion", Map.of("assertionType", "toBeHidden"),
                        "negate", true)),
                "action", Map.of("ref", "#more", "type", "click"),
                "limits", Map.of("maxIterations", 5)));

        assertEquals(LoopType.DO_WHILE, request.getLoop().getType());
        assertEquals(".spinner", request.getLoop().getUntil().getRef());
        assertEquals(AssertionType.TO_BE_HIDDEN, request.getLoop().getUntil().assertionType());
        assertTrue(request.getLoop().getUntil().isNegate());
        assertEquals(5, request.getLimits().getMaxIterations());
    }

    @Test
    void shouldDefaultNegateToFalse() {
        RepeatActionRequest request = parser.parse(Map.of(
                "loop", Map.of("type", "while", "until", Map.of(
                        "ref", "#done", "assertion", Map.of("assertionType", "toBeVisible"))),
                "action", Map.of("ref", "#more", "type", "hover")));

        assertFalse(request.getLoop().getUntil().isNegate());
    }

    @Test
    void shouldAcceptIntegralDoubles() {
        RepeatActionRequest request = parser.parse(Map.of(
                "loop", Map.of("type", "for", "iterations", 2.0),
                "action", Map.of("ref", "#more", "type", "click")));

        assertEquals(2, request.getLoop().getIterations());
    }

    @Test
    void shouldLeaveMissingSectionsForValidation() {
        RepeatActionRequest request = parser.parse(Map.of());

        assertNull(request.getLoop());
        assertNull(request.getAction());
    }

    @Test
    void shouldRejectUnsupportedValues() {
        assertEquals("loop.type", rejectedField(Map.of("loop", Map.of("type", "until"))));
        assertEquals("action.type", rejectedField(Map.of("action", Map.of("type", "scroll"))));
        assertEquals("loop.until.assertion.assertionType", rejectedField(Map.of("loop", Map.of(
                "type", "while", "until", Map.of("ref", "#x", "assertion", Map.of("assertionType", "toExist"))))));
    }

    @Test
    void shouldRejectWronglyTypedFields() {
        assertEquals("loop.iterations", rejectedField(Map.of("loop", Map.of("type", "for", "iterations", "3"))));
        assertEquals("loop.iterations", rejectedField(Map.of("loop", Map.of("type", "for", "iterations", 2.5))));
        assertEquals("action", rejectedField(Map.of("action", "click")));
        assertEquals("loop.until.negate", rejectedField(Map.of("loop", Map.of(
                "type", "while", "until", Map.of("ref", "#x", "negate", "yes")))));
        assertEquals("limits.maxIterations", rejectedField(Map.of("limits", Map.of("maxIterations", "ten"))));
    }

    @Test
    void shouldRejectIntegersOutsideIntRange() {
        assertEquals("loop.iterations", rejectedField(Map.of("loop", Map.of("type", "for",
                "iterations", 4294967298L))));
        assertEquals("loop.iterations", rejectedField(Map.of("loop", Map.of("type", "for",
                "iterations", 2147483648L))));
        assertEquals("limits.maxIterations", rejectedField(Map.of("limits", Map.of("maxIterations", 1e12))));
        assertEquals("limits.maxIterations", rejectedField(Map.of("limits", Map.of("maxIterations",
                Double.POSITIVE_INFINITY))));
        assertEquals("limits.maxIterations", rejectedField(Map.of("limits", Map.of("maxIterations", Double.NaN))));
    }

    @Test
    void shouldAcceptIntBoundaries() {
        RepeatActionRequest request = parser.parse(Map.of(
                "loop", Map.of("type", "for", "iterations", 2147483647L),
                "limits", Map.of("maxIterations", 5.0)));

        assertEquals(Integer.MAX_VALUE, request.getLoop().getIterations());
        assertEquals(5, request.getLimits().getMaxIterations());
    }

    @Test
    void shouldNameUnsupportedValueInMessage() {
        LoopSpecException e = assertThrows(LoopSpecException.class,
                () -> parser.parse(Map.of("action", Map.of("type", "drag"))));

        assertTrue(e.getMessage().contains("\"drag\""));
    }
}
