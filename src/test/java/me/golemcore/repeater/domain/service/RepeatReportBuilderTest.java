package me.golemcore.repeater.domain.service;

import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.ActionType;
import me.golemcore.repeater.domain.model.AssertionType;
import me.golemcore.repeater.domain.model.CheckResult;
import me.golemcore.repeater.domain.model.IterationRecord;
import me.golemcore.repeater.domain.model.LoopSpec;
import me.golemcore.repeater.domain.model.LoopType;
import me.golemcore.repeater.domain.model.RepeatReport;
import me.golemcore.repeater.domain.model.StopCondition;
import me.golemcore.repeater.domain.model.VerdictStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepeatReportBuilderTest {

    private final RepeatReportBuilder builder = new RepeatReportBuilder();
    private final ActionSpec action = ActionSpec.builder().ref("#next").type(ActionType.CLICK).build();

    private static LoopSpec whileLoop() {
        return LoopSpec.builder()
                .type(LoopType.WHILE)
                .until(StopCondition.builder()
                        .ref("#done")
                        .assertion(new StopCondition.Assertion(AssertionType.TO_BE_VISIBLE))
                        .build())
                .build();
    }

    @Test
    void shouldPassForLoopThatRan() {
        LoopSpec loop = LoopSpec.builder().type(LoopType.FOR).iterations(2).build();
        List<IterationRecord> evidence = List.of(
                new IterationRecord(1, action, "Performed for-loop iteration 1"),
                new IterationRecord(2, action, "Performed for-loop iteration 2"));

        RepeatReport report = builder.build(2, loop, action, evidence);

        assertSame(action, report.action());
        assertSame(loop, report.loop());
        assertEquals(2, report.summary().total());
        assertEquals(1, report.summary().passed());
        assertEquals(0, report.summary().failed());
        assertEquals(VerdictStatus.PASS, report.summary().status());
        assertEquals(evidence, report.summary().evidence());

        assertEquals(1, report.checks().size());
        CheckResult check = report.checks().get(0);
        assertEquals("action-execution", check.property());
        assertEquals("for", check.operator());
        assertEquals("2 iterations", check.expected());
        assertEquals(2, check.actual());
        assertEquals(VerdictStatus.PASS, check.result());
    }

    @Test
    void shouldFailForLoopWithZeroIterations() {
        LoopSpec loop = LoopSpec.builder().type(LoopType.FOR).iterations(0).build();

        RepeatReport report = builder.build(0, loop, action, List.of());

        assertEquals(VerdictStatus.FAIL, report.summary().status());
        assertEquals(0, report.summary().passed());
        assertEquals(1, report.summary().failed());
        assertTrue(report.summary().evidence().isEmpty());
        assertEquals("0 iterations", report.checks().get(0).expected());
        assertEquals(VerdictStatus.FAIL, report.checks().get(0).result());
    }

    @Test
    void shouldFailConditionalLoopThatNeverActed() {
        RepeatReport report = builder.build(0, whileLoop(), action, List.of());

        assertEquals(VerdictStatus.FAIL, report.summary().status());
        assertEquals("while", report.checks().get(0).operator());
        assertEquals("condition met or maxIterations reached", report.checks().get(0).expected());
    }

    @Test
    void shouldPassConditionalLoopRegardlessOfStopCause() {
        List<IterationRecord> evidence = List.of(new IterationRecord(1, action, "Performed while-loop iteration 1"));

        RepeatReport report = builder.build(1, whileLoop(), action, evidence);

        assertEquals(VerdictStatus.PASS, report.summary().status());
        assertEquals(1, report.checks().get(0).actual());
    }
}
