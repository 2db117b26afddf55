package me.golemcore.repeater.domain.loop;

import me.golemcore.repeater.domain.exception.ElementActionException;
import me.golemcore.repeater.domain.exception.ElementNotFoundException;
import me.golemcore.repeater.domain.exception.LoopSpecException;
import me.golemcore.repeater.domain.model.ActionSpec;
import me.golemcore.repeater.domain.model.ActionType;
import me.golemcore.repeater.domain.model.ElementRef;
import me.golemcore.repeater.port.outbound.BrowserTabPort;
import me.golemcore.repeater.port.outbound.ElementLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LocatorActionExecutorTest {

    private static final ElementRef SEARCH_BOX = new ElementRef("#search", "Search box");

    private BrowserTabPort browserTabPort;
    private ElementLocator locator;
    private LocatorActionExecutor executor;

    @BeforeEach
    void setUp() {
        browserTabPort = mock(BrowserTabPort.class);
        locator = mock(ElementLocator.class);
        when(browserTabPort.locate(SEARCH_BOX)).thenReturn(locator);
        when(locator.isAttached()).thenReturn(true);
        executor = new LocatorActionExecutor(browserTabPort);
    }

    private static ActionSpec action(ActionType type, String value) {
        return ActionSpec.builder()
                .ref(SEARCH_BOX.ref())
                .element(SEARCH_BOX.element())
                .type(type)
                .value(value)
                .build();
    }

    @Test
    void shouldClick() {
        executor.run(action(ActionType.CLICK, null));

        verify(locator).click();
    }

    @Test
    void shouldHover() {
        executor.run(action(ActionType.HOVER, null));

        verify(locator).hover();
    }

    @Test
    void shouldFillWithValue() {
        executor.run(action(ActionType.FILL, "golem"));

        verify(locator).fill("golem");
    }

    @Test
    void shouldPressKey() {
        executor.run(action(ActionType.PRESS, "Enter"));

        verify(locator).press("Enter");
    }

    @ParameterizedTest
    @EnumSource(value = ActionType.class, names = { "FILL", "PRESS" })
    void shouldRejectMissingValueWithoutTouchingThePage(ActionType type) {
        LoopSpecException e = assertThrows(LoopSpecException.class, () -> executor.run(action(type, null)));

        assertEquals("action.value", e.getField());
        verifyNoInteractions(browserTabPort);
        verifyNoInteractions(locator);
    }

    @Test
    void shouldAcceptEmptyFillValue() {
        executor.run(action(ActionType.FILL, ""));

        verify(locator).fill("");
    }

    @Test
    void shouldFailWhenElementIsNotAttached() {
        when(locator.isAttached()).thenReturn(false);

        ElementNotFoundException e = assertThrows(ElementNotFoundException.class,
                () -> executor.run(action(ActionType.CLICK, null)));

        assertEquals(SEARCH_BOX, e.getElementRef());
        verify(locator, never()).click();
    }

    @Test
    void shouldPropagateInteractionFailure() {
        doThrow(new ElementActionException("hover", SEARCH_BOX, new RuntimeException("detached")))
                .when(locator).hover();

        assertThrows(ElementActionException.class, () -> executor.run(action(ActionType.HOVER, null)));
    }

    @Test
    void shouldPropagateLocateFailure() {
        when(browserTabPort.locate(any())).thenThrow(new ElementNotFoundException(SEARCH_BOX, "no page"));

        assertThrows(ElementNotFoundException.class, () -> executor.run(action(ActionType.CLICK, null)));
        verifyNoInteractions(locator);
    }
}
