package me.golemcore.repeater.infrastructure.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RepeaterPropertiesTest {

    @Test
    void shouldExposeLoopDefaults() {
        RepeaterProperties properties = new RepeaterProperties();

        assertEquals(20, properties.getLoop().getDefaultMaxIterations());
        assertEquals(300L, properties.getLoop().getForDelayMs());
        assertEquals(100L, properties.getLoop().getConditionalDelayMs());
    }

    @Test
    void shouldExposeBrowserDefaults() {
        RepeaterProperties properties = new RepeaterProperties();

        assertTrue(properties.getBrowser().isEnabled());
        assertTrue(properties.getBrowser().isHeadless());
        assertNull(properties.getBrowser().getUserAgent());
        assertEquals(30000L, properties.getBrowser().getElementAttachedTimeoutMs());
    }
}
