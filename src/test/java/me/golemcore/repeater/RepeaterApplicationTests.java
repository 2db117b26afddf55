package me.golemcore.repeater;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class RepeaterApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(RepeaterApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(RepeaterApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(RepeaterApplication.class.getMethod("main", String[].class));
    }
}
