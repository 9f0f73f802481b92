package me.golemcore.engine;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class EngineApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(EngineApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(EngineApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(EngineApplication.class.getMethod("main", String[].class));
    }
}
