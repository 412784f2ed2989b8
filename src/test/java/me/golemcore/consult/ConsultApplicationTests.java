package me.golemcore.consult;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class ConsultApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(ConsultApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(ConsultApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(ConsultApplication.class.getMethod("main", String[].class));
    }
}
