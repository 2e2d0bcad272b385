package me.golemcore.events;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventsApplicationTests {

    @Test
    void shouldHaveExpectedSpringAnnotations() {
        assertNotNull(EventsApplication.class.getAnnotation(SpringBootApplication.class));
        assertNotNull(EventsApplication.class.getAnnotation(ConfigurationPropertiesScan.class));
    }

    @Test
    void shouldExposeMainMethod() throws NoSuchMethodException {
        assertNotNull(EventsApplication.class.getMethod("main", String[].class));
    }
}
