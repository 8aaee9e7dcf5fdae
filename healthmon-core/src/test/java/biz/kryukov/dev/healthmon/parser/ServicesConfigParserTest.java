package biz.kryukov.dev.healthmon.parser;

import biz.kryukov.dev.healthmon.ConfigurationException;
import biz.kryukov.dev.healthmon.ServiceEntry;
import biz.kryukov.dev.healthmon.ServiceRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ServicesConfigParserTest {

    @Test
    void parsesDefaultConfig() {
        ServiceRegistry registry = ServicesConfigParser.parse(
                "github=https://api.github.com,google=https://www.google.com");

        assertEquals(List.of(
                new ServiceEntry("github", "https://api.github.com"),
                new ServiceEntry("google", "https://www.google.com")
        ), registry.entries());
    }

    @Test
    void trimsWhitespace() {
        Map<String, String> services = ServicesConfigParser.parseMap(
                " api = http://api.local:8080/health ,  web=http://web.local ");

        assertEquals("http://api.local:8080/health", services.get("api"));
        assertEquals("http://web.local", services.get("web"));
    }

    @Test
    void urlMayContainEquals() {
        Map<String, String> services = ServicesConfigParser.parseMap(
                "search=https://search.local/health?probe=1");

        assertEquals("https://search.local/health?probe=1", services.get("search"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void blankConfigRejected(String raw) {
        assertThrows(ConfigurationException.class, () -> ServicesConfigParser.parseMap(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "github",
            "github=https://api.github.com,google",
            "=https://api.github.com",
            "github=",
            "github=https://api.github.com,",
            "a=http://a.local,a=http://b.local"
    })
    void malformedEntryRejected(String raw) {
        assertThrows(ConfigurationException.class, () -> ServicesConfigParser.parseMap(raw));
    }

    @Test
    void invalidUrlRejectedAsConfigurationError() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ServicesConfigParser.parse("files=ftp://files.local"));
        assertTrue(ex.getMessage().contains("files"));
    }
}
