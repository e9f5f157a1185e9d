package io.github.jbellis.mobilize.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OptionsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadFromFile() throws IOException {
        var file = tempDir.resolve("mobilize.json");
        Files.writeString(file, """
                {
                  "layoutMode": true,
                  "phoneNumber": "16175551212",
                  "conversionId": 42,
                  "phoneConversionLabel": "HelloWorld",
                  "beaconUrl": "/beacon",
                  "beaconCategory": "experiment2",
                  "theme": "#ff0000 #0000ff",
                  "debugMode": false
                }
                """);

        var options = OptionsLoader.load(file);

        assertTrue(options.layoutMode());
        assertTrue(options.navEnabled(), "absent keys keep builder defaults");
        assertEquals("16175551212", options.phoneNumber());
        assertEquals(42, options.conversionId());
        assertEquals("HelloWorld", options.phoneConversionLabel());
        assertEquals("/beacon", options.beaconUrl());
        assertEquals("experiment2", options.beaconCategory());
        assertEquals(new RgbColor(255, 0, 0), options.theme().background());
        assertFalse(options.debugMode());
        assertEquals("/psajs/", options.assetPrefix());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> OptionsLoader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void testUnknownKeyRejected() {
        var e = assertThrows(InvalidOptionException.class,
                             () -> OptionsLoader.parse("{\"layoutMode\": true, \"colour\": \"red\"}"));
        assertEquals("colour", e.getOptionName());
    }

    @Test
    void testBadThemeRejected() {
        var e = assertThrows(InvalidOptionException.class,
                             () -> OptionsLoader.parse("{\"theme\": \"#ff0000\"}"));
        assertEquals("theme", e.getOptionName());
    }

    @Test
    void testFractionalConversionIdRejected() {
        var e = assertThrows(InvalidOptionException.class,
                             () -> OptionsLoader.parse("{\"conversionId\": 4.7}"));
        assertEquals("conversionId", e.getOptionName());
    }

    @Test
    void testQuotedConversionIdRejected() {
        var e = assertThrows(InvalidOptionException.class,
                             () -> OptionsLoader.parse("{\"conversionId\": \"42\"}"));
        assertEquals("conversionId", e.getOptionName());
    }

    @Test
    void testMalformedJson() {
        var e = assertThrows(InvalidOptionException.class, () -> OptionsLoader.parse("{\"layoutMode\": "));
        assertEquals("options", e.getOptionName());
    }

    @Test
    void testEmptyObjectGivesDefaults() {
        assertEquals(MobilizeOptions.builder().build(), OptionsLoader.parse("{}"));
    }
}
