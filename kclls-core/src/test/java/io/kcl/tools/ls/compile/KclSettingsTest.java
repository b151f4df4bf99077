package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.LanguageServiceException;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class KclSettingsTest {

    @Test
    public void testParseFullSettings() {
        KclSettings settings = KclSettings.parse(String.join("\n",
                "kcl_cli_configs:",
                "  files:",
                "    - base.k",
                "    - main.k",
                "  disable_none: true",
                "  strict_range_check: true",
                "  overrides:",
                "    - app.name=demo",
                "kcl_options:",
                "  - key: env",
                "    value: prod",
                "  - key: replicas",
                "    value: 3",
                ""));
        assertEquals(List.of("base.k", "main.k"), settings.getFiles());
        assertTrue(settings.isDisableNone());
        assertTrue(settings.isStrictRangeCheck());
        assertEquals(List.of("app.name=demo"), settings.getOverrides());
        assertEquals(Map.of("env", "prod", "replicas", "3"), settings.getOptions());
    }

    @Test
    public void testSingleFileKey() {
        KclSettings settings = KclSettings.parse(String.join("\n",
                "kcl_cli_configs:",
                "  file:",
                "    - only.k",
                ""));
        assertEquals(List.of("only.k"), settings.getFiles());
        assertFalse(settings.isDisableNone());
        assertTrue(settings.getOptions().isEmpty());
    }

    @Test
    public void testEmptyDocument() {
        KclSettings settings = KclSettings.parse("");
        assertTrue(settings.getFiles().isEmpty());
        assertTrue(settings.getOverrides().isEmpty());
    }

    @Test(expected = LanguageServiceException.class)
    public void testMalformedYaml() {
        KclSettings.parse("kcl_cli_configs: [files");
    }
}
