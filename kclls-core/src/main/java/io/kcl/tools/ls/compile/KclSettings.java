package io.kcl.tools.ls.compile;

import io.kcl.tools.ls.LanguageServiceException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code kcl_cli_configs} and {@code kcl_options} sections of a {@code kcl.yaml} file.
 */
public class KclSettings {

    public static final String FILE_NAME = "kcl.yaml";

    private final List<String> files;
    private final boolean disableNone;
    private final boolean strictRangeCheck;
    private final List<String> overrides;
    private final Map<String, String> options;

    KclSettings(List<String> files, boolean disableNone, boolean strictRangeCheck, List<String> overrides,
                Map<String, String> options) {
        this.files = Collections.unmodifiableList(files);
        this.disableNone = disableNone;
        this.strictRangeCheck = strictRangeCheck;
        this.overrides = Collections.unmodifiableList(overrides);
        this.options = Collections.unmodifiableMap(options);
    }

    public static KclSettings load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Yaml yaml = new Yaml(new LoaderOptions());
            return fromYaml(yaml.load(reader));
        } catch (IOException | YAMLException | ClassCastException e) {
            throw new LanguageServiceException("failed to load " + path + ": " + e.getMessage(), e);
        }
    }

    public static KclSettings parse(String text) {
        try {
            Yaml yaml = new Yaml(new LoaderOptions());
            return fromYaml(yaml.load(text));
        } catch (YAMLException | ClassCastException e) {
            throw new LanguageServiceException("failed to parse " + FILE_NAME + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static KclSettings fromYaml(Object loaded) {
        Map<String, Object> root = loaded instanceof Map ? (Map<String, Object>) loaded : Collections.emptyMap();
        Map<String, Object> cli = root.get("kcl_cli_configs") instanceof Map
                ? (Map<String, Object>) root.get("kcl_cli_configs") : Collections.emptyMap();

        List<String> files = new ArrayList<>();
        Object filesValue = cli.containsKey("files") ? cli.get("files") : cli.get("file");
        if (filesValue instanceof List) {
            for (Object file : (List<Object>) filesValue) {
                files.add(String.valueOf(file));
            }
        } else if (filesValue != null) {
            files.add(String.valueOf(filesValue));
        }

        List<String> overrides = new ArrayList<>();
        if (cli.get("overrides") instanceof List) {
            for (Object override : (List<Object>) cli.get("overrides")) {
                overrides.add(String.valueOf(override));
            }
        }

        Map<String, String> options = new LinkedHashMap<>();
        if (root.get("kcl_options") instanceof List) {
            for (Object entry : (List<Object>) root.get("kcl_options")) {
                if (entry instanceof Map) {
                    Map<String, Object> keyValue = (Map<String, Object>) entry;
                    Object key = keyValue.get("key");
                    if (key != null) {
                        Object value = keyValue.get("value");
                        options.put(String.valueOf(key), value == null ? "" : String.valueOf(value));
                    }
                }
            }
        }
        return new KclSettings(files, isTrue(cli.get("disable_none")), isTrue(cli.get("strict_range_check")),
                overrides, options);
    }

    private static boolean isTrue(Object value) {
        return value instanceof Boolean ? (Boolean) value : value != null && Boolean.parseBoolean(value.toString());
    }

    public List<String> getFiles() {
        return files;
    }

    public boolean isDisableNone() {
        return disableNone;
    }

    public boolean isStrictRangeCheck() {
        return strictRangeCheck;
    }

    public List<String> getOverrides() {
        return overrides;
    }

    public Map<String, String> getOptions() {
        return options;
    }
}
