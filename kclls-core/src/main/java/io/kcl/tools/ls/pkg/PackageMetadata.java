package io.kcl.tools.ls.pkg;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependencies of a KCL module keyed by package name.
 * <pre>
 * {"packages": {"k8s": {"name": "k8s", "manifest_path": "/home/u/.kcl/kpm/k8s_1.28"}}}
 * </pre>
 */
public class PackageMetadata {

    private final Map<String, Package> packages;

    public PackageMetadata(Map<String, Package> packages) {
        this.packages = Collections.unmodifiableMap(new LinkedHashMap<>(packages));
    }

    public static PackageMetadata empty() {
        return new PackageMetadata(Collections.emptyMap());
    }

    /**
     * Parses the JSON printed by the metadata command. JSON is read with the YAML parser.
     */
    @SuppressWarnings("unchecked")
    public static PackageMetadata parse(String json) {
        Object loaded;
        try {
            loaded = new Yaml(new LoaderOptions()).load(json);
        } catch (YAMLException e) {
            throw new MetadataFetchException("invalid package metadata: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new MetadataFetchException("invalid package metadata: " + json);
        }
        Object packagesValue = ((Map<String, Object>) loaded).get("packages");
        Map<String, Package> packages = new LinkedHashMap<>();
        if (packagesValue instanceof Map) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) packagesValue).entrySet()) {
                if (!(entry.getValue() instanceof Map)) {
                    continue;
                }
                Map<String, Object> pkg = (Map<String, Object>) entry.getValue();
                Object name = pkg.getOrDefault("name", entry.getKey());
                Object manifestPath = pkg.get("manifest_path");
                try {
                    packages.put(entry.getKey(), new Package(String.valueOf(name),
                            Paths.get(manifestPath == null ? "" : manifestPath.toString())));
                } catch (InvalidPathException e) {
                    throw new MetadataFetchException("invalid manifest_path for " + entry.getKey(), e);
                }
            }
        }
        return new PackageMetadata(packages);
    }

    public Map<String, Package> getPackages() {
        return packages;
    }

    public Package getPackage(String name) {
        return packages.get(name);
    }
}
