package io.kcl.tools.ls.pkg;

import org.junit.Test;

import java.nio.file.Paths;

import static org.junit.Assert.*;

public class PackageMetadataTest {

    @Test
    public void testParseMetadataJson() {
        PackageMetadata metadata = PackageMetadata.parse(
                "{\"packages\": {\"k8s\": {\"name\": \"k8s\", \"manifest_path\": \"/home/u/.kcl/kpm/k8s_1.28\"},"
                        + " \"helper\": {\"name\": \"helper\", \"manifest_path\": \"/deps/helper\"}}}");

        assertEquals(2, metadata.getPackages().size());
        assertEquals(Paths.get("/home/u/.kcl/kpm/k8s_1.28"), metadata.getPackage("k8s").getManifestPath());
        assertEquals("helper", metadata.getPackage("helper").getName());
        assertNull(metadata.getPackage("missing"));
    }

    @Test
    public void testNoPackages() {
        assertTrue(PackageMetadata.parse("{\"packages\": {}}").getPackages().isEmpty());
        assertTrue(PackageMetadata.parse("{}").getPackages().isEmpty());
    }

    @Test(expected = MetadataFetchException.class)
    public void testNotAnObject() {
        PackageMetadata.parse("[1, 2]");
    }

    @Test(expected = MetadataFetchException.class)
    public void testMalformed() {
        PackageMetadata.parse("{\"packages\": ");
    }
}
