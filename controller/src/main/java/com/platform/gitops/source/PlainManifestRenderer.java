package com.platform.gitops.source;

import com.platform.gitops.model.Image;
import com.platform.gitops.model.Patch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Concatenates the plain YAML files of a directory tree, in path order.
 * Patches and image overrides are refused; the target namespace is applied later by the
 * manifest parser.
 */
public class PlainManifestRenderer implements OverlayRenderer {

    @Override
    public byte[] renderOverlay(Path path, List<Patch> patches, List<Image> images, String targetNamespace) {
        if (!patches.isEmpty() || !images.isEmpty()) {
            throw new OverlayBuildException("patches and images require an overlay engine");
        }
        if (!Files.isDirectory(path)) {
            throw new OverlayBuildException("build path not found: " + path);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Stream<Path> files = Files.walk(path)) {
            for (Path file : files.filter(PlainManifestRenderer::isYaml).sorted().toList()) {
                out.write("---\n".getBytes(StandardCharsets.UTF_8));
                out.write(Files.readAllBytes(file));
                out.write('\n');
            }
        } catch (IOException e) {
            throw new OverlayBuildException("failed to read " + path + ": " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private static boolean isYaml(Path file) {
        String name = file.getFileName().toString();
        return Files.isRegularFile(file) && (name.endsWith(".yaml") || name.endsWith(".yml"));
    }
}
