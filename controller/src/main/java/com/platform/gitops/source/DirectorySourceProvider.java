package com.platform.gitops.source;

import com.platform.gitops.model.SourceReference;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Stream;

/**
 * Serves sources from local directories laid out as {@code <root>/<namespace>/<name>}.
 * The revision is a digest of every file path and content under the directory.
 */
@Slf4j
public class DirectorySourceProvider implements SourceProvider {

    private final Path root;

    public DirectorySourceProvider(Path root) {
        this.root = root;
    }

    @Override
    public SourceArtifact fetchSource(SourceReference ref) {
        Path dir = root.resolve(ref.namespace()).resolve(ref.name()).normalize();
        if (!dir.startsWith(root.normalize()) || !Files.isDirectory(dir)) {
            throw new SourceUnavailableException("source " + ref + " has no artifact under " + root);
        }
        String revision = "local@sha256:" + digest(dir);
        log.debug("Fetched source {} at {}", ref, revision);
        return new SourceArtifact(dir, revision);
    }

    private static String digest(Path dir) {
        try (Stream<Path> files = Files.walk(dir)) {
            List<Path> sorted = files.filter(Files::isRegularFile).sorted().toList();
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            for (Path file : sorted) {
                sha.update(dir.relativize(file).toString().getBytes());
                sha.update(Files.readAllBytes(file));
            }
            return HexFormat.of().formatHex(sha.digest());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
