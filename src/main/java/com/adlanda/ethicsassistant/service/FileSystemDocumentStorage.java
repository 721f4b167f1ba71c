package com.adlanda.ethicsassistant.service;

import com.adlanda.ethicsassistant.config.AssistantProperties;
import com.adlanda.ethicsassistant.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Document storage backed by a local directory tree.
 *
 * Logical keys are paths relative to the root, always with forward slashes.
 */
@Service
public class FileSystemDocumentStorage implements DocumentStorage {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentStorage.class);

    private final Path root;
    private final String prefix;
    private final String suffix;

    public FileSystemDocumentStorage(AssistantProperties properties) {
        this.root = Path.of(properties.getStorage().getRoot()).toAbsolutePath().normalize();
        this.prefix = properties.getStorage().getPrefix();
        this.suffix = properties.getStorage().getSuffix().toLowerCase(Locale.ROOT);
    }

    @Override
    public List<String> list(String prefixFilter) {
        String fullPrefix = prefixFilter == null || prefixFilter.isEmpty() ? prefix : prefix + prefixFilter;

        if (!Files.isDirectory(root)) {
            throw new StorageException("Document root does not exist: " + root);
        }

        try (Stream<Path> paths = Files.walk(root)) {
            List<String> keys = paths.filter(Files::isRegularFile)
                    .map(this::toLogicalKey)
                    .filter(key -> key.startsWith(fullPrefix))
                    .filter(key -> key.toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted()
                    .toList();
            log.info("Found {} {} files under {}", keys.size(), suffix, root);
            return keys;
        } catch (IOException e) {
            throw new StorageException("Failed to list documents under " + root + ": " + e.getMessage(), e);
        }
    }

    @Override
    public byte[] fetch(String logicalKey) {
        Path path = resolve(logicalKey);
        if (!Files.isRegularFile(path)) {
            throw new StorageException("Document not found: " + logicalKey);
        }

        try {
            byte[] content = Files.readAllBytes(path);
            log.info("Read {} ({} bytes)", logicalKey, content.length);
            return content;
        } catch (IOException e) {
            throw new StorageException("Failed to read '" + logicalKey + "': " + e.getMessage(), e);
        }
    }

    @Override
    public boolean probe() {
        boolean readable = Files.isDirectory(root) && Files.isReadable(root);
        if (!readable) {
            log.error("Document root is not a readable directory: {}", root);
        }
        return readable;
    }

    private Path resolve(String logicalKey) {
        Path path = root.resolve(logicalKey).normalize();
        if (!path.startsWith(root)) {
            throw new StorageException("Key escapes the document root: " + logicalKey);
        }
        return path;
    }

    private String toLogicalKey(Path path) {
        // Normalize to forward slashes so keys are stable across platforms
        return root.relativize(path).toString().replace('\\', '/');
    }
}
