package com.example.pdfstamp.storage;

import com.example.pdfstamp.exception.ContractStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem backed blob store for local runs: object keys map to paths below a root directory.
 */
@Slf4j
public class LocalContractStorageService implements ContractStorageService {

    private final Path root;

    public LocalContractStorageService(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("Using local directory '{}' for templates and contracts", this.root);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void upload(String key, byte[] content, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException ex) {
            throw new ContractStorageException("Failed to write '%s'".formatted(key), ex);
        }
    }

    @Override
    public List<String> list(String prefix) {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .map(path -> root.relativize(path).toString().replace('\\', '/'))
                    .filter(key -> key.startsWith(prefix))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new ContractStorageException("Unable to list '%s'".formatted(prefix), ex);
        }
    }

    @Override
    public byte[] download(String key) {
        try {
            return Files.readAllBytes(resolve(key));
        } catch (NoSuchFileException ex) {
            throw new ContractStorageException("Object not found: '%s'".formatted(key), ex);
        } catch (IOException ex) {
            throw new ContractStorageException("Failed to read '%s'".formatted(key), ex);
        }
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new ContractStorageException("Key escapes storage root: '%s'".formatted(key));
        }
        return path;
    }
}
