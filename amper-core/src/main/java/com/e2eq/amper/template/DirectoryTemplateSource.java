package com.e2eq.amper.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads template text from files below a directory. Paths escaping the directory are rejected.
 */
public final class DirectoryTemplateSource implements TemplateSource {

    private final Path root;

    public DirectoryTemplateSource(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null").toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> load(String path) throws IOException {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Template path '" + path + "' is outside of " + root);
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
