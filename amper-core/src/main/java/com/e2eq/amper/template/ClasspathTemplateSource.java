package com.e2eq.amper.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Reads template text from classpath resources under a fixed prefix.
 */
public final class ClasspathTemplateSource implements TemplateSource {

    private final String prefix;
    private final ClassLoader classLoader;

    public ClasspathTemplateSource(String prefix) {
        this(prefix, Thread.currentThread().getContextClassLoader());
    }

    public ClasspathTemplateSource(String prefix, ClassLoader classLoader) {
        String p = prefix == null ? "" : prefix.trim();
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (!p.isEmpty() && !p.endsWith("/")) {
            p = p + "/";
        }
        this.prefix = p;
        this.classLoader = classLoader != null ? classLoader : ClasspathTemplateSource.class.getClassLoader();
    }

    @Override
    public Optional<String> load(String path) throws IOException {
        try (InputStream in = classLoader.getResourceAsStream(prefix + path)) {
            if (in == null) {
                return Optional.empty();
            }
            return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Override
    public String toString() {
        return "classpath:" + prefix;
    }
}
