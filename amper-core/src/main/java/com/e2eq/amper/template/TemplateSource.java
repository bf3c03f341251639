package com.e2eq.amper.template;

import java.io.IOException;
import java.util.Optional;

/**
 * Where the text of policy templates is read from.
 */
public interface TemplateSource {

    /**
     * @param path location of the template text relative to this source
     * @return the text, or empty when nothing exists at {@code path}
     * @throws IOException when the text exists but cannot be read
     */
    Optional<String> load(String path) throws IOException;
}
