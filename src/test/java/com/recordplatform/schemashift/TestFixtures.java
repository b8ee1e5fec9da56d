package com.recordplatform.schemashift;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recordplatform.schemashift.model.Schema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

public final class TestFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private TestFixtures() {
    }

    /**
     * Fresh copy on every call, so tests may mutate the result.
     */
    public static Schema contactSchema() {
        return read("/fixtures/contact-schema.json", Schema.class);
    }

    public static <T> T read(String path, Class<T> type) {
        try (InputStream in = TestFixtures.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + path);
            }
            return MAPPER.readValue(in, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
