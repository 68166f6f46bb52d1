package net.seitter.heapstore;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Creates the Jackson mapper shared by the JSON stores and the stats server.
 */
public final class ObjectMappers {

    private ObjectMappers() {
    }

    /**
     * Creates a mapper that writes {@code java.time} values as ISO-8601 strings
     * and pretty-prints its output.
     *
     * @return A new object mapper
     */
    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
