package com.kid.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec for objects carrying kids.
 * Uses Jackson with the {@link KidModule} serializers.
 */
public class JsonKidCodec {
    private final ObjectMapper objectMapper;

    public JsonKidCodec() {
        this.objectMapper = new ObjectMapper();

        // KidModule goes last so its Optional<Kid> deserializer takes precedence
        objectMapper.registerModule(new Jdk8Module());
        objectMapper.registerModule(new KidModule());
    }

    /**
     * Writes a value holding kids as JSON bytes.
     *
     * @throws UncheckedIOException if Jackson cannot write the value
     */
    public byte[] encode(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new UncheckedIOException("kid: cannot write " + describe(value) + " as JSON", e);
        }
    }

    /**
     * Reads JSON bytes into the given type.
     *
     * @throws UncheckedIOException if the JSON is malformed or a kid field
     *         holds an invalid string
     */
    public <T> T decode(byte[] data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new UncheckedIOException("kid: cannot read JSON into " + type.getSimpleName(), e);
        }
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
