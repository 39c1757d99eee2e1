package com.example.tftlobby;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {

    public static String read(String name) {
        try (InputStream is = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (is == null) {
                throw new IllegalArgumentException("missing fixture " + name);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Fixtures() {}
}
