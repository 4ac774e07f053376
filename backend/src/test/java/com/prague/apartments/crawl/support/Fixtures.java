package com.prague.apartments.crawl.support;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

public final class Fixtures {
    private Fixtures() {
    }

    /**
     * One page of the estates endpoint: three Prague listings with ids, one Prague listing
     * without an id and two listings outside Prague.
     */
    public static String estatesPage() throws IOException {
        return read("/sreality/estates-page.json");
    }

    public static String read(String path) throws IOException {
        try (InputStream in = Fixtures.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IOException("Missing fixture " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
