package com.herzen.migration.inventory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@FunctionalInterface
public interface ContentReader {
    String read(String relativePath) throws IOException;

    default byte[] readBytes(String relativePath) throws IOException {
        return read(relativePath).getBytes(StandardCharsets.UTF_8);
    }

    static ContentReader forRoot(Path courseRoot) {
        return new ContentReader() {
            @Override
            public String read(String relativePath) throws IOException {
                return Files.readString(courseRoot.resolve(relativePath), StandardCharsets.UTF_8);
            }

            @Override
            public byte[] readBytes(String relativePath) throws IOException {
                return Files.readAllBytes(courseRoot.resolve(relativePath));
            }
        };
    }
}
