package org.pseudoforge.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads the pseudocode a command works on. The file name {@code -} means standard input.
 */
final class SourceReader {

    private SourceReader() {
    }

    static String read(File file, InputStream stdin) throws IOException {
        if ("-".equals(file.getPath())) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }
}
