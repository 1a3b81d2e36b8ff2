package com.github.seamorder.image;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes an ordering as a single line of space-separated node indexes.
 */
public final class TourWriter {
    private TourWriter() {
    }

    /**
     * @param path  the output file; created or truncated
     * @param order node indexes in visiting order
     * @throws IOException if the file cannot be written
     */
    public static void write(Path path, List<Integer> order) throws IOException {
        Files.writeString(path, format(order), StandardCharsets.UTF_8);
    }

    static String format(List<Integer> order) {
        return order.stream().map(String::valueOf).collect(Collectors.joining(" "));
    }
}
