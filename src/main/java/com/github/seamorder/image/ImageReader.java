package com.github.seamorder.image;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads images from the text format: a header line <code>"&lt;n&gt; &lt;width&gt; &lt;height&gt;"</code>, followed
 * by one line per image holding <code>width * height * 3</code> whitespace-separated channel values, row-major,
 * red/green/blue per pixel. Trailing blank lines are ignored.
 */
public final class ImageReader {
    private ImageReader() {
    }

    /**
     * @param path the input file, UTF-8
     * @return the images in file order
     * @throws ImageParseException   if the content is malformed
     * @throws InvalidInputException if the header declares images without pixels
     * @throws IOException           if the file cannot be read
     */
    public static List<Image> read(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * @param reader the input
     * @return the images in input order
     * @throws ImageParseException   if the content is malformed
     * @throws InvalidInputException if the header declares images without pixels
     * @throws IOException           if reading fails
     */
    public static List<Image> read(BufferedReader reader) throws IOException {
        var header = reader.readLine();

        if (header == null || header.isBlank()) {
            throw new ImageParseException("missing header", 1);
        }

        var fields = split(header);
        if (fields.length != 3) {
            throw new ImageParseException("expected \"<n> <width> <height>\", got \"" + header + "\"", 1);
        }

        var count = parseCount(fields[0], 1);
        var width = parseCount(fields[1], 1);
        var height = parseCount(fields[2], 1);
        if (count > 0 && (width == 0 || height == 0)) {
            throw new InvalidInputException("images are empty: " + width + "x" + height);
        }

        // the header count is untrusted, so the list grows with the lines actually read
        var images = new ArrayList<Image>();
        var lineNo = 1;

        for (String line; (line = reader.readLine()) != null; ) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            if (images.size() == count) {
                throw new ImageParseException("more than " + count + " images", lineNo);
            }
            images.add(parseImage(split(line), width, height, lineNo));
        }

        if (images.size() != count) {
            throw new ImageParseException("expected " + count + " images, found " + images.size(), lineNo);
        }
        return images;
    }

    private static Image parseImage(String[] values, int width, int height, int lineNo) throws ImageParseException {
        var expected = (long) width * height * Pixel.CHANNELS;

        if (values.length != expected) {
            throw new ImageParseException("expected " + expected + " values, found " + values.length, lineNo);
        }

        var rows = new Pixel[height][width];
        var cursor = 0;

        for (var row = 0; row < height; row++) {
            for (var col = 0; col < width; col++) {
                var red = parseChannel(values[cursor++], lineNo);
                var green = parseChannel(values[cursor++], lineNo);
                var blue = parseChannel(values[cursor++], lineNo);
                rows[row][col] = new Pixel(red, green, blue);
            }
        }
        return new Image(rows);
    }

    private static int parseChannel(String s, int lineNo) throws ImageParseException {
        var value = parseInt(s, lineNo);

        if (Pixel.outOfRange(value)) {
            throw new ImageParseException("channel value out of range: " + value, lineNo);
        }
        return value;
    }

    private static int parseCount(String s, int lineNo) throws ImageParseException {
        var value = parseInt(s, lineNo);

        if (value < 0) {
            throw new ImageParseException("negative count: " + value, lineNo);
        }
        return value;
    }

    private static int parseInt(String s, int lineNo) throws ImageParseException {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new ImageParseException("not an integer: \"" + s + "\"", lineNo);
        }
    }

    private static String[] split(String line) {
        return line.strip().split("\\s+");
    }
}
