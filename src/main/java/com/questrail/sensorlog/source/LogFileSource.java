package com.questrail.sensorlog.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogFileSource
 * -----------------------------------------------------------------------------
 * Streams a telemetry log file line by line.
 *
 * <p>The file is never loaded as a whole; each line is handed to the consumer
 * as soon as it is read, so arbitrarily large logs are processed in constant
 * memory.</p>
 *
 * <p>Bytes that are not valid in the configured charset are replaced with
 * {@code U+FFFD} and reading continues.</p>
 */
public final class LogFileSource
{
    private final Path path;
    private final Charset charset;

    public LogFileSource(Path path) {
        this(path, StandardCharsets.UTF_8);
    }

    public LogFileSource(Path path, Charset charset) {
        this.path = Objects.requireNonNull(path, "path");
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    /**
     * Reads the file and passes every line, in order, to {@code lineConsumer}.
     *
     * @throws SensorLogSourceException if the file does not exist or cannot be read
     */
    public void forEachLine(Consumer<String> lineConsumer) {
        Objects.requireNonNull(lineConsumer, "lineConsumer");

        if (!Files.exists(path)) {
            throw new SensorLogSourceException("File '" + path + "' not found.");
        }

        final CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineConsumer.accept(line);
            }
        }
        catch (IOException | UncheckedIOException e) {
            throw new SensorLogSourceException("Unable to read file '" + path + "'", e);
        }
    }
}
