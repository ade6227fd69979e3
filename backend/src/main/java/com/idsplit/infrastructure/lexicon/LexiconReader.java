package com.idsplit.infrastructure.lexicon;

import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.ObjIntConsumer;

/**
 * Reads a UTF-8 lexicon resource line by line, skipping blank lines and '#' comments.
 */
final class LexiconReader {

    private LexiconReader() {
    }

    /**
     * @param resource the lexicon file
     * @param consumer receives each stripped entry line and its 1-based line number
     */
    static void forEachEntry(Resource resource, ObjIntConsumer<String> consumer) {
        if (!resource.exists()) {
            throw new LexiconLoadException("Lexicon resource not found: " + resource.getDescription());
        }
        try (var reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                line = line.strip();
                if (!line.isEmpty() && !line.startsWith("#")) {
                    consumer.accept(line, lineNumber);
                }
            }
        } catch (IOException e) {
            throw new LexiconLoadException("Failed to read lexicon resource: " + resource.getDescription(), e);
        }
    }
}
