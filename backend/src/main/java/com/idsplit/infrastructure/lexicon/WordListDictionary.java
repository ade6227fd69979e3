package com.idsplit.infrastructure.lexicon;

import com.idsplit.domain.split.oracle.DictionaryOracle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * English word list backed dictionary. One word per line; lookups are case-insensitive.
 */
@Slf4j
public final class WordListDictionary implements DictionaryOracle {

    private final Set<String> words;

    private WordListDictionary(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static WordListDictionary load(Resource resource) {
        Set<String> out = new HashSet<>();
        LexiconReader.forEachEntry(resource, (line, lineNumber) -> out.add(line.toLowerCase(Locale.ROOT)));
        log.info("Loaded {} dictionary words from {}", out.size(), resource.getDescription());
        return new WordListDictionary(out);
    }

    @Override
    public boolean isWord(String token) {
        return token != null && !token.isEmpty() && words.contains(token.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }
}
