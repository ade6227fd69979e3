package com.idsplit.infrastructure.lexicon;

import com.idsplit.domain.split.oracle.DictionaryOracle;
import com.idsplit.domain.split.oracle.FrequencyModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

@Configuration
public class LexiconConfig {

    @Value("${splitter.lexicon.frequencies:classpath:lexicon/word-frequencies.tsv}")
    private Resource frequencies;

    @Value("${splitter.lexicon.dictionary:classpath:lexicon/dictionary.txt}")
    private Resource dictionary;

    @Bean
    public FrequencyModel frequencyModel() {
        return CorpusFrequencyModel.load(frequencies);
    }

    @Bean
    public DictionaryOracle dictionaryOracle() {
        return WordListDictionary.load(dictionary);
    }
}
