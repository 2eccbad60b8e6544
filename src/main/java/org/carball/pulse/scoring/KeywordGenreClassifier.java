package org.carball.pulse.scoring;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-membership classifier over the concatenated song and artist text.
 */
@Slf4j
public class KeywordGenreClassifier implements GenreClassifier {

    public static final String DEFAULT_VOCABULARY_RESOURCE = "genre-keywords.yml";

    private final Map<String, List<String>> keywordsByGenre;

    public KeywordGenreClassifier(Map<String, List<String>> keywordsByGenre) {
        this.keywordsByGenre = new LinkedHashMap<>();
        keywordsByGenre.forEach((genre, keywords) -> this.keywordsByGenre.put(
                genre.toLowerCase(Locale.ROOT),
                keywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList()));
        log.debug("Initialized keyword genre classifier with {} genres", this.keywordsByGenre.size());
    }

    /**
     * Classifier backed by the bundled {@value #DEFAULT_VOCABULARY_RESOURCE} vocabulary.
     */
    public static KeywordGenreClassifier withDefaultVocabulary() {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
        try (InputStream in = KeywordGenreClassifier.class.getClassLoader()
                .getResourceAsStream(DEFAULT_VOCABULARY_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_VOCABULARY_RESOURCE);
            }
            Map<String, List<String>> vocabulary = yamlMapper.readValue(in, new TypeReference<>() {});
            return new KeywordGenreClassifier(vocabulary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read genre vocabulary", e);
        }
    }

    @Override
    public List<String> detect(String song, String artist) {
        if (isBlank(song) && isBlank(artist)) {
            return List.of();
        }

        String searchText = ((song == null ? "" : song) + " " + (artist == null ? "" : artist))
                .toLowerCase(Locale.ROOT);

        List<String> detected = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : keywordsByGenre.entrySet()) {
            if (entry.getValue().stream().anyMatch(searchText::contains)) {
                detected.add(entry.getKey());
            }
        }
        return detected;
    }

    public int genreCount() {
        return keywordsByGenre.size();
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
