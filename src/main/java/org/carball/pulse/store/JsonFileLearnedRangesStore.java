package org.carball.pulse.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pulse.model.learning.VenueLearningRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One JSON file per venue in a directory. Writes go to a temporary file that is then moved over the old
 * record, so readers never see a half-written file.
 */
@Slf4j
public class JsonFileLearnedRangesStore implements LearnedRangesStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileLearnedRangesStore(Path directory) throws IOException {
        this.directory = Files.createDirectories(directory);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<VenueLearningRecord> find(String venueId) throws IOException {
        Path file = fileFor(venueId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(file.toFile(), VenueLearningRecord.class));
    }

    @Override
    public void replace(VenueLearningRecord record) throws IOException {
        Path target = fileFor(record.venueId());
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), record);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            log.info("Stored learning record for venue {} at {}", record.venueId(), target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    Path fileFor(String venueId) {
        if (venueId == null || venueId.isBlank()) {
            throw new IllegalArgumentException("Venue id must not be blank");
        }
        return directory.resolve(venueId.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX);
    }
}
