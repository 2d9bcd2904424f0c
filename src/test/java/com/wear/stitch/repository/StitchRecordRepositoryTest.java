package com.wear.stitch.repository;

import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.model.StitchRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class StitchRecordRepositoryTest {

    @TempDir
    Path dataDir;

    private YamlConfig yamlConfig;

    @BeforeEach
    void setUp() {
        yamlConfig = new YamlConfig();
        yamlConfig.getSystem().setDataDir(dataDir.toString());
    }

    private StitchRecordRepository newRepository() {
        StitchRecordRepository repository = new StitchRecordRepository();
        ReflectionTestUtils.setField(repository, "yamlConfig", yamlConfig);
        repository.init();
        return repository;
    }

    private static StitchRecord record(LocalDateTime timestamp, int height) {
        StitchRecord record = new StitchRecord();
        record.setTimestamp(timestamp);
        record.setSource("frames");
        record.setFrameCount(3);
        record.setWidth(454);
        record.setHeight(height);
        record.setOffsets(List.of(0, 120, 118));
        record.setScores(List.of(0, 334, 336));
        return record;
    }

    @Test
    @DisplayName("Should assign an id and find the record again after a restart")
    void insert_ThenFindById() {
        StitchRecord saved = newRepository().insert(record(LocalDateTime.of(2024, 1, 15, 10, 30), 692));

        assertThat(saved.getId()).isNotBlank();
        assertThat(dataDir.resolve("records/2024-01-15.jsonl")).exists();

        Optional<StitchRecord> found = newRepository().findById(saved.getId());
        assertThat(found).isPresent();
        assertThat(found.get().getHeight()).isEqualTo(692);
        assertThat(found.get().getOffsets()).containsExactly(0, 120, 118);
        assertThat(found.get().getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 15, 10, 30));
    }

    @Test
    @DisplayName("Should fall back to scanning record files when the id index is lost")
    void findById_MissingIndex_ScansFiles() throws Exception {
        StitchRecordRepository repository = newRepository();
        StitchRecord saved = repository.insert(record(LocalDateTime.of(2024, 2, 1, 8, 0), 500));
        Files.writeString(dataDir.resolve("id_index.txt"), "");

        assertThat(repository.findById(saved.getId())).isPresent();
        assertThat(repository.findById("unknown")).isEmpty();
    }

    @Test
    @DisplayName("Should list the newest records first across days")
    void findRecent_NewestFirst() {
        StitchRecordRepository repository = newRepository();
        repository.insert(record(LocalDateTime.of(2024, 1, 15, 9, 0), 1));
        repository.insert(record(LocalDateTime.of(2024, 1, 16, 9, 0), 2));
        repository.insert(record(LocalDateTime.of(2024, 1, 15, 18, 0), 3));

        List<StitchRecord> recent = repository.findRecent(2);

        assertThat(recent).extracting(StitchRecord::getHeight).containsExactly(2, 3);
        assertThat(repository.findRecent(10)).extracting(StitchRecord::getHeight).containsExactly(2, 3, 1);
    }

    @Test
    @DisplayName("Should keep nothing on disk when local saving is off")
    void insert_SaveLocalDisabled_NothingStored() {
        yamlConfig.getSystem().setSaveLocal(false);
        StitchRecordRepository repository = newRepository();

        StitchRecord saved = repository.insert(record(LocalDateTime.now(), 10));

        assertThat(saved.getId()).isNotBlank();
        assertThat(repository.findById(saved.getId())).isEmpty();
        assertThat(repository.findRecent(5)).isEmpty();
        assertThat(dataDir.resolve("records")).doesNotExist();
    }
}
