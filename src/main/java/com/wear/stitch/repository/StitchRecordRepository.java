package com.wear.stitch.repository;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.wear.stitch.config.YamlConfig;
import com.wear.stitch.model.StitchRecord;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 拼接记录存储
 * <p>
 * 按日期分文件：{dataDir}/records/2024-01-15.jsonl，每行一条记录；
 * {dataDir}/id_index.txt 保存 id,日期 索引。
 */
@Repository
public class StitchRecordRepository {
    private static final Logger logger = LoggerFactory.getLogger(StitchRecordRepository.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .create();

    @Autowired
    private YamlConfig yamlConfig;

    private boolean saveLocal;
    private Path recordsDir;
    private Path idIndexFile;

    @PostConstruct
    public void init() {
        saveLocal = yamlConfig.getSystem().isSaveLocal();
        if (!saveLocal) {
            return;
        }
        Path dataDir = Paths.get(yamlConfig.getSystem().getDataDir());
        recordsDir = dataDir.resolve("records");
        idIndexFile = dataDir.resolve("id_index.txt");
        try {
            Files.createDirectories(recordsDir);
            if (!Files.exists(idIndexFile)) {
                Files.createFile(idIndexFile);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize record store", e);
        }
    }

    private Path getRecordsFileForDate(LocalDate date) {
        return recordsDir.resolve(date.toString() + ".jsonl");
    }

    /**
     * 插入记录（追加到对应日期的文件）
     */
    public StitchRecord insert(StitchRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(LocalDateTime.now());
        }
        if (!saveLocal) {
            return record;
        }

        LocalDate date = record.getTimestamp().toLocalDate();
        try (BufferedWriter writer = Files.newBufferedWriter(getRecordsFileForDate(date),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(gson.toJson(record));
            writer.newLine();
        } catch (IOException e) {
            throw new RuntimeException("Failed to write to records file", e);
        }

        try {
            Files.writeString(idIndexFile, record.getId() + "," + date + "\n",
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // 索引更新失败不影响主流程，findById 会退化为全量扫描
            logger.warn("Failed to update id index for {}: {}", record.getId(), e.getMessage());
        }
        return record;
    }

    /**
     * 根据 ID 查找（先查 id_index 定位日期文件）
     */
    public Optional<StitchRecord> findById(String id) {
        if (!saveLocal) {
            return Optional.empty();
        }

        Optional<LocalDate> date = findDateById(id);
        List<Path> files = date.map(d -> List.of(getRecordsFileForDate(d))).orElseGet(this::listRecordFiles);
        for (Path file : files) {
            Optional<StitchRecord> found = readFile(file).stream()
                    .filter(record -> id.equals(record.getId()))
                    .findFirst();
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * 最近的记录，按时间倒序
     */
    public List<StitchRecord> findRecent(int limit) {
        if (!saveLocal || limit <= 0) {
            return new ArrayList<>();
        }
        List<StitchRecord> result = new ArrayList<>();
        for (Path file : listRecordFiles()) {
            List<StitchRecord> records = readFile(file);
            records.sort(Comparator.comparing(StitchRecord::getTimestamp,
                    Comparator.nullsLast(Comparator.reverseOrder())));
            for (StitchRecord record : records) {
                result.add(record);
                if (result.size() >= limit) {
                    return result;
                }
            }
        }
        return result;
    }

    private Optional<LocalDate> findDateById(String id) {
        if (!Files.exists(idIndexFile)) {
            return Optional.empty();
        }
        try (Stream<String> lines = Files.lines(idIndexFile)) {
            return lines
                    .filter(line -> !line.trim().isEmpty())
                    .map(line -> line.split(","))
                    .filter(parts -> parts.length == 2 && id.equals(parts[0]))
                    .map(parts -> LocalDate.parse(parts[1].trim()))
                    .findFirst();
        } catch (IOException e) {
            logger.warn("Failed to read id index: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 记录文件列表，日期倒序
     */
    private List<Path> listRecordFiles() {
        try (Stream<Path> files = Files.list(recordsDir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".jsonl"))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RuntimeException("Failed to list record files", e);
        }
    }

    private List<StitchRecord> readFile(Path file) {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try (Stream<String> lines = Files.lines(file)) {
            return lines
                    .filter(line -> !line.trim().isEmpty())
                    .map(this::parse)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read records file " + file, e);
        }
    }

    private StitchRecord parse(String line) {
        try {
            return gson.fromJson(line, StitchRecord.class);
        } catch (RuntimeException e) {
            logger.warn("Skipping malformed record line: {}", e.getMessage());
            return null;
        }
    }
}
