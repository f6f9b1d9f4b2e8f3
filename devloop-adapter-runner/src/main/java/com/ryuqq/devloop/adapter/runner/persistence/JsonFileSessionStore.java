package com.ryuqq.devloop.adapter.runner.persistence;

import com.ryuqq.devloop.core.model.SessionId;
import com.ryuqq.devloop.core.outcome.CompletionSummary;
import com.ryuqq.devloop.core.session.SessionRecord;
import com.ryuqq.devloop.core.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 디렉터리 기반 JSON SessionStore.
 *
 * <p>세션마다 {@code <sessionId>.json} 파일 하나와, 완료 시 {@code <sessionId>.summary.json}
 * 파일 하나를 씁니다. 쓰기는 임시 파일 작성 후 이동으로 처리하여 읽는 쪽이 반쯤 쓰인 파일을
 * 보지 않도록 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionStore.class);

    private static final String RECORD_SUFFIX = ".json";
    private static final String SUMMARY_SUFFIX = ".summary.json";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._-]+$");

    private final Path directory;

    public JsonFileSessionStore(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create session directory " + directory, e);
        }
        this.directory = directory;
    }

    @Override
    public void save(SessionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        write(recordPath(record.sessionId()), SessionJson.toJson(record));
    }

    @Override
    public Optional<SessionRecord> find(SessionId sessionId) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        return read(recordPath(sessionId.getValue()), SessionRecord.class);
    }

    @Override
    public List<SessionRecord> list() {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(path -> {
                    String name = path.getFileName().toString();
                    return name.endsWith(RECORD_SUFFIX) && !name.endsWith(SUMMARY_SUFFIX);
                })
                .map(path -> read(path, SessionRecord.class))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(SessionRecord::updatedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list sessions in " + directory, e);
        }
    }

    @Override
    public void saveSummary(SessionId sessionId, CompletionSummary summary) {
        if (sessionId == null || summary == null) {
            throw new IllegalArgumentException("sessionId and summary cannot be null");
        }
        write(summaryPath(sessionId.getValue()), SessionJson.toJson(summary));
    }

    @Override
    public Optional<CompletionSummary> findSummary(SessionId sessionId) {
        return read(summaryPath(sessionId.getValue()), CompletionSummary.class);
    }

    private Path recordPath(String sessionId) {
        return directory.resolve(requireSafe(sessionId) + RECORD_SUFFIX);
    }

    private Path summaryPath(String sessionId) {
        return directory.resolve(requireSafe(sessionId) + SUMMARY_SUFFIX);
    }

    private static String requireSafe(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Session id is not usable as a file name: " + sessionId);
        }
        return sessionId;
    }

    private void write(Path target, String json) {
        try {
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target, e);
        }
    }

    private static <T> Optional<T> read(Path path, Class<T> type) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(SessionJson.fromJson(Files.readString(path, StandardCharsets.UTF_8), type));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }
}
