package com.example.mediasync;

import com.example.mediasync.session.SessionConfig;
import com.example.mediasync.storage.StorageConfig;
import com.example.mediasync.storage.UploadConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ConfigLoader {
    private static final String DEFAULT_DATA_DIRECTORY = "./media_data";
    private static final String DEFAULT_DATABASE_FILE = "media-sync.db";
    private static final int DEFAULT_INSERT_BATCH_SIZE = 50;
    private static final int DEFAULT_MAX_RETRIES = 2;
    private static final int DEFAULT_MIN_TIMEOUT_SECONDS = 30;

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public MediaSyncConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        RawStorage rawStorage = raw.storage == null ? new RawStorage() : raw.storage;
        String bucket = optionalString(rawStorage.bucket, null);
        if (bucket == null) {
            throw new IllegalArgumentException("Config must include storage.bucket.");
        }

        Path dataDirectory = Path.of(optionalString(raw.dataDirectory, DEFAULT_DATA_DIRECTORY));
        List<Path> roots = raw.roots == null
                ? List.of()
                : raw.roots.stream().filter(root -> root != null && !root.isBlank()).map(Path::of).toList();
        String jdbcUrl = raw.database == null ? null : optionalString(raw.database.jdbcUrl, null);
        if (jdbcUrl == null) {
            jdbcUrl = "jdbc:sqlite:" + dataDirectory.resolve(DEFAULT_DATABASE_FILE);
        }
        int insertBatchSize = raw.insertBatchSize != null && raw.insertBatchSize > 0
                ? raw.insertBatchSize
                : DEFAULT_INSERT_BATCH_SIZE;

        StorageConfig storage = new StorageConfig(
                bucket,
                present(rawStorage.region),
                present(rawStorage.endpoint),
                rawStorage.pathStyleAccess != null && rawStorage.pathStyleAccess,
                present(rawStorage.publicBaseUrl)
        );

        return new MediaSyncConfig(
                dataDirectory,
                roots,
                jdbcUrl,
                storage,
                sessionConfig(raw.session),
                uploadConfig(raw.upload),
                insertBatchSize
        );
    }

    private SessionConfig sessionConfig(RawSession raw) {
        SessionConfig defaults = SessionConfig.defaults();
        if (raw == null) {
            return defaults;
        }
        List<String> landmarks = new ArrayList<>();
        if (raw.landmarkSelectors != null) {
            for (String selector : raw.landmarkSelectors) {
                if (selector != null && !selector.isBlank()) {
                    landmarks.add(selector);
                }
            }
        }
        return new SessionConfig(
                optionalString(raw.entryUrl, defaults.entryUrl()),
                optionalString(raw.qrSelector, defaults.qrSelector()),
                landmarks.isEmpty() ? defaults.landmarkSelectors() : List.copyOf(landmarks),
                seconds(raw.qrTimeoutSeconds, defaults.qrTimeout()),
                seconds(raw.pollQrTimeoutSeconds, defaults.pollQrTimeout()),
                seconds(raw.probeTimeoutSeconds, defaults.probeTimeout()),
                defaults.titleMarker(),
                defaults.loginMarker(),
                defaults.readyMarker(),
                defaults.acceptUrlMarker()
        );
    }

    private UploadConfig uploadConfig(RawUpload raw) {
        if (raw == null) {
            return UploadConfig.defaults();
        }
        int maxRetries = raw.maxRetries != null && raw.maxRetries >= 0 ? raw.maxRetries : DEFAULT_MAX_RETRIES;
        Duration minTimeout = seconds(raw.minTimeoutSeconds, Duration.ofSeconds(DEFAULT_MIN_TIMEOUT_SECONDS));
        boolean recordFailures = raw.recordFailures == null || raw.recordFailures;
        return new UploadConfig(maxRetries, minTimeout, recordFailures);
    }

    private Duration seconds(Integer value, Duration fallback) {
        return value != null && value > 0 ? Duration.ofSeconds(value) : fallback;
    }

    private Optional<String> present(String value) {
        return Optional.ofNullable(value).filter(v -> !v.isBlank());
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String dataDirectory;
        public List<String> roots = new ArrayList<>();
        public RawDatabase database;
        public RawStorage storage;
        public RawSession session;
        public RawUpload upload;
        public Integer insertBatchSize;
    }

    private static class RawDatabase {
        public String jdbcUrl;
    }

    private static class RawStorage {
        public String bucket;
        public String region;
        public String endpoint;
        public Boolean pathStyleAccess;
        public String publicBaseUrl;
    }

    private static class RawSession {
        public String entryUrl;
        public String qrSelector;
        public List<String> landmarkSelectors;
        public Integer qrTimeoutSeconds;
        public Integer pollQrTimeoutSeconds;
        public Integer probeTimeoutSeconds;
    }

    private static class RawUpload {
        public Integer maxRetries;
        public Integer minTimeoutSeconds;
        public Boolean recordFailures;
    }
}
