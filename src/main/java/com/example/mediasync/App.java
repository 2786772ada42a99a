package com.example.mediasync;

import com.example.mediasync.metadata.FileQuery;
import com.example.mediasync.metadata.MetadataStore;
import com.example.mediasync.metadata.SyncStatus;
import com.example.mediasync.metadata.jdbi.JdbiMetadataStore;
import com.example.mediasync.metadata.jdbi.MetadataDatabase;
import com.example.mediasync.session.RendererFactory;
import com.example.mediasync.storage.ObjectStore;
import com.example.mediasync.storage.S3ObjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);
    private static final String USAGE =
            "Usage: java -jar media-sync.jar <config.json> <command> [owner|sessionId] [args...]\n"
                    + "Commands: scan, sync, list, missing, stats, delete, verify, remediate, reconcile, import, url,\n"
                    + "          session-start, session-poll, session-close";
    private static final String IDENTITY_FLAG = "--identity=";

    private App() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length < 3) {
            LOGGER.error(USAGE);
            System.exit(2);
        }
        Path configPath = Path.of(args[0]);
        String command = args[1];
        String subject = args[2];
        List<String> rest = Arrays.asList(args).subList(3, args.length);

        MediaSyncConfig config = new ConfigLoader().load(configPath);
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);

        MetadataStore store = new JdbiMetadataStore(MetadataDatabase.open(config.jdbcUrl()));
        ObjectStore objectStore = new S3ObjectStore(config.storage());
        // No browser driver ships with this build; session commands report the capability as unavailable.
        RendererFactory renderers = RendererFactory.unavailable("No browser automation driver is configured");
        MediaSyncService service = new MediaSyncService(config, store, objectStore, renderers, Clock.systemUTC());
        Thread shutdownHook = new Thread(service::close, "media-sync-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        int exitCode = 0;
        try {
            Object result = run(service, command, subject, rest);
            System.out.println(mapper.writeValueAsString(result));
        } catch (MediaSyncException ex) {
            LOGGER.warn("{} failed: {}", command, ex.getMessage());
            System.out.println(mapper.writeValueAsString(ex.toError()));
            exitCode = 1;
        } catch (IllegalArgumentException ex) {
            LOGGER.error(USAGE);
            System.out.println(mapper.writeValueAsString(
                    new OperationError(ErrorKind.INVALID_REQUEST, ex.getMessage(), subject)));
            exitCode = 2;
        } finally {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
            service.close();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static Object run(MediaSyncService service, String command, String subject, List<String> args) {
        if ("scan".equals(command)) {
            return service.triggerScan(subject);
        }
        if ("sync".equals(command)) {
            return service.triggerSync(subject, intArg(args, 0, 1000));
        }
        if ("list".equals(command)) {
            FileQuery query = FileQuery.forOwner(subject);
            if (!args.isEmpty() && !"all".equals(args.get(0))) {
                query = query.withStatus(SyncStatus.fromWire(args.get(0)));
            }
            return service.listFiles(query, intArg(args, 1, 100), intArg(args, 2, 0));
        }
        if ("missing".equals(command)) {
            return service.getMissingFiles(subject, intArg(args, 0, 100));
        }
        if ("stats".equals(command)) {
            return service.getFileStats(subject);
        }
        if ("delete".equals(command)) {
            return service.deleteFile(subject, requiredArg(args, 0, "fileId"));
        }
        if ("verify".equals(command)) {
            return service.verifyStorage(subject);
        }
        if ("remediate".equals(command)) {
            return service.remediateMissing(subject);
        }
        if ("reconcile".equals(command)) {
            return service.reconcileIdentities(subject);
        }
        if ("import".equals(command)) {
            String identity = null;
            List<Path> files = new ArrayList<>();
            for (String arg : args) {
                if (arg.startsWith(IDENTITY_FLAG)) {
                    identity = arg.substring(IDENTITY_FLAG.length());
                } else {
                    files.add(Path.of(arg));
                }
            }
            return service.importFiles(subject, files, identity);
        }
        if ("url".equals(command)) {
            return service.getFileUrl(subject, requiredArg(args, 0, "fileId"));
        }
        if ("session-start".equals(command)) {
            return service.startSession(subject, args.isEmpty() ? null : args.get(0));
        }
        if ("session-poll".equals(command)) {
            return service.pollSession(subject);
        }
        if ("session-close".equals(command)) {
            return service.closeSession(subject);
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }

    private static int intArg(List<String> args, int index, int fallback) {
        if (args.size() <= index) {
            return fallback;
        }
        try {
            return Integer.parseInt(args.get(index));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Expected a number but got " + args.get(index), ex);
        }
    }

    private static String requiredArg(List<String> args, int index, String name) {
        if (args.size() <= index) {
            throw new IllegalArgumentException("Missing argument: " + name);
        }
        return args.get(index);
    }
}
