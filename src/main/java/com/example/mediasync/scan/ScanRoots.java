package com.example.mediasync.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Candidate media directories for the messaging desktop client.
 */
public final class ScanRoots {
    private final String osName;
    private final Map<String, String> environment;

    public ScanRoots(String osName, Map<String, String> environment) {
        this.osName = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        this.environment = environment;
    }

    public static ScanRoots forCurrentSystem() {
        return new ScanRoots(System.getProperty("os.name"), System.getenv());
    }

    /**
     * Configured roots take precedence. Without them the client's default media directories are used.
     */
    public List<Path> resolve(List<Path> configured) {
        if (configured != null && !configured.isEmpty()) {
            return List.copyOf(configured);
        }
        return defaults();
    }

    public List<Path> defaults() {
        List<Path> roots = new ArrayList<>();
        if (osName.contains("mac") || osName.contains("darwin")) {
            String home = environment.get("HOME");
            if (notBlank(home)) {
                roots.add(Path.of(home, "Library", "Group Containers",
                        "group.net.whatsapp.WhatsApp.shared", "Message", "Media"));
            }
            String user = environment.get("USER");
            if (notBlank(user)) {
                Path userPath = Path.of("/Users", user, "Library", "Group Containers",
                        "group.net.whatsapp.WhatsApp.shared", "Message", "Media");
                if (!roots.contains(userPath)) {
                    roots.add(userPath);
                }
            }
        } else if (osName.contains("win")) {
            String username = environment.get("USERNAME");
            if (notBlank(username)) {
                roots.add(Path.of("C:\\Users\\" + username + "\\AppData\\Local\\WhatsApp\\Media"));
            }
        } else {
            String home = environment.get("HOME");
            if (notBlank(home)) {
                roots.add(Path.of(home, ".config", "WhatsApp", "Media"));
            }
        }
        return roots;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
