package com.example.mediasync.scan;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScanRootsTest {
    @Test
    void configuredRootsTakePrecedence() {
        ScanRoots roots = new ScanRoots("Linux", Map.of("HOME", "/home/me"));

        assertEquals(List.of(Path.of("/data/media")), roots.resolve(List.of(Path.of("/data/media"))));
    }

    @Test
    void linuxFallbackUsesHome() {
        ScanRoots roots = new ScanRoots("Linux", Map.of("HOME", "/home/me"));

        assertEquals(List.of(Path.of("/home/me/.config/WhatsApp/Media")), roots.resolve(List.of()));
    }

    @Test
    void macFallbackUsesGroupContainer() {
        ScanRoots roots = new ScanRoots("Mac OS X", Map.of("HOME", "/Users/me", "USER", "me"));

        List<Path> resolved = roots.resolve(null);

        assertEquals(1, resolved.size());
        assertTrue(resolved.get(0).toString().endsWith("group.net.whatsapp.WhatsApp.shared/Message/Media"));
    }

    @Test
    void noEnvironmentMeansNoDefaults() {
        assertTrue(new ScanRoots("Windows 11", Map.of()).defaults().isEmpty());
        assertEquals(1, new ScanRoots("Windows 11", Map.of("USERNAME", "me")).defaults().size());
    }
}
