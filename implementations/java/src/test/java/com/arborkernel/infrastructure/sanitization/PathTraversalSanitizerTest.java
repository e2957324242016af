package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.Taint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PathTraversalSanitizerTest {

    @TempDir
    Path tmp;

    private Path root;
    private Path outside;
    private SanitizeOptions options;
    private final PathTraversalSanitizer sanitizer = new PathTraversalSanitizer();

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createDirectories(tmp.resolve("root"));
        outside = Files.createDirectories(tmp.resolve("outside"));
        Files.createDirectories(root.resolve("docs"));
        Files.writeString(root.resolve("docs/a.txt"), "a");
        Files.writeString(outside.resolve("secret.txt"), "s");
        options = SanitizeOptions.builder().allowedRoot(root.toString()).build();
    }

    private String resolve(String candidate) {
        return sanitizer.sanitize(candidate, Taint.untrusted(), options).getValue();
    }

    private ErrorCode failure(String candidate) {
        return assertThrows(SanitizationException.class, () -> resolve(candidate), candidate).getErrorCode();
    }

    @Test
    void resolvesInsideRoot() throws IOException {
        Path realRoot = root.toRealPath();
        assertEquals(realRoot.resolve("docs/a.txt").toString(), resolve("docs/a.txt"));
        assertEquals(realRoot.resolve("docs/new/file.txt").toString(), resolve("docs/new/file.txt"));
        assertEquals(realRoot.resolve("docs/a.txt").toString(), resolve("docs/../docs/a.txt"));
    }

    @Test
    void rejectsEscapes() {
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("../outside/secret.txt"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("docs/../../outside"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure(outside.resolve("secret.txt").toString()));
    }

    @Test
    void rejectsSuspiciousEncodings() {
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("docs/a.txt\0.png"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("docs\\..\\..\\x"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("%2e%2e/outside"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("%252e%252e/outside"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure(""));
    }

    @Test
    void followsSymlinksOutOfRoot() throws IOException {
        Path link = root.resolve("escape");
        try {
            Files.createSymbolicLink(link, outside);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symlinks not supported here");
        }
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("escape/secret.txt"));
        assertEquals(ErrorCode.PATH_TRAVERSAL, failure("escape/not-yet-created.txt"));
    }

    @Test
    void requiresAllowedRoot() {
        SanitizationException e = assertThrows(SanitizationException.class,
            () -> sanitizer.sanitize("docs/a.txt", Taint.untrusted(), SanitizeOptions.defaults()));
        assertEquals(ErrorCode.MISSING_OPTION, e.getErrorCode());
    }

    @Test
    void detectReportsTraversalShapes() {
        Detection detection = sanitizer.detect("../etc/passwd");
        assertFalse(detection.isSafe());
        assertTrue(detection.getPatterns().contains("dot_dot_segment"));
        assertTrue(sanitizer.detect("docs/a.txt").isSafe());
    }
}
