package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Resolves a user-supplied path inside an allowed root.
 *
 * <p>The root is canonicalized with {@link Path#toRealPath}. For the candidate,
 * the longest prefix that exists on disk is canonicalized too, so a symlink
 * anywhere along an existing prefix is followed before the containment check.
 * The not-yet-existing tail is appended after lexical normalization.
 */
@Slf4j
final class SafePathResolver {

    private static final String[] ENCODED_TRAVERSAL = {"%2e", "%252e", "%2f", "%252f", "%5c", "%255c"};

    private SafePathResolver() {
    }

    static Path resolveWithin(String candidate, String allowedRoot) {
        rejectSuspiciousText(candidate);

        Path root = canonicalRoot(allowedRoot);
        Path target;
        try {
            Path raw = Paths.get(candidate);
            target = (raw.isAbsolute() ? raw : root.resolve(raw)).normalize();
        } catch (InvalidPathException e) {
            throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, "invalid_path");
        }

        Path resolved = followExistingPrefix(target);
        if (!resolved.startsWith(root)) {
            log.warn("Path escapes allowed root: {} -> {}", Encode.forJava(candidate), resolved);
            throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, candidate);
        }
        return resolved;
    }

    private static void rejectSuspiciousText(String candidate) {
        if (candidate.isEmpty()) {
            throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, "empty_path");
        }
        if (candidate.indexOf('\0') >= 0) {
            throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, "null_byte");
        }
        if (candidate.indexOf('\\') >= 0) {
            throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, "backslash");
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (String encoded : ENCODED_TRAVERSAL) {
            if (lower.contains(encoded)) {
                throw SanitizationException.of(ErrorCode.PATH_TRAVERSAL, "encoded_traversal");
            }
        }
    }

    private static Path canonicalRoot(String allowedRoot) {
        try {
            return Paths.get(allowedRoot).toRealPath();
        } catch (IOException | InvalidPathException e) {
            log.error("Allowed root cannot be resolved: {}", allowedRoot, e);
            throw new SanitizationException(ErrorCode.PATH_TRAVERSAL, "Allowed root unavailable: " + allowedRoot, e);
        }
    }

    private static Path followExistingPrefix(Path target) {
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = target;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            return target;
        }
        Path real;
        try {
            real = existing.toRealPath();
        } catch (IOException e) {
            // dangling symlink: its target cannot be proven to stay inside the root
            throw new SanitizationException(ErrorCode.PATH_TRAVERSAL, "Unresolvable path: " + existing, e);
        }
        while (!missing.isEmpty()) {
            real = real.resolve(missing.pop());
        }
        return real.normalize();
    }
}
