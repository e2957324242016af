package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Base64;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded decoding of untrusted structured payloads.
 *
 * <p>JSON payloads are size-checked, depth-checked on the raw text before any
 * parsing, decoded with field-name interning disabled (so hostile keys cannot
 * grow the JVM string table), then element-counted. The result is re-emitted
 * as compact JSON.
 *
 * <p>Binary payloads are Base64 Java serialization streams read behind an
 * {@link ObjectInputFilter} allowlist; any class outside it is refused before
 * it is instantiated.
 */
@Slf4j
public class DeserializationSanitizer implements Sanitizer {

    private final ObjectMapper mapper;
    private final Set<String> defaultAllowlist;

    public DeserializationSanitizer(Set<String> defaultAllowlist) {
        this.defaultAllowlist = Set.copyOf(defaultAllowlist);
        JsonFactory factory = JsonFactory.builder()
            .disable(JsonFactory.Feature.INTERN_FIELD_NAMES)
            .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
            .build();
        this.mapper = JsonMapper.builder(factory)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    @Override
    public SanitizerKind kind() {
        return SanitizerKind.DESERIALIZATION;
    }

    @Override
    public Sanitized sanitize(String value, Taint taint, SanitizeOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(taint, "taint must not be null");
        SanitizeOptions opts = options == null ? SanitizeOptions.defaults() : options;

        String result = opts.getDeserializationFormat() == SanitizeOptions.DeserializationFormat.BINARY
            ? decodeBinary(value, opts)
            : decodeJson(value, opts);
        return new Sanitized(result, taint.withSanitization(SanitizerKind.DESERIALIZATION));
    }

    @Override
    public Detection detect(String value) {
        Objects.requireNonNull(value, "value must not be null");
        SanitizeOptions defaults = SanitizeOptions.defaults();
        try {
            decodeJson(value, defaults);
            return Detection.safe(1.0);
        } catch (SanitizationException e) {
            return Detection.unsafe(List.of(e.getErrorCode().code()));
        }
    }

    private String decodeJson(String value, SanitizeOptions opts) {
        if (value.getBytes(StandardCharsets.UTF_8).length > opts.getMaxByteSize()) {
            throw SanitizationException.of(ErrorCode.TOO_LARGE, String.valueOf(opts.getMaxByteSize()));
        }
        int depth = nestingDepth(value);
        if (depth > opts.getMaxDepth()) {
            log.warn("JSON payload nesting {} exceeds limit {}", depth, opts.getMaxDepth());
            throw SanitizationException.of(ErrorCode.MAX_DEPTH_EXCEEDED, String.valueOf(opts.getMaxDepth()));
        }

        JsonNode tree;
        try {
            tree = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new SanitizationException(ErrorCode.JSON_DECODE_ERROR,
                "Malformed JSON: " + e.getOriginalMessage(), List.of(e.getOriginalMessage()));
        }
        if (tree == null || tree.isMissingNode()) {
            throw SanitizationException.of(ErrorCode.JSON_DECODE_ERROR, "empty document");
        }

        long elements = countElements(tree, opts.getMaxSize());
        if (elements > opts.getMaxSize()) {
            log.warn("JSON payload exceeds element limit {}", opts.getMaxSize());
            throw SanitizationException.of(ErrorCode.MAX_SIZE_EXCEEDED, String.valueOf(opts.getMaxSize()));
        }
        try {
            return mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new SanitizationException(ErrorCode.JSON_DECODE_ERROR, "Re-encoding failed", e);
        }
    }

    /**
     * Maximum container nesting in raw JSON text; brackets inside strings are ignored.
     * A scalar has depth 0, {@code []} depth 1.
     */
    static int nestingDepth(String json) {
        int depth = 0;
        int max = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '[' || c == '{') {
                depth++;
                max = Math.max(max, depth);
            } else if (c == ']' || c == '}') {
                depth--;
            }
        }
        return max;
    }

    /**
     * Counts every value in the document, containers included, stopping once
     * {@code limit} is passed.
     */
    static long countElements(JsonNode root, int limit) {
        long count = 0;
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            count++;
            if (count > limit) {
                return count;
            }
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                pending.push(children.next());
            }
        }
        return count;
    }

    private String decodeBinary(String value, SanitizeOptions opts) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw SanitizationException.of(ErrorCode.UNSAFE_TERM, "malformed_base64");
        }
        if (bytes.length > opts.getMaxByteSize()) {
            throw SanitizationException.of(ErrorCode.TOO_LARGE, String.valueOf(opts.getMaxByteSize()));
        }

        Set<String> allowlist = opts.getDeserializationAllowlist() != null
            ? opts.getDeserializationAllowlist()
            : defaultAllowlist;
        AllowlistFilter filter = new AllowlistFilter(allowlist, opts.getMaxDepth(), opts.getMaxSize());

        Object decoded;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            in.setObjectInputFilter(filter);
            decoded = in.readObject();
        } catch (InvalidClassException e) {
            throw filter.rejection();
        } catch (IOException | ClassNotFoundException e) {
            if (filter.rejected != null) {
                throw filter.rejection();
            }
            throw new SanitizationException(ErrorCode.UNSAFE_TERM, "Unreadable serialization stream", e);
        }
        try {
            return mapper.writeValueAsString(decoded);
        } catch (JsonProcessingException e) {
            throw new SanitizationException(ErrorCode.UNSAFE_TERM, "Decoded value is not representable", e);
        }
    }

    /**
     * Remembers why it rejected so the caller can report a typed error.
     */
    private static final class AllowlistFilter implements ObjectInputFilter {

        private final Set<String> allowlist;
        private final int maxDepth;
        private final int maxSize;
        private SanitizationException rejected;

        AllowlistFilter(Set<String> allowlist, int maxDepth, int maxSize) {
            this.allowlist = allowlist;
            this.maxDepth = maxDepth;
            this.maxSize = maxSize;
        }

        @Override
        public Status checkInput(FilterInfo info) {
            if (info.depth() > maxDepth) {
                return reject(SanitizationException.of(ErrorCode.MAX_DEPTH_EXCEEDED, String.valueOf(maxDepth)));
            }
            if (info.references() > maxSize || info.arrayLength() > maxSize) {
                return reject(SanitizationException.of(ErrorCode.MAX_SIZE_EXCEEDED, String.valueOf(maxSize)));
            }
            Class<?> type = info.serialClass();
            if (type == null) {
                return Status.UNDECIDED;
            }
            while (type.isArray()) {
                type = type.getComponentType();
            }
            if (type.isPrimitive() || isAllowed(type.getName())) {
                return Status.ALLOWED;
            }
            log.warn("Refusing to deserialize class {}", Encode.forJava(type.getName()));
            return reject(SanitizationException.of(ErrorCode.UNSAFE_TERM, type.getName()));
        }

        private boolean isAllowed(String className) {
            if (allowlist.contains(className)) {
                return true;
            }
            for (String entry : allowlist) {
                if (entry.endsWith(".*")
                        && className.startsWith(entry.substring(0, entry.length() - 1))
                        && className.indexOf('.', entry.length() - 1) < 0) {
                    return true;
                }
            }
            return false;
        }

        private Status reject(SanitizationException reason) {
            if (rejected == null) {
                rejected = reason;
            }
            return Status.REJECTED;
        }

        SanitizationException rejection() {
            return rejected != null
                ? rejected
                : SanitizationException.of(ErrorCode.UNSAFE_TERM, "rejected_by_filter");
        }
    }
}
