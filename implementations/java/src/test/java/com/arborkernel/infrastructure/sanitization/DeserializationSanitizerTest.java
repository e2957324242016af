package com.arborkernel.infrastructure.sanitization;

import com.arborkernel.application.exceptions.ErrorCode;
import com.arborkernel.application.exceptions.SanitizationException;
import com.arborkernel.config.KernelProperties;
import com.arborkernel.domain.model.SanitizerKind;
import com.arborkernel.domain.model.Taint;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeserializationSanitizerTest {

    private final DeserializationSanitizer sanitizer = new DeserializationSanitizer(
        new LinkedHashSet<>(new KernelProperties().getSanitizers().getDeserializationAllowlist()));

    private static final SanitizeOptions BINARY = SanitizeOptions.builder()
        .deserializationFormat(SanitizeOptions.DeserializationFormat.BINARY)
        .build();

    static class Gadget implements Serializable {
        private static final long serialVersionUID = 1L;
        String command = "calc";
    }

    private static String nested(int depth) {
        return "[".repeat(depth) + "]".repeat(depth);
    }

    private static String serialize(Object value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    private ErrorCode failure(String value, SanitizeOptions options) {
        return assertThrows(SanitizationException.class,
            () -> sanitizer.sanitize(value, Taint.untrusted(), options)).getErrorCode();
    }

    @Test
    void jsonIsReEmittedCompact() {
        Sanitized result = sanitizer.sanitize("{ \"a\" : [1, 2, {\"b\": null}] }", Taint.untrusted(), null);

        assertEquals("{\"a\":[1,2,{\"b\":null}]}", result.getValue());
        assertTrue(result.getTaint().isSanitizedFor(SanitizerKind.DESERIALIZATION));
    }

    @Test
    void depthAtLimitSucceedsAndOneBeyondFails() {
        assertEquals(nested(32), sanitizer.sanitize(nested(32), Taint.untrusted(), SanitizeOptions.defaults()).getValue());
        assertEquals(ErrorCode.MAX_DEPTH_EXCEEDED, failure(nested(33), SanitizeOptions.defaults()));
    }

    @Test
    void bracketsInsideStringsDoNotCountTowardDepth() {
        String json = "{\"k\":\"" + "[".repeat(100) + "\\\"\"}";
        assertEquals(json, sanitizer.sanitize(json, Taint.untrusted(), SanitizeOptions.defaults()).getValue());
    }

    @Test
    void elementCountIncludesContainers() {
        SanitizeOptions three = SanitizeOptions.builder().maxSize(3).build();

        assertEquals("[1,2]", sanitizer.sanitize("[1,2]", Taint.untrusted(), three).getValue());
        assertEquals(ErrorCode.MAX_SIZE_EXCEEDED, failure("[1,2,3]", three));
    }

    @Test
    void oversizedPayloadIsRejectedBeforeParsing() {
        SanitizeOptions tiny = SanitizeOptions.builder().maxByteSize(8).build();
        assertEquals(ErrorCode.TOO_LARGE, failure("[\"0123456789\"]", tiny));
    }

    @Test
    void malformedOrAmbiguousJsonIsRejected() {
        assertEquals(ErrorCode.JSON_DECODE_ERROR, failure("{bad", SanitizeOptions.defaults()));
        assertEquals(ErrorCode.JSON_DECODE_ERROR, failure("{\"a\":1,\"a\":2}", SanitizeOptions.defaults()));
        assertEquals(ErrorCode.JSON_DECODE_ERROR, failure("", SanitizeOptions.defaults()));
    }

    @Test
    void binaryAllowlistedGraphDecodes() throws IOException {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("a", 1);
        map.put("b", new ArrayList<>(List.of(1L, 2L)));

        Sanitized result = sanitizer.sanitize(serialize(map), Taint.untrusted(), BINARY);

        assertEquals("{\"a\":1,\"b\":[1,2]}", result.getValue());
    }

    @Test
    void binaryClassOutsideAllowlistIsRefused() throws IOException {
        SanitizationException e = assertThrows(SanitizationException.class,
            () -> sanitizer.sanitize(serialize(new Gadget()), Taint.untrusted(), BINARY));

        assertEquals(ErrorCode.UNSAFE_TERM, e.getErrorCode());
        assertEquals(List.of(Gadget.class.getName()), e.getDetails());
    }

    @Test
    void binaryWithCustomAllowlist() throws IOException {
        SanitizeOptions onlyStrings = BINARY.toBuilder()
            .deserializationAllowlist(Set.of("java.lang.String"))
            .build();
        assertEquals(ErrorCode.UNSAFE_TERM, failure(serialize(new ArrayList<>(List.of("x"))), onlyStrings));
    }

    @Test
    void malformedBase64IsUnsafe() {
        assertEquals(ErrorCode.UNSAFE_TERM, failure("!!not base64!!", BINARY));
    }

    @Test
    void detectReportsErrorCode() {
        assertTrue(sanitizer.detect("{\"ok\":true}").isSafe());
        assertEquals(List.of("max_depth_exceeded"), sanitizer.detect(nested(40)).getPatterns());
    }
}
