package com.arborkernel.domain.model;

import com.arborkernel.application.exceptions.CapabilityException;
import com.arborkernel.application.exceptions.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceUriTest {

    @Test
    void parsesSchemeDomainActionAndPath() {
        ResourceUri uri = ResourceUri.parse("ARBOR://fs/read/docs/reports");

        assertEquals("arbor", uri.getScheme());
        assertEquals("fs", uri.getDomain());
        assertEquals("read", uri.getAction());
        assertEquals(List.of("docs", "reports"), uri.getPath());
        assertEquals("arbor://fs/read/docs/reports", uri.asString());
    }

    @Test
    void rejectsMalformedInput() {
        for (String raw : new String[] {"", "fs/read", "arbor://fs", "arbor://fs/read//x",
            "arbor://fs/read/../etc", "arbor://fs/read/déjà", "arbor://fs/read/a b"}) {
            CapabilityException e = assertThrows(CapabilityException.class, () -> ResourceUri.parse(raw), raw);
            assertEquals(ErrorCode.INVALID_RESOURCE, e.getErrorCode());
        }
        assertFalse(ResourceUri.isValid(null));
    }

    @Test
    void coversOnlyOnSegmentBoundary() {
        ResourceUri docs = ResourceUri.parse("arbor://fs/read/docs");

        assertTrue(docs.covers(ResourceUri.parse("arbor://fs/read/docs")));
        assertTrue(docs.covers(ResourceUri.parse("arbor://fs/read/docs/a/b")));
        assertFalse(docs.covers(ResourceUri.parse("arbor://fs/read/docs2")));
        assertFalse(docs.covers(ResourceUri.parse("arbor://fs/write/docs/a")));
        assertFalse(docs.covers(ResourceUri.parse("arbor://fs/read")));
    }

    @Test
    void pathIsCaseSensitive() {
        assertNotEquals(ResourceUri.parse("arbor://fs/read/Docs"), ResourceUri.parse("arbor://fs/read/docs"));
    }
}
