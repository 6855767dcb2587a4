package com.shiplock.remote.northflank;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shiplock.core.model.BuildHandle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NorthflankResponsesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void unwrapAcceptsBothShapes() throws Exception {
        assertEquals("x", NorthflankResponses.unwrap(json("{\"data\":{\"id\":\"x\"}}")).get("id").asText());
        assertEquals("x", NorthflankResponses.unwrap(json("{\"id\":\"x\"}")).get("id").asText());
    }

    @Test
    void buildIdIgnoresNonTextualIds() throws Exception {
        assertEquals("", NorthflankResponses.buildId(json("{\"data\":{\"id\":42}}")));
        assertEquals("", NorthflankResponses.buildId(json("{}")));
        assertEquals("b1", NorthflankResponses.buildId(json("{\"id\":\" b1 \"}")));
    }

    @Test
    void buildsSkipsEntriesWithoutId() throws Exception {
        var builds = NorthflankResponses.builds(json(
                "{\"builds\":[{\"status\":\"SUCCESS\"},{\"id\":\"b2\",\"status\":null}]}"));

        assertEquals(1, builds.size());
        assertEquals("b2", builds.get(0).handle().id());
        assertEquals("", builds.get(0).rawStatus());
    }

    @Test
    void paddedListingIdStillMatchesSubmittedHandle() throws Exception {
        var handle = new BuildHandle(NorthflankResponses.buildId(json("{\"data\":{\"id\":\"b7\"}}")));
        var builds = NorthflankResponses.builds(json(
                "{\"data\":{\"builds\":[{\"id\":\" b7 \",\"status\":\"SUCCESS\"}]}}"));

        assertEquals(1, builds.size());
        assertTrue(builds.get(0).matches(handle));
    }

    @Test
    void missingBuildsArrayIsEmptyList() throws Exception {
        assertTrue(NorthflankResponses.builds(json("{\"data\":{}}")).isEmpty());
    }

    @Test
    void deployedRevisionToleratesMissingInternal() throws Exception {
        assertEquals("", NorthflankResponses.deployedRevision(json("{\"data\":{}}")));
        assertEquals("abc", NorthflankResponses.deployedRevision(json("{\"internal\":{\"deployedSHA\":\"abc\"}}")));
    }
}
