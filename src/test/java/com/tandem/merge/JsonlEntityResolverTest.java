package com.tandem.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tandem.merge.JsonlEntityResolver.EntityConflictType;
import com.tandem.merge.JsonlEntityResolver.Resolution;
import com.tandem.merge.JsonlEntityResolver.ResolvedEntities;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlEntityResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonlEntityResolver resolver = new JsonlEntityResolver(mapper);

    private ObjectNode entity(String id, String uuid, String createdAt, String updatedAt) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", id);
        node.put("uuid", uuid);
        node.put("title", "title of " + id);
        node.put("created_at", createdAt);
        node.put("updated_at", updatedAt);
        return node;
    }

    private List<JsonNode> lines(String content) throws Exception {
        var nodes = new ArrayList<JsonNode>();
        for (String line : content.split("\n")) {
            nodes.add(mapper.readTree(line));
        }
        return nodes;
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("keeps records appended on both sides of a hunk, sorted by creation time")
        void keepsBothAppends() throws Exception {
            String content = """
                    {"id":"ISS-1","uuid":"aaaa1111","created_at":"2024-01-01T00:00:00Z","updated_at":"2024-01-01T00:00:00Z"}
                    <<<<<<< ours
                    {"id":"ISS-3","uuid":"cccc3333","created_at":"2024-01-03T00:00:00Z","updated_at":"2024-01-03T00:00:00Z"}
                    =======
                    {"id":"ISS-2","uuid":"bbbb2222","created_at":"2024-01-02T00:00:00Z","updated_at":"2024-01-02T00:00:00Z"}
                    >>>>>>> theirs
                    """;

            Resolution resolution = resolver.resolve(content);

            assertFalse(ConflictMarkerParser.hasConflictMarkers(resolution.content()));
            assertTrue(resolution.content().endsWith("\n"));
            assertEquals(List.of("ISS-1", "ISS-2", "ISS-3"),
                    lines(resolution.content()).stream().map(n -> n.get("id").asText()).toList());
            assertEquals(3, resolution.totalInput());
            assertEquals(3, resolution.totalOutput());
            assertTrue(resolution.conflicts().isEmpty());
        }

        @Test
        @DisplayName("collapses the same record edited on both sides")
        void collapsesSameRecord() throws Exception {
            String content = """
                    <<<<<<< ours
                    {"id":"ISS-1","uuid":"aaaa1111","status":"open","tags":["a"],"created_at":"2024-01-01T00:00:00Z","updated_at":"2024-01-02T00:00:00Z"}
                    =======
                    {"id":"ISS-1","uuid":"aaaa1111","status":"closed","tags":["b"],"created_at":"2024-01-01T00:00:00Z","updated_at":"2024-01-03T00:00:00Z"}
                    >>>>>>> theirs
                    """;

            Resolution resolution = resolver.resolve(content);

            List<JsonNode> out = lines(resolution.content());
            assertEquals(1, out.size());
            assertEquals("closed", out.get(0).get("status").asText());
            assertEquals(2, out.get(0).get("tags").size());
            assertEquals(EntityConflictType.SAME_UUID_SAME_ID, resolution.conflicts().get(0).type());
        }

        @Test
        @DisplayName("keeps malformed lines verbatim after the records")
        void keepsMalformedLines() {
            String content = """
                    {"id":"ISS-1","uuid":"aaaa1111","created_at":"2024-01-01T00:00:00Z"}
                    <<<<<<< ours
                    not json at all
                    =======
                    [1,2,3]
                    >>>>>>> theirs
                    """;

            Resolution resolution = resolver.resolve(content);

            String[] out = resolution.content().split("\n");
            assertEquals(3, out.length);
            assertTrue(out[0].contains("ISS-1"));
            assertEquals("not json at all", out[1]);
            assertEquals("[1,2,3]", out[2]);
            assertEquals(1, resolution.totalInput());
        }

        @Test
        @DisplayName("empty input resolves to empty output")
        void emptyInput() {
            Resolution resolution = resolver.resolve("");

            assertEquals("", resolution.content());
            assertEquals(0, resolution.totalOutput());
        }
    }

    @Nested
    @DisplayName("resolveEntities")
    class ResolveEntitiesTests {

        @Test
        @DisplayName("a uuid seen under two ids keeps the newest id and renames the older")
        void renamesOlderIdForSameUuid() {
            var older = entity("ISS-1", "abcdef1234567890", "2024-01-01T00:00:00Z", "2024-01-01T00:00:00Z");
            var newer = entity("ISS-9", "abcdef1234567890", "2024-01-01T00:00:00Z", "2024-02-01T00:00:00Z");

            ResolvedEntities resolved = resolver.resolveEntities(List.of(older, newer));

            List<String> ids = resolved.entities().stream().map(n -> n.get("id").asText()).toList();
            assertTrue(ids.contains("ISS-9"));
            assertTrue(ids.contains("ISS-1-conflict-abcdef12"));
            assertEquals(EntityConflictType.SAME_UUID_DIFFERENT_IDS, resolved.conflicts().get(0).type());
        }

        @Test
        @DisplayName("different uuids sharing an id keep the oldest and suffix the rest")
        void suffixesCollidingIds() {
            var first = entity("ISS-1", "uuid-one", "2024-01-01T00:00:00Z", "2024-01-01T00:00:00Z");
            var second = entity("ISS-1", "uuid-two", "2024-01-02T00:00:00Z", "2024-01-02T00:00:00Z");
            var third = entity("ISS-1", "uuid-three", "2024-01-03T00:00:00Z", "2024-01-03T00:00:00Z");

            ResolvedEntities resolved = resolver.resolveEntities(List.of(third, first, second));

            assertEquals(List.of("ISS-1", "ISS-1.1", "ISS-1.2"),
                    resolved.entities().stream().map(n -> n.get("id").asText()).toList());
            assertEquals("uuid-one", resolved.entities().get(0).get("uuid").asText());
            assertEquals(2, resolved.conflicts().stream()
                    .filter(c -> c.type() == EntityConflictType.DIFFERENT_UUIDS).count());
        }

        @Test
        @DisplayName("does not modify the caller's nodes")
        void leavesInputUntouched() {
            var first = entity("ISS-1", "uuid-one", "2024-01-01T00:00:00Z", "2024-01-01T00:00:00Z");
            var second = entity("ISS-1", "uuid-two", "2024-01-02T00:00:00Z", "2024-01-02T00:00:00Z");

            resolver.resolveEntities(List.of(first, second));

            assertEquals("ISS-1", second.get("id").asText());
        }
    }

    @Nested
    @DisplayName("mergeVersions")
    class MergeVersionsTests {

        @Test
        @DisplayName("unions relationships and feedback across versions")
        void unionsCollections() throws Exception {
            var a = (ObjectNode) mapper.readTree("""
                    {"id":"ISS-1","updated_at":"2024-01-01T00:00:00Z",
                     "relationships":[{"from":"ISS-1","to":"ISS-2","type":"blocks"}],
                     "feedback":[{"id":"f1","text":"old"}]}
                    """);
            var b = (ObjectNode) mapper.readTree("""
                    {"id":"ISS-1","updated_at":"2024-01-05T00:00:00Z",
                     "relationships":[{"from":"ISS-1","to":"ISS-2","type":"blocks"},
                                      {"from":"ISS-1","to":"ISS-3","type":"relates"}],
                     "feedback":[{"id":"f1","text":"new"},{"id":"f2","text":"more"}]}
                    """);

            ObjectNode merged = resolver.mergeVersions(List.of(a, b));

            assertEquals("2024-01-05T00:00:00Z", merged.get("updated_at").asText());
            assertEquals(2, merged.get("relationships").size());
            assertEquals(2, merged.get("feedback").size());
            assertEquals("new", merged.get("feedback").get(0).get("text").asText());
        }
    }

    @Test
    @DisplayName("timestamps accept a space separator and a missing offset")
    void parsesLenientTimestamps() {
        ObjectNode node = mapper.createObjectNode();
        node.put("a", "2024-03-01 10:00:00");
        node.put("b", "2024-03-01T10:00:00+02:00");
        node.put("c", "garbage");

        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), JsonlEntityResolver.timestamp(node, "a"));
        assertEquals(Instant.parse("2024-03-01T08:00:00Z"), JsonlEntityResolver.timestamp(node, "b"));
        assertEquals(Instant.EPOCH, JsonlEntityResolver.timestamp(node, "c"));
        assertEquals(Instant.EPOCH, JsonlEntityResolver.timestamp(node, "missing"));
    }
}
