package com.tandem.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves a structured entity log (one JSON object per line) whose line merge
 * still left conflict markers, typically because both sides appended records
 * at the end of the file.
 *
 * <p>Every record from clean sections and from both sides of each hunk is
 * collected, then:
 * <ul>
 *   <li>versions sharing uuid and id collapse into the one with the latest
 *       {@code updated_at}; tags, relationships and feedback are unioned</li>
 *   <li>a uuid that appears under several ids keeps its newest id; older ones
 *       become {@code <id>-conflict-<uuid prefix>}</li>
 *   <li>different uuids sharing one id keep the oldest as-is and suffix the
 *       rest with {@code .1}, {@code .2}, ...</li>
 * </ul>
 * Output is sorted by {@code created_at} then {@code id}, one compact object per line.
 */
public class JsonlEntityResolver {

    private static final Logger log = LoggerFactory.getLogger(JsonlEntityResolver.class);

    private static final Comparator<ObjectNode> BY_CREATED =
            Comparator.comparing((ObjectNode n) -> timestamp(n, "created_at"))
                    .thenComparing(n -> text(n, "id"));

    private final ObjectMapper objectMapper;

    public JsonlEntityResolver(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public enum EntityConflictType { SAME_UUID_SAME_ID, SAME_UUID_DIFFERENT_IDS, DIFFERENT_UUIDS }

    /**
     * A collision the resolver had to settle.
     */
    public record EntityConflict(EntityConflictType type, List<String> originalIds,
                                 List<String> resolvedIds, String action) {}

    /**
     * @param content     resolved file content, newline terminated unless empty
     * @param conflicts   collisions settled along the way
     * @param totalInput  records read (malformed lines excluded)
     * @param totalOutput records written
     */
    public record Resolution(String content, List<EntityConflict> conflicts, int totalInput, int totalOutput) {}

    /**
     * @param entities resolved records, sorted
     * @param conflicts collisions settled along the way
     */
    public record ResolvedEntities(List<ObjectNode> entities, List<EntityConflict> conflicts) {}

    public Resolution resolve(String conflictedContent) {
        var entities = new ArrayList<ObjectNode>();
        var malformed = new ArrayList<String>();
        for (ConflictSection section : ConflictMarkerParser.parse(conflictedContent)) {
            if (section.isConflict()) {
                section.ours().forEach(line -> collect(line, entities, malformed));
                section.theirs().forEach(line -> collect(line, entities, malformed));
            } else {
                section.lines().forEach(line -> collect(line, entities, malformed));
            }
        }

        ResolvedEntities resolved = resolveEntities(entities);
        var out = new StringBuilder();
        for (ObjectNode entity : resolved.entities()) {
            out.append(write(entity)).append('\n');
        }
        for (String line : malformed) {
            out.append(line).append('\n');
        }
        log.info("Resolved {} record(s) into {} ({} collision(s), {} malformed line(s) kept)",
                entities.size(), resolved.entities().size(), resolved.conflicts().size(), malformed.size());
        return new Resolution(out.toString(), resolved.conflicts(), entities.size(), resolved.entities().size());
    }

    public ResolvedEntities resolveEntities(List<ObjectNode> input) {
        var conflicts = new ArrayList<EntityConflict>();

        Map<String, List<ObjectNode>> byUuid = new LinkedHashMap<>();
        for (ObjectNode entity : input) {
            String key = text(entity, "uuid");
            if (key.isEmpty()) {
                key = "id:" + text(entity, "id");
            }
            byUuid.computeIfAbsent(key, k -> new ArrayList<>()).add(entity.deepCopy());
        }

        var merged = new ArrayList<ObjectNode>();
        for (List<ObjectNode> versions : byUuid.values()) {
            Map<String, List<ObjectNode>> byId = new LinkedHashMap<>();
            for (ObjectNode version : versions) {
                byId.computeIfAbsent(text(version, "id"), k -> new ArrayList<>()).add(version);
            }

            var perId = new ArrayList<ObjectNode>();
            for (Map.Entry<String, List<ObjectNode>> group : byId.entrySet()) {
                List<ObjectNode> same = group.getValue();
                if (same.size() > 1) {
                    conflicts.add(new EntityConflict(EntityConflictType.SAME_UUID_SAME_ID,
                            List.of(group.getKey()), List.of(group.getKey()),
                            "merged " + same.size() + " versions"));
                }
                perId.add(same.size() == 1 ? same.get(0) : mergeVersions(same));
            }

            if (perId.size() > 1) {
                perId.sort(Comparator.comparing((ObjectNode n) -> timestamp(n, "updated_at")));
                for (ObjectNode older : perId.subList(0, perId.size() - 1)) {
                    String originalId = text(older, "id");
                    String uuid = text(older, "uuid");
                    String renamed = originalId + "-conflict-" + uuid.substring(0, Math.min(8, uuid.length()));
                    older.put("id", renamed);
                    conflicts.add(new EntityConflict(EntityConflictType.SAME_UUID_DIFFERENT_IDS,
                            List.of(originalId), List.of(renamed), "renamed older id"));
                }
            }
            merged.addAll(perId);
        }

        merged.sort(BY_CREATED);
        Map<String, List<ObjectNode>> byId = new LinkedHashMap<>();
        for (ObjectNode entity : merged) {
            byId.computeIfAbsent(text(entity, "id"), k -> new ArrayList<>()).add(entity);
        }
        for (Map.Entry<String, List<ObjectNode>> group : byId.entrySet()) {
            List<ObjectNode> sharing = group.getValue();
            for (int i = 1; i < sharing.size(); i++) {
                String renamed = group.getKey() + "." + i;
                sharing.get(i).put("id", renamed);
                conflicts.add(new EntityConflict(EntityConflictType.DIFFERENT_UUIDS,
                        List.of(group.getKey()), List.of(renamed), "suffixed colliding id"));
            }
        }
        merged.sort(BY_CREATED);
        return new ResolvedEntities(merged, conflicts);
    }

    /**
     * Collapses versions of one entity. The most recently updated version is the
     * base; tags, relationships and feedback from every version are unioned.
     */
    public ObjectNode mergeVersions(List<ObjectNode> versions) {
        ObjectNode latest = versions.stream()
                .max(Comparator.comparing((ObjectNode n) -> timestamp(n, "updated_at")))
                .orElseThrow();
        ObjectNode result = latest.deepCopy();

        Set<String> tags = new LinkedHashSet<>();
        Map<String, JsonNode> relationships = new LinkedHashMap<>();
        Map<String, JsonNode> feedback = new LinkedHashMap<>();
        boolean hasTags = false;
        boolean hasRelationships = false;
        boolean hasFeedback = false;
        for (ObjectNode version : versions) {
            if (version.get("tags") instanceof ArrayNode array) {
                hasTags = true;
                array.forEach(tag -> tags.add(tag.asText()));
            }
            if (version.get("relationships") instanceof ArrayNode array) {
                hasRelationships = true;
                array.forEach(rel -> relationships.putIfAbsent(text(rel, "from") + "|" + text(rel, "to")
                        + "|" + text(rel, "type"), rel));
            }
            if (version.get("feedback") instanceof ArrayNode array) {
                hasFeedback = true;
                array.forEach(fb -> feedback.put(text(fb, "id"), fb));
            }
        }
        if (hasTags) {
            ArrayNode array = result.putArray("tags");
            tags.forEach(array::add);
        }
        if (hasRelationships) {
            result.putArray("relationships").addAll(relationships.values());
        }
        if (hasFeedback) {
            result.putArray("feedback").addAll(feedback.values());
        }
        return result;
    }

    private void collect(String line, List<ObjectNode> entities, List<String> malformed) {
        if (line.isBlank()) {
            return;
        }
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node instanceof ObjectNode object) {
                entities.add(object);
                return;
            }
        } catch (JsonProcessingException e) {
            log.debug("Unparseable line: {}", e.getOriginalMessage());
        }
        log.warn("Keeping malformed structured-log line verbatim: {}", line);
        malformed.add(line);
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize record " + text(node, "id"), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    /**
     * Parses ISO-8601 timestamps, also accepting a space instead of {@code T}
     * and a missing offset (read as UTC). Missing or unreadable values sort first.
     */
    static Instant timestamp(JsonNode node, String field) {
        String raw = text(node, field).strip();
        if (raw.isEmpty()) {
            return Instant.EPOCH;
        }
        String iso = raw.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(iso + "Z");
            } catch (DateTimeParseException again) {
                log.debug("Unreadable timestamp '{}' in field {}", raw, field);
                return Instant.EPOCH;
            }
        }
    }
}
