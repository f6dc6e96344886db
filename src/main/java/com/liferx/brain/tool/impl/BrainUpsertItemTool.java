package com.liferx.brain.tool.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.knowledge.BrainItem;
import com.liferx.brain.knowledge.BrainItemArgs;
import com.liferx.brain.knowledge.BrainItemRepository;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolDefinition;
import com.liferx.brain.tool.ToolResponse;
import com.liferx.brain.tool.ToolValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Creates or updates a brain item.
 *
 * With a canonical_key the item for (org, key) is updated in place and its
 * version incremented; without one a new item is always inserted at version 1.
 * This is a write tool: the executor rejects it unless the request allows writes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrainUpsertItemTool implements ToolDefinition<BrainUpsertItemTool.Args> {

    static final double DEFAULT_CONFIDENCE = 0.75;
    static final int MAX_TAGS = 20;
    private static final int MIN_TITLE_LENGTH = 3;
    private static final int MIN_CONTENT_LENGTH = 20;

    private final BrainItemRepository repository;
    private final ObjectMapper objectMapper;

    public record Args(BrainItem.Type type,
                       String title,
                       String contentMd,
                       List<String> tags,
                       double confidenceScore,
                       String canonicalKey,
                       Map<String, Object> metadata) {
    }

    @Override
    public String getName() {
        return "brain.upsert_item";
    }

    @Override
    public String getDescription() {
        return """
                Creates or updates a brain item (decision, SOP, principle, playbook).
                If canonical_key is provided, the existing item with that key is updated and its version bumped.
                Otherwise a new item is created. Only use when the user asks to save or record something.
                """;
    }

    @Override
    public boolean isWrites() {
        return true;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "type", Map.of(
                                "type", "string",
                                "enum", List.of("decision", "sop", "principle", "playbook")
                        ),
                        "title", Map.of(
                                "type", "string",
                                "description", "Short title, at least 3 characters"
                        ),
                        "content_md", Map.of(
                                "type", "string",
                                "description", "Markdown body, at least 20 characters"
                        ),
                        "tags", Map.of(
                                "type", "array",
                                "items", Map.of("type", "string"),
                                "description", "Up to 20 tags"
                        ),
                        "confidence_score", Map.of(
                                "type", "number",
                                "description", "0 to 1, default 0.75"
                        ),
                        "canonical_key", Map.of(
                                "type", "string",
                                "description", "Stable key; reuse it to update the same item"
                        ),
                        "metadata", Map.of("type", "object")
                ),
                "required", List.of("type", "title", "content_md")
        );
    }

    /**
     * Collects every field error before failing, so the model can fix all of
     * them in one retry.
     */
    @Override
    public Args validateArgs(JsonNode raw) throws ToolValidationException {
        JsonNode node = BrainItemArgs.requireObject(raw);
        if (node == null) {
            throw new ToolValidationException("Validation failed: body: Invalid input");
        }
        List<String> errors = new ArrayList<>();

        BrainItem.Type type = null;
        JsonNode t = node.get("type");
        if (t == null || !t.isTextual() || t.asText().isEmpty()) {
            errors.add("type: type is required");
        } else if (!BrainItemArgs.isValidType(t.asText())) {
            errors.add("type: type must be one of: " + BrainItemArgs.TYPE_CHOICES);
        } else {
            type = BrainItem.Type.valueOf(t.asText());
        }

        String title = requiredText(node, "title", MIN_TITLE_LENGTH, errors);
        String content = requiredText(node, "content_md", MIN_CONTENT_LENGTH, errors);

        double confidence = DEFAULT_CONFIDENCE;
        JsonNode c = node.get("confidence_score");
        if (c != null && !c.isNull()) {
            if (!c.isNumber()) {
                errors.add("confidence_score: confidence_score must be a number");
            } else if (c.asDouble() < 0 || c.asDouble() > 1) {
                errors.add("confidence_score: confidence_score must be between 0 and 1");
            } else {
                confidence = c.asDouble();
            }
        }

        List<String> tags = List.of();
        JsonNode tg = node.get("tags");
        if (tg != null && !tg.isNull()) {
            if (!tg.isArray()) {
                errors.add("tags: tags must be an array");
            } else {
                tags = normalizeTags(tg);
                if (tags.size() > MAX_TAGS) {
                    errors.add("tags: maximum 20 tags allowed");
                }
            }
        }

        String canonicalKey = null;
        JsonNode k = node.get("canonical_key");
        if (k != null && !k.isNull()) {
            if (!k.isTextual()) {
                errors.add("canonical_key: canonical_key must be a string");
            } else if (k.asText().trim().isEmpty()) {
                errors.add("canonical_key: canonical_key cannot be empty");
            } else {
                canonicalKey = k.asText().trim();
            }
        }

        Map<String, Object> metadata = Map.of();
        JsonNode m = node.get("metadata");
        if (m != null) {
            if (!m.isObject()) {
                errors.add("metadata: metadata must be an object");
            } else {
                metadata = objectMapper.convertValue(m, new TypeReference<Map<String, Object>>() {});
            }
        }

        if (!errors.isEmpty()) {
            throw new ToolValidationException("Validation failed: " + String.join("; ", errors));
        }
        return new Args(type, title, content, tags, confidence, canonicalKey, metadata);
    }

    @Override
    public ToolResponse run(Args args, ToolContext context) {
        String orgId = context.getOrgId();
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalStateException("org_id is required");
        }

        Optional<BrainItem> existing = args.canonicalKey() == null
                ? Optional.empty()
                : repository.findByOrgIdAndCanonicalKey(orgId, args.canonicalKey());

        BrainItem item = existing.orElseGet(() -> BrainItem.builder()
                .orgId(orgId)
                .canonicalKey(args.canonicalKey())
                .source("agent")
                .status(BrainItem.Status.active)
                .version(0)
                .build());

        item.setType(args.type());
        item.setTitle(args.title());
        item.setContentMd(args.contentMd());
        item.setTags(args.tags());
        item.setConfidenceScore(args.confidenceScore());
        item.setMetadata(args.metadata());
        item.setVersion(item.getVersion() + 1);

        BrainItem saved = repository.save(item);
        boolean isUpdate = saved.getVersion() > 1;
        log.info("brain.upsert_item {} item [{}] v{} [org={}]",
                isUpdate ? "updated" : "created", saved.getId(), saved.getVersion(), orgId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", saved.getId());
        data.put("version", saved.getVersion());

        Map<String, Object> explainability = new LinkedHashMap<>();
        explainability.put("reason", "Brain item persisted for future recall and context");
        explainability.put("confidence_score", args.confidenceScore());
        explainability.put("tags", args.tags());
        explainability.put("type", args.type().name());
        explainability.put("canonical_key", args.canonicalKey());
        explainability.put("is_update", isUpdate);

        return ToolResponse.of(data, explainability);
    }

    private static String requiredText(JsonNode node, String field, int minLength, List<String> errors) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            errors.add(field + ": " + field + " is required");
            return null;
        }
        String trimmed = value.asText().trim();
        if (trimmed.length() < minLength) {
            errors.add(field + ": " + field + " must be at least " + minLength + " characters");
            return null;
        }
        return trimmed;
    }

    /** trim, lower-case, drop empties and non-strings, de-duplicate preserving order */
    static List<String> normalizeTags(JsonNode array) {
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode tag : array) {
            if (!tag.isTextual()) continue;
            String normalized = tag.asText().trim().toLowerCase();
            if (!normalized.isEmpty()) {
                seen.add(normalized);
            }
        }
        return List.copyOf(seen);
    }
}
