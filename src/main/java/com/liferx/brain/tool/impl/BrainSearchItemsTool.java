package com.liferx.brain.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.liferx.brain.knowledge.BrainItem;
import com.liferx.brain.knowledge.BrainItemArgs;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolDefinition;
import com.liferx.brain.tool.ToolResponse;
import com.liferx.brain.tool.ToolValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Read-only search over the organisation's brain items.
 *
 * Filters are all optional and combined with AND:
 * - query: case-insensitive substring of title or content
 * - type:  exact item type
 * - tag:   items carrying the (lower-cased) tag
 * Only active items are returned, most recently updated first.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BrainSearchItemsTool implements ToolDefinition<BrainSearchItemsTool.Args> {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;
    static final int EXCERPT_LENGTH = 200;
    private static final int EXCERPT_BEFORE = 50;
    private static final int EXCERPT_AFTER = 150;

    private final MongoTemplate mongoTemplate;

    public record Args(String query, String type, String tag, Integer limit) {
        int effectiveLimit() {
            return limit != null ? limit : DEFAULT_LIMIT;
        }
    }

    @Override
    public String getName() {
        return "brain.search_items";
    }

    @Override
    public String getDescription() {
        return """
                Searches brain items (decisions, SOPs, principles, playbooks) with optional filters.
                Supports free-text query on title and content, a type filter and a tag filter.
                Use this before answering questions about how the organisation works or what was decided.
                """;
    }

    @Override
    public boolean isWrites() {
        return false;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "Text to look for in item titles and content"
                        ),
                        "type", Map.of(
                                "type", "string",
                                "enum", List.of("decision", "sop", "principle", "playbook"),
                                "description", "Restrict results to one item type"
                        ),
                        "tag", Map.of(
                                "type", "string",
                                "description", "Restrict results to items with this tag"
                        ),
                        "limit", Map.of(
                                "type", "integer",
                                "description", "Max results (default 20, max 100)"
                        )
                ),
                "required", List.of()
        );
    }

    @Override
    public Args validateArgs(JsonNode raw) throws ToolValidationException {
        JsonNode node = BrainItemArgs.requireObject(raw);
        if (node == null) {
            return new Args(null, null, null, null);
        }

        String query = null;
        if (!BrainItemArgs.absent(node, "query")) {
            if (!node.get("query").isTextual()) {
                throw new ToolValidationException("query must be a string");
            }
            query = blankToNull(node.get("query").asText().trim());
        }

        String type = null;
        if (!BrainItemArgs.absent(node, "type")) {
            JsonNode t = node.get("type");
            if (!t.isTextual() || !BrainItemArgs.isValidType(t.asText())) {
                throw new ToolValidationException("type must be one of: " + BrainItemArgs.TYPE_CHOICES);
            }
            type = t.asText();
        }

        String tag = null;
        if (!BrainItemArgs.absent(node, "tag")) {
            if (!node.get("tag").isTextual()) {
                throw new ToolValidationException("tag must be a string");
            }
            tag = blankToNull(node.get("tag").asText().trim().toLowerCase());
        }

        Integer limit = null;
        if (!BrainItemArgs.absent(node, "limit")) {
            JsonNode l = node.get("limit");
            if (!l.isIntegralNumber() || l.asLong() < 1) {
                throw new ToolValidationException("limit must be a positive integer");
            }
            limit = (int) Math.min(l.asLong(), MAX_LIMIT);
        }

        return new Args(query, type, tag, limit);
    }

    @Override
    public ToolResponse run(Args args, ToolContext context) {
        String orgId = context.getOrgId();
        if (orgId == null || orgId.isBlank()) {
            throw new IllegalStateException("org_id is required");
        }

        Criteria criteria = Criteria.where("orgId").is(orgId)
                .and("status").is(BrainItem.Status.active);
        if (args.type() != null) {
            criteria = criteria.and("type").is(args.type());
        }
        if (args.tag() != null) {
            criteria = criteria.and("tags").is(args.tag());
        }
        if (args.query() != null) {
            Pattern pattern = Pattern.compile(Pattern.quote(args.query()), Pattern.CASE_INSENSITIVE);
            criteria = criteria.orOperator(
                    Criteria.where("title").regex(pattern),
                    Criteria.where("contentMd").regex(pattern));
        }

        int limit = args.effectiveLimit();
        Query query = new Query(criteria)
                .with(Sort.by(Sort.Direction.DESC, "updatedAt"))
                .limit(limit);

        List<BrainItem> found = mongoTemplate.find(query, BrainItem.class);
        log.debug("brain.search_items matched {} items [org={}]", found.size(), orgId);

        List<Map<String, Object>> items = found.stream()
                .map(item -> toResult(item, args.query()))
                .toList();

        Map<String, Object> searchParams = new LinkedHashMap<>();
        searchParams.put("query", args.query());
        searchParams.put("type", args.type());
        searchParams.put("tag", args.tag());
        searchParams.put("limit", limit);

        Map<String, Object> explainability = new LinkedHashMap<>();
        explainability.put("search_params", searchParams);
        explainability.put("results_count", items.size());

        return ToolResponse.of(Map.of("items", items), explainability);
    }

    private Map<String, Object> toResult(BrainItem item, String query) {
        Map<String, Object> m = new HashMap<>();
        m.put("id", item.getId());
        m.put("type", item.getType() != null ? item.getType().name() : null);
        m.put("title", item.getTitle());
        m.put("excerpt", excerpt(item.getContentMd(), query));
        m.put("tags", item.getTags() != null ? item.getTags() : List.of());
        m.put("confidence_score", item.getConfidenceScore());
        m.put("updated_at", item.getUpdatedAt() != null ? item.getUpdatedAt().toString() : null);
        return m;
    }

    /**
     * Window around the first match of the query, or the head of the content.
     * Ellipses mark cut edges.
     */
    static String excerpt(String content, String query) {
        if (content == null || content.isEmpty()) return "";

        if (query != null && !query.isEmpty()) {
            int match = content.toLowerCase().indexOf(query.toLowerCase());
            if (match != -1) {
                int start = Math.max(0, match - EXCERPT_BEFORE);
                int end = Math.min(content.length(), match + query.length() + EXCERPT_AFTER);
                String excerpt = content.substring(start, end);
                if (start > 0) excerpt = "..." + excerpt;
                if (end < content.length()) excerpt = excerpt + "...";
                return excerpt;
            }
        }

        if (content.length() <= EXCERPT_LENGTH) return content;
        return content.substring(0, EXCERPT_LENGTH) + "...";
    }

    private static String blankToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
