package com.liferx.brain.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.knowledge.BrainItem;
import com.liferx.brain.knowledge.BrainItemRepository;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolResponse;
import com.liferx.brain.tool.ToolValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrainUpsertItemToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BrainItemRepository repository;
    private BrainUpsertItemTool tool;

    private final ToolContext context = ToolContext.builder()
            .orgId("org-1").sessionId("s-1").allowWrites(true).build();

    @BeforeEach
    void setUp() {
        repository = mock(BrainItemRepository.class);
        when(repository.save(any(BrainItem.class))).thenAnswer(inv -> {
            BrainItem item = inv.getArgument(0);
            if (item.getId() == null) item.setId("item-1");
            return item;
        });
        tool = new BrainUpsertItemTool(repository, objectMapper);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void isWriteTool() {
        assertThat(tool.getName()).isEqualTo("brain.upsert_item");
        assertThat(tool.isWrites()).isTrue();
        assertThat(tool.getInputSchema().get("required")).isEqualTo(List.of("type", "title", "content_md"));
    }

    @Test
    void validateArgs_collectsEveryFieldError() {
        assertThatThrownBy(() -> tool.validateArgs(json("{\"title\":\"ab\",\"confidence_score\":1.5}")))
                .isInstanceOf(ToolValidationException.class)
                .hasMessageStartingWith("Validation failed: ")
                .hasMessageContaining("type: type is required")
                .hasMessageContaining("title: title must be at least 3 characters")
                .hasMessageContaining("content_md: content_md is required")
                .hasMessageContaining("confidence_score: confidence_score must be between 0 and 1");
    }

    @Test
    void validateArgs_missingBody_rejected() {
        assertThatThrownBy(() -> tool.validateArgs(json("null")))
                .hasMessage("Validation failed: body: Invalid input");
    }

    @Test
    void validateArgs_tooManyTags_rejected() {
        StringBuilder tags = new StringBuilder("[");
        for (int i = 0; i < 21; i++) {
            if (i > 0) tags.append(',');
            tags.append("\"t").append(i).append('"');
        }
        tags.append(']');

        assertThatThrownBy(() -> tool.validateArgs(json(
                "{\"type\":\"sop\",\"title\":\"Deploys\",\"content_md\":\"Always deploy on a Tuesday morning.\",\"tags\":"
                        + tags + "}")))
                .hasMessageContaining("tags: maximum 20 tags allowed");
    }

    @Test
    void validateArgs_blankCanonicalKey_rejected() {
        assertThatThrownBy(() -> tool.validateArgs(json(
                "{\"type\":\"sop\",\"title\":\"Deploys\",\"content_md\":\"Always deploy on a Tuesday morning.\",\"canonical_key\":\"  \"}")))
                .hasMessageContaining("canonical_key: canonical_key cannot be empty");
    }

    @Test
    void validateArgs_appliesDefaultsAndTrims() throws Exception {
        BrainUpsertItemTool.Args args = tool.validateArgs(json(
                "{\"type\":\"principle\",\"title\":\"  Bias to action \",\"content_md\":\"Ship small changes and learn quickly.\"}"));

        assertThat(args.type()).isEqualTo(BrainItem.Type.principle);
        assertThat(args.title()).isEqualTo("Bias to action");
        assertThat(args.confidenceScore()).isEqualTo(BrainUpsertItemTool.DEFAULT_CONFIDENCE);
        assertThat(args.tags()).isEmpty();
        assertThat(args.canonicalKey()).isNull();
        assertThat(args.metadata()).isEmpty();
    }

    @Test
    void normalizeTags_trimsLowercasesAndDeduplicates() throws Exception {
        List<String> tags = BrainUpsertItemTool.normalizeTags(json("[\" Ops \",\"ops\",\"\",42,\"Finance\"]"));
        assertThat(tags).containsExactly("ops", "finance");
    }

    @Test
    void run_withoutCanonicalKey_insertsVersionOne() {
        BrainUpsertItemTool.Args args = new BrainUpsertItemTool.Args(BrainItem.Type.decision, "Pricing",
                "Keep pricing flat through the year.", List.of("finance"), 0.8, null, Map.of());

        ToolResponse response = tool.run(args, context);

        verify(repository, never()).findByOrgIdAndCanonicalKey(anyString(), anyString());
        ArgumentCaptor<BrainItem> saved = ArgumentCaptor.forClass(BrainItem.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getOrgId()).isEqualTo("org-1");
        assertThat(saved.getValue().getSource()).isEqualTo("agent");
        assertThat(saved.getValue().getStatus()).isEqualTo(BrainItem.Status.active);

        assertThat(response.getData()).isEqualTo(Map.of("id", "item-1", "version", 1));
        assertThat(response.getExplainability())
                .containsEntry("is_update", false)
                .containsEntry("type", "decision")
                .containsEntry("confidence_score", 0.8);
    }

    @Test
    void run_withExistingCanonicalKey_updatesInPlaceAndBumpsVersion() {
        BrainItem existing = BrainItem.builder()
                .id("item-7").orgId("org-1").canonicalKey("pricing-policy")
                .type(BrainItem.Type.decision).title("Old").contentMd("old content")
                .source("manual").status(BrainItem.Status.active).version(2)
                .build();
        when(repository.findByOrgIdAndCanonicalKey("org-1", "pricing-policy")).thenReturn(Optional.of(existing));

        ToolResponse response = tool.run(new BrainUpsertItemTool.Args(BrainItem.Type.decision, "Pricing",
                "Keep pricing flat through the year.", List.of(), 0.75, "pricing-policy", Map.of()), context);

        assertThat(existing.getVersion()).isEqualTo(3);
        assertThat(existing.getTitle()).isEqualTo("Pricing");
        assertThat(existing.getSource()).isEqualTo("manual");
        assertThat(response.getData()).isEqualTo(Map.of("id", "item-7", "version", 3));
        assertThat(response.getExplainability())
                .containsEntry("is_update", true)
                .containsEntry("canonical_key", "pricing-policy");
    }

    @Test
    void run_withoutOrg_throws() {
        ToolContext noOrg = ToolContext.builder().sessionId("s-1").allowWrites(true).build();
        assertThatThrownBy(() -> tool.run(new BrainUpsertItemTool.Args(BrainItem.Type.sop, "Title",
                "Content long enough to pass.", List.of(), 0.75, null, Map.of()), noOrg))
                .isInstanceOf(IllegalStateException.class);
    }
}
