package com.liferx.brain.knowledge;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A unit of organisational knowledge: a decision, SOP, principle or playbook.
 *
 * Collection: brain_items
 *
 * Items written with a canonical key are updated in place (version + 1)
 * instead of duplicated; the (orgId, canonicalKey) index is unique but sparse
 * so keyless items are unaffected.
 */
@Document(collection = "brain_items")
@CompoundIndexes({
    @CompoundIndex(name = "idx_org_canonical", def = "{'orgId': 1, 'canonicalKey': 1}", unique = true, sparse = true),
    @CompoundIndex(name = "idx_org_status_updated", def = "{'orgId': 1, 'status': 1, 'updatedAt': -1}"),
    @CompoundIndex(name = "idx_org_tags", def = "{'orgId': 1, 'tags': 1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BrainItem {

    public enum Type { decision, sop, principle, playbook }

    public enum Status { active, archived }

    @Id
    private String id;

    private String orgId;
    private Type type;
    private String title;
    private String contentMd;
    private List<String> tags;

    /** 0..1 */
    private double confidenceScore;

    /** manual | agent | import */
    private String source;

    private Status status;
    private int version;
    private String canonicalKey;
    private Map<String, Object> metadata;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;
}
