package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Sequence aggregate: an id-keyed node arena plus metadata. Nodes reference children by id, so a
 * malformed document may contain dangling references or cycles; those are reported by validation
 * and every walker guards against them. Immutable; {@code with*} methods return modified copies.
 */
public final class Sequence {

    /** Document format written by this release. */
    public static final int CURRENT_SCHEMA_VERSION = 1;
    public static final String DEFAULT_NAME = "Untitled Sequence";

    private static final Comparator<SequenceNode> BY_ORDER = Comparator.comparingInt(SequenceNode::getOrderIndex);

    private final int schemaVersion;
    private final String id;
    private final Long databaseId;
    private final String name;
    private final String description;
    private final Map<String, SequenceNode> nodes;
    private final String rootNodeId;
    private final Instant createdAt;
    private final Instant modifiedAt;
    private final boolean template;
    private final Integer estimatedDurationMins;

    @JsonCreator
    public Sequence(
            @JsonProperty("schemaVersion") Integer schemaVersion,
            @JsonProperty("id") String id,
            @JsonProperty("databaseId") Long databaseId,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("nodes") Map<String, SequenceNode> nodes,
            @JsonProperty("rootNodeId") String rootNodeId,
            @JsonProperty("createdAt") Instant createdAt,
            @JsonProperty("modifiedAt") Instant modifiedAt,
            @JsonProperty("template") Boolean template,
            @JsonProperty("estimatedDurationMins") Integer estimatedDurationMins) {
        this.schemaVersion = schemaVersion != null ? schemaVersion : CURRENT_SCHEMA_VERSION;
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.databaseId = databaseId;
        this.name = name != null ? name : DEFAULT_NAME;
        this.description = description != null ? description : "";
        this.nodes = nodes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(nodes)) : Map.of();
        this.rootNodeId = rootNodeId;
        this.createdAt = createdAt != null ? createdAt : Instant.EPOCH;
        this.modifiedAt = modifiedAt != null ? modifiedAt : this.createdAt;
        this.template = template != null && template;
        this.estimatedDurationMins = estimatedDurationMins;
    }

    /** Empty sequence with the given name, created at {@code now}. */
    public static Sequence empty(String name, Instant now) {
        return new Sequence(CURRENT_SCHEMA_VERSION, null, null, name, null, null, null, now, now, false, null);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public String getId() {
        return id;
    }

    public Long getDatabaseId() {
        return databaseId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, SequenceNode> getNodes() {
        return nodes;
    }

    public String getRootNodeId() {
        return rootNodeId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public boolean isTemplate() {
        return template;
    }

    public Integer getEstimatedDurationMins() {
        return estimatedDurationMins;
    }

    public SequenceNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    /** Root node, or null when unset or not present in the mapping. */
    @JsonIgnore
    public SequenceNode getRootNode() {
        return getNode(rootNodeId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Children of the given node that exist in the mapping, sorted by order index. Dangling ids are dropped.
     */
    public List<SequenceNode> getChildren(String parentId) {
        SequenceNode parent = getNode(parentId);
        if (parent == null) return List.of();
        List<SequenceNode> children = new ArrayList<>();
        for (String childId : parent.getChildIds()) {
            SequenceNode child = nodes.get(childId);
            if (child != null) children.add(child);
        }
        children.sort(BY_ORDER);
        return children;
    }

    /** Enabled target headers anywhere in the mapping, by order index. */
    public List<SequenceNode> targetHeaders() {
        return nodes.values().stream()
                .filter(n -> n.isEnabled() && n.getType() == NodeType.TARGET_HEADER)
                .sorted(BY_ORDER)
                .toList();
    }

    /** Enabled exposure nodes anywhere in the mapping. */
    public List<SequenceNode> exposureNodes() {
        return nodes.values().stream()
                .filter(n -> n.isEnabled() && n.getType() == NodeType.EXPOSURE)
                .toList();
    }

    /** Sum of frame counts over enabled exposure nodes, ignoring loop multipliers. */
    public int totalExposures() {
        int total = 0;
        for (SequenceNode node : exposureNodes()) {
            total += node.spec(NodeSpec.Exposure.class).count();
        }
        return total;
    }

    // ---- copy-on-write edits ----

    /** Adds or replaces a node by id. Links are not touched. */
    public Sequence withNode(SequenceNode node) {
        Map<String, SequenceNode> next = new LinkedHashMap<>(nodes);
        next.put(node.getId(), node);
        return copy(next, rootNodeId, name, modifiedAt);
    }

    /** Removes a node and its id from any parent's child list. Descendants become orphans. */
    public Sequence withoutNode(String nodeId) {
        Map<String, SequenceNode> next = new LinkedHashMap<>();
        for (SequenceNode n : nodes.values()) {
            if (n.getId().equals(nodeId)) continue;
            if (n.getChildIds().contains(nodeId)) {
                List<String> ids = new ArrayList<>(n.getChildIds());
                ids.remove(nodeId);
                n = n.withChildIds(ids);
            }
            next.put(n.getId(), n);
        }
        String root = nodeId.equals(rootNodeId) ? null : rootNodeId;
        return copy(next, root, name, modifiedAt);
    }

    /** Adds {@code node} and makes it the root. */
    public Sequence withRoot(SequenceNode node) {
        Map<String, SequenceNode> next = new LinkedHashMap<>(nodes);
        next.put(node.getId(), node.withParentId(null));
        return copy(next, node.getId(), name, modifiedAt);
    }

    public Sequence withRootNodeId(String newRootNodeId) {
        return copy(nodes, newRootNodeId, name, modifiedAt);
    }

    /**
     * Appends {@code child} under {@code parentId}, setting its parent link and an order index after
     * the existing siblings.
     *
     * @throws IllegalArgumentException if the parent does not exist
     */
    public Sequence withChild(String parentId, SequenceNode child) {
        SequenceNode parent = getNode(parentId);
        if (parent == null) {
            throw new IllegalArgumentException("Parent node not found: " + parentId);
        }
        Map<String, SequenceNode> next = new LinkedHashMap<>(nodes);
        next.put(child.getId(), child.withParentId(parentId).withOrderIndex(parent.getChildIds().size()));
        next.put(parentId, parent.withChildAppended(child.getId()));
        return copy(next, rootNodeId, name, modifiedAt);
    }

    public Sequence withName(String newName) {
        return copy(nodes, rootNodeId, newName, modifiedAt);
    }

    public Sequence withModifiedAt(Instant newModifiedAt) {
        return copy(nodes, rootNodeId, name, newModifiedAt);
    }

    public Sequence withEstimatedDurationMins(Integer mins) {
        return new Sequence(schemaVersion, id, databaseId, name, description, nodes, rootNodeId,
                createdAt, modifiedAt, template, mins);
    }

    public Sequence asTemplate(boolean isTemplate) {
        return new Sequence(schemaVersion, id, databaseId, name, description, nodes, rootNodeId,
                createdAt, modifiedAt, isTemplate, estimatedDurationMins);
    }

    /**
     * Copy with a new sequence id, no storage key, and every node id regenerated. Child, parent and
     * root references are remapped consistently; references to ids not in the mapping are kept as-is.
     * Used when instantiating a template.
     */
    public Sequence withRefreshedIds() {
        Map<String, String> remap = new HashMap<>();
        for (String oldId : nodes.keySet()) {
            remap.put(oldId, UUID.randomUUID().toString());
        }
        Map<String, SequenceNode> next = new LinkedHashMap<>();
        for (SequenceNode n : nodes.values()) {
            List<String> children = n.getChildIds().stream().map(c -> remap.getOrDefault(c, c)).toList();
            String parent = n.getParentId() != null ? remap.getOrDefault(n.getParentId(), n.getParentId()) : null;
            SequenceNode refreshed = n.withId(remap.get(n.getId())).withChildIds(children).withParentId(parent);
            next.put(refreshed.getId(), refreshed);
        }
        String root = rootNodeId != null ? remap.getOrDefault(rootNodeId, rootNodeId) : null;
        return new Sequence(schemaVersion, null, null, name, description, next, root,
                createdAt, modifiedAt, false, estimatedDurationMins);
    }

    private Sequence copy(Map<String, SequenceNode> newNodes, String newRoot, String newName, Instant newModifiedAt) {
        return new Sequence(schemaVersion, id, databaseId, newName, description, newNodes, newRoot,
                createdAt, newModifiedAt, template, estimatedDurationMins);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sequence that = (Sequence) o;
        return schemaVersion == that.schemaVersion && template == that.template
                && Objects.equals(id, that.id) && Objects.equals(databaseId, that.databaseId)
                && Objects.equals(name, that.name) && Objects.equals(description, that.description)
                && Objects.equals(nodes, that.nodes) && Objects.equals(rootNodeId, that.rootNodeId)
                && Objects.equals(createdAt, that.createdAt) && Objects.equals(modifiedAt, that.modifiedAt)
                && Objects.equals(estimatedDurationMins, that.estimatedDurationMins);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaVersion, id, databaseId, name, description, nodes, rootNodeId,
                createdAt, modifiedAt, template, estimatedDurationMins);
    }

    @Override
    public String toString() {
        return "Sequence{id=" + id + ", name='" + name + "', nodes=" + nodes.size() + ", root=" + rootNodeId + "}";
    }
}
