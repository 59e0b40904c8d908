package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One node of a sequence tree: the fields every variant shares plus the variant payload.
 * Children are referenced by id and resolved through {@link Sequence#getNode(String)}.
 * Instances are immutable; {@code with*} methods return modified copies.
 */
public final class SequenceNode {

    private final String id;
    private final String name;
    private final boolean enabled;
    private final List<String> childIds;
    private final String parentId;
    private final int orderIndex;
    private final NodeSpec spec;

    @JsonCreator
    public SequenceNode(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("childIds") List<String> childIds,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("orderIndex") Integer orderIndex,
            @JsonProperty("spec") NodeSpec spec) {
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.spec = spec != null ? spec : new NodeSpec.Unknown();
        this.name = name != null ? name : this.spec.nodeType().toValue();
        this.enabled = enabled == null || enabled;
        this.childIds = childIds != null ? List.copyOf(childIds) : List.of();
        this.parentId = parentId;
        this.orderIndex = orderIndex != null ? orderIndex : 0;
    }

    /** New enabled node with a random id and no links. */
    public static SequenceNode create(String name, NodeSpec spec) {
        return new SequenceNode(null, name, true, null, null, 0, spec);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> getChildIds() {
        return childIds;
    }

    public String getParentId() {
        return parentId;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    public NodeSpec getSpec() {
        return spec;
    }

    /** Variant tag, derived from the payload. */
    @JsonIgnore
    public NodeType getType() {
        return spec.nodeType();
    }

    /**
     * Payload cast to the expected variant.
     *
     * @throws IllegalStateException if this node carries a different variant
     */
    public <T extends NodeSpec> T spec(Class<T> expected) {
        if (!expected.isInstance(spec)) {
            throw new IllegalStateException("Node " + id + " is " + getType() + ", not " + expected.getSimpleName());
        }
        return expected.cast(spec);
    }

    public SequenceNode withId(String newId) {
        return new SequenceNode(newId, name, enabled, childIds, parentId, orderIndex, spec);
    }

    public SequenceNode withName(String newName) {
        return new SequenceNode(id, newName, enabled, childIds, parentId, orderIndex, spec);
    }

    public SequenceNode withEnabled(boolean newEnabled) {
        return new SequenceNode(id, name, newEnabled, childIds, parentId, orderIndex, spec);
    }

    public SequenceNode withChildIds(List<String> newChildIds) {
        return new SequenceNode(id, name, enabled, newChildIds, parentId, orderIndex, spec);
    }

    public SequenceNode withChildAppended(String childId) {
        List<String> next = new ArrayList<>(childIds);
        next.add(childId);
        return withChildIds(next);
    }

    public SequenceNode withParentId(String newParentId) {
        return new SequenceNode(id, name, enabled, childIds, newParentId, orderIndex, spec);
    }

    public SequenceNode withOrderIndex(int newOrderIndex) {
        return new SequenceNode(id, name, enabled, childIds, parentId, newOrderIndex, spec);
    }

    public SequenceNode withSpec(NodeSpec newSpec) {
        return new SequenceNode(id, name, enabled, childIds, parentId, orderIndex, newSpec);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SequenceNode that = (SequenceNode) o;
        return enabled == that.enabled && orderIndex == that.orderIndex
                && Objects.equals(id, that.id) && Objects.equals(name, that.name)
                && Objects.equals(childIds, that.childIds) && Objects.equals(parentId, that.parentId)
                && Objects.equals(spec, that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, enabled, childIds, parentId, orderIndex, spec);
    }

    @Override
    public String toString() {
        return "SequenceNode{" + getType().toValue() + " " + id + " '" + name + "'}";
    }
}
