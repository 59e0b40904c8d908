/**
 * Sequence tree data model and its serialization.
 * <ul>
 *   <li>{@link com.nightshade.sequence.model.Sequence} – aggregate holding the id-keyed node arena</li>
 *   <li>{@link com.nightshade.sequence.model.SequenceNode} / {@link com.nightshade.sequence.model.NodeSpec} – shared node fields and the closed per-variant payload</li>
 *   <li>{@link com.nightshade.sequence.requirements.DeviceRequirements} – static device table keyed by node type</li>
 *   <li>{@link com.nightshade.sequence.tree.StructureAnalyzer} – reachability, orphan and cycle analysis</li>
 *   <li>{@link com.nightshade.sequence.edit.SequenceWorkspace} – authoring context with the exclusive run lease</li>
 *   <li>{@link com.nightshade.sequence.SequenceJson} – versioned JSON read/write</li>
 * </ul>
 */
package com.nightshade.sequence;
