package com.nightshade.engine.handler;

import com.nightshade.sequence.model.NodeType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps every {@link NodeType} to exactly one handler. Construction fails if a type is left
 * uncovered or claimed twice, so a new node type cannot ship without an execution handler.
 */
public final class NodeHandlerRegistry {

    private final Map<NodeType, NodeHandler> handlers = new EnumMap<>(NodeType.class);

    public NodeHandlerRegistry(List<NodeHandler> handlerList) {
        for (NodeHandler handler : handlerList) {
            for (NodeType type : handler.supportedTypes()) {
                NodeHandler previous = handlers.put(type, handler);
                if (previous != null && previous != handler) {
                    throw new IllegalStateException("Node type " + type + " claimed by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        Set<NodeType> missing = EnumSet.allOf(NodeType.class);
        missing.removeAll(handlers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for node types " + missing);
        }
    }

    /** Registry with the built-in handler for every node type. */
    public static NodeHandlerRegistry standard() {
        return new NodeHandlerRegistry(standardHandlers());
    }

    public static List<NodeHandler> standardHandlers() {
        List<NodeHandler> list = new ArrayList<>();
        list.add(new SequentialHandler());
        list.add(new TargetHeaderHandler());
        list.add(new LoopHandler());
        list.add(new ParallelHandler());
        list.add(new ConditionalHandler());
        list.add(new RecoveryHandler());
        list.add(new ExposureHandler());
        list.add(new MountHandler());
        list.add(new FocusHandler());
        list.add(new GuidingHandler());
        list.add(new CameraTemperatureHandler());
        list.add(new AccessoryHandler());
        list.add(new DomeHandler());
        list.add(new TimingHandler());
        list.add(new UtilityHandler());
        list.add(new UnknownNodeHandler());
        return list;
    }

    public NodeHandler forType(NodeType type) {
        return handlers.get(type);
    }
}
