package com.nightshade.engine.handler;

import com.nightshade.sequence.model.NodeType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeHandlerRegistryTest {

    @Test
    void standard_coversEveryNodeType() {
        NodeHandlerRegistry registry = NodeHandlerRegistry.standard();
        for (NodeType type : NodeType.values()) {
            assertNotNull(registry.forType(type), type.name());
        }
    }

    @Test
    void missingHandler_failsConstruction() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new NodeHandlerRegistry(List.of(new SequentialHandler())));
        assertTrue(e.getMessage().contains("EXPOSURE"), e.getMessage());
    }

    @Test
    void duplicateHandler_failsConstruction() {
        List<NodeHandler> handlers = new ArrayList<>(NodeHandlerRegistry.standardHandlers());
        handlers.add(new DomeHandler());
        assertThrows(IllegalStateException.class, () -> new NodeHandlerRegistry(handlers));
    }
}
