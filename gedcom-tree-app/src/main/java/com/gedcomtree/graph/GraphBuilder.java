package com.gedcomtree.graph;

import com.gedcomtree.model.Family;
import com.gedcomtree.model.GedcomData;
import com.gedcomtree.model.GraphLink;
import com.gedcomtree.model.GraphNode;
import com.gedcomtree.model.Individual;
import com.gedcomtree.model.LinkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns parsed records into nodes and links. References to individuals that do
 * not exist are dropped and counted.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public LayoutContext build(GedcomData data) {
        LayoutContext context = new LayoutContext();

        for (Individual individual : data.individuals().values()) {
            context.addNode(new GraphNode(individual));
        }

        for (Family family : data.families().values()) {
            String husband = resolve(context, family.getHusband());
            String wife = resolve(context, family.getWife());

            // Marriage link between spouses
            if (husband != null && wife != null) {
                context.addLink(new GraphLink(husband, wife, LinkType.MARRIAGE, family.getId()));
            }

            // Parent-child links, one per known parent
            for (String childId : family.getChildren()) {
                if (!context.hasNode(childId)) {
                    context.recordDroppedReference();
                    continue;
                }
                if (husband != null) {
                    context.addLink(new GraphLink(husband, childId, LinkType.PARENT_CHILD, family.getId()));
                }
                if (wife != null) {
                    context.addLink(new GraphLink(wife, childId, LinkType.PARENT_CHILD, family.getId()));
                }
            }
        }

        if (context.droppedReferences() > 0) {
            log.debug("Dropped {} references to unknown individuals", context.droppedReferences());
        }
        return context;
    }

    private String resolve(LayoutContext context, String id) {
        if (id == null || id.isEmpty()) {
            return null;
        }
        if (!context.hasNode(id)) {
            context.recordDroppedReference();
            return null;
        }
        return id;
    }
}
