/*
 * Markup-Repair - Legacy Markup Tree Normalization
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.markup.repair.walk;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.markup.repair.issue.IssueList;
import net.boyechko.markup.repair.tree.MarkupNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a markup tree once in pre-order, invoking multiple visitors at each node.
 *
 * <p>Children are descended into after the visitors have seen their parent, from a snapshot of the
 * parent's children taken at that moment. A node's parent and grandparent are looked up in the
 * live tree when the node is reached, so fixes applied to earlier nodes are visible to later ones.
 */
public class MarkupTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(MarkupTreeWalker.class);

    private final List<MarkupTreeVisitor> visitors = new ArrayList<>();

    private List<MarkupNode> root;
    private Map<MarkupNode, MarkupNode> parentIndex;
    private boolean indexStale;
    private int globalIndex;

    public MarkupTreeWalker addVisitor(MarkupTreeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(List<MarkupNode> root) {
        this.root = root;
        this.globalIndex = 0;
        this.indexStale = true;

        for (MarkupTreeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        for (MarkupNode node : List.copyOf(root)) {
            walkElement(node, "/", 0);
        }

        IssueList allIssues = new IssueList();
        for (MarkupTreeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }

        return allIssues;
    }

    private void walkElement(MarkupNode node, String parentPath, int depth) {
        if (indexStale) {
            rebuildParentIndex();
        }
        if (!parentIndex.containsKey(node)) {
            logger.debug("Skipping {} under {}: no longer attached to the tree", node, parentPath);
            return;
        }
        globalIndex++;

        VisitorContext ctx = buildContext(node, parentPath, depth);

        // Call enterElement on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (MarkupTreeVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            for (MarkupNode child : List.copyOf(node.children())) {
                walkElement(child, ctx.path() + ".", depth + 1);
            }
        }

        for (MarkupTreeVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }

    private VisitorContext buildContext(MarkupNode node, String parentPath, int depth) {
        String tag = node.tagName() != null ? node.tagName() : "?";
        String path = parentPath + tag + "[" + globalIndex + "]";

        MarkupNode parent = parentIndex.get(node);
        MarkupNode grandparent = parent != null ? parentIndex.get(parent) : null;
        List<MarkupNode> siblings = parent != null ? parent.children() : root;

        return new VisitorContext(
                node,
                parent,
                grandparent,
                siblings,
                root,
                path,
                depth,
                globalIndex,
                this::markStale);
    }

    private void markStale() {
        indexStale = true;
    }

    /** Maps every attached node to its parent; top-level nodes map to null. */
    private void rebuildParentIndex() {
        parentIndex = new IdentityHashMap<>();
        for (MarkupNode top : root) {
            parentIndex.put(top, null);
            indexChildren(top);
        }
        indexStale = false;
    }

    private void indexChildren(MarkupNode parent) {
        for (MarkupNode child : parent.children()) {
            parentIndex.put(child, parent);
            indexChildren(child);
        }
    }
}
