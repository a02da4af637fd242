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
package net.boyechko.markup.repair.passes;

import java.util.List;
import net.boyechko.markup.repair.tree.MarkupNode;

/**
 * One structural pass of the repair pipeline.
 *
 * <p>A pass receives the current top-level node list and returns the list the next pass should
 * see. Passes may rewrite nodes in place and return the same list, or build a new one. Input that
 * violates a tree invariant is never an error: it is what the pass exists to fix.
 */
public interface RepairPass {

    String name();

    String description();

    List<MarkupNode> apply(List<MarkupNode> elements, RepairContext ctx);
}
