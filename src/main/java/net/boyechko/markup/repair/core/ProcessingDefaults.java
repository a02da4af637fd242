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
package net.boyechko.markup.repair.core;

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.markup.repair.passes.AttributeLoweringPass;
import net.boyechko.markup.repair.passes.AuxiliaryNodeConsolidationPass;
import net.boyechko.markup.repair.passes.ExpressionRewritePass;
import net.boyechko.markup.repair.passes.FilterAndFlattenPass;
import net.boyechko.markup.repair.passes.NestingRepairPass;
import net.boyechko.markup.repair.passes.RepairPass;
import net.boyechko.markup.repair.passes.TableStructureRepairPass;

public final class ProcessingDefaults {
    private ProcessingDefaults() {}

    /** The repair passes, in the order they must run. */
    public static List<Supplier<RepairPass>> passSuppliers() {
        return List.of(
                AttributeLoweringPass::new,
                AuxiliaryNodeConsolidationPass::new,
                ExpressionRewritePass::new,
                TableStructureRepairPass::new,
                NestingRepairPass::new,
                FilterAndFlattenPass::new);
    }
}
