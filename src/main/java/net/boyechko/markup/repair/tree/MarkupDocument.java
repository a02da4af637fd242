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
package net.boyechko.markup.repair.tree;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Root structure exchanged with the generator: {@code { "elements": [...] }}. */
public final class MarkupDocument {
    private List<MarkupNode> elements = new ArrayList<>();
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public MarkupDocument() {}

    public MarkupDocument(List<MarkupNode> elements) {
        setElements(elements);
    }

    /** Live, mutable list of top-level nodes. */
    @JsonProperty("elements")
    public List<MarkupNode> elements() {
        return elements;
    }

    @JsonProperty("elements")
    public void setElements(List<MarkupNode> elements) {
        this.elements = new ArrayList<>();
        if (elements != null) {
            for (MarkupNode node : elements) {
                if (node != null) {
                    this.elements.add(node);
                }
            }
        }
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkupDocument)) return false;
        MarkupDocument other = (MarkupDocument) o;
        return elements.equals(other.elements) && extras.equals(other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, extras);
    }
}
