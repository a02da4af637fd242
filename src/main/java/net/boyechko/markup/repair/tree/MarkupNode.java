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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One element of a converted markup tree.
 *
 * <p>A node owns its {@code children} list exclusively; there are no parent back-references.
 * Passes that need the parent or grandparent of a node receive them from the walker (see {@code
 * walk.VisitorContext}).
 *
 * <p>Attribute values are strings, except for {@code style} (a map of camel-case property to
 * value) and consolidated parameter sets. Fields the engine does not interpret are kept in {@link
 * #extras()} and written back unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "tagName",
    "attributes",
    "children",
    "isComponent",
    "componentUrl",
    "condition",
    "collection",
    "item",
    "text"
})
public final class MarkupNode {
    public static final String TEXT = "#text";
    public static final String STYLE = "style";

    private String tagName;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private List<MarkupNode> children = new ArrayList<>();
    private boolean component;
    private String componentUrl;
    private String condition;
    private String collection;
    private String item;
    private String text;
    private final Map<String, Object> extras = new LinkedHashMap<>();

    public MarkupNode() {}

    public MarkupNode(String tagName) {
        this.tagName = tagName;
    }

    public static MarkupNode element(String tagName, MarkupNode... children) {
        MarkupNode node = new MarkupNode(tagName);
        for (MarkupNode child : children) {
            node.children.add(child);
        }
        return node;
    }

    public static MarkupNode text(String text) {
        MarkupNode node = new MarkupNode(TEXT);
        node.text = text;
        return node;
    }

    @JsonProperty("tagName")
    public String tagName() {
        return tagName;
    }

    @JsonProperty("tagName")
    public void setTagName(String tagName) {
        this.tagName = tagName;
    }

    public boolean hasTag(String name) {
        return name != null && name.equals(tagName);
    }

    public boolean hasTagIgnoreCase(String name) {
        return name != null && name.equalsIgnoreCase(tagName);
    }

    @JsonProperty("attributes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> attributes() {
        return attributes;
    }

    @JsonProperty("attributes")
    public void setAttributes(Map<String, Object> attributes) {
        this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
    }

    /** Returns the attribute as a string, or null if absent. Non-string values are stringified. */
    public String attribute(String name) {
        Object value = attributes.get(name);
        return value != null ? String.valueOf(value) : null;
    }

    public MarkupNode withAttribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    /** Live, mutable list of children. */
    @JsonProperty("children")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<MarkupNode> children() {
        return children;
    }

    @JsonProperty("children")
    public void setChildren(List<MarkupNode> children) {
        this.children = new ArrayList<>();
        if (children != null) {
            for (MarkupNode child : children) {
                if (child != null) {
                    this.children.add(child);
                }
            }
        }
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    @JsonProperty("isComponent")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isComponent() {
        return component;
    }

    @JsonProperty("isComponent")
    public void setComponent(boolean component) {
        this.component = component;
    }

    @JsonProperty("componentUrl")
    public String componentUrl() {
        return componentUrl;
    }

    @JsonProperty("componentUrl")
    public void setComponentUrl(String componentUrl) {
        this.componentUrl = componentUrl;
    }

    @JsonProperty("condition")
    public String condition() {
        return condition;
    }

    @JsonProperty("condition")
    public void setCondition(String condition) {
        this.condition = condition;
    }

    @JsonProperty("collection")
    public String collection() {
        return collection;
    }

    @JsonProperty("collection")
    public void setCollection(String collection) {
        this.collection = collection;
    }

    @JsonProperty("item")
    public String item() {
        return item;
    }

    @JsonProperty("item")
    public void setItem(String item) {
        this.item = item;
    }

    @JsonProperty("text")
    public String text() {
        return text;
    }

    @JsonProperty("text")
    public void setText(String text) {
        this.text = text;
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return extras;
    }

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @JsonIgnore
    public boolean isText() {
        return TEXT.equals(tagName);
    }

    /** Copies every field except children; the attribute and extras maps are copied one level. */
    public MarkupNode shallowCopy(List<MarkupNode> newChildren) {
        MarkupNode copy = new MarkupNode(tagName);
        copy.attributes = new LinkedHashMap<>(attributes);
        copy.setChildren(newChildren);
        copy.component = component;
        copy.componentUrl = componentUrl;
        copy.condition = condition;
        copy.collection = collection;
        copy.item = item;
        copy.text = text;
        copy.extras.putAll(extras);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkupNode)) return false;
        MarkupNode other = (MarkupNode) o;
        return component == other.component
                && Objects.equals(tagName, other.tagName)
                && Objects.equals(attributes, other.attributes)
                && Objects.equals(children, other.children)
                && Objects.equals(componentUrl, other.componentUrl)
                && Objects.equals(condition, other.condition)
                && Objects.equals(collection, other.collection)
                && Objects.equals(item, other.item)
                && Objects.equals(text, other.text)
                && Objects.equals(extras, other.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, attributes, children, component, condition, text);
    }

    @Override
    public String toString() {
        return tagName != null ? tagName : "(untagged)";
    }
}
