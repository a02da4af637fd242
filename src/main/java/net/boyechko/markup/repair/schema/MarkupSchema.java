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
package net.boyechko.markup.repair.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/** Tag sets and attribute-lowering table shared by the repair passes. */
public final class MarkupSchema {
    private static final String DEFAULT_SCHEMA_RESOURCE = "/markup-schema.yaml";
    private static final Logger logger = LoggerFactory.getLogger(MarkupSchema.class);

    public String length_unit = "px";
    public Set<String> removable_tags = new LinkedHashSet<>();
    public Set<String> wrapper_tags = new LinkedHashSet<>();
    public EmbeddedObject embedded_object = new EmbeddedObject();
    public Map<String, AttributeRule> legacy_attributes = new LinkedHashMap<>();

    /** How to recognise a legacy embedded-object container and what to turn it into. */
    public static final class EmbeddedObject {
        public Set<String> container_tags = new LinkedHashSet<>(Set.of("object"));
        public Set<String> parameter_tags = new LinkedHashSet<>(Set.of("param"));
        public String placeholder_tag = "ActiveXPlaceholder";
    }

    /**
     * One row of the lowering table.
     *
     * <p>{@code property} is the camel-case style property the value lands in; {@code transform} is
     * one of {@link Transform}'s names in lower case; {@code value} is the fixed style value used by
     * the {@code constant} transform.
     */
    public static final class AttributeRule {
        public String property;
        public String transform;
        public String value;

        public AttributeRule() {}

        public AttributeRule(String property, String transform, String value) {
            this.property = property;
            this.transform = transform;
            this.value = value;
        }

        public Transform getTransform() {
            return Transform.parse(transform);
        }
    }

    /** Value transforms applied while lowering an attribute. */
    public enum Transform {
        VERBATIM,
        LENGTH,
        URL,
        BORDER,
        CONSTANT,
        CELL_SPACING;

        static Transform parse(String name) {
            if (name == null || name.isBlank()) {
                return VERBATIM;
            }
            return Transform.valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    public String getLengthUnit() {
        return length_unit;
    }

    /** Removable and wrapper tags match exactly; {@code SCRIPT} is not {@code script}. */
    public boolean isRemovable(String tagName) {
        return tagName != null && removable_tags.contains(tagName);
    }

    public boolean isWrapper(String tagName) {
        return tagName != null && wrapper_tags.contains(tagName);
    }

    public boolean isEmbeddedObject(String tagName) {
        return tagName != null
                && embedded_object.container_tags.contains(tagName.toLowerCase(Locale.ROOT));
    }

    public boolean isObjectParameter(String tagName) {
        return tagName != null
                && embedded_object.parameter_tags.contains(tagName.toLowerCase(Locale.ROOT));
    }

    public String getPlaceholderTag() {
        return embedded_object.placeholder_tag;
    }

    /** Looks up a lowering rule; attribute names match case-insensitively. */
    public AttributeRule legacyAttribute(String attributeName) {
        if (attributeName == null) return null;
        return legacy_attributes.get(attributeName.toLowerCase(Locale.ROOT));
    }

    public Map<String, AttributeRule> getLegacyAttributes() {
        return legacy_attributes;
    }

    /**
     * Load MarkupSchema from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static MarkupSchema fromResource(String resourcePath) {
        try (var inputStream = MarkupSchema.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }

            var yaml = new Yaml(new Constructor(MarkupSchema.class, new LoaderOptions()));
            MarkupSchema schema = yaml.load(inputStream);
            schema.normalize();

            logger.debug(
                    "Loaded MarkupSchema with {} legacy attributes from resource {}",
                    schema.legacy_attributes.size(),
                    resourcePath);

            var warnings = schema.validateConsistency();
            if (!warnings.isEmpty()) {
                logger.warn(
                        "Schema loaded from {} has {} consistency warnings:",
                        resourcePath,
                        warnings.size());
                for (String warning : warnings) {
                    logger.warn("  - {}", warning);
                }
            }

            return schema;
        } catch (Exception e) {
            logger.error(
                    "Failed to load MarkupSchema from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load schema from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load default schema from standard location */
    public static MarkupSchema loadDefault() {
        return fromResource(DEFAULT_SCHEMA_RESOURCE);
    }

    /**
     * Lower-cases embedded-object tags and attribute names so those lookups can be
     * case-insensitive. Removable and wrapper tags are kept as written.
     */
    private void normalize() {
        if (length_unit == null) length_unit = "px";
        if (removable_tags == null) removable_tags = new LinkedHashSet<>();
        if (wrapper_tags == null) wrapper_tags = new LinkedHashSet<>();
        if (embedded_object == null) embedded_object = new EmbeddedObject();
        embedded_object.container_tags = lowerCased(embedded_object.container_tags);
        embedded_object.parameter_tags = lowerCased(embedded_object.parameter_tags);

        Map<String, AttributeRule> rules = new LinkedHashMap<>();
        if (legacy_attributes != null) {
            for (Map.Entry<String, AttributeRule> e : legacy_attributes.entrySet()) {
                AttributeRule rule = e.getValue() != null ? e.getValue() : new AttributeRule();
                rules.put(e.getKey().toLowerCase(Locale.ROOT), rule);
            }
        }
        legacy_attributes = rules;
    }

    private static Set<String> lowerCased(Set<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        if (tags != null) {
            for (String t : tags) {
                out.add(t.toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    /**
     * Checks that every lowering rule can actually be applied: the transform is known, a target
     * property exists where the transform needs one, and constants carry a value.
     *
     * @return warning messages (empty if the schema is consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, AttributeRule> entry : legacy_attributes.entrySet()) {
            String name = entry.getKey();
            AttributeRule rule = entry.getValue();
            Transform transform;
            try {
                transform = rule.getTransform();
            } catch (IllegalArgumentException e) {
                warnings.add("Attribute '" + name + "' has unknown transform '" + rule.transform + "'");
                continue;
            }
            if (transform != Transform.CELL_SPACING && (rule.property == null || rule.property.isBlank())) {
                warnings.add("Attribute '" + name + "' has no target style property");
            }
            if (transform == Transform.CONSTANT && rule.value == null) {
                warnings.add("Attribute '" + name + "' uses constant transform without a value");
            }
        }
        for (String tag : removable_tags) {
            if (wrapper_tags.contains(tag)) {
                warnings.add("Tag '" + tag + "' is both removable and a wrapper");
            }
        }
        return warnings;
    }
}
