package com.questrail.touchportal.descriptor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.touchportal.schema.AttributeRule;
import com.questrail.touchportal.schema.EntityKind;
import com.questrail.touchportal.schema.SdkSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DescriptorGenerator
 * =============================================================================
 * Expands a {@link PluginDeclaration} into a complete descriptor document.
 *
 * <h2>Identifiers</h2>
 * A declared {@code id} always wins and is never rewritten; a blank or non-string
 * one is reported. Otherwise identifiers are derived from the
 * plugin id (the namespace), the owning category's local name and the entity's
 * local name:
 * <pre>
 *   category   namespace.category
 *   entity     namespace.category.local
 *   data item  owningEntityId.local
 * </pre>
 * Settings are identified by {@code name}, which defaults to the local name.
 *
 * <h2>Expansion</h2>
 * <ul>
 *   <li>attributes are written in rule table order; missing attributes that have
 *       a table default and are legal at the target {@code sdk} are filled in</li>
 *   <li>entities without a {@code category} belong to the first declared category</li>
 *   <li>{@code $[name]} and {@code $[n]} (1-based) tokens in action and connector
 *       formats become {@code {$dataId$}}</li>
 *   <li>an event {@code valueStateId} naming a declared state by local name is
 *       replaced by that state's identifier</li>
 *   <li>settings are emitted only from sdk 3 and connectors only from sdk 4</li>
 *   <li>the declaration-only keys {@code category} and {@code doc} are stripped</li>
 * </ul>
 *
 * <h2>Guarantee</h2>
 * The result is always passed through {@link DescriptorValidator}. Problems found
 * during expansion and validation are reported together in one
 * {@link DescriptorValidationException}; an invalid document is never returned.
 */
public final class DescriptorGenerator
{
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final Pattern FORMAT_TOKEN = Pattern.compile("\\$\\[(\\w+)]");
    private static final Set<String> DECLARATION_ONLY = Set.of("category", "doc");

    private final DescriptorValidator validator;

    public DescriptorGenerator() {
        this(new DescriptorValidator());
    }

    public DescriptorGenerator(DescriptorValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * @throws DescriptorValidationException if the expanded document does not validate
     */
    public ObjectNode generate(PluginDeclaration declaration) {
        Objects.requireNonNull(declaration, "declaration");

        Expansion expansion = new Expansion(declaration);
        ObjectNode document = expansion.run();

        ValidationReport validation = validator.validate(document);
        if (!expansion.problems.isEmpty() || !validation.isValid()) {
            List<Violation> all = new ArrayList<>(expansion.problems);
            all.addAll(validation.violations());
            throw new DescriptorValidationException(new ValidationReport(validation.sdkVersion(), all));
        }
        return document;
    }

    // -------------------------------------------------------------------------
    // Single expansion
    // -------------------------------------------------------------------------

    private static final class Expansion
    {
        private final PluginDeclaration declaration;
        private final int sdk;
        private final String namespace;
        private final List<Violation> problems = new ArrayList<>();

        /** Category local name to the category's declared attributes, id resolved. */
        private final Map<String, ObjectNode> categories = new LinkedHashMap<>();
        private final Map<String, Map<String, ArrayNode>> members = new LinkedHashMap<>();
        private final Map<String, String> stateIds = new LinkedHashMap<>();

        Expansion(PluginDeclaration declaration) {
            this.declaration = declaration;
            this.sdk = DescriptorValidator.declaredVersion(declaration.info());
            JsonNode id = declaration.info().get("id");
            this.namespace = id != null && id.isTextual() ? id.asText() : "";
        }

        ObjectNode run() {
            ObjectNode info = declaration.info().deepCopy();
            for (String section : List.of("categories", "settings")) {
                if (info.has(section)) {
                    problem("$.info", section, Violation.Rule.UNKNOWN_ATTRIBUTE,
                            "Declare " + section + " in their own section, not inside info");
                    info.remove(section);
                }
            }

            for (Map.Entry<String, ObjectNode> e : declaration.categories().entrySet()) {
                ObjectNode source = e.getValue().deepCopy();
                idFor(source, namespace + "." + e.getKey(), "$.categories." + e.getKey());
                categories.put(e.getKey(), source);
                members.put(e.getKey(), new LinkedHashMap<>());
            }

            // states first so events can refer to them by local name
            for (Map.Entry<String, ObjectNode> e : declaration.states().entrySet()) {
                place("states", e.getKey(), e.getValue(), EntityKind.STATE);
            }
            for (Map.Entry<String, ObjectNode> e : declaration.actions().entrySet()) {
                place("actions", e.getKey(), e.getValue(), EntityKind.ACTION);
            }
            if (sdk >= 4) {
                for (Map.Entry<String, ObjectNode> e : declaration.connectors().entrySet()) {
                    place("connectors", e.getKey(), e.getValue(), EntityKind.CONNECTOR);
                }
            }
            for (Map.Entry<String, ObjectNode> e : declaration.events().entrySet()) {
                place("events", e.getKey(), e.getValue(), EntityKind.EVENT);
            }

            ArrayNode categoryArray = NODES.arrayNode();
            for (Map.Entry<String, ObjectNode> e : categories.entrySet()) {
                ObjectNode source = e.getValue();
                members.get(e.getKey()).forEach(source::set);
                categoryArray.add(expand(source, EntityKind.CATEGORY));
            }
            info.set("categories", categoryArray);

            if (sdk >= 3) {
                ArrayNode settings = NODES.arrayNode();
                for (Map.Entry<String, ObjectNode> e : declaration.settings().entrySet()) {
                    ObjectNode source = e.getValue().deepCopy();
                    if (!source.has("name")) {
                        source.put("name", e.getKey());
                    }
                    settings.add(expand(source, EntityKind.SETTING));
                }
                info.set("settings", settings);
            }

            return expand(info, EntityKind.PLUGIN);
        }

        private void place(String section, String local, ObjectNode declared, EntityKind kind) {
            String path = "$." + section + "." + local;
            ObjectNode source = declared.deepCopy();

            String categoryKey = owningCategory(source, path);
            if (categoryKey == null) {
                return;
            }
            String id = idFor(source, namespace + "." + categoryKey + "." + local, path);

            switch (kind) {
                case STATE -> stateIds.put(local, id);
                case EVENT -> resolveStateReference(source);
                case ACTION, CONNECTOR -> {
                    JsonNode data = source.get("data");
                    if (data != null) {
                        source.set("data", dataItems(data, id, path));
                    }
                    rewriteFormat(source, path);
                }
                default -> { }
            }

            members.get(categoryKey)
                    .computeIfAbsent(section, s -> NODES.arrayNode())
                    .add(expand(source, kind));
        }

        private String owningCategory(ObjectNode source, String path) {
            JsonNode category = source.get("category");
            if (category == null) {
                return categories.keySet().iterator().next();
            }
            if (category.isTextual() && categories.containsKey(category.asText())) {
                return category.asText();
            }
            problem(path, "category", Violation.Rule.UNRESOLVED_REFERENCE,
                    "No category declared with local name '" + category.asText() + "'");
            return null;
        }

        private ArrayNode dataItems(JsonNode data, String ownerId, String ownerPath) {
            ArrayNode items = NODES.arrayNode();
            if (data.isArray()) {
                for (JsonNode item : data) {
                    items.add(item.isObject()
                            ? expand((ObjectNode) item, EntityKind.ACTION_DATA)
                            : item.deepCopy());
                }
                return items;
            }
            if (!data.isObject()) {
                problem(ownerPath, "data", Violation.Rule.WRONG_TYPE,
                        "data must be an object keyed by local name or an array");
                return items;
            }
            Iterator<Map.Entry<String, JsonNode>> it = data.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String path = ownerPath + ".data." + e.getKey();
                if (!e.getValue().isObject()) {
                    problem(path, "", Violation.Rule.MALFORMED, "Data item must be an object");
                    continue;
                }
                ObjectNode source = ((ObjectNode) e.getValue()).deepCopy();
                idFor(source, ownerId + "." + e.getKey(), path);
                items.add(expand(source, EntityKind.ACTION_DATA));
            }
            return items;
        }

        private void rewriteFormat(ObjectNode entity, String path) {
            JsonNode format = entity.get("format");
            JsonNode data = entity.get("data");
            if (format == null || !format.isTextual()) {
                return;
            }

            Map<String, String> byLocalName = new LinkedHashMap<>();
            if (data != null && data.isArray()) {
                for (JsonNode item : data) {
                    JsonNode id = item.get("id");
                    if (id != null && id.isTextual()) {
                        String full = id.asText();
                        byLocalName.put(full.substring(full.lastIndexOf('.') + 1), full);
                    }
                }
            }
            List<String> byPosition = new ArrayList<>(byLocalName.values());

            Matcher m = FORMAT_TOKEN.matcher(format.asText());
            StringBuilder out = new StringBuilder();
            while (m.find()) {
                String token = m.group(1);
                String dataId = byLocalName.get(token);
                if (dataId == null && token.chars().allMatch(Character::isDigit)) {
                    int index = Integer.parseInt(token) - 1;
                    if (index >= 0 && index < byPosition.size()) {
                        dataId = byPosition.get(index);
                    }
                }
                if (dataId == null) {
                    problem(path, "format", Violation.Rule.UNRESOLVED_REFERENCE,
                            "Token $[" + token + "] does not name a data item by local name or position");
                    m.appendReplacement(out, Matcher.quoteReplacement(m.group()));
                } else {
                    m.appendReplacement(out, Matcher.quoteReplacement("{$" + dataId + "$}"));
                }
            }
            m.appendTail(out);
            entity.put("format", out.toString());
        }

        private void resolveStateReference(ObjectNode event) {
            JsonNode ref = event.get("valueStateId");
            if (ref != null && ref.isTextual() && stateIds.containsKey(ref.asText())) {
                event.put("valueStateId", stateIds.get(ref.asText()));
            }
        }

        /**
         * Copies {@code source} into table order, filling defaults and dropping
         * declaration-only keys. Unknown keys are kept so validation reports them.
         */
        private ObjectNode expand(ObjectNode source, EntityKind kind) {
            ObjectNode out = NODES.objectNode();
            for (AttributeRule rule : SdkSchema.rulesFor(kind).values()) {
                JsonNode value = source.get(rule.name());
                if (value != null) {
                    out.set(rule.name(), value);
                } else if (rule.appliesAt(sdk)) {
                    rule.defaultValueCopy().ifPresent(d -> out.set(rule.name(), d));
                }
            }
            Iterator<Map.Entry<String, JsonNode>> it = source.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!out.has(e.getKey()) && !DECLARATION_ONLY.contains(e.getKey())) {
                    out.set(e.getKey(), e.getValue());
                }
            }
            return out;
        }

        /**
         * Fills in the derived id when none is declared. A declared id is never
         * replaced; a non-string one is left for the validator to report, and
         * child identifiers fall back to the derived form.
         */
        private String idFor(ObjectNode source, String derived, String path) {
            JsonNode explicit = source.get("id");
            if (explicit == null) {
                source.put("id", derived);
                return derived;
            }
            if (!explicit.isTextual()) {
                return derived;
            }
            if (explicit.asText().isBlank()) {
                problem(path, "id", Violation.Rule.INVALID_VALUE, "Declared id must not be blank");
                return derived;
            }
            return explicit.asText();
        }

        private void problem(String path, String attribute, Violation.Rule rule, String message) {
            problems.add(new Violation(path, attribute, rule, message));
        }
    }
}
