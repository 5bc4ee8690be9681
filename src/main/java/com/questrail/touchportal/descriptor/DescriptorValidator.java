package com.questrail.touchportal.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.touchportal.schema.AttributeRule;
import com.questrail.touchportal.schema.EntityKind;
import com.questrail.touchportal.schema.SdkSchema;
import com.questrail.touchportal.schema.TypeDomains;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * DescriptorValidator
 * =============================================================================
 * Checks a plugin descriptor document against the {@link SdkSchema} rule table.
 *
 * <h2>Checks</h2>
 * Applied depth-first over the whole category tree:
 * <ol>
 *   <li>Required attributes are present for every entity</li>
 *   <li>No unknown attribute, and none that is newer than the declared {@code sdk}</li>
 *   <li>Values have the right JSON type, are within permitted value lists and
 *       satisfy the type domain rules of {@link TypeDomains}</li>
 *   <li>Identifiers are unique across the whole document, at any depth</li>
 *   <li>{@code {$dataId$}} tokens in an action or connector {@code format} name a
 *       data item of that same entity; event {@code valueStateId}s name a declared state</li>
 * </ol>
 *
 * <p>Validation is total: every violation is collected in a single pass and
 * returned in one {@link ValidationReport}. Instances are stateless and may be
 * shared between threads.</p>
 */
public final class DescriptorValidator
{
    private static final Pattern DATA_TOKEN = Pattern.compile("\\{\\$([^$]+)\\$}");

    private final ObjectMapper mapper;

    public DescriptorValidator() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public DescriptorValidator(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Validates descriptor JSON text. Text that is not a JSON document yields a
     * single {@link Violation.Rule#MALFORMED} violation.
     */
    public ValidationReport validate(String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode document;
        try {
            document = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            return new ValidationReport(SdkSchema.DEFAULT_VERSION, List.of(new Violation(
                    "$", "", Violation.Rule.MALFORMED, "Descriptor is not valid JSON: " + e.getOriginalMessage())));
        }
        return validate(document);
    }

    public ValidationReport validate(JsonNode document) {
        if (document == null || !document.isObject()) {
            return new ValidationReport(SdkSchema.DEFAULT_VERSION, List.of(new Violation(
                    "$", "", Violation.Rule.MALFORMED, "Descriptor root must be a JSON object")));
        }
        int sdk = declaredVersion(document);
        Pass pass = new Pass(sdk);
        pass.entity((ObjectNode) document, EntityKind.PLUGIN, "$");
        pass.resolveStateReferences();
        return new ValidationReport(sdk, pass.violations);
    }

    /**
     * The schema version a document targets; {@link SdkSchema#DEFAULT_VERSION}
     * when absent or not an integer.
     */
    public static int declaredVersion(JsonNode document) {
        JsonNode sdk = document.get("sdk");
        return sdk != null && sdk.isIntegralNumber() ? sdk.intValue() : SdkSchema.DEFAULT_VERSION;
    }

    // -------------------------------------------------------------------------
    // Single validation pass
    // -------------------------------------------------------------------------

    private static final class Pass
    {
        private record StateReference(String path, String stateId) {}

        private final int sdk;
        private final List<Violation> violations = new ArrayList<>();
        private final Map<String, String> seenIds = new HashMap<>();
        private final Set<String> stateIds = new HashSet<>();
        private final List<StateReference> stateReferences = new ArrayList<>();

        Pass(int sdk) {
            this.sdk = sdk;
        }

        void entity(ObjectNode node, EntityKind kind, String path) {
            Map<String, AttributeRule> rules = SdkSchema.rulesFor(kind);

            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String name = field.getKey();
                JsonNode value = field.getValue();

                AttributeRule rule = rules.get(name);
                if (rule == null) {
                    report(path, name, Violation.Rule.UNKNOWN_ATTRIBUTE,
                            "Attribute is not known for " + kind.displayName());
                    continue;
                }
                if (!rule.type().matches(value)) {
                    report(path, name, Violation.Rule.WRONG_TYPE,
                            "Expected " + rule.type().description() + " but got " + value.getNodeType().name().toLowerCase());
                    continue;
                }
                if (!rule.appliesAt(sdk)) {
                    report(path, name, Violation.Rule.UNSUPPORTED_VERSION,
                            "Requires sdk " + rule.minSdk() + " but descriptor targets sdk " + sdk);
                    continue;
                }
                if (!rule.permits(value)) {
                    report(path, name, Violation.Rule.INVALID_VALUE,
                            "Got '" + value.asText() + "' but expected one of " + rule.choices());
                    continue;
                }
                if (name.equals(kind.identifierAttribute())) {
                    identifier(value.asText(), path, kind);
                }
                if (rule.hasChildren()) {
                    children(value, rule.childKind(), path + "." + name);
                }
            }

            for (AttributeRule rule : rules.values()) {
                if (rule.required() && rule.appliesAt(sdk) && !node.has(rule.name())) {
                    report(path, rule.name(), Violation.Rule.MISSING_REQUIRED,
                            "Missing required attribute of " + kind.displayName());
                }
            }

            for (TypeDomains.Problem problem : TypeDomains.check(kind, node)) {
                report(path, problem.attribute(), Violation.Rule.DOMAIN, problem.message());
            }

            if (kind == EntityKind.ACTION || kind == EntityKind.CONNECTOR) {
                formatReferences(node, path);
            }
            if (kind == EntityKind.EVENT) {
                text(node, "valueStateId").ifPresent(id -> stateReferences.add(new StateReference(path, id)));
            }
        }

        private void children(JsonNode array, EntityKind kind, String path) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode member = array.get(i);
                String memberPath = path + "[" + i + "]";
                if (member.isObject()) {
                    entity((ObjectNode) member, kind, memberPath);
                } else {
                    report(memberPath, "", Violation.Rule.MALFORMED,
                            "Expected a " + kind.displayName() + " object but got " + member.getNodeType().name().toLowerCase());
                }
            }
        }

        private void identifier(String id, String path, EntityKind kind) {
            String previous = seenIds.putIfAbsent(id, path);
            if (previous != null) {
                report(path, kind.identifierAttribute(), Violation.Rule.DUPLICATE_ID,
                        "Identifier '" + id + "' was already declared at " + previous);
            }
            if (kind == EntityKind.STATE) {
                stateIds.add(id);
            }
        }

        private void formatReferences(ObjectNode node, String path) {
            Optional<String> format = text(node, "format");
            if (format.isEmpty()) {
                return;
            }
            Set<String> dataIds = new HashSet<>();
            JsonNode data = node.get("data");
            if (data != null && data.isArray()) {
                for (JsonNode item : data) {
                    text(item, "id").ifPresent(dataIds::add);
                }
            }
            Matcher m = DATA_TOKEN.matcher(format.get());
            while (m.find()) {
                if (!dataIds.contains(m.group(1))) {
                    report(path, "format", Violation.Rule.UNRESOLVED_REFERENCE,
                            "Format references data item '" + m.group(1) + "' which this entity does not declare");
                }
            }
        }

        void resolveStateReferences() {
            for (StateReference ref : stateReferences) {
                if (!stateIds.contains(ref.stateId())) {
                    report(ref.path(), "valueStateId", Violation.Rule.UNRESOLVED_REFERENCE,
                            "Event refers to state '" + ref.stateId() + "' which is not declared");
                }
            }
        }

        private void report(String path, String attribute, Violation.Rule rule, String message) {
            violations.add(new Violation(path, attribute, rule, message));
        }

        private static Optional<String> text(JsonNode node, String attribute) {
            JsonNode value = node.get(attribute);
            return value != null && value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
        }
    }
}
