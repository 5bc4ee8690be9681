package com.questrail.touchportal.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Value-domain checks driven by an entity's declared {@code type}.
 *
 * <p>Applies to action data items, states and settings:</p>
 * <ul>
 *   <li>{@code number}: numeric default, {@code minValue <= maxValue}, default in range</li>
 *   <li>{@code choice}: non-empty {@code valueChoices}; a non-blank default must be one of them</li>
 *   <li>{@code switch}: boolean default</li>
 *   <li>{@code color}: default of the form {@code #RRGGBB} or {@code #RRGGBBAA}</li>
 * </ul>
 *
 * <p>Only attributes that are present are checked. Missing attributes are the
 * concern of the required-attribute rules.</p>
 */
public final class TypeDomains
{
    private static final Pattern COLOR = Pattern.compile("^#([0-9A-Fa-f]{6}|[0-9A-Fa-f]{8})$");

    /**
     * A single out-of-domain attribute value.
     */
    public record Problem(String attribute, String message) {}

    private TypeDomains() {}

    public static boolean appliesTo(EntityKind kind) {
        return kind == EntityKind.ACTION_DATA || kind == EntityKind.STATE || kind == EntityKind.SETTING;
    }

    public static List<Problem> check(EntityKind kind, ObjectNode entity) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entity, "entity");

        List<Problem> problems = new ArrayList<>();
        if (!appliesTo(kind)) {
            return problems;
        }
        JsonNode type = entity.get("type");
        if (type == null || !type.isTextual()) {
            return problems;
        }

        JsonNode dflt = entity.get("default");
        switch (type.asText()) {
            case "number" -> checkNumber(entity, dflt, problems);
            case "choice" -> checkChoice(entity, dflt, problems);
            case "switch" -> {
                if (dflt != null && !isBooleanLike(dflt)) {
                    problems.add(new Problem("default", "switch default must be true or false, got '" + dflt.asText() + "'"));
                }
            }
            case "color" -> {
                if (dflt != null && !COLOR.matcher(dflt.asText()).matches()) {
                    problems.add(new Problem("default", "color default must look like #RRGGBB or #RRGGBBAA, got '" + dflt.asText() + "'"));
                }
            }
            default -> {
                // text, file, folder: any value
            }
        }
        return problems;
    }

    private static void checkNumber(ObjectNode entity, JsonNode dflt, List<Problem> problems) {
        Optional<BigDecimal> min = integral(entity.get("minValue"));
        Optional<BigDecimal> max = integral(entity.get("maxValue"));

        if (min.isPresent() && max.isPresent() && min.get().compareTo(max.get()) > 0) {
            problems.add(new Problem("minValue", "minValue " + min.get() + " exceeds maxValue " + max.get()));
        }
        if (dflt == null) {
            return;
        }
        Optional<BigDecimal> value = numeric(dflt);
        if (value.isEmpty()) {
            problems.add(new Problem("default", "number default must be numeric, got '" + dflt.asText() + "'"));
            return;
        }
        if (min.isPresent() && value.get().compareTo(min.get()) < 0) {
            problems.add(new Problem("default", "default " + dflt.asText() + " is below minValue " + min.get()));
        }
        if (max.isPresent() && value.get().compareTo(max.get()) > 0) {
            problems.add(new Problem("default", "default " + dflt.asText() + " is above maxValue " + max.get()));
        }
    }

    private static void checkChoice(ObjectNode entity, JsonNode dflt, List<Problem> problems) {
        JsonNode choices = entity.get("valueChoices");
        if (choices == null) {
            problems.add(new Problem("valueChoices", "choice type requires valueChoices"));
            return;
        }
        if (!choices.isArray()) {
            return;
        }
        if (choices.isEmpty()) {
            problems.add(new Problem("valueChoices", "choice type requires at least one value"));
            return;
        }
        if (dflt == null || dflt.asText().isBlank()) {
            return;
        }
        for (JsonNode choice : choices) {
            if (choice.asText().equals(dflt.asText())) {
                return;
            }
        }
        problems.add(new Problem("default", "default '" + dflt.asText() + "' is not one of valueChoices"));
    }

    private static boolean isBooleanLike(JsonNode value) {
        if (value.isBoolean()) {
            return true;
        }
        return value.isTextual()
                && (value.asText().equalsIgnoreCase("true") || value.asText().equalsIgnoreCase("false"));
    }

    private static Optional<BigDecimal> integral(JsonNode value) {
        return value != null && value.isIntegralNumber() ? Optional.of(value.decimalValue()) : Optional.empty();
    }

    private static Optional<BigDecimal> numeric(JsonNode value) {
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(new BigDecimal(value.asText().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
