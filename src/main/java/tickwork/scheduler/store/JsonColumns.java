package tickwork.scheduler.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import tickwork.scheduler.model.Frequency;
import tickwork.scheduler.model.RecurrenceRule;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON encoding of the CLOB columns: the recurrence rule and the opaque job
 * config. Dates are written as ISO-8601 strings.
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> CONFIG_TYPE = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String writeConfig(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return "{}";
        }
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job config is not serializable: " + e.getMessage(), e);
        }
    }

    static Map<String, Object> readConfig(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, CONFIG_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt job config column: " + e.getMessage(), e);
        }
    }

    static String writeRule(RecurrenceRule rule) {
        if (rule == null) {
            return null;
        }
        ObjectNode node = MAPPER.createObjectNode();
        node.put("frequency", rule.frequency() != null ? rule.frequency().name() : null);
        node.put("interval", rule.interval());
        ArrayNode dow = node.putArray("days_of_week");
        rule.daysOfWeek().forEach(dow::add);
        ArrayNode dom = node.putArray("days_of_month");
        rule.daysOfMonth().forEach(dom::add);
        node.put("time_of_day", rule.timeOfDay());
        node.put("start_date", rule.startDate() != null ? rule.startDate().toString() : null);
        node.put("end_date", rule.endDate() != null ? rule.endDate().toString() : null);
        if (rule.count() != null) {
            node.put("count", rule.count());
        } else {
            node.putNull("count");
        }
        ArrayNode exceptions = node.putArray("exceptions");
        rule.exceptions().stream().sorted().forEach(d -> exceptions.add(d.toString()));
        return node.toString();
    }

    static RecurrenceRule readRule(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            String frequency = text(node, "frequency");
            RecurrenceRule.Builder builder = RecurrenceRule
                    .builder(frequency != null ? Frequency.valueOf(frequency) : null)
                    .interval(node.path("interval").asInt(1))
                    .daysOfWeek(ints(node.path("days_of_week")))
                    .daysOfMonth(ints(node.path("days_of_month")))
                    .startDate(date(node, "start_date"))
                    .endDate(date(node, "end_date"));
            String timeOfDay = text(node, "time_of_day");
            if (timeOfDay != null) {
                builder.timeOfDay(timeOfDay);
            }
            JsonNode count = node.path("count");
            if (count.isNumber()) {
                builder.count(count.asInt());
            }
            Set<LocalDate> exceptions = new LinkedHashSet<>();
            for (JsonNode d : node.path("exceptions")) {
                exceptions.add(LocalDate.parse(d.asText()));
            }
            return builder.exceptions(exceptions).build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt recurrence rule column: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static LocalDate date(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? LocalDate.parse(value) : null;
    }

    private static List<Integer> ints(JsonNode array) {
        List<Integer> values = new ArrayList<>();
        for (JsonNode n : array) {
            values.add(n.asInt());
        }
        return values;
    }
}
