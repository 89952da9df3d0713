package com.valan.harvester.crawl.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.valan.harvester.crawl.model.PublicationRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the registry's publication JSON onto {@link PublicationRecord}. Field names
 * are the registry's own (Dutch) wire names.
 */
@Component
public class PublicationJsonMapper {
    private static final int MAX_DESCRIPTION_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public PublicationJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode readTree(byte[] body) throws IOException {
        return objectMapper.readTree(body);
    }

    public PublicationRecord toRecord(JsonNode node, long requestedId) {
        long id = node.path("publicatieId").asLong(requestedId);
        if (id <= 0) {
            id = requestedId;
        }
        List<String> cpvCodes = new ArrayList<>();
        String cpvPrimary = null;
        for (JsonNode cpv : iterable(node.get("cpvCodes"))) {
            String code = text(cpv, "code");
            if (code == null) {
                continue;
            }
            cpvCodes.add(code);
            if (cpvPrimary == null && cpv.path("isHoofdOpdracht").asBoolean(false)) {
                cpvPrimary = code;
            }
        }
        if (cpvPrimary == null && !cpvCodes.isEmpty()) {
            cpvPrimary = cpvCodes.get(0);
        }
        List<String> nutsCodes = new ArrayList<>();
        for (JsonNode nuts : iterable(node.get("nutsCodes"))) {
            String code = text(nuts, "code");
            if (code != null) {
                nutsCodes.add(code);
            }
        }

        String procedure = describedCode(node.get("procedureCode"));
        String contractType = describedCode(node.get("typeOpdrachtCode"));
        String reference = text(node, "kenmerk");
        String tedNumber = text(node, "pbNummerTed");
        String publicationCode = text(node, "publicatieCode");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("kenmerk", reference);
        metadata.put("procedure", procedure);
        metadata.put("tedNummer", tedNumber);
        metadata.put("isDigitaal", scalar(node.get("isDigitaalInschrijvenMogelijk")));
        metadata.put("typeOpdracht", contractType);
        metadata.put("publicatieCode", publicationCode);
        metadata.put("referentieNummer", text(node, "referentieNummer"));
        metadata.put("gerelateerdePublicaties", tree(node.get("gerelateerdePublicaties")));

        return new PublicationRecord(
            id,
            orEmpty(firstNonBlank(text(node, "aanbestedingNaam"), text(node, "titel"))),
            buyerName(node),
            noticeType(node),
            parseDateTime(text(node, "publicatieDatum")),
            parseDateTime(text(node, "sluitingsDatum")),
            isAboveThreshold(node),
            cpvCodes,
            cpvPrimary,
            nutsCodes,
            procedure,
            contractType,
            truncate(text(node, "opdrachtBeschrijving"), MAX_DESCRIPTION_LENGTH),
            reference,
            tedNumber,
            publicationCode,
            metadata
        );
    }

    public long latestId(JsonNode listing) {
        JsonNode content = listing == null ? null : listing.get("content");
        if (content == null || !content.isArray() || content.isEmpty()) {
            return 0L;
        }
        return content.get(0).path("publicatieId").asLong(0L);
    }

    String noticeType(JsonNode node) {
        JsonNode type = node.get("typePublicatie");
        if (type == null || type.isNull()) {
            return "";
        }
        if (type.isObject()) {
            return orEmpty(firstNonBlank(text(type, "omschrijving"), text(type, "code")));
        }
        return type.asText("").trim();
    }

    private String buyerName(JsonNode node) {
        String buyer = text(node, "opdrachtgeverNaam");
        if (buyer != null) {
            return buyer;
        }
        JsonNode service = node.get("aanbestedendeDienst");
        if (service == null || service.isNull()) {
            return "";
        }
        if (service.isObject()) {
            return orEmpty(firstNonBlank(text(service, "naam"), text(service, "name")));
        }
        return service.asText("").trim();
    }

    private boolean isAboveThreshold(JsonNode node) {
        if (node.path("europees").asBoolean(false)) {
            return true;
        }
        return "EU".equalsIgnoreCase(text(node.path("nationaalOfEuropeesCode"), "code"));
    }

    private String describedCode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            return firstNonBlank(text(node, "omschrijving"), text(node, "code"));
        }
        String value = node.asText("").trim();
        return value.isEmpty() ? null : value;
    }

    static OffsetDateTime parseDateTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String candidate = raw.trim();
        try {
            return OffsetDateTime.parse(candidate);
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less forms
        }
        try {
            return LocalDateTime.parse(candidate).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // fall through to a bare date
        }
        try {
            String datePart = candidate.length() >= 10 ? candidate.substring(0, 10) : candidate;
            return LocalDate.parse(datePart).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.asText();
    }

    private Object tree(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private Iterable<JsonNode> iterable(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return node;
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return value.toString();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
