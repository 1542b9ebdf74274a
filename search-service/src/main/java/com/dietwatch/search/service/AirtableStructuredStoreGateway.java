package com.dietwatch.search.service;

import com.dietwatch.search.exception.BackendTimeoutException;
import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.exception.SearchEngineException;
import com.dietwatch.search.exception.UpstreamThrottledException;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchableEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Airtable REST access. Keyword search is a {@code filterByFormula} OR-match of the query terms over
 * the configured text fields; relevance is computed locally by weighted term frequency, the first
 * text field counting double.
 */
@Service
public class AirtableStructuredStoreGateway implements StructuredStoreGateway {
    private static final Logger log = LoggerFactory.getLogger(AirtableStructuredStoreGateway.class);

    private static final int AIRTABLE_MAX_PAGE_SIZE = 100;
    private static final double PRIMARY_FIELD_WEIGHT = 2.0;
    private static final double SECONDARY_FIELD_WEIGHT = 1.0;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseId;
    private final String table;
    private final List<String> textFields;
    private final String categoryField;
    private final String statusField;
    private final String dateField;
    private final String versionField;
    private final String modifiedField;
    private final int pageSize;
    private final Duration requestTimeout;

    @Autowired
    public AirtableStructuredStoreGateway(
            @Value("${structured-store.base-url:https://api.airtable.com/v0}") String baseUrl,
            @Value("${structured-store.api-key:}") String apiKey,
            @Value("${structured-store.base-id}") String baseId,
            @Value("${structured-store.table}") String table,
            @Value("${structured-store.text-fields:Title,Summary,Body}") String textFields,
            @Value("${structured-store.category-field:Category}") String categoryField,
            @Value("${structured-store.status-field:Status}") String statusField,
            @Value("${structured-store.date-field:Date}") String dateField,
            @Value("${structured-store.version-field:Version}") String versionField,
            @Value("${structured-store.modified-field:Updated_At}") String modifiedField,
            @Value("${structured-store.page-size:100}") int pageSize,
            @Value("${structured-store.request-timeout-ms:800}") long requestTimeoutMs,
            ObjectMapper objectMapper
    ) {
        this(
                WebClient.builder()
                        .baseUrl(baseUrl)
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                        .build(),
                objectMapper,
                baseId,
                table,
                Arrays.stream(textFields.split(",")).map(String::trim).filter(f -> !f.isEmpty()).toList(),
                categoryField,
                statusField,
                dateField,
                versionField,
                modifiedField,
                pageSize,
                Duration.ofMillis(Math.max(50L, requestTimeoutMs))
        );
    }

    public AirtableStructuredStoreGateway(
            WebClient webClient,
            ObjectMapper objectMapper,
            String baseId,
            String table,
            List<String> textFields,
            String categoryField,
            String statusField,
            String dateField,
            String versionField,
            String modifiedField,
            int pageSize,
            Duration requestTimeout
    ) {
        if (textFields.isEmpty()) {
            throw new IllegalArgumentException("at least one text field is required");
        }
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseId = baseId;
        this.table = table;
        this.textFields = List.copyOf(textFields);
        this.categoryField = categoryField;
        this.statusField = statusField;
        this.dateField = dateField;
        this.versionField = versionField;
        this.modifiedField = modifiedField;
        this.pageSize = Math.min(AIRTABLE_MAX_PAGE_SIZE, Math.max(1, pageSize));
        this.requestTimeout = requestTimeout;
    }

    @Override
    public KeywordPage search(String text, SearchFilters filters, String offset) {
        List<String> terms = terms(text);
        String formula = searchFormula(terms, filters == null ? SearchFilters.none() : filters);
        JsonNode root = get(uriBuilder -> {
            UriBuilder builder = uriBuilder
                    .path("/{baseId}/{table}")
                    .queryParam("filterByFormula", "{formula}")
                    .queryParam("pageSize", pageSize);
            if (offset != null && !offset.isBlank()) {
                builder.queryParam("offset", "{offset}");
                return builder.build(baseId, table, formula, offset);
            }
            return builder.build(baseId, table, formula);
        }, false);

        List<ScoredHit> hits = new ArrayList<>();
        int scanned = 0;
        for (JsonNode record : root.path("records")) {
            scanned++;
            SearchableEntity entity = toEntity(record);
            double score = score(entity, terms);
            if (score > 0) {
                hits.add(new ScoredHit(entity.id(), score, entity.date()));
            }
        }
        return new KeywordPage(hits, scanned, root.path("offset").asText(null));
    }

    @Override
    public Optional<SearchableEntity> getEntity(String entityId) {
        JsonNode record = get(uriBuilder -> uriBuilder
                .path("/{baseId}/{table}/{recordId}")
                .build(baseId, table, entityId), true);
        return record == null ? Optional.empty() : Optional.of(toEntity(record));
    }

    @Override
    public ChangedPage listChangedSince(Instant since, String offset) {
        String formula = "IS_AFTER(LAST_MODIFIED_TIME(), \"" + since.toString() + "\")";
        JsonNode root = get(uriBuilder -> {
            UriBuilder builder = uriBuilder
                    .path("/{baseId}/{table}")
                    .queryParam("filterByFormula", "{formula}")
                    .queryParam("pageSize", AIRTABLE_MAX_PAGE_SIZE);
            if (offset != null && !offset.isBlank()) {
                builder.queryParam("offset", "{offset}");
                return builder.build(baseId, table, formula, offset);
            }
            return builder.build(baseId, table, formula);
        }, false);
        List<SearchableEntity> entities = new ArrayList<>();
        for (JsonNode record : root.path("records")) {
            entities.add(toEntity(record));
        }
        String next = root.path("offset").asText(null);
        return new ChangedPage(entities, next);
    }

    public String searchFormula(List<String> terms, SearchFilters filters) {
        List<String> clauses = new ArrayList<>();
        List<String> matches = new ArrayList<>();
        for (String term : terms) {
            for (String field : textFields) {
                matches.add("SEARCH(\"" + escape(term) + "\", LOWER({" + field + "}&\"\"))");
            }
        }
        if (!matches.isEmpty()) {
            clauses.add("OR(" + String.join(", ", matches) + ")");
        }
        if (hasText(filters.getCategory())) {
            clauses.add("{" + categoryField + "}=\"" + escape(filters.getCategory().trim()) + "\"");
        }
        if (hasText(filters.getStatus())) {
            clauses.add("{" + statusField + "}=\"" + escape(filters.getStatus().trim()) + "\"");
        }
        if (hasText(filters.getDateFrom())) {
            clauses.add("NOT(IS_BEFORE({" + dateField + "}, \"" + escape(filters.getDateFrom().trim()) + "\"))");
        }
        if (hasText(filters.getDateTo())) {
            clauses.add("NOT(IS_AFTER({" + dateField + "}, \"" + escape(filters.getDateTo().trim()) + "\"))");
        }
        if (clauses.isEmpty()) {
            return "TRUE()";
        }
        return clauses.size() == 1 ? clauses.get(0) : "AND(" + String.join(", ", clauses) + ")";
    }

    double score(SearchableEntity entity, List<String> terms) {
        double score = 0.0;
        int index = 0;
        for (String field : textFields) {
            String value = entity.textFields().get(field);
            double weight = index == 0 ? PRIMARY_FIELD_WEIGHT : SECONDARY_FIELD_WEIGHT;
            index++;
            if (value == null || value.isEmpty()) {
                continue;
            }
            String haystack = value.toLowerCase(Locale.ROOT);
            for (String term : terms) {
                score += weight * occurrences(haystack, term);
            }
        }
        return score;
    }

    private SearchableEntity toEntity(JsonNode record) {
        String id = record.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new BackendUnavailableException("structured store returned a record without id");
        }
        JsonNode fields = record.path("fields");
        Map<String, String> text = new LinkedHashMap<>();
        for (String field : textFields) {
            JsonNode node = fields.get(field);
            if (node != null && !node.isNull()) {
                text.put(field, node.isTextual() ? node.asText() : node.toString());
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        putText(metadata, "category", fields.get(categoryField));
        putText(metadata, "status", fields.get(statusField));
        putText(metadata, "date", fields.get(dateField));
        return new SearchableEntity(id, text, metadata, version(record, fields));
    }

    private long version(JsonNode record, JsonNode fields) {
        JsonNode versionNode = fields.get(versionField);
        if (versionNode != null && versionNode.canConvertToLong()) {
            return versionNode.asLong();
        }
        long modified = epochMillis(fields.path(modifiedField).asText(null));
        if (modified > 0) {
            return modified;
        }
        return Math.max(0L, epochMillis(record.path("createdTime").asText(null)));
    }

    private JsonNode get(Function<UriBuilder, URI> uri, boolean missingAsNull) {
        String body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException ex) {
            if (missingAsNull && ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return null;
            }
            throw translate(ex);
        } catch (WebClientRequestException ex) {
            throw new BackendUnavailableException("structured store unreachable: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            if (Exceptions.unwrap(ex) instanceof TimeoutException) {
                throw new BackendTimeoutException("structured store timed out after " + requestTimeout.toMillis() + "ms", ex);
            }
            throw ex;
        }
        if (body == null || body.isBlank()) {
            throw new BackendUnavailableException("structured store returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new BackendUnavailableException("structured store returned malformed JSON", ex);
        }
    }

    private SearchEngineException translate(WebClientResponseException ex) {
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == HttpStatus.TOO_MANY_REQUESTS) {
            Duration retryAfter = retryAfter(ex.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
            log.warn("event=structured_store_throttled retry_after_s={}", retryAfter.toSeconds());
            return new UpstreamThrottledException("structured store answered 429", retryAfter);
        }
        if (ex.getStatusCode().is5xxServerError()) {
            return new BackendUnavailableException("structured store answered " + ex.getStatusCode().value(), ex);
        }
        return new InvalidQueryException(
                "structured store rejected the request (" + ex.getStatusCode().value() + "): " + ex.getResponseBodyAsString(),
                ex
        );
    }

    public static Duration retryAfter(String header) {
        if (header == null || header.isBlank()) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofSeconds(Math.max(0L, Long.parseLong(header.trim())));
        } catch (NumberFormatException ex) {
            return Duration.ZERO;
        }
    }

    public static List<String> terms(String text) {
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(normalized.split("\\s+")).distinct().toList();
    }

    private static int occurrences(String haystack, String term) {
        int count = 0;
        int from = haystack.indexOf(term);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(term, from + term.length());
        }
        return count;
    }

    private static long epochMillis(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return -1L;
        }
        try {
            return OffsetDateTime.parse(timestamp).toInstant().toEpochMilli();
        } catch (DateTimeParseException ex) {
            return -1L;
        }
    }

    private static void putText(Map<String, Object> target, String key, JsonNode node) {
        if (node != null && !node.isNull()) {
            target.put(key, node.isTextual() ? node.asText() : node.toString());
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
