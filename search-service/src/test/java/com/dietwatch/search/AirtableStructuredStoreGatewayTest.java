package com.dietwatch.search;

import com.dietwatch.search.exception.BackendTimeoutException;
import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.exception.InvalidQueryException;
import com.dietwatch.search.exception.UpstreamThrottledException;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.service.AirtableStructuredStoreGateway;
import com.dietwatch.search.service.StructuredStoreGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AirtableStructuredStoreGatewayTest {

    private static final String RECORDS = """
            {"records":[
              {"id":"recA","createdTime":"2025-01-01T00:00:00.000Z",
               "fields":{"Title":"Consumption tax","Summary":"tax relief for food","Category":"bill","Date":"2025-06-12","Version":3}},
              {"id":"recB","createdTime":"2025-01-01T00:00:00.000Z",
               "fields":{"Title":"Education reform","Summary":"tax credits","Category":"bill","Date":"2025-02-01","Version":1}},
              {"id":"recC","createdTime":"2025-01-01T00:00:00.000Z",
               "fields":{"Title":"Unrelated","Summary":"nothing here","Category":"bill"}}
            ]}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void testSearchScoresLocallyAndSendsFormula() {
        AirtableStructuredStoreGateway gateway = gateway(ok(RECORDS));

        StructuredStoreGateway.KeywordPage page = gateway.search("Tax", new SearchFilters("bill", null, "2025-01-01", null), null);
        List<ScoredHit> hits = page.hits();

        assertThat(page.scanned()).isEqualTo(3);
        assertThat(page.hasMore()).isFalse();
        assertThat(hits).extracting(ScoredHit::entityId).containsExactly("recA", "recB");
        assertThat(hits.get(0).score()).isEqualTo(3.0);
        assertThat(hits.get(1).score()).isEqualTo(1.0);
        assertThat(hits.get(0).date()).isEqualTo(LocalDate.of(2025, 6, 12));

        URI uri = requests.get(0).url();
        assertThat(uri.getPath()).isEqualTo("/v0/appBase/Bills");
        assertThat(uri.getQuery())
                .contains("SEARCH(\"tax\", LOWER({Title}&\"\"))")
                .contains("{Category}=\"bill\"")
                .contains("NOT(IS_BEFORE({Date}, \"2025-01-01\"))")
                .contains("pageSize=100")
                .doesNotContain("offset=");
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.GET);
    }

    @Test
    void testSearchPassesAndReturnsOffset() {
        AirtableStructuredStoreGateway gateway = gateway(ok("""
                {"records":[{"id":"recD","fields":{"Title":"Tax credits","Version":1}}],"offset":"itr2/recD"}
                """));

        StructuredStoreGateway.KeywordPage page = gateway.search("tax", SearchFilters.none(), "itr1/recC");

        assertThat(page.hits()).extracting(ScoredHit::entityId).containsExactly("recD");
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextOffset()).isEqualTo("itr2/recD");
        assertThat(requests.get(0).url().getQuery()).contains("offset=itr1/recC");
    }

    @Test
    void testFormulaEscapesQuotesAndHandlesNoClauses() {
        AirtableStructuredStoreGateway gateway = gateway(ok(RECORDS));

        assertThat(gateway.searchFormula(List.of(), SearchFilters.none())).isEqualTo("TRUE()");
        assertThat(gateway.searchFormula(List.of("say \"hi\""), SearchFilters.none()))
                .contains("say \\\"hi\\\"")
                .startsWith("OR(");
        assertThat(AirtableStructuredStoreGateway.terms("  Tax  tax reform ")).containsExactly("tax", "reform");
    }

    @Test
    void testThrottleCarriesRetryAfter() {
        AirtableStructuredStoreGateway gateway = gateway(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "30")
                .build()));

        assertThatThrownBy(() -> gateway.search("tax", null, null))
                .isInstanceOf(UpstreamThrottledException.class)
                .satisfies(ex -> assertThat(((UpstreamThrottledException) ex).getRetryAfter()).isEqualTo(Duration.ofSeconds(30)));
    }

    @Test
    void testServerErrorIsTransientAndClientErrorIsNot() {
        AirtableStructuredStoreGateway failing = gateway(status(HttpStatus.BAD_GATEWAY));
        AirtableStructuredStoreGateway rejecting = gateway(status(HttpStatus.UNPROCESSABLE_ENTITY));

        assertThatThrownBy(() -> failing.search("tax", null, null)).isInstanceOf(BackendUnavailableException.class);
        assertThatThrownBy(() -> rejecting.search("tax", null, null)).isInstanceOf(InvalidQueryException.class);
    }

    @Test
    void testSlowResponseTimesOut() {
        AirtableStructuredStoreGateway gateway = gateway(request -> Mono.never());

        assertThatThrownBy(() -> gateway.search("tax", null, null)).isInstanceOf(BackendTimeoutException.class);
    }

    @Test
    void testConnectionFailureIsUnavailable() {
        AirtableStructuredStoreGateway gateway = gateway(request -> Mono.error(new WebClientRequestException(
                new ConnectException("refused"), HttpMethod.GET, request.url(), HttpHeaders.EMPTY)));

        assertThatThrownBy(() -> gateway.search("tax", null, null)).isInstanceOf(BackendUnavailableException.class);
    }

    @Test
    void testGetEntityMapsFieldsAndVersion() {
        AirtableStructuredStoreGateway gateway = gateway(ok("""
                {"id":"recA","createdTime":"2025-01-01T00:00:00.000Z",
                 "fields":{"Title":"Consumption tax","Body":"full text","Status":"passed","Date":"2025-06-12","Version":7}}
                """));

        SearchableEntity entity = gateway.getEntity("recA").orElseThrow();

        assertThat(entity.version()).isEqualTo(7);
        assertThat(entity.textFields()).containsKeys("Title", "Body");
        assertThat(entity.concatenatedText()).isEqualTo("Consumption tax\nfull text");
        assertThat(entity.status()).isEqualTo("passed");
        assertThat(entity.date()).isEqualTo(LocalDate.of(2025, 6, 12));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/v0/appBase/Bills/recA");
    }

    @Test
    void testVersionFallsBackToModifiedTime() {
        AirtableStructuredStoreGateway gateway = gateway(ok("""
                {"id":"recA","createdTime":"2025-01-01T00:00:00.000Z",
                 "fields":{"Title":"x","Updated_At":"2025-06-12T10:00:00.000Z"}}
                """));

        assertThat(gateway.getEntity("recA").orElseThrow().version())
                .isEqualTo(Instant.parse("2025-06-12T10:00:00Z").toEpochMilli());
    }

    @Test
    void testMissingEntityIsEmpty() {
        AirtableStructuredStoreGateway gateway = gateway(status(HttpStatus.NOT_FOUND));

        assertThat(gateway.getEntity("recZ")).isEqualTo(Optional.empty());
    }

    @Test
    void testListChangedSinceReturnsOffset() {
        AirtableStructuredStoreGateway gateway = gateway(ok("""
                {"records":[{"id":"recA","fields":{"Title":"x","Version":2}}],"offset":"itr1/recA"}
                """));

        StructuredStoreGateway.ChangedPage page = gateway.listChangedSince(Instant.parse("2026-03-01T08:00:00Z"), "itr0");

        assertThat(page.entities()).extracting(SearchableEntity::id).containsExactly("recA");
        assertThat(page.hasMore()).isTrue();
        assertThat(page.nextOffset()).isEqualTo("itr1/recA");
        assertThat(requests.get(0).url().getQuery())
                .contains("IS_AFTER(LAST_MODIFIED_TIME(), \"2026-03-01T08:00:00Z\")")
                .contains("offset=itr0");
    }

    @Test
    void testRetryAfterParsing() {
        assertThat(AirtableStructuredStoreGateway.retryAfter("12")).isEqualTo(Duration.ofSeconds(12));
        assertThat(AirtableStructuredStoreGateway.retryAfter(null)).isEqualTo(Duration.ZERO);
        assertThat(AirtableStructuredStoreGateway.retryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isEqualTo(Duration.ZERO);
    }

    private AirtableStructuredStoreGateway gateway(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://api.airtable.test/v0")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return exchange.exchange(request);
                })
                .build();
        return new AirtableStructuredStoreGateway(
                webClient,
                new ObjectMapper(),
                "appBase",
                "Bills",
                List.of("Title", "Summary", "Body"),
                "Category",
                "Status",
                "Date",
                "Version",
                "Updated_At",
                100,
                Duration.ofMillis(200)
        );
    }

    private static ExchangeFunction ok(String body) {
        return request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private static ExchangeFunction status(HttpStatus status) {
        return request -> Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body("{\"error\":\"" + status.name() + "\"}")
                .build());
    }
}
