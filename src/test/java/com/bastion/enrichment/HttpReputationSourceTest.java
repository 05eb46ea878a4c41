package com.bastion.enrichment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HTTP reputation source Tests")
class HttpReputationSourceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private WebClient respondingWith(HttpStatus status, String body) {
        return WebClient.builder()
            .baseUrl("https://feed.test")
            .exchangeFunction(request -> {
                requests.add(request);
                ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                if (body != null) {
                    response.body(body);
                }
                return Mono.just(response.build());
            })
            .build();
    }

    @Test
    @DisplayName("Should scale the AbuseIPDB confidence score and collect tags")
    void shouldParseAbuseIpDb() {
        // Given
        String json = "{\"data\":{\"ipAddress\":\"192.0.2.1\",\"abuseConfidenceScore\":87,"
            + "\"isTor\":true,\"usageType\":\"Data Center/Web Hosting/Transit\","
            + "\"totalReports\":12,\"countryCode\":\"NL\"}}";
        AbuseIpDbSource source = new AbuseIpDbSource(respondingWith(HttpStatus.OK, json), "secret",
            AbuseIpDbSource.DEFAULT_BUDGET);

        // When / Then
        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> {
                assertThat(signal.getSource()).isEqualTo("abuseipdb");
                assertThat(signal.getMaliciousConfidence()).isEqualTo(0.87);
                assertThat(signal.getTags()).containsExactly("tor", "data center/web hosting/transit");
                assertThat(signal.getRaw()).containsEntry("totalReports", 12).containsEntry("countryCode", "NL");
            })
            .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.url().getPath()).isEqualTo("/api/v2/check");
        assertThat(request.url().getQuery()).contains("ipAddress=192.0.2.1").contains("maxAgeInDays=90");
        assertThat(request.headers().getFirst("Key")).isEqualTo("secret");
    }

    @Test
    @DisplayName("Should accept the older AbuseIPDB percentage field")
    void shouldParseAbuseIpDbPercentageField() {
        String json = "{\"data\":{\"abuseConfidencePercentage\":40}}";
        AbuseIpDbSource source = new AbuseIpDbSource(respondingWith(HttpStatus.OK, json), "secret",
            AbuseIpDbSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> assertThat(signal.getMaliciousConfidence()).isEqualTo(0.4))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should compute the VirusTotal malicious share")
    void shouldParseVirusTotal() {
        String json = "{\"data\":{\"attributes\":{\"last_analysis_stats\":"
            + "{\"harmless\":60,\"malicious\":20,\"suspicious\":5,\"undetected\":15},"
            + "\"tags\":[\"proxy\"],\"reputation\":-12}}}";
        VirusTotalSource source = new VirusTotalSource(respondingWith(HttpStatus.OK, json), "vt-key",
            VirusTotalSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> {
                assertThat(signal.getMaliciousConfidence()).isEqualTo(0.2);
                assertThat(signal.getTags()).containsExactly("proxy");
                assertThat(signal.getRaw()).containsEntry("reputation", -12);
            })
            .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v3/ip_addresses/192.0.2.1");
        assertThat(requests.get(0).headers().getFirst("x-apikey")).isEqualTo("vt-key");
    }

    @Test
    @DisplayName("Should report zero confidence for VirusTotal without analysis stats")
    void shouldHandleEmptyVirusTotalStats() {
        VirusTotalSource source = new VirusTotalSource(respondingWith(HttpStatus.OK, "{\"data\":{}}"), "vt-key",
            VirusTotalSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> assertThat(signal.getMaliciousConfidence()).isZero())
            .verifyComplete();
    }

    @Test
    @DisplayName("Should carry Shodan exposure context without confidence")
    void shouldParseShodan() {
        String json = "{\"ports\":[22,443],\"hostnames\":[\"host.example.net\"],"
            + "\"org\":\"Example Hosting\",\"country_code\":\"US\"}";
        ShodanSource source = new ShodanSource(respondingWith(HttpStatus.OK, json), "sh-key",
            ShodanSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> {
                assertThat(signal.getMaliciousConfidence()).isZero();
                assertThat(signal.getRaw()).containsEntry("ports", List.of(22, 443))
                    .containsEntry("org", "Example Hosting");
            })
            .verifyComplete();

        assertThat(requests.get(0).url().getPath()).isEqualTo("/shodan/host/192.0.2.1");
        assertThat(requests.get(0).url().getQuery()).isEqualTo("key=sh-key");
        assertThat(source.maliciousCutoff()).isGreaterThan(1.0);
    }

    @Test
    @DisplayName("Should treat 404 as an unlisted IP")
    void shouldTreatNotFoundAsUnlisted() {
        VirusTotalSource source = new VirusTotalSource(respondingWith(HttpStatus.NOT_FOUND, null), "vt-key",
            VirusTotalSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .assertNext(signal -> {
                assertThat(signal.getSource()).isEqualTo("virustotal");
                assertThat(signal.getMaliciousConfidence()).isZero();
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Should propagate server errors to the caller")
    void shouldPropagateServerErrors() {
        AbuseIpDbSource source = new AbuseIpDbSource(respondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "{}"), "secret",
            AbuseIpDbSource.DEFAULT_BUDGET);

        StepVerifier.create(source.lookup("192.0.2.1"))
            .expectError(WebClientResponseException.class)
            .verify();
    }

    @Test
    @DisplayName("Should open the circuit after repeated failures")
    void shouldOpenCircuitAfterFailures() {
        AbuseIpDbSource source = new AbuseIpDbSource(respondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "{}"), "secret",
            AbuseIpDbSource.DEFAULT_BUDGET);

        for (int i = 0; i < 5; i++) {
            StepVerifier.create(source.lookup("192.0.2.1")).expectError().verify();
        }
        int sent = requests.size();
        StepVerifier.create(source.lookup("192.0.2.1")).expectError().verify();

        assertThat(source.getCircuitBreaker().getState().name()).isEqualTo("OPEN");
        assertThat(requests).hasSize(sent);
    }
}
