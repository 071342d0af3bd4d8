package com.dixonrepair.vinsearch.vehicle.impl;

import com.dixonrepair.vinsearch.config.VinDecodeProperties;
import com.dixonrepair.vinsearch.exception.ResolutionFailedException;
import com.dixonrepair.vinsearch.model.VehicleProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NHTSA VIN decode client")
class NhtsaVinDecodeClientTest {

    private static final String VIN = "1HGBH41JXMN109186";
    private final ObjectMapper mapper = new ObjectMapper();

    private NhtsaVinDecodeClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(status)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build()))
                .build();
        return new NhtsaVinDecodeClient(webClient, new VinDecodeProperties());
    }

    @Test
    @DisplayName("Clean decode maps make, model, year, trim and engine")
    void cleanDecode() {
        String body = "{\"Count\":1,\"Results\":[{\"ErrorCode\":\"0\",\"Make\":\"HONDA\",\"Model\":\"Civic\","
                + "\"ModelYear\":\"2021\",\"Trim\":\"EX\",\"EngineModel\":\"K20C2\"}]}";

        VehicleProfile profile = clientReturning(HttpStatus.OK, body).decode(VIN);

        assertThat(profile.getMake()).isEqualTo("HONDA");
        assertThat(profile.getModel()).isEqualTo("Civic");
        assertThat(profile.getYear()).isEqualTo("2021");
        assertThat(profile.getTrim()).isEqualTo("EX");
        assertThat(profile.getEngine()).isEqualTo("K20C2");
        assertThat(profile.getVin()).isEqualTo(VIN);
        assertThat(profile.isPartialDecode()).isFalse();
        assertThat(profile.isVinResolved()).isTrue();
    }

    @Test
    @DisplayName("Error code 8 is a partial decode; engine falls back to displacement")
    void partialDecode() throws Exception {
        String body = "{\"Results\":[{\"ErrorCode\":\"8\",\"Make\":\"HONDA\",\"Model\":\"Accord\","
                + "\"ModelYear\":\"1991\",\"Trim\":\"\",\"EngineModel\":\"\",\"EngineConfiguration\":\"In-Line\","
                + "\"DisplacementL\":\"2.2\"}]}";

        VehicleProfile profile = clientReturning(HttpStatus.OK, "{}").parse(VIN, mapper.readTree(body));

        assertThat(profile.isPartialDecode()).isTrue();
        assertThat(profile.getTrim()).isNull();
        assertThat(profile.getEngine()).isEqualTo("In-Line 2.2L");
    }

    @Test
    @DisplayName("Other error codes and missing fields fail resolution")
    void decodeErrors() throws Exception {
        NhtsaVinDecodeClient client = clientReturning(HttpStatus.OK, "{}");

        assertThatThrownBy(() -> client.parse(VIN, mapper.readTree(
                "{\"Results\":[{\"ErrorCode\":\"1,11\",\"ErrorText\":\"1 - Check Digit (9th position) does not calculate properly\"}]}")))
                .isInstanceOf(ResolutionFailedException.class)
                .hasMessageContaining("Check Digit");

        assertThatThrownBy(() -> client.parse(VIN, mapper.readTree(
                "{\"Results\":[{\"ErrorCode\":\"0\",\"Make\":\"HONDA\",\"Model\":\"\",\"ModelYear\":\"2021\"}]}")))
                .isInstanceOf(ResolutionFailedException.class)
                .hasMessageContaining("year, make and model");

        assertThatThrownBy(() -> client.parse(VIN, mapper.readTree("{\"Results\":[]}")))
                .isInstanceOf(ResolutionFailedException.class);
    }

    @Test
    @DisplayName("HTTP errors become resolution failures")
    void httpError() {
        NhtsaVinDecodeClient client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE, "");

        assertThatThrownBy(() -> client.decode(VIN))
                .isInstanceOf(ResolutionFailedException.class)
                .hasMessageContaining("503");
    }
}
