package com.giftcalc.adapter.out.http;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftcalc.adapter.out.http.dto.ExchangeRateApiResponse;
import com.giftcalc.application.port.out.ExchangeRateProvider;
import com.giftcalc.domain.model.RateFetchResult;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * HTTP adapter to fetch exchange rates from the external rate API
 * Implements ExchangeRateProvider output port
 * One GET per call, no retries, no timeout beyond the client's own
 */
@Slf4j
public class ExchangeRateHttpAdapter implements ExchangeRateProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final WebClient webClient;
    private final String apiBaseUrl;

    public ExchangeRateHttpAdapter(WebClient webClient, String apiBaseUrl) {
        this.webClient = webClient;
        this.apiBaseUrl = apiBaseUrl.endsWith("/")
                ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1)
                : apiBaseUrl;
    }

    @Override
    public Future<RateFetchResult> fetchRates(String baseCurrency) {
        String url = apiBaseUrl + "/" + baseCurrency;
        log.info("Fetching exchange rates for {} from {}", baseCurrency, url);

        return webClient.getAbs(url)
                .send()
                .map(this::toResult)
                .otherwise(error -> {
                    log.warn("Exchange rate request for {} failed: {}", baseCurrency, error.getMessage());
                    return RateFetchResult.failure("Conversion failed: " + error.getMessage());
                });
    }

    private RateFetchResult toResult(HttpResponse<Buffer> response) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("Exchange rate API returned HTTP {}", status);
            return RateFetchResult.unavailable();
        }

        ExchangeRateApiResponse body;
        try {
            Buffer buffer = response.body();
            body = MAPPER.readValue(buffer == null ? new byte[0] : buffer.getBytes(), ExchangeRateApiResponse.class);
        } catch (IOException e) {
            log.warn("Exchange rate API returned an unreadable body: {}", e.getMessage());
            return RateFetchResult.failure("Conversion failed: " + e.getMessage());
        }

        if (body == null || !body.isSuccessful()) {
            log.warn("Exchange rate API reported result '{}'", body == null ? null : body.getResult());
            return RateFetchResult.unavailable();
        }

        log.info("Fetched {} exchange rates for base {}", body.getRates().size(), body.getBaseCode());
        return RateFetchResult.success(body.getRates());
    }
}
