package com.giftcalc.adapter.out.http.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Body of the provider's "latest rates" endpoint
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExchangeRateApiResponse {

    public static final String RESULT_SUCCESS = "success";

    String result;
    String baseCode;
    Map<String, BigDecimal> rates;

    @JsonCreator
    public ExchangeRateApiResponse(
            @JsonProperty("result") String result,
            @JsonProperty("base_code") String baseCode,
            @JsonProperty("rates") Map<String, BigDecimal> rates) {
        this.result = result;
        this.baseCode = baseCode;
        this.rates = rates;
    }

    public boolean isSuccessful() {
        return RESULT_SUCCESS.equals(result) && rates != null;
    }
}
