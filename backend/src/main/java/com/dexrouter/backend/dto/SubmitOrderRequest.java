package com.dexrouter.backend.dto;

import com.dexrouter.backend.model.OrderType;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitOrderRequest {

    @NotBlank
    @Size(max = 50)
    @JsonAlias("tokenIn")
    private String assetIn;

    @NotBlank
    @Size(max = 50)
    @JsonAlias("tokenOut")
    private String assetOut;

    // Matches the DECIMAL(20,8) column
    @NotNull
    @Positive
    @Digits(integer = 12, fraction = 8)
    private BigDecimal amount;

    // Fraction of the quoted price, defaults to the configured tolerance
    @Digits(integer = 1, fraction = 4)
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal slippage;

    @JsonAlias("type")
    private OrderType orderType;
}
