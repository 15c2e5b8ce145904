package com.tradingstation.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradingstation.backtest.BacktestResult;
import com.tradingstation.backtest.DailySnapshot;
import com.tradingstation.backtest.TradeRecord;
import com.tradingstation.domain.enums.BacktestStatus;
import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.mapper.JsonHelper;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JsonHelperTest {

    @Test
    @DisplayName("Snapshot renders ISO dates and property names")
    void snapshot() {
        DailySnapshot snapshot = DailySnapshot.builder()
                .date(LocalDate.of(2024, 1, 31))
                .cash(new BigDecimal("84995"))
                .positionsValue(new BigDecimal("15000"))
                .totalEquity(new BigDecimal("99995"))
                .openPositions(1)
                .build();

        JsonNode node = JsonHelper.toTree(JsonHelper.toJson(snapshot));

        assertThat(node.get("date").asText()).isEqualTo("2024-01-31");
        assertThat(node.get("cash").decimalValue()).isEqualByComparingTo("84995");
        assertThat(node.get("positionsValue").decimalValue()).isEqualByComparingTo("15000");
        assertThat(node.get("totalEquity").decimalValue()).isEqualByComparingTo("99995");
        assertThat(node.get("openPositions").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("Trade record omits derived properties")
    void tradeRecord() {
        TradeRecord trade = TradeRecord.builder()
                .date(LocalDate.of(2024, 2, 2))
                .symbol("AAPL")
                .side(OrderSide.SELL)
                .quantity(100)
                .price(new BigDecimal("160"))
                .commission(new BigDecimal("5.00"))
                .positionId(1L)
                .realizedPnl(new BigDecimal("1000"))
                .exitReason("User requested")
                .build();

        JsonNode node = JsonHelper.toTree(JsonHelper.toJson(trade));

        assertThat(node.get("side").asText()).isEqualTo("SELL");
        assertThat(node.get("exitReason").asText()).isEqualTo("User requested");
        assertThat(node.has("closingTrade")).isFalse();
    }

    @Test
    @DisplayName("Backtest result renders only its report fields")
    void backtestResult() {
        BacktestResult result = BacktestResult.builder()
                .accountId(1L)
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 31))
                .initialCapital(new BigDecimal("100000"))
                .finalEquity(new BigDecimal("101000"))
                .totalReturn(new BigDecimal("0.010000"))
                .maxDrawdown(new BigDecimal("0.002000"))
                .sharpeRatio(new BigDecimal("1.250000"))
                .winRate(new BigDecimal("0.500000"))
                .totalTrades(2)
                .trades(List.of())
                .dailySnapshots(List.of())
                .status(BacktestStatus.COMPLETED)
                .rejectedOrders(List.of())
                .build();

        JsonNode node = JsonHelper.toTree(JsonHelper.toJson(result));
        List<String> fields = new ArrayList<>();
        node.fieldNames().forEachRemaining(fields::add);

        assertThat(fields)
                .containsExactlyInAnyOrder(
                        "accountId",
                        "startDate",
                        "endDate",
                        "initialCapital",
                        "finalEquity",
                        "totalReturn",
                        "maxDrawdown",
                        "sharpeRatio",
                        "winRate",
                        "totalTrades",
                        "trades",
                        "dailySnapshots",
                        "status",
                        "rejectedOrders");
        assertThat(node.get("startDate").asText()).isEqualTo("2024-01-01");
        assertThat(node.get("totalReturn").decimalValue()).isEqualByComparingTo("0.01");
    }

    @Test
    @DisplayName("Null and blank inputs return null")
    void nulls() {
        assertThat(JsonHelper.toJson(null)).isNull();
        assertThat(JsonHelper.toPrettyJson(null)).isNull();
        assertThat(JsonHelper.toTree("  ")).isNull();
    }
}
