package com.tradingstation.unit.oms;

import static com.tradingstation.support.PriceBars.bar;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.tradingstation.config.ExecutionProperties;
import com.tradingstation.domain.enums.LotSelection;
import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.enums.SellProceedsMode;
import com.tradingstation.domain.model.Position;
import com.tradingstation.domain.model.StopLoss;
import com.tradingstation.exception.ErrorCode;
import com.tradingstation.exception.TemporalViolationException;
import com.tradingstation.marketdata.BacktestMarketDataProvider;
import com.tradingstation.oms.OrderExecutionService;
import com.tradingstation.oms.OrderRequest;
import com.tradingstation.oms.OrderResult;
import com.tradingstation.pnl.FlatCommissionModel;
import com.tradingstation.position.PositionBook;
import com.tradingstation.risk.RiskLimits;
import com.tradingstation.risk.RiskManager;
import com.tradingstation.support.TradingEngineFixture;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests the order pipeline against the real ledger and position book: fills, cash
 * accounting under both sell-proceeds conventions, lot selection and failure outcomes.
 */
class OrderExecutionServiceTest {

    private static final LocalDate DAY1 = LocalDate.of(2024, 2, 1);
    private static final LocalDate DAY2 = DAY1.plusDays(1);
    private static final LocalDate DAY3 = DAY1.plusDays(2);

    private TradingEngineFixture fixture;
    private OrderExecutionService service;
    private BacktestMarketDataProvider marketData;
    private Long accountId;

    @BeforeEach
    void setUp() {
        fixture = new TradingEngineFixture();
        service = fixture.orderExecutionService;
        accountId = fixture.accountLedger.openAccount("test", new BigDecimal("100000")).getId();
        marketData = new BacktestMarketDataProvider(
                Map.of(
                        "AAPL",
                        List.of(bar("AAPL", DAY1, "150"), bar("AAPL", DAY2, "160"), bar("AAPL", DAY3, "145")),
                        "PENNY",
                        List.of(bar("PENNY", DAY1, "0.01"))),
                DAY1);
    }

    private OrderRequest buy(int quantity) {
        return OrderRequest.builder()
                .accountId(accountId)
                .symbol("AAPL")
                .side(OrderSide.BUY)
                .quantity(quantity)
                .build();
    }

    private OrderRequest sell(int quantity) {
        return OrderRequest.builder()
                .accountId(accountId)
                .symbol("AAPL")
                .side(OrderSide.SELL)
                .quantity(quantity)
                .build();
    }

    private BigDecimal cash() {
        return fixture.accountLedger.getAvailableBalance(accountId);
    }

    @Nested
    @DisplayName("Buy")
    class Buy {

        @Test
        @DisplayName("Buy 100 @150 with 5.00 commission leaves 84995 cash and one open position")
        void buy_reservesCostPlusCommission() {
            OrderResult result = service.executeOrder(buy(100), marketData, DAY1);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getExecutionPrice()).isEqualByComparingTo("150");
            assertThat(result.getCommission()).isEqualByComparingTo("5.00");
            assertThat(result.getExecutionDate()).isEqualTo(DAY1);
            assertThat(cash()).isEqualByComparingTo("84995");

            List<Position> open = fixture.positionBook.getOpenPositions(accountId);
            assertThat(open).hasSize(1);
            assertThat(open.get(0).getId()).isEqualTo(result.getPositionId());
            assertThat(open.get(0).getQuantity()).isEqualTo(100);
            assertThat(open.get(0).getEntryPrice()).isEqualByComparingTo("150");
        }

        @Test
        @DisplayName("Stop loss from the order is attached to the opened position")
        void buy_attachesStopLoss() {
            OrderRequest order = OrderRequest.builder()
                    .accountId(accountId)
                    .symbol("AAPL")
                    .side(OrderSide.BUY)
                    .quantity(10)
                    .stopLoss(StopLoss.price(new BigDecimal("140")))
                    .build();

            OrderResult result = service.executeOrder(order, marketData, DAY1);

            assertThat(fixture.positionBook.getPosition(result.getPositionId()).getStopLoss())
                    .isEqualTo(StopLoss.price(new BigDecimal("140")));
        }

        @Test
        @DisplayName("Risk rejection fails with VALIDATION_FAILED and mutates nothing")
        void buy_riskRejected() {
            // 200 * 150 = 30000 > 25% of 100000
            OrderResult result = service.executeOrder(buy(200), marketData, DAY1);

            assertThat(result.isFailed()).isTrue();
            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
            assertThat(result.getErrorMessage()).contains("exceeds maximum position size");
            assertThat(cash()).isEqualByComparingTo("100000");
            assertThat(fixture.positionBook.getOpenPositions(accountId)).isEmpty();
        }

        @Test
        @DisplayName("Inactive account is rejected by validation")
        void buy_inactiveAccount() {
            fixture.accountLedger.setActive(accountId, false);

            OrderResult result = service.executeOrder(buy(10), marketData, DAY1);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
            assertThat(result.getErrorMessage()).isEqualTo("Account is not active");
        }

        @Test
        @DisplayName("Reservation failure after validation reports INSUFFICIENT_FUNDS and opens nothing")
        void buy_reservationFails() {
            fixture.accountLedger.reserveFunds(accountId, new BigDecimal("98000"));
            // Quoted at 10 the order passes validation, but it fills at 150
            OrderRequest order = OrderRequest.builder()
                    .accountId(accountId)
                    .symbol("AAPL")
                    .side(OrderSide.BUY)
                    .quantity(100)
                    .referencePrice(new BigDecimal("10"))
                    .build();

            OrderResult result = service.executeOrder(order, marketData, DAY1);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_FUNDS);
            assertThat(cash()).isEqualByComparingTo("2000");
            assertThat(fixture.positionBook.getOpenPositions(accountId)).isEmpty();
        }

        @Test
        @DisplayName("Unknown account fails with NOT_FOUND")
        void buy_unknownAccount() {
            OrderRequest order = buy(10);
            order.setAccountId(999L);

            OrderResult result = service.executeOrder(order, marketData, DAY1);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        }

        @Test
        @DisplayName("Symbol without data fails with DATA_NOT_FOUND")
        void buy_noData() {
            OrderRequest order = buy(10);
            order.setSymbol("MSFT");

            OrderResult result = service.executeOrder(order, marketData, DAY1);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.DATA_NOT_FOUND);
            assertThat(cash()).isEqualByComparingTo("100000");
        }

        @Test
        @DisplayName("Executing at a date after the clock propagates the temporal violation")
        void buy_futureDate_propagates() {
            assertThatThrownBy(() -> service.executeOrder(buy(10), marketData, DAY2))
                    .isInstanceOf(TemporalViolationException.class);
            assertThat(cash()).isEqualByComparingTo("100000");
        }
    }

    @Nested
    @DisplayName("Sell")
    class Sell {

        @BeforeEach
        void openPosition() {
            service.executeOrder(buy(100), marketData, DAY1);
            marketData.advanceTime(DAY2);
        }

        @Test
        @DisplayName("Sell @160 realizes 1000; net P&L deducts the sell commission")
        void sell_realizesPnl() {
            OrderResult result = service.executeOrder(sell(100), marketData, DAY2);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRealizedPnl()).isEqualByComparingTo("1000");
            assertThat(result.getNetPnl()).isEqualByComparingTo("995");
            assertThat(fixture.positionBook.getOpenPositions(accountId)).isEmpty();
            assertThat(fixture.positionBook.getPosition(result.getPositionId()).getExitReason())
                    .isEqualTo("User requested");
        }

        @Test
        @DisplayName("NET proceeds: cash = 84995 + 16000 - 5")
        void sell_netProceeds() {
            fixture.executionProperties.setSellProceeds(SellProceedsMode.NET);

            service.executeOrder(sell(100), marketData, DAY2);

            assertThat(cash()).isEqualByComparingTo("100990");
        }

        @Test
        @DisplayName("GROSS proceeds: cash = 84995 + 16000")
        void sell_grossProceeds() {
            fixture.executionProperties.setSellProceeds(SellProceedsMode.GROSS);

            service.executeOrder(sell(100), marketData, DAY2);

            assertThat(cash()).isEqualByComparingTo("100995");
        }

        @Test
        @DisplayName("No open position for the symbol fails with NO_OPEN_POSITION")
        void sell_noPosition() {
            OrderRequest order = sell(10);
            order.setSymbol("PENNY");

            OrderResult result = service.executeOrder(order, marketData, DAY2);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NO_OPEN_POSITION);
            assertThat(result.getErrorMessage()).isEqualTo("No open position for PENNY");
        }

        @Test
        @DisplayName("Selling more than held fails with INSUFFICIENT_QUANTITY and mutates nothing")
        void sell_tooMany() {
            OrderResult result = service.executeOrder(sell(101), marketData, DAY2);

            assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_QUANTITY);
            assertThat(result.getErrorMessage()).isEqualTo("Insufficient shares. Have 100, requested 101");
            assertThat(cash()).isEqualByComparingTo("84995");
            assertThat(fixture.positionBook.getOpenPositions(accountId)).hasSize(1);
        }

        @Test
        @DisplayName("Partial sell credits only the shares sold and keeps the rest open")
        void sell_partial() {
            OrderResult result = service.executeOrder(sell(40), marketData, DAY2);

            assertThat(result.getRealizedPnl()).isEqualByComparingTo("400");
            assertThat(cash()).isEqualByComparingTo("91390");
            assertThat(fixture.positionBook.getOpenPositions(accountId))
                    .singleElement()
                    .satisfies(p -> assertThat(p.getQuantity()).isEqualTo(60));
        }

        @Test
        @DisplayName("Order reason becomes the exit reason")
        void sell_reason() {
            OrderRequest order = sell(100);
            order.setReason("MA20 crossed below MA50");

            OrderResult result = service.executeOrder(order, marketData, DAY2);

            assertThat(fixture.positionBook.getPosition(result.getPositionId()).getExitReason())
                    .isEqualTo("MA20 crossed below MA50");
        }
    }

    @Test
    @DisplayName("Sale worth more than the position size limit is rejected and mutates nothing")
    void sell_overPositionLimit_rejected() {
        BacktestMarketDataProvider doubling = new BacktestMarketDataProvider(
                Map.of("AAPL", List.of(bar("AAPL", DAY1, "200"), bar("AAPL", DAY2, "400"))), DAY1);
        OrderResult bought = service.executeOrder(buy(100), doubling, DAY1);
        assertThat(bought.isSuccess()).isTrue();
        doubling.advanceTime(DAY2);

        // 100 x 400 = 40000 against a 25000 limit
        OrderResult result = service.executeOrder(sell(100), doubling, DAY2);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_FAILED);
        assertThat(result.getErrorMessage()).contains("exceeds maximum position size");
        assertThat(cash()).isEqualByComparingTo("79995");
        assertThat(fixture.positionBook.getOpenPositions(accountId))
                .singleElement()
                .satisfies(p -> assertThat(p.getQuantity()).isEqualTo(100));
    }

    @Nested
    @DisplayName("Lot selection")
    class Lots {

        private Long firstLot;
        private Long secondLot;

        @BeforeEach
        void openTwoLots() {
            firstLot = service.executeOrder(buy(10), marketData, DAY1).getPositionId();
            marketData.advanceTime(DAY2);
            secondLot = service.executeOrder(buy(10), marketData, DAY2).getPositionId();
            marketData.advanceTime(DAY3);
        }

        @Test
        @DisplayName("FIFO sells the oldest lot")
        void fifo() {
            fixture.executionProperties.setLotSelection(LotSelection.FIFO);

            OrderResult result = service.executeOrder(sell(10), marketData, DAY3);

            assertThat(result.getPositionId()).isEqualTo(firstLot);
            assertThat(result.getRealizedPnl()).isEqualByComparingTo("-50");
        }

        @Test
        @DisplayName("LIFO sells the newest lot")
        void lifo() {
            fixture.executionProperties.setLotSelection(LotSelection.LIFO);

            OrderResult result = service.executeOrder(sell(10), marketData, DAY3);

            assertThat(result.getPositionId()).isEqualTo(secondLot);
            assertThat(result.getRealizedPnl()).isEqualByComparingTo("-150");
        }

        @Test
        @DisplayName("An explicit position id overrides the policy")
        void explicitPosition() {
            OrderRequest order = sell(10);
            order.setPositionId(secondLot);

            OrderResult result = service.executeOrder(order, marketData, DAY3);

            assertThat(result.getPositionId()).isEqualTo(secondLot);
        }
    }

    @Test
    @DisplayName("Sale whose net proceeds would overdraw the account is refused before closing")
    void sell_proceedsBelowCommission() {
        Long smallAccount = fixture.accountLedger.openAccount("small", new BigDecimal("5.01")).getId();
        OrderRequest pennyBuy = OrderRequest.builder()
                .accountId(smallAccount)
                .symbol("PENNY")
                .side(OrderSide.BUY)
                .quantity(1)
                .build();
        assertThat(service.executeOrder(pennyBuy, marketData, DAY1).isSuccess()).isTrue();
        assertThat(fixture.accountLedger.getAvailableBalance(smallAccount)).isEqualByComparingTo("0");

        OrderRequest pennySell = OrderRequest.builder()
                .accountId(smallAccount)
                .symbol("PENNY")
                .side(OrderSide.SELL)
                .quantity(1)
                .build();
        OrderResult result = service.executeOrder(pennySell, marketData, DAY1);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INSUFFICIENT_FUNDS);
        assertThat(fixture.positionBook.getOpenPositions(smallAccount)).hasSize(1);
        assertThat(fixture.accountLedger.getAvailableBalance(smallAccount)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Failure to open the position releases the reservation")
    void openFailure_releasesReservation() {
        PositionBook failingBook = mock(PositionBook.class);
        when(failingBook.openPosition(anyLong(), anyString(), any(), anyInt(), any(), any()))
                .thenThrow(new IllegalStateException("store unavailable"));
        OrderExecutionService failing = new OrderExecutionService(
                fixture.accountLedger,
                failingBook,
                new RiskManager(RiskLimits.builder().build(), failingBook),
                new FlatCommissionModel(new BigDecimal("5.00")),
                fixture.accountLockManager,
                new ExecutionProperties());

        OrderResult result = failing.executeOrder(buy(100), marketData, DAY1);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(result.getErrorMessage()).isEqualTo("store unavailable");
        assertThat(cash()).isEqualByComparingTo("100000");
    }
}
