package com.tradingstation.config;

import com.tradingstation.pnl.CommissionModel;
import com.tradingstation.pnl.FlatCommissionModel;
import com.tradingstation.pnl.PerShareCommissionModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    @Bean
    public CommissionModel commissionModel(ExecutionProperties executionProperties) {
        if (executionProperties.getCommissionPerShare() != null) {
            return new PerShareCommissionModel(
                    executionProperties.getCommissionPerShare(), executionProperties.getFlatCommission());
        }
        return new FlatCommissionModel(executionProperties.getFlatCommission());
    }
}
