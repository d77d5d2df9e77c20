package com.gillianbc.retirement.config;

import com.gillianbc.retirement.service.OrderedWithdrawalPolicy;
import com.gillianbc.retirement.service.WithdrawalPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.time.Clock;

/**
 * Wires the projection engine into a Spring context. Import this into the host application.
 */
@Configuration
@ComponentScan(basePackages = "com.gillianbc.retirement")
@EnableConfigurationProperties(ProjectionProperties.class)
public class ProjectionEngineConfiguration {

    @Bean
    public Clock projectionClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LocalValidatorFactoryBean projectionValidator() {
        return new LocalValidatorFactoryBean();
    }

    @Bean
    public WithdrawalPolicy withdrawalPolicy(ProjectionProperties properties) {
        return new OrderedWithdrawalPolicy(properties.withdrawalOrder());
    }
}
