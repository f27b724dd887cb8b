package com.chicu.airetrain.config;

import com.chicu.airetrain.validation.PairedSignificanceTest;
import com.chicu.airetrain.validation.StudentPairedTTest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        RetrainProperties.class,
        ExternalServicesProperties.class,
        NotificationProperties.class
})
public class RetrainConfig {

    /**
     * Все решения по времени (debounce/cooldown/окна бюджета/таймауты) идут через этот Clock.
     */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PairedSignificanceTest pairedSignificanceTest() {
        return new StudentPairedTTest();
    }
}
