package com.scanfleet.core.config;

import com.scanfleet.core.process.CommandRunner;
import com.scanfleet.core.process.SecretMasker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ScanfleetConfig {

    /**
     * In-process registry for run metrics; replaced by any registry another
     * auto-configuration contributes.
     */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    /**
     * Command runner that masks the analysis-server token in every logged command and line.
     */
    @Bean
    public CommandRunner commandRunner(ScanfleetProperties properties) {
        return new CommandRunner(new SecretMasker(List.of(properties.getSonar().getToken())));
    }
}
