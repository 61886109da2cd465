package tech.yump.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.gateway.lease.ExpiryClock;

@Configuration
public class LeaseCacheConfig {

    @Bean
    public ExpiryClock expiryClock() {
        return ExpiryClock.system();
    }
}
