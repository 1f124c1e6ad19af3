package quest.gekko.salesboard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import quest.gekko.salesboard.service.exception.ConcurrencyException;

import java.time.Clock;

@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryTemplate recomputeRetryTemplate(final SalesboardProperties.Sweep sweep) {
        return RetryTemplate.builder()
                .maxAttempts(sweep.maxAttempts())
                .fixedBackoff(sweep.backoff().toMillis())
                .retryOn(ConcurrencyException.class)
                .build();
    }
}
