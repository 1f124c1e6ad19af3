package quest.gekko.salesboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Configuration properties for target allocation and leaderboard scoring
 */
@Configuration
@EnableConfigurationProperties({
        SalesboardProperties.Allocation.class,
        SalesboardProperties.Transitions.class,
        SalesboardProperties.Leaderboard.class,
        SalesboardProperties.Sweep.class
})
public class SalesboardProperties {

    @ConfigurationProperties("salesboard.allocation")
    public record Allocation(@DefaultValue("2s") Duration lockTimeout) {}

    /** When blockWhenDirty is off, publishing a period with stale targets only logs a warning. */
    @ConfigurationProperties("salesboard.transitions")
    public record Transitions(@DefaultValue("false") boolean blockWhenDirty) {}

    @ConfigurationProperties("salesboard.leaderboard")
    public record Leaderboard(@DefaultValue("0.001") BigDecimal trendEpsilon,
                              @DefaultValue("v1") String defaultRulesVersion) {}

    /** A cron of "-" disables the sweep. */
    @ConfigurationProperties("salesboard.recalc.sweep")
    public record Sweep(@DefaultValue("-") String cron,
                        @DefaultValue("3") int maxAttempts,
                        @DefaultValue("500ms") Duration backoff) {}
}
