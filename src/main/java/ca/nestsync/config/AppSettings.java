package ca.nestsync.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Application-wide settings resolved from environment variables.
 *
 * Values come from application.yml placeholders so every deployment can be
 * configured through the environment alone. The data region is validated at
 * startup: personal data of Canadian families must stay in a Canadian region.
 *
 * @see org.springframework.beans.factory.annotation.Value
 */
@Component
@Getter
@Slf4j
public class AppSettings {

    public static final List<String> CANADIAN_REGIONS = List.of("canada-central", "canada-east");
    private static final List<String> ENVIRONMENTS = List.of("development", "staging", "production");

    @Value("${app.name:NestSync}")
    private String appName;

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${app.environment:development}")
    private String environment;

    @Value("${app.debug:false}")
    private boolean debug;

    @Value("${app.data-region:canada-central}")
    private String dataRegion;

    @Value("${app.timezone:America/Toronto}")
    private String defaultTimezone;

    @Value("${app.currency:CAD}")
    private String currency;

    @Value("${app.consent-version:1.0}")
    private String consentVersion;

    @Value("${app.data-retention-days:2555}")
    private int dataRetentionDays;

    @Value("${app.max-children-per-user:10}")
    private int maxChildrenPerUser;

    /**
     * Fail fast on an unknown environment or a data region outside Canada.
     */
    @PostConstruct
    public void validate() {
        String env = environment.toLowerCase(Locale.ROOT);
        if (!ENVIRONMENTS.contains(env)) {
            throw new IllegalStateException("Unknown environment '" + environment
                    + "'. Expected one of " + ENVIRONMENTS);
        }
        this.environment = env;

        if (!CANADIAN_REGIONS.contains(dataRegion)) {
            throw new IllegalStateException("Data region must be Canadian for PIPEDA compliance, got '"
                    + dataRegion + "'");
        }

        log.info("{} {} starting: environment={}, region={}, debug={}",
                appName, appVersion, environment, dataRegion, debug);
    }

    public boolean isDevelopment() {
        return "development".equals(environment);
    }

    public boolean isProduction() {
        return "production".equals(environment);
    }
}
