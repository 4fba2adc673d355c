package ca.nestsync.graphql;

import ca.nestsync.config.AppSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

@Controller
@RequiredArgsConstructor
public class SystemGraphQlController {

    private final AppSettings appSettings;

    @QueryMapping
    public String healthCheck() {
        return "GraphQL endpoint is healthy";
    }

    @QueryMapping
    public String apiInfo() {
        return appSettings.getAppName() + " GraphQL API v" + appSettings.getAppVersion()
                + " - Canadian diaper planning with PIPEDA compliance";
    }
}
