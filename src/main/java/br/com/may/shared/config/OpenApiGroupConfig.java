package br.com.may.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi subscriptionsGroup() {
        return GroupedOpenApi.builder()
                .group("subscriptions")
                .displayName("Subscriptions & Billing")
                .pathsToMatch("/api/subscriptions/**")
                .build();
    }
}
