package org.caureq.opsinsights.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    @Bean
    public FilterRegistrationBean<ApiKeyFilter> apiKeyFilterRegistration(ApiKeyFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10);
        reg.addUrlPatterns("/api/*");
        return reg;
    }
}
