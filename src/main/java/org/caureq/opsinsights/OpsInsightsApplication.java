package org.caureq.opsinsights;

import org.caureq.opsinsights.config.AppProps;
import org.caureq.opsinsights.config.InsightsProps;
import org.caureq.opsinsights.config.ProxmoxProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({InsightsProps.class, ProxmoxProps.class, AppProps.class})
public class OpsInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpsInsightsApplication.class, args);
    }

}
