package com.flagship.cash_session.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PosSessionProperties.class)
public class PosSessionConfig {
}
