package com.xapdoc.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(XapDocProperties.class)
public class XapDocConfiguration {
}
