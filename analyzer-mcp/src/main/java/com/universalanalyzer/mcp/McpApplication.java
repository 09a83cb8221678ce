package com.universalanalyzer.mcp;

import com.universalanalyzer.mcp.config.AnalyzerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@SpringBootApplication(scanBasePackages = "com.universalanalyzer.mcp.config")
@Import(McpApplication.AnalyzerConfig.class)
public class McpApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpApplication.class, args);
    }

    @Configuration
    @ComponentScan(basePackages = {
            "com.universalanalyzer.mcp.analysis", "com.universalanalyzer.mcp.config"
    })
    @EnableConfigurationProperties(AnalyzerProperties.class)
    public static class AnalyzerConfig {
    }
}
