package com.universalanalyzer.mcp.analysis;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class UniversalAnalyzerToolConfiguration {

  @Bean
  ToolCallbackProvider universalAnalyzerToolCallbackProvider(UniversalAnalyzerTools tools) {
    return MethodToolCallbackProvider.builder().toolObjects(tools).build();
  }
}
