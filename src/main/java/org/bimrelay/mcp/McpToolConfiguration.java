package org.bimrelay.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 把 {@link IfcMcpTools} 上的 {@code @Tool} 方法注册为 {@link ToolCallback}，由 MCP Server 暴露给调用方。
 */
@Configuration(proxyBeanMethods = false)
public class McpToolConfiguration {

    private static final Logger log = LoggerFactory.getLogger(McpToolConfiguration.class);

    @Bean
    public List<ToolCallback> ifcToolCallbacks(IfcMcpTools tools) {
        List<ToolCallback> callbacks = List.of(ToolCallbacks.from(tools));
        log.info("已注册 IFC 工具：{}", callbacks.stream().map(c -> c.getToolDefinition().name()).toList());
        return callbacks;
    }
}
