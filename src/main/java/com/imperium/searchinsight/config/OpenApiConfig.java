package com.imperium.searchinsight.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI searchInsightOpenApi(@Value("${server.port:8093}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Search Insight API")
                        .description("带缓存、去重与降级的联网搜索服务接口文档")
                        .version("v1")
                        .contact(new Contact().name("Search Insight Team")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
