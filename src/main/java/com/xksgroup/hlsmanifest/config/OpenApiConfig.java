package com.xksgroup.hlsmanifest.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${server.port:8080}") int serverPort) {

        Server localDev = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local development");

        return new OpenAPI()
                .info(new Info()
                        .title("HLS Manifest Normalizer API")
                        .version("v1")
                        .description("Normalizes parsed HLS manifests into a resolved playlist graph"))
                .servers(List.of(localDev));
    }
}
