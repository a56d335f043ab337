package com.nfttrader.backend;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@SpringBootApplication
public class NftTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(NftTraderApplication.class, args);
    }

    @Bean
    public WebMvcConfigurer corsConfigurer(@Value("${nft.cors.allowed-origins:http://localhost:3000}") String[] allowedOrigins) {
        return new CorsConfig(allowedOrigins);
    }

    private static class CorsConfig implements WebMvcConfigurer {
        private final String[] allowedOrigins;

        CorsConfig(String[] allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        @Override
        public void addCorsMappings(CorsRegistry registry) {
            registry.addMapping("/api/**")
                   .allowedOrigins(allowedOrigins)
                   .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                   .allowedHeaders("*")
                   .allowCredentials(true);
        }
    }
}
