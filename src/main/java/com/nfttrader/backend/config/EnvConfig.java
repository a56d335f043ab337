package com.nfttrader.backend.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.SystemEnvironmentPropertySource;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads a local {@code .env} file. Entries resolve like OS environment variables, so
 * {@code NFT_MARKET_DATA_MAX_CONCURRENT_REQUESTS=4} overrides
 * {@code nft.market-data.max-concurrent-requests}.
 */
@Configuration
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EnvConfig {

    private static final Logger logger = LoggerFactory.getLogger(EnvConfig.class);

    static final String PROPERTY_SOURCE_NAME = "dotenvProperties";

    @Autowired
    private ConfigurableEnvironment environment;

    @PostConstruct
    public void init() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, Object> envMap = new HashMap<>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            envMap.put(entry.getKey(), entry.getValue());
        }

        if (!envMap.isEmpty()) {
            logger.info("Loaded {} entries from .env", envMap.size());
        }
        environment.getPropertySources().addFirst(dotenvPropertySource(envMap));
    }

    static SystemEnvironmentPropertySource dotenvPropertySource(Map<String, Object> entries) {
        return new SystemEnvironmentPropertySource(PROPERTY_SOURCE_NAME, entries);
    }
}
