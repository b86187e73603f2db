package com.williamcallahan.research_engine.config;

import com.williamcallahan.research_engine.repository.ArtifactRepository;
import com.williamcallahan.research_engine.repository.InMemoryArtifactRepository;
import com.williamcallahan.research_engine.repository.InMemoryRunEventRepository;
import com.williamcallahan.research_engine.repository.InMemoryRunRepository;
import com.williamcallahan.research_engine.repository.RunEventRepository;
import com.williamcallahan.research_engine.repository.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration to run without a database when no database URL is configured
 *
 * @author William Callahan
 *
 * Features:
 * - Activates only when spring.datasource.url is empty
 * - Disables Spring's datasource and schema initialization auto-configuration
 * - Supplies in-memory run, event and artifact repositories in place of the JDBC ones
 */
@Configuration
@ConditionalOnExpression("'${spring.datasource.url:}'.length() == 0")
@EnableAutoConfiguration(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        SqlInitializationAutoConfiguration.class
})
public class NoDatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(NoDatabaseConfig.class);

    public NoDatabaseConfig() {
        logger.warn("No spring.datasource.url configured. Runs, events and artifacts are kept in memory only.");
    }

    @Bean
    public RunRepository runRepository() {
        return new InMemoryRunRepository();
    }

    @Bean
    public RunEventRepository runEventRepository() {
        return new InMemoryRunEventRepository();
    }

    @Bean
    public ArtifactRepository artifactRepository() {
        return new InMemoryArtifactRepository();
    }
}
