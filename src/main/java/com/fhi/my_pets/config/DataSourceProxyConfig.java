package com.fhi.my_pets.config;

import java.sql.Connection;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.autoconfigure.liquibase.LiquibaseDataSource;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import com.fhi.my_pets.tools.ProfilingQueryExecutionListener;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.support.ProxyDataSourceBuilder;

/**
 * Replaces the application's {@link DataSource} with a datasource-proxy wrapper around a Hikari
 * pool, so that every SQL statement can be logged with its duration and the application method
 * that triggered it (see {@link ProfilingQueryExecutionListener}).
 *
 * <p>Never active in "prod".
 *
 * <p>Liquibase gets its own plain, unproxied datasource: running the migrations through the
 * proxy makes Spring report a circular dependency.
 */
@Configuration
@Profile({ "local", "test" })
@Slf4j
public class DataSourceProxyConfig
{
    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariConfig hikariConfig()
    {   return new HikariConfig();
    }


    /**
     * @return the proxied pool used by JPA and everything else but Liquibase
     */
    @Bean
    @Primary
    public DataSource proxiedDataSource(DataSourceProperties dsProps,
                                        HikariConfig hikariConfig,
                                        ProfilingQueryExecutionListener queryExecutionListener)
    {
        // Built from the properties rather than from the auto-configured DataSource bean,
        // which isn't fully configured yet at this point (auto-commit in particular).
        hikariConfig.setJdbcUrl        (dsProps.determineUrl());
        hikariConfig.setUsername       (dsProps.determineUsername());
        hikariConfig.setPassword       (dsProps.determinePassword());
        hikariConfig.setDriverClassName(dsProps.determineDriverClassName());

        HikariDataSource hikariDs = new HikariDataSource(hikariConfig);

        log.debug("Hikari pool '{}': auto-commit={}, maximum-pool-size={}",
                  hikariDs.getPoolName(), hikariDs.isAutoCommit(), hikariDs.getMaximumPoolSize());

        DataSource proxiedDataSource = ProxyDataSourceBuilder
                .create(hikariDs)
                .name("MYPETS-PROXY-DS")
                .listener(queryExecutionListener)
                .multiline()
                .countQuery()
                .build();

        try (Connection testConn = proxiedDataSource.getConnection())
        {   log.debug("proxiedDataSource auto-commit : {}", testConn.getAutoCommit());
        }
        catch (SQLException e)
        {   log.warn("Failed to get auto-commit status for proxiedDataSource: {}", e.getMessage());
        }

        return proxiedDataSource;
    }


    @Bean
    @LiquibaseDataSource
    public DataSource liquibaseDataSource(DataSourceProperties properties)
    {   return properties.initializeDataSourceBuilder().build();
    }


    @Bean
    public ProfilingQueryExecutionListener queryExecutionListener
          (@Value("${profiling.sql.enabled:false}")              boolean enabled,
           @Value("${profiling.sql.logLinePrefix:PROFILING---}") String logLinePrefix)
    {   return new ProfilingQueryExecutionListener(enabled, logLinePrefix);
    }
}
