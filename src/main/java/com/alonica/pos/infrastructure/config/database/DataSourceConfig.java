package com.alonica.pos.infrastructure.config.database;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.datasource.LazyConnectionDataSourceProxy;

import javax.sql.DataSource;

/**
 * DataSourceConfig - DB 없이도 애플리케이션이 기동되도록 하는 DataSource 설정
 *
 * - HikariCP 풀은 첫 커넥션 요청 시 초기화된다
 * - LazyConnectionDataSourceProxy: 실제 SQL 실행 전까지 물리 커넥션을 얻지 않으므로
 *   인메모리 저장소로 대체된 경우 @Transactional 경계가 DB에 접근하지 않는다
 * - hibernate.boot.allow_jdbc_metadata_access=false와 함께 사용 (application.yml)
 */
@Configuration
public class DataSourceConfig {

    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource targetDataSource(DataSourceProperties properties) {
        return properties.initializeDataSourceBuilder()
                .type(HikariDataSource.class)
                .build();
    }

    @Bean
    @Primary
    public DataSource dataSource(HikariDataSource targetDataSource) {
        return new LazyConnectionDataSourceProxy(targetDataSource);
    }
}
