// DatabaseConfig.java - JPA 리포지토리와 트랜잭션 설정
package org.be.trackerservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "org.be.trackerservice.repository")
public class DatabaseConfig {
}
