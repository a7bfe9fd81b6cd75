package com.example.casa.config;

import dev.miku.r2dbc.mysql.MySqlConnectionConfiguration;
import dev.miku.r2dbc.mysql.MySqlConnectionFactory;
import dev.miku.r2dbc.mysql.constant.SslMode;
import io.r2dbc.spi.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.r2dbc.config.AbstractR2dbcConfiguration;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.transaction.ReactiveTransactionManager;

import java.time.Duration;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Configuration
@EnableR2dbcRepositories(basePackages = "com.example.casa.repository")
public class DatabaseConfig extends AbstractR2dbcConfiguration {

    private static final Pattern URL_PATTERN =
            Pattern.compile("r2dbc:mysql://([^:/]+)(?::(\\d+))?/([^?]+)(?:\\?(.+))?");

    @Value("${spring.r2dbc.url}")
    private String databaseUrl;

    @Value("${spring.r2dbc.username}")
    private String username;

    @Value("${spring.r2dbc.password}")
    private String password;

    @Value("${casa.storage.type:file}")
    private String storageType;

    @Override
    @Bean
    public ConnectionFactory connectionFactory() {
        log.info("配置R2DBC MySQL连接: {}", databaseUrl);

        DatabaseUrlInfo urlInfo = parseR2dbcUrl(databaseUrl);

        MySqlConnectionConfiguration configuration = MySqlConnectionConfiguration.builder()
                .host(urlInfo.host)
                .port(urlInfo.port)
                .user(username)
                .password(password)
                .database(urlInfo.database)
                .connectTimeout(Duration.ofSeconds(30))
                .sslMode(urlInfo.useSSL ? SslMode.REQUIRED : SslMode.DISABLED)
                .serverZoneId(ZoneId.of(urlInfo.serverTimezone))
                .build();

        log.info("MySQL连接配置完成 - Host: {}:{}, Database: {}, SSL: {}",
                urlInfo.host, urlInfo.port, urlInfo.database, urlInfo.useSSL);

        // 连接在首次使用时建立，文件存储模式下不会访问数据库
        return MySqlConnectionFactory.from(configuration);
    }

    @Bean
    public ReactiveTransactionManager transactionManager(ConnectionFactory connectionFactory) {
        return new R2dbcTransactionManager(connectionFactory);
    }

    /**
     * 数据库存储模式下启动时建表
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema.sql")));
        initializer.setEnabled("database".equalsIgnoreCase(storageType));
        return initializer;
    }

    /**
     * 解析R2DBC URL
     */
    static DatabaseUrlInfo parseR2dbcUrl(String url) {
        DatabaseUrlInfo info = new DatabaseUrlInfo();

        // r2dbc:mysql://localhost:3306/casa_analysis?useSSL=false&serverTimezone=UTC
        Matcher matcher = url != null ? URL_PATTERN.matcher(url) : null;
        if (matcher == null || !matcher.matches()) {
            log.warn("无法解析R2DBC URL: {}, 使用默认配置", url);
            return info;
        }

        info.host = matcher.group(1);
        info.port = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 3306;
        info.database = matcher.group(3);

        String queryParams = matcher.group(4);
        if (queryParams != null) {
            for (String param : queryParams.split("&")) {
                String[] keyValue = param.split("=");
                if (keyValue.length != 2) {
                    continue;
                }
                switch (keyValue[0]) {
                    case "useSSL":
                        info.useSSL = Boolean.parseBoolean(keyValue[1]);
                        break;
                    case "serverTimezone":
                        info.serverTimezone = keyValue[1];
                        break;
                    default:
                        break;
                }
            }
        }
        return info;
    }

    /**
     * 数据库URL信息
     */
    static class DatabaseUrlInfo {
        String host = "localhost";
        int port = 3306;
        String database = "casa_analysis";
        boolean useSSL = false;
        String serverTimezone = "UTC";
    }
}
