package com.example.kosagent.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 配置类 - 索引重建分布式锁与索引持久化
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(@Value("${kos.redis.address:redis://localhost:6379}") String address,
                                         @Value("${kos.redis.database:0}") int database) {
        Config config = new Config();

        // 单机模式
        config.useSingleServer()
            .setAddress(address)
            .setDatabase(database)
            .setConnectionPoolSize(16)
            .setConnectionMinimumIdleSize(4)
            .setConnectTimeout(5000)
            .setTimeout(3000)
            .setRetryAttempts(3)
            .setRetryInterval(1500);

        return Redisson.create(config);
    }
}
