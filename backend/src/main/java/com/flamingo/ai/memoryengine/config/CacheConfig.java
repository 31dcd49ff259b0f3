package com.flamingo.ai.memoryengine.config;

import com.flamingo.ai.memoryengine.service.cache.UserCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Creates the process-wide per-user cache. */
@Configuration
public class CacheConfig {

  @Bean
  public UserCacheManager userCacheManager(MemoryEngineConfig config) {
    MemoryEngineConfig.Cache cache = config.getCache();
    return new UserCacheManager(cache.getMaxUsers(), cache::capacityFor);
  }
}
