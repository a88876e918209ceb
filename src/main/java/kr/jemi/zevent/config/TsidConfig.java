package kr.jemi.zevent.config;

import io.hypersistence.tsid.TSID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class TsidConfig {

    private static final Logger log = LoggerFactory.getLogger(TsidConfig.class);

    static final String NODE_COUNTER_KEY = "zevent:tsid:node:counter";

    @Bean
    public TSID.Factory tsidFactory(StringRedisTemplate redisTemplate,
                                    @Value("${zevent.tsid.node-bits}") int nodeBits) {
        int maxNodeCount = 1 << nodeBits;
        Long counter = redisTemplate.opsForValue().increment(NODE_COUNTER_KEY);
        int nodeId = (int) (counter % maxNodeCount);
        log.info("TSID 노드 할당: {}/{}", nodeId, maxNodeCount);

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId)
                .build();
    }
}
