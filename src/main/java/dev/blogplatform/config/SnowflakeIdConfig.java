package dev.blogplatform.config;

import dev.blogplatform.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;
import java.net.NetworkInterface;

/**
 * Snowflake ID generator bean.
 *
 * <p>The node ID comes from {@code app.snowflake.node-id} (env SNOWFLAKE_NODE_ID)
 * or is derived from the MAC address, then the hostname.</p>
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = resolveNodeId();
        log.info("Initialized Snowflake ID generator with node ID: {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long resolveNodeId() {
        if (configuredNodeId != null) {
            return configuredNodeId;
        }

        try {
            NetworkInterface networkInterface = NetworkInterface.getByInetAddress(InetAddress.getLocalHost());
            if (networkInterface != null) {
                byte[] mac = networkInterface.getHardwareAddress();
                if (mac != null && mac.length >= 2) {
                    int hash = ((mac[mac.length - 2] & 0xFF) << 8) | (mac[mac.length - 1] & 0xFF);
                    return hash & 0x3FF;
                }
            }
        } catch (Exception e) {
            log.warn("Failed to derive node ID from network interface: {}", e.getMessage());
        }

        try {
            String hostname = InetAddress.getLocalHost().getHostName();
            return Math.abs(hostname.hashCode()) & 0x3FF;
        } catch (Exception e) {
            log.warn("Failed to get hostname, using default node ID 0");
            return 0;
        }
    }
}
