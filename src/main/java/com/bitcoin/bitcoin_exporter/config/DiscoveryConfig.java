package com.bitcoin.bitcoin_exporter.config;

import com.bitcoin.bitcoin_exporter.network.discovery.HostnameResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetAddress;

@Configuration
public class DiscoveryConfig {

    @Bean
    public HostnameResolver hostnameResolver() {
        return InetAddress::getByName;
    }
}
