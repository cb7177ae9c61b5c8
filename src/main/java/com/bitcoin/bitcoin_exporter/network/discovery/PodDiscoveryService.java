package com.bitcoin.bitcoin_exporter.network.discovery;

import com.bitcoin.bitcoin_exporter.config.ExporterConfigProperties;
import com.bitcoin.bitcoin_exporter.core.model.BitcoinPod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the Bitcoin StatefulSet pods behind the headless service by resolving
 * {@code <service>-<i>.<service>.<namespace>.svc.cluster.local} for i = 0, 1, 2, ...
 * <p>
 * The scan stops at the first ordinal that does not resolve, so it assumes ordinals are
 * contiguous from 0. Pods beyond a gap (e.g. after scaling down and up again) and pods past
 * {@code bitcoin.discovery.max-pods} are not reported.
 */
@Component
public class PodDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(PodDiscoveryService.class);

    private final HostnameResolver hostnameResolver;
    private final ExporterConfigProperties.DiscoveryProperties discoveryProperties;

    public PodDiscoveryService(HostnameResolver hostnameResolver, ExporterConfigProperties exporterConfigProperties){
        this.hostnameResolver = hostnameResolver;
        this.discoveryProperties = exporterConfigProperties.getDiscovery();
        log.info("PodDiscoveryService initialized for service {} in namespace {}",
                discoveryProperties.getServiceName(), discoveryProperties.getNamespace());
    }

    /**
     * Probes pod ordinals in ascending order. Blocks on DNS.
     * @return discovered pods ordered by ordinal, possibly empty.
     */
    public List<BitcoinPod> discover() {
        List<BitcoinPod> pods = new ArrayList<>();

        for (int i = 0; i < discoveryProperties.getMaxPods(); i++) {
            BitcoinPod candidate = podForOrdinal(i);
            try {
                hostnameResolver.resolve(candidate.getHost());
            } catch (UnknownHostException e) {
                if (i == 0) {
                    log.warn("No Bitcoin pods found starting from {}", candidate.getHost());
                }
                break;
            }
            pods.add(candidate);
            log.info("Discovered Bitcoin pod: {}", candidate.getHost());
        }

        if (pods.isEmpty()) {
            log.warn("No Bitcoin pods discovered for service {} in namespace {}",
                    discoveryProperties.getServiceName(), discoveryProperties.getNamespace());
        }
        return Collections.unmodifiableList(pods);
    }

    /**
     * Ordinal 0 of the configured service, used when discovery finds nothing.
     */
    public BitcoinPod fallbackPod() {
        return podForOrdinal(0);
    }

    private BitcoinPod podForOrdinal(int ordinal) {
        return BitcoinPod.forOrdinal(ordinal,
                discoveryProperties.getServiceName(),
                discoveryProperties.getNamespace(),
                discoveryProperties.getClusterDomain());
    }
}
